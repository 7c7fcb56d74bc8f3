package com.standcapacity.engine.allocation;

import com.standcapacity.engine.error.DataException;
import com.standcapacity.engine.flight.Flight;
import com.standcapacity.engine.slot.OccupancyCalculator;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Pairs arrivals with departures into rotations.
 *
 * <p>Flights carrying a registration pair with the next departure of the same airline and
 * registration. Flights without one pair by airline and aircraft type with the earliest later
 * departure that satisfies the turnaround rule.
 */
public class RotationMatcher {
  private static final Comparator<Flight> CHRONOLOGICAL =
      Comparator.comparing(Flight::scheduledTime).thenComparing(Flight::id);

  private final OccupancyCalculator occupancy;

  public RotationMatcher(OccupancyCalculator occupancy) {
    this.occupancy = occupancy;
  }

  public record Pairing(List<Rotation> rotations, List<Flight> singles, List<AllocationIssue> issues) {}

  /**
   * Splits a flight list into rotations and single movements.
   *
   * @param flights flights of one day
   * @return pairing, deterministic for a given list
   * @throws DataException when two flights share an id
   */
  public Pairing match(List<Flight> flights) {
    Set<String> ids = new HashSet<>();
    for (Flight flight : flights) {
      if (!ids.add(flight.id())) {
        throw new DataException("duplicate flight id " + flight.id(), flight.id());
      }
    }

    List<Rotation> rotations = new ArrayList<>();
    List<Flight> singles = new ArrayList<>();
    List<AllocationIssue> issues = new ArrayList<>();

    Map<String, List<Flight>> byRegistration = new TreeMap<>();
    Map<String, List<Flight>> byAirlineAndType = new TreeMap<>();
    for (Flight flight : flights) {
      if (flight.hasRegistration()) {
        byRegistration
            .computeIfAbsent(flight.airlineCode() + "/" + flight.registration(), k -> new ArrayList<>())
            .add(flight);
      } else {
        byAirlineAndType
            .computeIfAbsent(flight.airlineCode() + "/" + flight.aircraftTypeCode(), k -> new ArrayList<>())
            .add(flight);
      }
    }

    for (List<Flight> movements : byRegistration.values()) {
      matchByRegistration(movements, rotations, singles, issues);
    }
    for (List<Flight> movements : byAirlineAndType.values()) {
      matchByType(movements, rotations, singles);
    }
    return new Pairing(List.copyOf(rotations), List.copyOf(singles), List.copyOf(issues));
  }

  private void matchByRegistration(
      List<Flight> movements,
      List<Rotation> rotations,
      List<Flight> singles,
      List<AllocationIssue> issues) {
    movements.sort(CHRONOLOGICAL);
    Flight pending = null;
    for (Flight flight : movements) {
      if (flight.isArrival()) {
        if (pending != null) {
          unpaired(pending, singles, issues);
        }
        pending = flight;
        continue;
      }
      if (pending == null) {
        unpaired(flight, singles, issues);
        continue;
      }
      long ground = groundMinutes(pending, flight);
      int turnaround = occupancy.turnaroundMinutes(pending.aircraftTypeCode());
      if (ground < turnaround) {
        issues.add(new AllocationIssue(
            IssueType.TURNAROUND_NOT_MET,
            List.of(pending.id(), flight.id()),
            "ground time " + ground + " min is below the " + turnaround
                + " min turnaround of " + pending.aircraftTypeCode()));
        singles.add(pending);
        singles.add(flight);
      } else {
        rotations.add(new Rotation(pending, flight));
      }
      pending = null;
    }
    if (pending != null) {
      unpaired(pending, singles, issues);
    }
  }

  private void matchByType(List<Flight> movements, List<Rotation> rotations, List<Flight> singles) {
    movements.sort(CHRONOLOGICAL);
    List<Flight> departures = new ArrayList<>();
    for (Flight flight : movements) {
      if (!flight.isArrival()) {
        departures.add(flight);
      }
    }
    Set<String> used = new HashSet<>();
    for (Flight arrival : movements) {
      if (!arrival.isArrival()) {
        continue;
      }
      int turnaround = occupancy.turnaroundMinutes(arrival.aircraftTypeCode());
      Flight match = null;
      for (Flight departure : departures) {
        if (!used.contains(departure.id()) && groundMinutes(arrival, departure) >= turnaround) {
          match = departure;
          break;
        }
      }
      if (match == null) {
        singles.add(arrival);
      } else {
        used.add(match.id());
        rotations.add(new Rotation(arrival, match));
      }
    }
    for (Flight departure : departures) {
      if (!used.contains(departure.id())) {
        singles.add(departure);
      }
    }
  }

  private static void unpaired(Flight flight, List<Flight> singles, List<AllocationIssue> issues) {
    singles.add(flight);
    issues.add(new AllocationIssue(
        IssueType.UNPAIRED_REGISTRATION,
        List.of(flight.id()),
        (flight.isArrival() ? "arrival" : "departure") + " of " + flight.registration()
            + " has no matching " + (flight.isArrival() ? "departure" : "arrival")));
  }

  private static long groundMinutes(Flight arrival, Flight departure) {
    return Duration.between(arrival.scheduledTime(), departure.scheduledTime()).toMinutes();
  }
}

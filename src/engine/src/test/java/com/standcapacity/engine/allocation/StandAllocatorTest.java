package com.standcapacity.engine.allocation;

import static com.standcapacity.engine.TestReference.DAY;
import static com.standcapacity.engine.TestReference.arrival;
import static com.standcapacity.engine.TestReference.at;
import static com.standcapacity.engine.TestReference.base;
import static com.standcapacity.engine.TestReference.departure;
import static com.standcapacity.engine.TestReference.flight;
import static com.standcapacity.engine.TestReference.stand;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

import com.standcapacity.engine.error.ConfigException;
import com.standcapacity.engine.error.DataException;
import com.standcapacity.engine.flight.Flight;
import com.standcapacity.engine.flight.FlightNature;
import com.standcapacity.engine.maintenance.MaintenanceCalendar;
import com.standcapacity.engine.maintenance.MaintenanceRequest;
import com.standcapacity.engine.maintenance.MaintenanceStatus;
import com.standcapacity.engine.reference.AdjacencyRestriction;
import com.standcapacity.engine.reference.AircraftType;
import com.standcapacity.engine.reference.AirlineTerminalAllocation;
import com.standcapacity.engine.reference.ImpactDirection;
import com.standcapacity.engine.reference.Pier;
import com.standcapacity.engine.reference.ReferenceSnapshot;
import com.standcapacity.engine.reference.Stand;
import com.standcapacity.engine.reference.StandAdjacency;
import com.standcapacity.engine.reference.Terminal;
import com.standcapacity.engine.run.RunControl;
import com.standcapacity.engine.slot.TimeSlotGrid;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.junit.jupiter.api.Test;

class StandAllocatorTest {

  private static AllocationResult allocate(ReferenceSnapshot snapshot, List<Flight> flights) {
    TimeSlotGrid grid = TimeSlotGrid.build(DAY, snapshot.settings());
    return new StandAllocator(snapshot).allocate(grid, flights);
  }

  private static AllocationResult allocate(
      ReferenceSnapshot snapshot, List<Flight> flights, AllocationOptions options) {
    TimeSlotGrid grid = TimeSlotGrid.build(DAY, snapshot.settings());
    return new StandAllocator(snapshot)
        .allocate(grid, flights, MaintenanceCalendar.empty(grid), options, new RunControl());
  }

  @Test
  void singleArrivalOnSingleStand() {
    ReferenceSnapshot snapshot = base().stand(stand("S1", "C")).build();

    AllocationResult result = allocate(snapshot, List.of(arrival("F1", "A320", "10:00")));

    Allocation allocation = result.assignmentOf("F1");
    assertThat(allocation.standId()).isEqualTo("S1");
    assertThat(allocation.start()).isEqualTo(at("09:45"));
    assertThat(allocation.end()).isEqualTo(at("10:45"));
    assertThat(allocation.score()).isEqualTo(1.0);
    assertThat(result.unallocated()).isEmpty();
    StandUtilisation utilisation = result.utilisation().stand("S1");
    assertThat(utilisation.occupiedMinutes()).isEqualTo(60);
    assertThat(utilisation.availableMinutes()).isEqualTo(17 * 60);
    assertEquals(60.0 / 1020.0, utilisation.ratio(), 1e-9);
  }

  @Test
  void singleDepartureOccupiesTurnaroundBeforeAndGapAfter() {
    ReferenceSnapshot snapshot = base().stand(stand("S1", "C")).build();

    AllocationResult result = allocate(snapshot, List.of(departure("F1", "A320", "10:00")));

    Allocation allocation = result.assignmentOf("F1");
    assertThat(allocation.start()).isEqualTo(at("09:15"));
    assertThat(allocation.end()).isEqualTo(at("10:15"));
  }

  @Test
  void adjacencyBlocksLargeAircraftNextToOccupiedStand() {
    ReferenceSnapshot snapshot = base()
        .stand(stand("S1", "E"))
        .stand(stand("S2", "F"))
        .adjacency(new StandAdjacency("S1", "S2", ImpactDirection.RIGHT,
            AdjacencyRestriction.MAX_SIZE_REDUCED, "E", "C", null, true))
        .build();
    List<Flight> flights = List.of(
        arrival("F1A", "B777", "08:15"),
        departure("F1D", "B777", "09:45"),
        arrival("F2", "B747", "09:15"));

    AllocationResult result = allocate(snapshot, flights);

    assertThat(result.assignmentOf("F1A").standId()).isEqualTo("S1");
    assertThat(result.assignmentOf("F1A").start()).isEqualTo(at("08:00"));
    assertThat(result.assignmentOf("F1A").end()).isEqualTo(at("10:00"));
    assertThat(result.unallocatedOf("F2").reason()).isEqualTo(UnallocatedReason.ADJACENCY_CONFLICT);
  }

  @Test
  void adjacencyIsCheckedFromThePrimaryStandToo() {
    ReferenceSnapshot snapshot = base()
        .stand(stand("S1", "C"))
        .stand(stand("S2", "C"))
        .adjacency(new StandAdjacency("S1", "S2", ImpactDirection.LEFT,
            AdjacencyRestriction.NO_USE, null, null, null, true))
        .build();
    // the rotation is placed first and takes S1, which then forbids any use of S2
    List<Flight> flights = List.of(
        arrival("R1", "A320", "09:00"),
        departure("R2", "A320", "11:00"),
        departure("D1", "E190", "10:30"));

    AllocationResult result = allocate(snapshot, flights);

    assertThat(result.assignmentOf("R1").standId()).isEqualTo("S1");
    assertThat(result.unallocatedOf("D1").reason()).isEqualTo(UnallocatedReason.ADJACENCY_CONFLICT);
  }

  @Test
  void prohibitedTypeNextToOccupiedStand() {
    ReferenceSnapshot snapshot = base()
        .stand(stand("S1", "C"))
        .stand(stand("S2", "C"))
        .adjacency(new StandAdjacency("S1", "S2", ImpactDirection.LEFT,
            AdjacencyRestriction.AIRCRAFT_TYPE_PROHIBITED, null, null, "A320", true))
        .build();
    List<Flight> flights = List.of(
        arrival("R1", "E190", "09:00"),
        departure("R2", "E190", "11:00"),
        departure("D1", "A320", "10:30"),
        flight("D2", FlightNature.DEPARTURE, "E190", "10:30", "F-HZZZ"));

    AllocationResult result = allocate(snapshot, flights);

    assertThat(result.assignmentOf("R1").standId()).isEqualTo("S1");
    assertThat(result.unallocatedOf("D1").reason()).isEqualTo(UnallocatedReason.ADJACENCY_CONFLICT);
    assertThat(result.assignmentOf("D2").standId()).isEqualTo("S2");
  }

  @Test
  void largeAircraftRejectedNextToAlreadyOccupiedNeighbour() {
    ReferenceSnapshot snapshot = base()
        .stand(stand("S1", "E"))
        .stand(stand("S2", "F"))
        .adjacency(new StandAdjacency("S1", "S2", ImpactDirection.RIGHT,
            AdjacencyRestriction.MAX_SIZE_REDUCED, "E", "C", null, true))
        .build();
    // the B747 rotation only fits S2 and is placed first; the B777 on S1 would then trigger
    // the rule against it
    List<Flight> flights = List.of(
        flight("J1A", FlightNature.ARRIVAL, "B747", "08:15", "G-CIVA"),
        flight("J1D", FlightNature.DEPARTURE, "B747", "10:15", "G-CIVA"),
        arrival("W1", "B777", "09:15"));

    AllocationResult result = allocate(snapshot, flights);

    assertThat(result.assignmentOf("J1A").standId()).isEqualTo("S2");
    assertThat(result.assignmentOf("J1D").standId()).isEqualTo("S2");
    assertThat(result.unallocatedOf("W1").reason()).isEqualTo(UnallocatedReason.ADJACENCY_CONFLICT);
  }

  @Test
  void everyOverlappingPairOnAdjacentStandsHonoursTheRule() {
    ReferenceSnapshot snapshot = base()
        .stand(stand("S1", "C"))
        .stand(stand("S2", "E"))
        .stand(stand("S3", "F"))
        .stand(stand("S4", "C"))
        .stand(stand("S5", "F"))
        .adjacency(new StandAdjacency("S2", "S3", ImpactDirection.RIGHT,
            AdjacencyRestriction.MAX_SIZE_REDUCED, "E", "C", null, true))
        .adjacency(new StandAdjacency("S3", "S2", ImpactDirection.LEFT,
            AdjacencyRestriction.MAX_SIZE_REDUCED, "F", "C", null, true))
        .adjacency(new StandAdjacency("S1", "S4", ImpactDirection.RIGHT,
            AdjacencyRestriction.AIRCRAFT_TYPE_PROHIBITED, null, null, "E190", true))
        .adjacency(new StandAdjacency("S4", "S1", ImpactDirection.LEFT,
            AdjacencyRestriction.NO_USE, "C", null, null, true))
        .adjacency(new StandAdjacency("S5", "S3", ImpactDirection.LEFT,
            AdjacencyRestriction.NO_USE, "F", null, null, true))
        .build();
    String[] types = {"A320", "E190", "B777", "B747"};
    Random random = new Random(20250602L);
    List<Flight> flights = new ArrayList<>();
    for (int i = 0; i < 80; i++) {
      int minute = 390 + 15 * random.nextInt(58);
      String hhmm = String.format("%02d:%02d", minute / 60, minute % 60);
      FlightNature nature = random.nextBoolean() ? FlightNature.ARRIVAL : FlightNature.DEPARTURE;
      flights.add(flight("G" + i, nature, types[random.nextInt(types.length)], hhmm, null));
    }
    Map<String, Flight> byId = new HashMap<>();
    flights.forEach(f -> byId.put(f.id(), f));

    AllocationResult result = allocate(snapshot, flights);

    assertThat(result.assignments()).isNotEmpty();
    for (StandAdjacency rule : snapshot.adjacencies()) {
      for (Allocation primary : result.assignments()) {
        if (!primary.standId().equals(rule.standId())) {
          continue;
        }
        if (rule.triggerSizeCode() != null
            && rankOf(snapshot, byId.get(primary.flightId()))
                < snapshot.sizeRank(rule.triggerSizeCode())) {
          continue;
        }
        for (Allocation neighbour : result.assignments()) {
          if (!neighbour.standId().equals(rule.adjacentStandId())
              || !primary.start().isBefore(neighbour.end())
              || !neighbour.start().isBefore(primary.end())) {
            continue;
          }
          Flight occupant = byId.get(neighbour.flightId());
          String pair = primary.flightId() + " on " + rule.standId() + " and "
              + neighbour.flightId() + " on " + rule.adjacentStandId();
          switch (rule.restriction()) {
            case NO_USE -> throw new AssertionError("no-use rule broken by " + pair);
            case MAX_SIZE_REDUCED -> assertThat(rankOf(snapshot, occupant))
                .as(pair)
                .isLessThanOrEqualTo(snapshot.sizeRank(rule.maxSizeWhenAdjacentCode()));
            case AIRCRAFT_TYPE_PROHIBITED -> assertThat(occupant.aircraftTypeCode())
                .as(pair)
                .isNotEqualTo(rule.prohibitedAircraftTypeCode());
            default -> throw new IllegalStateException("Unexpected restriction " + rule.restriction());
          }
        }
      }
    }
  }

  private static int rankOf(ReferenceSnapshot snapshot, Flight flight) {
    return snapshot.sizeRank(
        snapshot.requireAircraftType(flight.aircraftTypeCode()).sizeCategoryCode());
  }

  @Test
  void flightWithoutAirlineIsRejected() {
    assertThatThrownBy(() -> new Flight(
            "F1", null, "100", at("10:00"), FlightNature.ARRIVAL, "A320", "CDG", 180, null))
        .isInstanceOf(ConfigException.class)
        .hasMessageContaining("no airline");
    assertThatThrownBy(() -> new Flight(
            "F1", " ", "100", at("10:00"), FlightNature.ARRIVAL, "A320", "CDG", 180, null))
        .isInstanceOf(ConfigException.class);
  }

  @Test
  void rotationOccupiesOneContiguousWindow() {
    ReferenceSnapshot snapshot = base().stand(stand("S1", "C")).stand(stand("S2", "C")).build();
    List<Flight> flights = List.of(
        flight("IN", FlightNature.ARRIVAL, "A320", "10:00", "F-HABC"),
        flight("OUT", FlightNature.DEPARTURE, "A320", "11:00", "F-HABC"));

    AllocationResult result = allocate(snapshot, flights);

    Allocation in = result.assignmentOf("IN");
    Allocation out = result.assignmentOf("OUT");
    assertThat(in.standId()).isEqualTo(out.standId());
    assertThat(in.start()).isEqualTo(at("09:45"));
    assertThat(in.end()).isEqualTo(at("11:15"));
    assertThat(out.start()).isEqualTo(in.start());
    assertThat(out.end()).isEqualTo(in.end());
    assertThat(in.linkedFlightId()).isEqualTo("OUT");
    assertThat(out.linkedFlightId()).isEqualTo("IN");
    assertThat(result.utilisation().stand(in.standId()).occupiedMinutes()).isEqualTo(90);
  }

  @Test
  void largerAircraftWinsTheOnlyFittingStand() {
    ReferenceSnapshot snapshot = base().stand(stand("S1", "E")).build();
    List<Flight> flights = List.of(departure("NB", "A320", "10:00"), departure("WB", "B777", "10:00"));

    AllocationResult result = allocate(snapshot, flights);

    assertThat(result.assignmentOf("WB").standId()).isEqualTo("S1");
    assertThat(result.unallocatedOf("NB").reason()).isEqualTo(UnallocatedReason.STAND_BUSY);
  }

  @Test
  void smallerAircraftMovesToTighterStand() {
    ReferenceSnapshot snapshot = base().stand(stand("S1", "E")).stand(stand("S2", "C")).build();
    List<Flight> flights = List.of(departure("NB", "A320", "10:00"), departure("WB", "B777", "10:00"));

    AllocationResult result = allocate(snapshot, flights);

    assertThat(result.assignmentOf("WB").standId()).isEqualTo("S1");
    assertThat(result.assignmentOf("NB").standId()).isEqualTo("S2");
    assertThat(result.assignmentOf("NB").score()).isEqualTo(1.0);
    assertThat(result.unallocated()).isEmpty();
  }

  @Test
  void prefersLessLoadedStandAmongEquallyTightOnes() {
    ReferenceSnapshot snapshot = base().stand(stand("S1", "C")).stand(stand("S2", "C")).build();
    List<Flight> flights = List.of(departure("D1", "A320", "08:00"), departure("D2", "A320", "12:00"));

    AllocationResult result = allocate(snapshot, flights);

    assertThat(result.assignmentOf("D1").standId()).isEqualTo("S1");
    assertThat(result.assignmentOf("D2").standId()).isEqualTo("S2");
  }

  @Test
  void keepsDefaultGapBetweenOccupancies() {
    ReferenceSnapshot snapshot = base().stand(stand("S1", "C")).build();
    // arrival window 09:45-10:45; the departure windows start at 10:45 and 11:00
    List<Flight> tooClose = List.of(arrival("A1", "A320", "10:00"), departure("D1", "E190", "11:30"));
    List<Flight> separated = List.of(arrival("A1", "A320", "10:00"), departure("D1", "E190", "11:45"));

    assertThat(allocate(snapshot, tooClose).unallocatedOf("D1").reason())
        .isEqualTo(UnallocatedReason.STAND_BUSY);
    assertThat(allocate(snapshot, separated).assignmentOf("D1").start()).isEqualTo(at("11:00"));
  }

  @Test
  void windowBeyondOperatingDayIsUnallocated() {
    ReferenceSnapshot snapshot = base().stand(stand("S1", "C")).build();

    AllocationResult result = allocate(snapshot, List.of(arrival("EARLY", "A320", "06:05"),
        departure("LATE", "A320", "22:55")));

    assertThat(result.unallocatedOf("EARLY").reason())
        .isEqualTo(UnallocatedReason.OUTSIDE_OPERATING_WINDOW);
    assertThat(result.unallocatedOf("LATE").reason())
        .isEqualTo(UnallocatedReason.OUTSIDE_OPERATING_WINDOW);
  }

  @Test
  void aircraftLargerThanEveryStandHasNoEligibleStand() {
    ReferenceSnapshot snapshot = base().stand(stand("S1", "C")).stand(stand("S2", "E")).build();

    AllocationResult result = allocate(snapshot, List.of(arrival("J1", "B747", "10:00"),
        arrival("J2", "B747", "14:00")));

    assertThat(result.unallocated()).extracting(UnallocatedFlight::reason)
        .containsOnly(UnallocatedReason.NO_ELIGIBLE_STAND);
    assertThat(result.assignments()).isEmpty();
  }

  @Test
  void approvedMaintenanceBlocksStand() {
    ReferenceSnapshot snapshot = base().stand(stand("S1", "C")).build();
    TimeSlotGrid grid = TimeSlotGrid.build(DAY, snapshot.settings());
    MaintenanceCalendar calendar = MaintenanceCalendar.approved(grid, List.of(
        new MaintenanceRequest("M1", "S1", at("09:00"), at("12:00"), MaintenanceStatus.APPROVED, null)),
        snapshot);

    AllocationResult result = new StandAllocator(snapshot).allocate(grid,
        List.of(arrival("F1", "A320", "10:00"), arrival("F2", "A320", "15:00")),
        calendar, AllocationOptions.DEFAULT, new RunControl());

    assertThat(result.unallocatedOf("F1").reason()).isEqualTo(UnallocatedReason.MAINTENANCE_CONFLICT);
    assertThat(result.assignmentOf("F2").standId()).isEqualTo("S1");
    assertThat(result.utilisation().stand("S1").availableMinutes()).isEqualTo(14 * 60);
  }

  @Test
  void airlineTerminalAllocationRestrictsStands() {
    ReferenceSnapshot snapshot = base()
        .terminal(new Terminal("T2", "Terminal 2"))
        .pier(new Pier("P2", "B", "T2", "Pier B"))
        .stand(stand("S1", "P1", "C"))
        .stand(stand("S2", "P2", "E"))
        .airlineAllocation(new AirlineTerminalAllocation("XX", "T2", false))
        .build();

    AllocationResult result = allocate(snapshot, List.of(arrival("F1", "A320", "10:00")));

    assertThat(result.assignmentOf("F1").standId()).isEqualTo("S2");
    assertThat(result.assignmentOf("F1").score()).isEqualTo(1.0 / 3);
  }

  @Test
  void contactStandRequirementExcludesRemoteStands() {
    Stand remote = new Stand("S1", "S1", "P1", 36, 45, "C", false, true, null);
    ReferenceSnapshot snapshot = base()
        .stand(remote)
        .airlineAllocation(new AirlineTerminalAllocation("XX", "T1", true))
        .build();

    AllocationResult result = allocate(snapshot, List.of(arrival("F1", "A320", "10:00")));

    assertThat(result.unallocatedOf("F1").reason()).isEqualTo(UnallocatedReason.NO_ELIGIBLE_STAND);
  }

  @Test
  void relocationPassAdmitsBlockedFlightWithoutLosingAny() {
    ReferenceSnapshot snapshot = base()
        .terminal(new Terminal("T2", "Terminal 2"))
        .pier(new Pier("P2", "B", "T2", "Pier B"))
        .stand(stand("S1", "P1", "C"))
        .stand(stand("S2", "P1", "E"))
        .stand(stand("S3", "P2", "E"))
        .airlineAllocation(new AirlineTerminalAllocation("YY", "T1", false))
        .build();
    List<Flight> flights = List.of(
        arrival("R1", "A320", "09:00"),
        departure("R2", "A320", "10:30"),
        arrival("X1", "A320", "09:30"),
        departure("X2", "A320", "10:45"),
        new Flight("Y1", "YY", "100", at("10:30"), FlightNature.DEPARTURE, "B777", "JFK", 350, null),
        departure("Z1", "A320", "20:00"));

    AllocationResult greedy = allocate(snapshot, flights);
    AllocationResult disabled = allocate(snapshot, flights, new AllocationOptions(false));
    AllocationResult enabled = allocate(snapshot, flights, new AllocationOptions(true));

    assertThat(greedy.allocatedCount()).isEqualTo(5);
    assertThat(greedy.unallocatedOf("Y1").reason()).isEqualTo(UnallocatedReason.STAND_BUSY);
    assertThat(disabled).isEqualTo(greedy);
    assertThat(enabled.allocatedCount()).isGreaterThanOrEqualTo(greedy.allocatedCount());
    assertThat(enabled.allocatedCount()).isEqualTo(6);
    assertThat(enabled.assignmentOf("Y1").standId()).isEqualTo("S2");
    assertThat(enabled.assignmentOf("X1").standId()).isEqualTo("S3");
    assertThat(enabled.displacedCount()).isEqualTo(1);
    assertThat(enabled.unallocated()).isEmpty();
  }

  @Test
  void allocationIsDeterministicRegardlessOfInputOrder() {
    ReferenceSnapshot snapshot = base()
        .stand(stand("S1", "C"))
        .stand(stand("S2", "C"))
        .stand(stand("S3", "E"))
        .build();
    List<Flight> flights = new ArrayList<>(List.of(
        arrival("A1", "A320", "08:00"),
        departure("D1", "A320", "09:30"),
        arrival("A2", "E190", "08:10"),
        departure("D2", "B777", "08:30"),
        arrival("A3", "B777", "12:00"),
        departure("D3", "A320", "08:45"),
        departure("D4", "E190", "08:40")));

    AllocationResult first = allocate(snapshot, flights);
    Collections.reverse(flights);
    AllocationResult second = allocate(snapshot, flights);

    assertThat(second).isEqualTo(first);
  }

  @Test
  void allocationsRespectStandGapAndEligibility() {
    ReferenceSnapshot snapshot = base().stand(stand("S1", "C")).stand(stand("S2", "E")).build();
    List<Flight> flights = new ArrayList<>();
    for (int hour = 7; hour < 21; hour++) {
      String time = String.format("%02d:%02d", hour, (hour * 7) % 60);
      flights.add(departure("D" + hour, hour % 3 == 0 ? "B777" : "A320", time));
      flights.add(arrival("A" + hour, "E190", time));
    }

    AllocationResult result = allocate(snapshot, flights);

    assertThat(result.allocatedCount() + result.unallocated().size()).isEqualTo(flights.size());
    for (Allocation a : result.assignments()) {
      for (Allocation b : result.assignments()) {
        if (a != b && a.standId().equals(b.standId()) && !a.flightId().equals(b.linkedFlightId())) {
          boolean separated = !a.end().plusMinutes(15).isAfter(b.start())
              || !b.end().plusMinutes(15).isAfter(a.start());
          assertThat(separated).as("%s and %s on %s", a.flightId(), b.flightId(), a.standId()).isTrue();
        }
      }
    }
    assertThat(result.assignments())
        .filteredOn(a -> a.flightId().startsWith("D") && a.standId().equals("S1"))
        .allSatisfy(a -> assertThat(Integer.parseInt(a.flightId().substring(1)) % 3).isNotZero());
  }

  @Test
  void perSlotUtilisationComparesAllocationsWithCapacity() {
    ReferenceSnapshot snapshot = base().stand(stand("S1", "C")).stand(stand("S2", "C")).build();

    AllocationResult result = allocate(snapshot, List.of(arrival("F1", "A320", "10:00")));

    SlotUtilisation tenOClock = result.utilisation().perSlot().get(16);
    assertThat(tenOClock.allocated()).isEqualTo(1);
    assertThat(tenOClock.capacity()).isEqualTo(2);
    assertThat(tenOClock.ratio()).isEqualTo(0.5);
    assertThat(result.utilisation().perSlot().get(0).allocated()).isZero();
  }

  @Test
  void unknownAircraftTypeIsDataError() {
    ReferenceSnapshot snapshot = base().stand(stand("S1", "C")).build();

    assertThatThrownBy(() -> allocate(snapshot, List.of(arrival("F1", "Z999", "10:00"))))
        .isInstanceOf(DataException.class)
        .extracting(e -> ((DataException) e).getOffendingId())
        .isEqualTo("Z999");
  }

  @Test
  void missingTurnaroundRuleIsConfigError() {
    ReferenceSnapshot snapshot = base()
        .aircraftType(new AircraftType("CRJ9", "CRJ9", "CRJ-900", 24.9, 36.2, "C"))
        .stand(stand("S1", "C"))
        .build();

    assertThatThrownBy(() -> allocate(snapshot, List.of(arrival("F1", "CRJ9", "10:00"))))
        .isInstanceOf(ConfigException.class);
  }

  @Test
  void cancelledRunStopsBeforeNextFlight() {
    ReferenceSnapshot snapshot = base().stand(stand("S1", "C")).build();
    TimeSlotGrid grid = TimeSlotGrid.build(DAY, snapshot.settings());
    RunControl control = new RunControl();
    control.cancel();

    AllocationResult result = new StandAllocator(snapshot).allocate(grid,
        List.of(arrival("F1", "A320", "10:00")), MaintenanceCalendar.empty(grid),
        AllocationOptions.DEFAULT, control);

    assertThat(result.complete()).isFalse();
    assertThat(result.assignments()).isEmpty();
    assertThat(control.flightsProcessed()).isZero();
  }
}

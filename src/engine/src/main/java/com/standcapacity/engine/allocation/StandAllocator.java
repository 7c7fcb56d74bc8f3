package com.standcapacity.engine.allocation;

import com.standcapacity.engine.capacity.EligibilityMatrix;
import com.standcapacity.engine.error.InternalPlanningException;
import com.standcapacity.engine.flight.Flight;
import com.standcapacity.engine.maintenance.MaintenanceCalendar;
import com.standcapacity.engine.reference.AircraftType;
import com.standcapacity.engine.reference.AirlineTerminalAllocation;
import com.standcapacity.engine.reference.ReferenceSnapshot;
import com.standcapacity.engine.reference.Stand;
import com.standcapacity.engine.run.RunControl;
import com.standcapacity.engine.slot.Interval;
import com.standcapacity.engine.slot.OccupancyCalculator;
import com.standcapacity.engine.slot.TimeSlot;
import com.standcapacity.engine.slot.TimeSlotGrid;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Greedy, deterministic stand allocator.
 *
 * <p>Demands (single movements and rotations) are placed one by one in priority order on the
 * best-scoring stand whose timeline admits the slot-aligned window without breaking maintenance
 * or adjacency rules. The greedy pass never backtracks. An optional relocation pass then tries,
 * for each unallocated demand, to move a single blocking placement to another stand.
 */
public class StandAllocator {
  private static final Logger log = LoggerFactory.getLogger(StandAllocator.class);

  private final ReferenceSnapshot snapshot;
  private final EligibilityMatrix matrix;
  private final OccupancyCalculator occupancy;
  private final RotationMatcher rotationMatcher;

  public StandAllocator(ReferenceSnapshot snapshot) {
    this(snapshot, EligibilityMatrix.of(snapshot));
  }

  public StandAllocator(ReferenceSnapshot snapshot, EligibilityMatrix matrix) {
    this.snapshot = snapshot;
    this.matrix = matrix;
    this.occupancy = new OccupancyCalculator(snapshot);
    this.rotationMatcher = new RotationMatcher(occupancy);
  }

  public AllocationResult allocate(TimeSlotGrid grid, List<Flight> flights) {
    return allocate(
        grid, flights, MaintenanceCalendar.empty(grid), AllocationOptions.DEFAULT, new RunControl());
  }

  /**
   * Allocates the flights of one operating day.
   *
   * @param grid slot grid of the day
   * @param flights validated flights of the day
   * @param maintenance approved downtime of the day
   * @param options allocator switches
   * @param control cancellation and progress; checked before every demand
   * @return allocation result, incomplete when cancelled
   * @throws com.standcapacity.engine.error.DataException for duplicate flight ids or unknown
   *     aircraft types
   * @throws com.standcapacity.engine.error.ConfigException when a type has no turnaround rule
   */
  public AllocationResult allocate(
      TimeSlotGrid grid,
      List<Flight> flights,
      MaintenanceCalendar maintenance,
      AllocationOptions options,
      RunControl control) {
    for (Flight flight : flights) {
      snapshot.requireAircraftType(flight.aircraftTypeCode());
    }
    RotationMatcher.Pairing pairing = rotationMatcher.match(flights);
    List<Demand> demands = demands(grid, pairing);
    demands.sort(Demand.PRIORITY);

    Run run = new Run(grid, maintenance);
    Map<Demand, UnallocatedReason> unallocated = new LinkedHashMap<>();
    boolean complete = true;

    for (Demand demand : demands) {
      if (control.isCancelled()) {
        complete = false;
        break;
      }
      if (demand.window() == null) {
        unallocated.put(demand, UnallocatedReason.OUTSIDE_OPERATING_WINDOW);
        log.debug("Demand {} falls outside the operating window", demand.id());
      } else {
        Attempt attempt = run.tryPlace(demand);
        if (attempt.placement() != null) {
          run.timeline.add(attempt.placement());
          log.debug("Demand {} placed on {}", demand.id(), attempt.placement().stand().code());
        } else {
          unallocated.put(demand, attempt.reason());
          log.debug("Demand {} unallocated: {}", demand.id(), attempt.reason().code());
        }
      }
      control.flightsProcessed(demand.flights().size());
    }

    int displaced = 0;
    if (complete && options.displacementEnabled()) {
      displaced = run.relocate(unallocated);
    }
    run.verify();

    return new AllocationResult(
        grid.day(),
        assignments(grid, run.timeline),
        unallocatedFlights(unallocated),
        utilisation(grid, run.timeline, maintenance),
        pairing.issues(),
        displaced,
        complete);
  }

  private List<Demand> demands(TimeSlotGrid grid, RotationMatcher.Pairing pairing) {
    List<Demand> demands = new ArrayList<>();
    for (Rotation rotation : pairing.rotations()) {
      Flight arrival = rotation.arrival();
      Interval required = occupancy.rotation(
          grid.minuteOf(arrival.scheduledTime()),
          grid.minuteOf(rotation.departure().scheduledTime()));
      demands.add(demand(grid, List.of(arrival, rotation.departure()), required));
    }
    for (Flight flight : pairing.singles()) {
      int minute = grid.minuteOf(flight.scheduledTime());
      Interval required = flight.isArrival()
          ? occupancy.arrival(minute, flight.aircraftTypeCode())
          : occupancy.departure(minute, flight.aircraftTypeCode());
      demands.add(demand(grid, List.of(flight), required));
    }
    return demands;
  }

  private Demand demand(TimeSlotGrid grid, List<Flight> flights, Interval required) {
    AircraftType type = snapshot.requireAircraftType(flights.get(0).aircraftTypeCode());
    Interval window = grid.slotRange(required).map(grid::toInterval).orElse(null);
    return new Demand(
        flights.get(0).id(),
        flights,
        type,
        snapshot.sizeRank(type.sizeCategoryCode()),
        required,
        window);
  }

  /** Stands eligible for the demand's aircraft type and airline, in stand order. */
  List<Stand> eligibleStands(Demand demand) {
    List<AirlineTerminalAllocation> allocations = snapshot.airlineAllocations(demand.airlineCode());
    List<Stand> eligible = new ArrayList<>();
    for (Stand stand : matrix.standsFor(demand.type().code())) {
      if (allocations.isEmpty() || airlineMayUse(allocations, stand)) {
        eligible.add(stand);
      }
    }
    return eligible;
  }

  private boolean airlineMayUse(List<AirlineTerminalAllocation> allocations, Stand stand) {
    String terminal = snapshot.terminalCodeOf(stand);
    boolean allowed = false;
    for (AirlineTerminalAllocation allocation : allocations) {
      if (!allocation.terminalCode().equals(terminal)) {
        continue;
      }
      if (allocation.requiresContactStand() && !stand.hasJetBridge()) {
        return false;
      }
      allowed = true;
    }
    return allowed;
  }

  private List<Allocation> assignments(TimeSlotGrid grid, StandTimeline timeline) {
    List<Allocation> assignments = new ArrayList<>();
    for (Placement placement : timeline.all()) {
      double score = 1.0 / (1 + placement.tightness());
      for (Flight flight : placement.demand().flights()) {
        assignments.add(new Allocation(
            flight.id(),
            placement.demand().linkedIdOf(flight),
            placement.stand().id(),
            placement.stand().code(),
            grid.timeAt(placement.window().start()),
            grid.timeAt(placement.window().end()),
            score));
      }
    }
    assignments.sort(Comparator.comparing(Allocation::start)
        .thenComparingInt(a -> snapshot.standOrder(a.standId()))
        .thenComparing(Allocation::flightId));
    return List.copyOf(assignments);
  }

  private static List<UnallocatedFlight> unallocatedFlights(Map<Demand, UnallocatedReason> unallocated) {
    List<UnallocatedFlight> result = new ArrayList<>();
    unallocated.forEach((demand, reason) -> {
      for (Flight flight : demand.flights()) {
        result.add(new UnallocatedFlight(flight.id(), demand.linkedIdOf(flight), reason));
      }
    });
    result.sort(Comparator.comparing(UnallocatedFlight::flightId));
    return List.copyOf(result);
  }

  private Utilisation utilisation(
      TimeSlotGrid grid, StandTimeline timeline, MaintenanceCalendar maintenance) {
    List<StandUtilisation> perStand = new ArrayList<>();
    for (Stand stand : matrix.stands()) {
      int availableSlots = 0;
      for (TimeSlot slot : grid.slots()) {
        if (maintenance.isAvailable(stand, slot.index())) {
          availableSlots++;
        }
      }
      int available = availableSlots * grid.slotDurationMinutes();
      int occupied = timeline.occupiedMinutes(stand.id());
      perStand.add(new StandUtilisation(
          stand.id(), stand.code(), occupied, available, ratio(occupied, available)));
    }

    List<SlotUtilisation> perSlot = new ArrayList<>();
    for (TimeSlot slot : grid.slots()) {
      int capacity = 0;
      int allocated = 0;
      for (Stand stand : matrix.stands()) {
        if (maintenance.isAvailable(stand, slot.index())) {
          capacity++;
        }
        allocated += timeline.overlapping(stand.id(), slot.minutes()).size();
      }
      perSlot.add(new SlotUtilisation(
          slot.index(), slot.start(), allocated, capacity, ratio(allocated, capacity)));
    }
    return new Utilisation(List.copyOf(perStand), List.copyOf(perSlot));
  }

  private static double ratio(int numerator, int denominator) {
    return denominator == 0 ? 0.0 : (double) numerator / denominator;
  }

  private record Attempt(Placement placement, UnallocatedReason reason) {}

  /** Mutable state of one allocation run. */
  private final class Run {
    private final MaintenanceCalendar maintenance;
    private final StandTimeline timeline;
    private final AdjacencyGraph adjacency;

    Run(TimeSlotGrid grid, MaintenanceCalendar maintenance) {
      this.maintenance = maintenance;
      this.timeline = new StandTimeline(grid.settings().defaultGapMinutes());
      this.adjacency = new AdjacencyGraph(snapshot);
    }

    /** Best admissible placement, or the most specific reason none exists. */
    Attempt tryPlace(Demand demand) {
      List<Stand> candidates = ranked(demand);
      if (candidates.isEmpty()) {
        return new Attempt(null, UnallocatedReason.NO_ELIGIBLE_STAND);
      }
      UnallocatedReason reason = UnallocatedReason.MAINTENANCE_CONFLICT;
      for (Stand stand : candidates) {
        if (maintenance.blocks(stand.id(), demand.window())) {
          continue;
        }
        if (!timeline.conflicts(stand.id(), demand.window()).isEmpty()) {
          reason = moreSpecific(reason, UnallocatedReason.STAND_BUSY);
          continue;
        }
        if (!adjacency.blockers(demand, stand.id(), demand.window(), timeline).isEmpty()) {
          reason = moreSpecific(reason, UnallocatedReason.ADJACENCY_CONFLICT);
          continue;
        }
        return new Attempt(new Placement(demand, stand, demand.window(), tightness(demand, stand)), null);
      }
      return new Attempt(null, reason);
    }

    /** Candidates by fit tightness, then current load, then stand order. */
    private List<Stand> ranked(Demand demand) {
      List<Stand> candidates = new ArrayList<>(eligibleStands(demand));
      Map<String, Integer> load = new LinkedHashMap<>();
      for (Stand stand : candidates) {
        load.put(stand.id(), timeline.occupiedMinutes(stand.id()));
      }
      candidates.sort(Comparator.comparingInt((Stand s) -> tightness(demand, s))
          .thenComparingInt(s -> load.get(s.id()))
          .thenComparingInt(s -> snapshot.standOrder(s.id())));
      return candidates;
    }

    private int tightness(Demand demand, Stand stand) {
      return Math.max(0, snapshot.sizeRank(stand.maxSizeCategoryCode()) - demand.sizeRank());
    }

    /**
     * Tries to admit each unallocated demand by moving exactly one blocking placement to another
     * stand. Every accepted move allocates one more demand and the blocker stays allocated, so the
     * allocated count only grows. Each demand is visited once.
     *
     * @return number of relocated placements
     */
    int relocate(Map<Demand, UnallocatedReason> unallocated) {
      int moved = 0;
      List<Demand> pending = new ArrayList<>(unallocated.keySet());
      for (Demand demand : pending) {
        UnallocatedReason reason = unallocated.get(demand);
        if (reason != UnallocatedReason.STAND_BUSY && reason != UnallocatedReason.ADJACENCY_CONFLICT) {
          continue;
        }
        if (relocateFor(demand)) {
          unallocated.remove(demand);
          moved++;
        }
      }
      if (moved > 0) {
        log.debug("Relocation pass admitted {} demands", moved);
      }
      return moved;
    }

    private boolean relocateFor(Demand demand) {
      for (Stand stand : ranked(demand)) {
        if (maintenance.blocks(stand.id(), demand.window())) {
          continue;
        }
        Set<Placement> blockers =
            new LinkedHashSet<>(timeline.conflicts(stand.id(), demand.window()));
        blockers.addAll(adjacency.blockers(demand, stand.id(), demand.window(), timeline));
        if (blockers.size() != 1) {
          continue;
        }
        Placement blocker = blockers.iterator().next();
        timeline.remove(blocker);
        Attempt admitted = tryPlace(demand);
        if (admitted.placement() == null) {
          timeline.add(blocker);
          continue;
        }
        timeline.add(admitted.placement());
        Optional<Placement> rehomed = Optional.ofNullable(tryPlace(blocker.demand()).placement());
        if (rehomed.isPresent()) {
          timeline.add(rehomed.get());
          log.debug(
              "Moved {} from {} to {} to admit {}",
              blocker.demand().id(),
              blocker.stand().code(),
              rehomed.get().stand().code(),
              demand.id());
          return true;
        }
        timeline.remove(admitted.placement());
        timeline.add(blocker);
      }
      return false;
    }

    void verify() {
      int gap = timeline.gapMinutes();
      for (Stand stand : matrix.stands()) {
        Placement previous = null;
        for (Placement placement : timeline.placements(stand.id())) {
          if (previous != null && previous.window().end() + gap > placement.window().start()) {
            throw new InternalPlanningException(
                "placements " + previous.demand().id() + " and " + placement.demand().id()
                    + " overlap on stand " + stand.id());
          }
          previous = placement;
        }
      }
    }
  }

  private static UnallocatedReason moreSpecific(UnallocatedReason current, UnallocatedReason next) {
    return next.ordinal() > current.ordinal() ? next : current;
  }
}

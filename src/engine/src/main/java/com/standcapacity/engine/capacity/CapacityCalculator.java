package com.standcapacity.engine.capacity;

import com.standcapacity.engine.reference.AdjacencyRestriction;
import com.standcapacity.engine.reference.AircraftType;
import com.standcapacity.engine.reference.ReferenceSnapshot;
import com.standcapacity.engine.reference.Stand;
import com.standcapacity.engine.reference.StandAdjacency;
import com.standcapacity.engine.run.RunControl;
import com.standcapacity.engine.slot.SlotBlock;
import com.standcapacity.engine.slot.TimeSlot;
import com.standcapacity.engine.slot.TimeSlotGrid;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Enumerates the theoretical capacity of the stand inventory over a slot grid.
 *
 * <p>Slot generation ignores adjacency: a stand contributes to every category in its capability
 * set while it is available. Adjacency only shows up in the worst-case figures. The calculator is
 * stateless and can be shared between runs.
 */
public class CapacityCalculator {
  private static final Logger log = LoggerFactory.getLogger(CapacityCalculator.class);

  private final ReferenceSnapshot snapshot;
  private final EligibilityMatrix matrix;
  private final Map<String, Set<String>> worstCaseCapability;

  public CapacityCalculator(ReferenceSnapshot snapshot) {
    this.snapshot = snapshot;
    this.matrix = EligibilityMatrix.of(snapshot);
    this.worstCaseCapability = worstCaseCapabilities();
  }

  public EligibilityMatrix matrix() {
    return matrix;
  }

  public CapacityResult calculate(TimeSlotGrid grid, CapacityMode mode) {
    return calculate(grid, mode, StandAvailability.ALWAYS, new RunControl());
  }

  /**
   * Computes the capacity of one day.
   *
   * @param grid slot grid of the day
   * @param mode pivot axis; totals do not depend on it
   * @param availability per-slot overlay, e.g. a maintenance calendar
   * @param control cancellation and progress; checked before every slot
   * @return capacity result, incomplete when cancelled
   */
  public CapacityResult calculate(
      TimeSlotGrid grid, CapacityMode mode, StandAvailability availability, RunControl control) {
    List<String> categories = snapshot.sizeCategoryCodes();
    List<Stand> stands = matrix.stands();
    int slotMinutes = grid.slotDurationMinutes();

    List<SlotCapacity> bySlot = new ArrayList<>(grid.slotCount());
    Map<String, Integer> slotsByCategory = zeroCounts(categories);
    Map<String, Integer> worstSlotsByCategory = zeroCounts(categories);
    Map<String, Integer> availableSlotsByStand = new HashMap<>();
    Map<String, Map<String, Integer>> typeCounts = new LinkedHashMap<>();
    int availableStandSlots = 0;
    boolean complete = true;

    for (TimeSlot slot : grid.slots()) {
      if (control.isCancelled()) {
        complete = false;
        break;
      }
      Map<String, Integer> counts = zeroCounts(categories);
      int available = 0;
      for (Stand stand : stands) {
        if (!availability.isAvailable(stand, slot.index())) {
          continue;
        }
        available++;
        availableSlotsByStand.merge(stand.id(), 1, Integer::sum);
        for (String category : matrix.capability(stand.id())) {
          counts.merge(category, 1, Integer::sum);
        }
        for (String category : worstCaseCapability.get(stand.id())) {
          worstSlotsByCategory.merge(category, 1, Integer::sum);
        }
        if (mode == CapacityMode.BY_AIRCRAFT_TYPE) {
          for (String type : matrix.typesAt(stand.id())) {
            typeCounts.computeIfAbsent(type, k -> new LinkedHashMap<>())
                .merge(slot.label(), 1, Integer::sum);
          }
        }
      }
      counts.forEach((category, count) -> slotsByCategory.merge(category, count, Integer::sum));
      availableStandSlots += available;
      bySlot.add(new SlotCapacity(
          slot.index(), slot.start(), Collections.unmodifiableMap(counts), available));
      control.slotProcessed();
    }

    CapacityResult result = new CapacityResult(
        grid.day(),
        mode,
        slotMinutes,
        categories,
        List.copyOf(bySlot),
        toStandHours(slotsByCategory, slotMinutes),
        blocks(grid, bySlot, categories),
        hours(bySlot, categories, slotMinutes),
        standHours(availableStandSlots, slotMinutes),
        toStandHours(worstSlotsByCategory, slotMinutes),
        turns(availableSlotsByStand, slotMinutes, grid.settings().defaultGapMinutes()),
        pivot(mode, grid, bySlot, categories, typeCounts),
        complete);
    log.debug(
        "Capacity {} mode={} slots={} grandTotal={} complete={}",
        grid.day(),
        mode,
        bySlot.size(),
        result.grandTotal(),
        complete);
    return result;
  }

  private Map<String, Set<String>> worstCaseCapabilities() {
    Map<String, Set<String>> result = new HashMap<>();
    for (Stand stand : matrix.stands()) {
      Set<String> types = new LinkedHashSet<>(matrix.typesAt(stand.id()));
      for (StandAdjacency rule : snapshot.adjacencies()) {
        if (!rule.active() || !rule.adjacentStandId().equals(stand.id())) {
          continue;
        }
        boolean primaryActive = snapshot.stand(rule.standId()).map(Stand::active).orElse(false);
        if (!primaryActive) {
          continue;
        }
        if (rule.restriction() == AdjacencyRestriction.NO_USE) {
          types.clear();
        } else if (rule.restriction() == AdjacencyRestriction.MAX_SIZE_REDUCED) {
          int cap = snapshot.sizeRank(rule.maxSizeWhenAdjacentCode());
          types.removeIf(code -> sizeRankOf(code) > cap);
        } else {
          types.remove(rule.prohibitedAircraftTypeCode());
        }
      }
      Set<String> categories = new LinkedHashSet<>();
      for (String category : snapshot.sizeCategoryCodes()) {
        for (String code : types) {
          if (snapshot.requireAircraftType(code).sizeCategoryCode().equals(category)) {
            categories.add(category);
            break;
          }
        }
      }
      result.put(stand.id(), categories);
    }
    return result;
  }

  private int sizeRankOf(String aircraftTypeCode) {
    return snapshot.sizeRank(snapshot.requireAircraftType(aircraftTypeCode).sizeCategoryCode());
  }

  private List<BlockCapacity> blocks(
      TimeSlotGrid grid, List<SlotCapacity> bySlot, List<String> categories) {
    List<BlockCapacity> blocks = new ArrayList<>();
    for (SlotBlock block : grid.blocks()) {
      if (block.slots().lastExclusive() > bySlot.size()) {
        break;
      }
      Map<String, Integer> counts = new LinkedHashMap<>();
      for (String category : categories) {
        int min = Integer.MAX_VALUE;
        for (int i = block.slots().first(); i < block.slots().lastExclusive(); i++) {
          min = Math.min(min, bySlot.get(i).count(category));
        }
        counts.put(category, min);
      }
      blocks.add(new BlockCapacity(
          block.index(), block.start(), block.end(), Collections.unmodifiableMap(counts)));
    }
    return List.copyOf(blocks);
  }

  private List<HourCapacity> hours(
      List<SlotCapacity> bySlot, List<String> categories, int slotMinutes) {
    Map<OffsetDateTime, Map<String, Integer>> slotsPerHour = new LinkedHashMap<>();
    for (SlotCapacity slot : bySlot) {
      Map<String, Integer> counts = slotsPerHour.computeIfAbsent(
          slot.start().truncatedTo(ChronoUnit.HOURS), k -> zeroCounts(categories));
      slot.countsByCategory().forEach((category, count) -> counts.merge(category, count, Integer::sum));
    }
    List<HourCapacity> hours = new ArrayList<>(slotsPerHour.size());
    slotsPerHour.forEach((hour, counts) ->
        hours.add(new HourCapacity(hour, toStandHours(counts, slotMinutes))));
    return List.copyOf(hours);
  }

  private Map<String, Integer> turns(
      Map<String, Integer> availableSlotsByStand, int slotMinutes, int gapMinutes) {
    Map<String, Integer> turns = new LinkedHashMap<>();
    for (AircraftType type : snapshot.aircraftTypes()) {
      OptionalInt turnaround = snapshot.turnaroundMinutes(type.code());
      if (turnaround.isEmpty()) {
        continue;
      }
      int cycle = turnaround.getAsInt() + gapMinutes;
      int total = 0;
      for (Stand stand : matrix.standsFor(type.code())) {
        int availableMinutes = availableSlotsByStand.getOrDefault(stand.id(), 0) * slotMinutes;
        total += availableMinutes / cycle;
      }
      turns.put(type.code(), total);
    }
    return Collections.unmodifiableMap(turns);
  }

  private List<PivotRow> pivot(
      CapacityMode mode,
      TimeSlotGrid grid,
      List<SlotCapacity> bySlot,
      List<String> categories,
      Map<String, Map<String, Integer>> typeCounts) {
    List<PivotRow> rows = new ArrayList<>();
    switch (mode) {
      case BY_TIME_SLOT -> {
        for (SlotCapacity slot : bySlot) {
          rows.add(new PivotRow(grid.slot(slot.slotIndex()).label(), slot.countsByCategory()));
        }
      }
      case BY_SIZE_CATEGORY -> {
        for (String category : categories) {
          Map<String, Integer> values = new LinkedHashMap<>();
          for (SlotCapacity slot : bySlot) {
            values.put(grid.slot(slot.slotIndex()).label(), slot.count(category));
          }
          rows.add(new PivotRow(category, Collections.unmodifiableMap(values)));
        }
      }
      case BY_AIRCRAFT_TYPE -> {
        for (AircraftType type : snapshot.aircraftTypes()) {
          Map<String, Integer> counted = typeCounts.getOrDefault(type.code(), Map.of());
          Map<String, Integer> values = new LinkedHashMap<>();
          for (SlotCapacity slot : bySlot) {
            String label = grid.slot(slot.slotIndex()).label();
            values.put(label, counted.getOrDefault(label, 0));
          }
          rows.add(new PivotRow(type.code(), Collections.unmodifiableMap(values)));
        }
      }
      default -> throw new IllegalStateException("Unsupported capacity mode " + mode);
    }
    return List.copyOf(rows);
  }

  private static Map<String, Integer> zeroCounts(List<String> categories) {
    Map<String, Integer> counts = new LinkedHashMap<>();
    for (String category : categories) {
      counts.put(category, 0);
    }
    return counts;
  }

  private static Map<String, Double> toStandHours(Map<String, Integer> slotCounts, int slotMinutes) {
    Map<String, Double> hours = new LinkedHashMap<>();
    slotCounts.forEach((category, slots) -> hours.put(category, standHours(slots, slotMinutes)));
    return Collections.unmodifiableMap(hours);
  }

  static double standHours(int standSlots, int slotMinutes) {
    return standSlots * (double) slotMinutes / 60.0;
  }
}

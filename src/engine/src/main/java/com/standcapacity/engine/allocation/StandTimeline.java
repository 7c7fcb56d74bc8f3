package com.standcapacity.engine.allocation;

import com.standcapacity.engine.error.InternalPlanningException;
import com.standcapacity.engine.slot.Interval;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Placements of a run keyed by stand, each stand ordered by window start. Windows on one stand
 * never conflict, so they are also ordered by end.
 */
final class StandTimeline {
  private final int gapMinutes;
  private final Map<String, TreeMap<Integer, Placement>> byStand = new HashMap<>();

  StandTimeline(int gapMinutes) {
    this.gapMinutes = gapMinutes;
  }

  int gapMinutes() {
    return gapMinutes;
  }

  /** Placements on the stand that would be closer than the gap to {@code window}. */
  List<Placement> conflicts(String standId, Interval window) {
    return within(standId, window, gapMinutes);
  }

  /** Placements on the stand whose windows overlap {@code window}. */
  List<Placement> overlapping(String standId, Interval window) {
    return within(standId, window, 0);
  }

  private List<Placement> within(String standId, Interval window, int gap) {
    TreeMap<Integer, Placement> placements = byStand.get(standId);
    if (placements == null) {
      return List.of();
    }
    List<Placement> result = new ArrayList<>();
    NavigableMap<Integer, Placement> candidates =
        placements.headMap(window.end() + gap, false).descendingMap();
    for (Placement placement : candidates.values()) {
      if (placement.window().end() + gap <= window.start()) {
        break;
      }
      if (placement.window().conflictsWith(window, gap)) {
        result.add(placement);
      }
    }
    return result;
  }

  void add(Placement placement) {
    TreeMap<Integer, Placement> placements =
        byStand.computeIfAbsent(placement.stand().id(), k -> new TreeMap<>());
    if (!conflicts(placement.stand().id(), placement.window()).isEmpty()) {
      throw new InternalPlanningException(
          "placement of " + placement.demand().id() + " conflicts on stand " + placement.stand().id());
    }
    placements.put(placement.window().start(), placement);
  }

  void remove(Placement placement) {
    TreeMap<Integer, Placement> placements = byStand.get(placement.stand().id());
    if (placements == null || placements.remove(placement.window().start()) == null) {
      throw new InternalPlanningException(
          "placement of " + placement.demand().id() + " is not on stand " + placement.stand().id());
    }
  }

  int occupiedMinutes(String standId) {
    TreeMap<Integer, Placement> placements = byStand.get(standId);
    if (placements == null) {
      return 0;
    }
    int total = 0;
    for (Placement placement : placements.values()) {
      total += placement.window().length();
    }
    return total;
  }

  Collection<Placement> placements(String standId) {
    TreeMap<Integer, Placement> placements = byStand.get(standId);
    return placements == null ? List.of() : placements.values();
  }

  List<Placement> all() {
    List<Placement> all = new ArrayList<>();
    byStand.values().forEach(placements -> all.addAll(placements.values()));
    return all;
  }
}

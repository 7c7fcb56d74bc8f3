package com.standcapacity.engine.allocation;

import com.standcapacity.engine.reference.ReferenceSnapshot;
import com.standcapacity.engine.reference.StandAdjacency;
import com.standcapacity.engine.slot.Interval;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Active adjacency rules as adjacency lists keyed by stand id. The graph may contain cycles;
 * it only stores ids and consults the timeline for occupants.
 */
final class AdjacencyGraph {
  private final ReferenceSnapshot snapshot;
  private final Map<String, List<StandAdjacency>> outgoing = new HashMap<>();
  private final Map<String, List<StandAdjacency>> incoming = new HashMap<>();

  AdjacencyGraph(ReferenceSnapshot snapshot) {
    this.snapshot = snapshot;
    for (StandAdjacency rule : snapshot.adjacencies()) {
      if (!rule.active()) {
        continue;
      }
      outgoing.computeIfAbsent(rule.standId(), k -> new ArrayList<>()).add(rule);
      incoming.computeIfAbsent(rule.adjacentStandId(), k -> new ArrayList<>()).add(rule);
    }
  }

  /**
   * Placements that would violate an adjacency rule together with {@code demand} on
   * {@code standId} over {@code window}, in either direction.
   */
  Set<Placement> blockers(Demand demand, String standId, Interval window, StandTimeline timeline) {
    Set<Placement> blockers = new LinkedHashSet<>();
    for (StandAdjacency rule : outgoing.getOrDefault(standId, List.of())) {
      if (!triggers(rule, demand)) {
        continue;
      }
      for (Placement neighbour : timeline.overlapping(rule.adjacentStandId(), window)) {
        if (!permits(rule, neighbour.demand())) {
          blockers.add(neighbour);
        }
      }
    }
    for (StandAdjacency rule : incoming.getOrDefault(standId, List.of())) {
      if (permits(rule, demand)) {
        continue;
      }
      for (Placement primary : timeline.overlapping(rule.standId(), window)) {
        if (triggers(rule, primary.demand())) {
          blockers.add(primary);
        }
      }
    }
    return blockers;
  }

  private boolean triggers(StandAdjacency rule, Demand occupant) {
    return rule.triggerSizeCode() == null
        || occupant.sizeRank() >= snapshot.sizeRank(rule.triggerSizeCode());
  }

  private boolean permits(StandAdjacency rule, Demand occupant) {
    return switch (rule.restriction()) {
      case NO_USE -> false;
      case MAX_SIZE_REDUCED -> occupant.sizeRank() <= snapshot.sizeRank(rule.maxSizeWhenAdjacentCode());
      case AIRCRAFT_TYPE_PROHIBITED -> !occupant.type().code().equals(rule.prohibitedAircraftTypeCode());
    };
  }
}

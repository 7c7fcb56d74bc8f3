package com.standcapacity.engine.maintenance;

import java.time.OffsetDateTime;
import java.util.Map;

/** Impacted minus baseline stand count per category for one slot; values are {@code <= 0}. */
public record SlotDelta(int slotIndex, OffsetDateTime start, Map<String, Integer> deltaByCategory) {
  public int delta(String category) {
    return deltaByCategory.getOrDefault(category, 0);
  }
}

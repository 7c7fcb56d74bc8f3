package com.standcapacity.engine.capacity;

import java.time.OffsetDateTime;
import java.util.Map;

/**
 * Capacity of one slot.
 *
 * @param slotIndex slot position in the day
 * @param start slot start
 * @param countsByCategory number of stands able to host each size category
 * @param availableStands active stands not blocked in this slot
 */
public record SlotCapacity(
    int slotIndex, OffsetDateTime start, Map<String, Integer> countsByCategory, int availableStands) {

  public int count(String category) {
    return countsByCategory.getOrDefault(category, 0);
  }
}

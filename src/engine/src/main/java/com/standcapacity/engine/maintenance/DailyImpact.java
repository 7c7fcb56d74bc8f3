package com.standcapacity.engine.maintenance;

import com.standcapacity.engine.capacity.CapacityResult;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Capacity impact of maintenance on one operating day.
 *
 * @param day operating day
 * @param baseline capacity with maintenance ignored
 * @param impacted capacity with approved downtime subtracted
 * @param deltaByCategory impacted minus baseline stand-hours
 * @param deltaBySlot per-slot count deltas
 * @param potentialDeltaByCategory additional stand-hours lost if requested maintenance were
 *     approved; empty when potential impact was not asked for
 */
public record DailyImpact(
    LocalDate day,
    CapacityResult baseline,
    CapacityResult impacted,
    Map<String, Double> deltaByCategory,
    List<SlotDelta> deltaBySlot,
    Map<String, Double> potentialDeltaByCategory) {

  public double delta(String category) {
    return deltaByCategory.getOrDefault(category, 0.0);
  }
}

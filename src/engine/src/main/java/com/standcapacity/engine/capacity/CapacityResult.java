package com.standcapacity.engine.capacity;

import com.standcapacity.engine.run.RunResult;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Theoretical capacity of the stand inventory for one operating day.
 *
 * @param day operating day
 * @param mode pivot axis of {@link #pivot()}
 * @param slotDurationMinutes slot duration used
 * @param categories size category codes in order
 * @param bySlot per-slot counts, chronological
 * @param byCategory available stand-hours per category over the day
 * @param byBlock per-block counts
 * @param byHour per clock hour stand-hours
 * @param grandTotal available stand-hours of the inventory, each stand counted once
 * @param worstCaseByCategory stand-hours per category when every adjacency restriction is active
 * @param turnsByAircraftType theoretical turns per day for each type with a turnaround rule
 * @param pivot mode-dependent rows
 * @param complete {@code false} when the run was cancelled before the last slot
 */
public record CapacityResult(
    LocalDate day,
    CapacityMode mode,
    int slotDurationMinutes,
    List<String> categories,
    List<SlotCapacity> bySlot,
    Map<String, Double> byCategory,
    List<BlockCapacity> byBlock,
    List<HourCapacity> byHour,
    double grandTotal,
    Map<String, Double> worstCaseByCategory,
    Map<String, Integer> turnsByAircraftType,
    List<PivotRow> pivot,
    boolean complete)
    implements RunResult {

  /** Stand-hours available for a category, 0 for an unknown one. */
  public double standHours(String category) {
    return byCategory.getOrDefault(category, 0.0);
  }

  public SlotCapacity slot(int slotIndex) {
    return bySlot.get(slotIndex);
  }
}

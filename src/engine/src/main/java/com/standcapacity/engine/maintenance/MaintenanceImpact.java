package com.standcapacity.engine.maintenance;

import com.standcapacity.engine.run.RunResult;
import java.util.List;
import java.util.Map;

/**
 * Capacity lost to maintenance over a date range.
 *
 * @param range analysed days
 * @param perDay one entry per analysed day, chronological
 * @param lostStandHoursByCategory stand-hours lost per category over the range, {@code >= 0}
 * @param affectedStands maintenance windows intersecting the range
 * @param complete {@code false} when the run was cancelled
 */
public record MaintenanceImpact(
    DateRange range,
    List<DailyImpact> perDay,
    Map<String, Double> lostStandHoursByCategory,
    List<AffectedStandWindow> affectedStands,
    boolean complete)
    implements RunResult {}

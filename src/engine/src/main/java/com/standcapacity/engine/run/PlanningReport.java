package com.standcapacity.engine.run;

import com.standcapacity.engine.allocation.AllocationResult;
import com.standcapacity.engine.capacity.CapacityResult;
import com.standcapacity.engine.maintenance.MaintenanceImpact;

/**
 * Outputs of a pipeline run. Stages after a cancelled one are {@code null}.
 *
 * @param capacity baseline capacity of the day
 * @param allocation allocation of the day
 * @param impact maintenance impact over the requested range
 */
public record PlanningReport(
    CapacityResult capacity, AllocationResult allocation, MaintenanceImpact impact)
    implements RunResult {

  @Override
  public boolean complete() {
    return capacity != null && capacity.complete()
        && allocation != null && allocation.complete()
        && impact != null && impact.complete();
  }
}

package com.standcapacity.engine.maintenance;

import com.standcapacity.engine.capacity.CapacityMode;

/**
 * Options of a maintenance impact run.
 *
 * @param mode pivot axis of the embedded capacity results
 * @param includePotential also report the impact of requests still awaiting approval
 */
public record ImpactOptions(CapacityMode mode, boolean includePotential) {
  public static final ImpactOptions DEFAULT = new ImpactOptions(CapacityMode.BY_TIME_SLOT, false);

  public ImpactOptions {
    if (mode == null) {
      mode = CapacityMode.BY_TIME_SLOT;
    }
  }
}

package com.standcapacity.engine.allocation;

/**
 * Allocator switches.
 *
 * @param displacementEnabled run the relocation pass after the greedy pass
 */
public record AllocationOptions(boolean displacementEnabled) {
  public static final AllocationOptions DEFAULT = new AllocationOptions(false);
}

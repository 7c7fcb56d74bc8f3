package com.standcapacity.engine.capacity;

/** Pivot axis of a capacity report. Totals never depend on the mode. */
public enum CapacityMode {
  BY_TIME_SLOT,
  BY_AIRCRAFT_TYPE,
  BY_SIZE_CATEGORY
}

package com.standcapacity.engine.reference;

import com.standcapacity.engine.error.ConfigException;

/** Minimum ground time of an aircraft type between arrival and departure. */
public record TurnaroundRule(String aircraftTypeCode, int minimumMinutes) {
  public TurnaroundRule {
    if (aircraftTypeCode == null || aircraftTypeCode.isBlank()) {
      throw new ConfigException("turnaround rule requires an aircraft type");
    }
    if (minimumMinutes <= 0) {
      throw new ConfigException(
          "turnaround for " + aircraftTypeCode + " must be > 0 minutes, got " + minimumMinutes);
    }
  }
}

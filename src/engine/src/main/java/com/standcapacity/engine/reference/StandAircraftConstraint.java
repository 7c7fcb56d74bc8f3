package com.standcapacity.engine.reference;

import com.standcapacity.engine.error.ConfigException;

/**
 * Per-stand, per-aircraft-type override. A disallowing constraint removes the type from the
 * stand even when the size category and dimensions fit.
 */
public record StandAircraftConstraint(
    String standId, String aircraftTypeCode, boolean allowed, String reason) {
  public StandAircraftConstraint {
    if (standId == null || aircraftTypeCode == null) {
      throw new ConfigException("stand constraint requires a stand and an aircraft type");
    }
  }
}

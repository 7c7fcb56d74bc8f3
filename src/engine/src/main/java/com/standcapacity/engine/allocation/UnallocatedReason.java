package com.standcapacity.engine.allocation;

/** Why a flight could not be placed. Listed from least to most specific. */
public enum UnallocatedReason {
  OUTSIDE_OPERATING_WINDOW("outside_operating_window"),
  NO_ELIGIBLE_STAND("no_eligible_stand"),
  MAINTENANCE_CONFLICT("maintenance_conflict"),
  STAND_BUSY("stand_busy"),
  ADJACENCY_CONFLICT("adjacency_conflict");

  private final String code;

  UnallocatedReason(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }
}

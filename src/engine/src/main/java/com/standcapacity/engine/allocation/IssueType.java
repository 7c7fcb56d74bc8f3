package com.standcapacity.engine.allocation;

public enum IssueType {
  /** Arrival and departure share a registration but the ground time is below the turnaround. */
  TURNAROUND_NOT_MET,
  /** A movement with a registration has no counterpart on the day. */
  UNPAIRED_REGISTRATION
}

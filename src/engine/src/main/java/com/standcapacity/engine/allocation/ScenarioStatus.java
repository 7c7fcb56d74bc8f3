package com.standcapacity.engine.allocation;

/** Lifecycle of a schedule scenario: {@code DRAFT -> ALLOCATING -> ALLOCATED | FAILED}. */
public enum ScenarioStatus {
  DRAFT,
  ALLOCATING,
  ALLOCATED,
  FAILED,
  CANCELLED;

  public boolean isFinal() {
    return this == ALLOCATED || this == FAILED || this == CANCELLED;
  }
}

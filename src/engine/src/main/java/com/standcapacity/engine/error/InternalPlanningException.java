package com.standcapacity.engine.error;

/** Invariant violation detected by the engine about its own state. Never shown to end users. */
public class InternalPlanningException extends PlanningException {
  public InternalPlanningException(String message) {
    super(ErrorKind.INTERNAL, message);
  }
}

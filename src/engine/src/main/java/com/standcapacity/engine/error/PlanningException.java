package com.standcapacity.engine.error;

/**
 * Base type of every failure that aborts a planning run.
 *
 * <p>Per-flight allocation failures are never exceptions; they are reported as unallocated
 * flights. {@link com.standcapacity.engine.run.PlanningEngine} converts subclasses into typed run
 * outcomes at the run boundary.
 */
public abstract class PlanningException extends RuntimeException {
  private final ErrorKind kind;

  protected PlanningException(ErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  protected PlanningException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public ErrorKind getKind() {
    return kind;
  }
}

package com.standcapacity.engine.error;

/**
 * Raised when an input references an entity that does not exist (unknown stand, aircraft type,
 * size category, and so on).
 */
public class DataException extends PlanningException {
  private final String offendingId;

  /**
   * Creates a dangling-reference exception.
   *
   * @param message description of the broken reference
   * @param offendingId id of the unknown entity, surfaced to the caller
   */
  public DataException(String message, String offendingId) {
    super(ErrorKind.DATA, message);
    this.offendingId = offendingId;
  }

  public String getOffendingId() {
    return offendingId;
  }
}

package com.standcapacity.engine.maintenance;

import com.standcapacity.engine.error.ConfigException;
import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a maintenance request. Only {@link #APPROVED} and {@link #IN_PROGRESS} take a
 * stand out of capacity.
 */
public enum MaintenanceStatus {
  REQUESTED(1),
  APPROVED(2),
  IN_PROGRESS(3),
  ON_HOLD(4),
  COMPLETED(5),
  CANCELLED(6),
  REJECTED(7);

  private final int code;

  MaintenanceStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public boolean affectsCapacity() {
    return this == APPROVED || this == IN_PROGRESS;
  }

  public boolean isTerminal() {
    return this == COMPLETED;
  }

  /** Statuses reachable from this one in a single step. */
  public Set<MaintenanceStatus> nextStatuses() {
    return switch (this) {
      case REQUESTED -> EnumSet.of(APPROVED, REJECTED, CANCELLED);
      case APPROVED -> EnumSet.of(IN_PROGRESS, ON_HOLD, CANCELLED);
      case IN_PROGRESS -> EnumSet.of(ON_HOLD, COMPLETED, CANCELLED);
      case ON_HOLD -> EnumSet.of(IN_PROGRESS, CANCELLED);
      case REJECTED, CANCELLED -> EnumSet.of(REQUESTED);
      case COMPLETED -> EnumSet.noneOf(MaintenanceStatus.class);
    };
  }

  public boolean canTransitionTo(MaintenanceStatus target) {
    return nextStatuses().contains(target);
  }

  /**
   * Resolves a numeric status code.
   *
   * @param code status code, 1 to 7
   * @return matching status
   * @throws ConfigException when the code is unknown
   */
  public static MaintenanceStatus fromCode(int code) {
    for (MaintenanceStatus status : values()) {
      if (status.code == code) {
        return status;
      }
    }
    throw new ConfigException("unknown maintenance status code " + code);
  }
}

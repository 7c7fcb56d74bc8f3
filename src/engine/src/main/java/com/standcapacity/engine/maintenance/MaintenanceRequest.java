package com.standcapacity.engine.maintenance;

import com.standcapacity.engine.error.ConfigException;
import java.time.OffsetDateTime;

/**
 * Planned downtime of one stand.
 *
 * @param id opaque request id
 * @param standId stand taken out of service
 * @param start inclusive start
 * @param end exclusive end, after {@code start}
 * @param status current lifecycle status
 * @param title free text, may be {@code null}
 */
public record MaintenanceRequest(
    String id,
    String standId,
    OffsetDateTime start,
    OffsetDateTime end,
    MaintenanceStatus status,
    String title) {

  public MaintenanceRequest {
    if (id == null || id.isBlank() || standId == null || standId.isBlank()) {
      throw new ConfigException("maintenance request requires an id and a stand");
    }
    if (start == null || end == null || !start.isBefore(end)) {
      throw new ConfigException("maintenance request " + id + " must start before it ends");
    }
    if (status == null) {
      throw new ConfigException("maintenance request " + id + " has no status");
    }
  }

  /**
   * Moves the request to a new status.
   *
   * @param target next status
   * @return copy of this request in {@code target} status
   * @throws ConfigException when the transition is not allowed
   */
  public MaintenanceRequest transitionTo(MaintenanceStatus target) {
    if (!status.canTransitionTo(target)) {
      throw new ConfigException(
          "maintenance request " + id + " cannot move from " + status + " to " + target);
    }
    return new MaintenanceRequest(id, standId, start, end, target, title);
  }

  public boolean affectsCapacity() {
    return status.affectsCapacity();
  }
}

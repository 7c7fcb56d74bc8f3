package com.standcapacity.engine.maintenance;

import java.time.OffsetDateTime;

/**
 * A maintenance window intersecting the analysed range.
 *
 * @param requestId originating request
 * @param standId stand taken out of service
 * @param standCode stand code for display
 * @param start window start
 * @param end window end
 * @param status request status
 * @param potential {@code true} for a request not approved yet
 */
public record AffectedStandWindow(
    String requestId,
    String standId,
    String standCode,
    OffsetDateTime start,
    OffsetDateTime end,
    MaintenanceStatus status,
    boolean potential) {}

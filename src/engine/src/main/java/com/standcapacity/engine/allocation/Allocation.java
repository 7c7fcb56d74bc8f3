package com.standcapacity.engine.allocation;

import java.time.OffsetDateTime;

/**
 * Stand assignment of one flight. Both flights of a rotation get an allocation with the same
 * stand and window, each linking to the other.
 *
 * @param flightId allocated flight
 * @param linkedFlightId other flight of the rotation, or {@code null}
 * @param standId assigned stand
 * @param standCode assigned stand code
 * @param start slot-aligned occupancy start
 * @param end slot-aligned occupancy end, exclusive
 * @param score fit quality in {@code (0, 1]}; 1 when the stand's maximum size matches the aircraft
 */
public record Allocation(
    String flightId,
    String linkedFlightId,
    String standId,
    String standCode,
    OffsetDateTime start,
    OffsetDateTime end,
    double score) {}

package com.standcapacity.engine.flight;

import com.standcapacity.engine.error.ConfigException;
import java.time.OffsetDateTime;

/**
 * Validated scheduled flight for one operating day. Immutable to the allocator.
 *
 * @param id opaque flight id, unique within a flight list
 * @param airlineCode IATA airline code
 * @param flightNumber flight number without the airline prefix
 * @param scheduledTime scheduled on/off-block time with explicit offset
 * @param nature arrival or departure
 * @param aircraftTypeCode IATA aircraft type code
 * @param originDestinationCode origin for arrivals, destination for departures
 * @param seatCapacity configured seats
 * @param registration aircraft registration, may be {@code null}; used to pair rotations
 */
public record Flight(
    String id,
    String airlineCode,
    String flightNumber,
    OffsetDateTime scheduledTime,
    FlightNature nature,
    String aircraftTypeCode,
    String originDestinationCode,
    int seatCapacity,
    String registration) {

  public Flight {
    if (id == null || id.isBlank()) {
      throw new ConfigException("flight id must not be blank");
    }
    if (airlineCode == null || airlineCode.isBlank()) {
      throw new ConfigException("flight " + id + " has no airline");
    }
    if (scheduledTime == null || nature == null) {
      throw new ConfigException("flight " + id + " requires a scheduled time and a nature");
    }
    if (aircraftTypeCode == null || aircraftTypeCode.isBlank()) {
      throw new ConfigException("flight " + id + " has no aircraft type");
    }
    if (seatCapacity < 0) {
      throw new ConfigException("flight " + id + " has a negative seat capacity");
    }
    if (registration != null && registration.isBlank()) {
      registration = null;
    }
  }

  public boolean isArrival() {
    return nature == FlightNature.ARRIVAL;
  }

  public boolean hasRegistration() {
    return registration != null;
  }
}

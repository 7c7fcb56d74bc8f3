package com.standcapacity.engine.allocation;

import com.standcapacity.engine.flight.Flight;
import com.standcapacity.engine.reference.AircraftType;
import com.standcapacity.engine.slot.Interval;
import java.util.Comparator;
import java.util.List;

/**
 * One unit of allocation: a single movement or a rotation.
 *
 * @param id id of the first flight, used as tie-break
 * @param flights the movement, or the arrival then the departure
 * @param type aircraft type
 * @param sizeRank rank of the type's size category
 * @param required required occupancy in grid minutes
 * @param window slot-aligned occupancy, {@code null} when outside the operating window
 */
record Demand(
    String id,
    List<Flight> flights,
    AircraftType type,
    int sizeRank,
    Interval required,
    Interval window) {

  /** Rotations, then larger aircraft, then earlier start, then id. */
  static final Comparator<Demand> PRIORITY =
      Comparator.comparing((Demand d) -> !d.isRotation())
          .thenComparing(Comparator.comparingInt(Demand::sizeRank).reversed())
          .thenComparingInt(d -> d.required().start())
          .thenComparing(Demand::id);

  boolean isRotation() {
    return flights.size() == 2;
  }

  String airlineCode() {
    return flights.get(0).airlineCode();
  }

  String linkedIdOf(Flight flight) {
    if (!isRotation()) {
      return null;
    }
    return flights.get(0).id().equals(flight.id()) ? flights.get(1).id() : flights.get(0).id();
  }
}

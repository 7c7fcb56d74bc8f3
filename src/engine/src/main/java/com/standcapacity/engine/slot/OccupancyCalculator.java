package com.standcapacity.engine.slot;

import com.standcapacity.engine.error.ConfigException;
import com.standcapacity.engine.reference.ReferenceSnapshot;
import java.util.OptionalInt;

/**
 * Turnaround and gap arithmetic producing the required stand occupancy of a movement.
 *
 * <ul>
 *   <li>departure at {@code t}: {@code [t - turnaround, t + gap)}</li>
 *   <li>arrival at {@code t}: {@code [t - gap, t + turnaround)}</li>
 *   <li>rotation arriving at {@code a}, departing at {@code d}: {@code [a - gap, d + gap)}</li>
 * </ul>
 */
public final class OccupancyCalculator {
  private final ReferenceSnapshot snapshot;
  private final int gapMinutes;

  public OccupancyCalculator(ReferenceSnapshot snapshot) {
    this.snapshot = snapshot;
    this.gapMinutes = snapshot.settings().defaultGapMinutes();
  }

  public int gapMinutes() {
    return gapMinutes;
  }

  /**
   * Minimum turnaround of an aircraft type.
   *
   * @param aircraftTypeCode IATA type code
   * @return turnaround in minutes
   * @throws ConfigException when no turnaround rule exists for the type
   */
  public int turnaroundMinutes(String aircraftTypeCode) {
    OptionalInt minutes = snapshot.turnaroundMinutes(aircraftTypeCode);
    if (minutes.isEmpty()) {
      throw new ConfigException("no turnaround rule for aircraft type " + aircraftTypeCode);
    }
    return minutes.getAsInt();
  }

  public Interval departure(int departureMinute, String aircraftTypeCode) {
    return new Interval(departureMinute - turnaroundMinutes(aircraftTypeCode), departureMinute + gapMinutes);
  }

  public Interval arrival(int arrivalMinute, String aircraftTypeCode) {
    return new Interval(arrivalMinute - gapMinutes, arrivalMinute + turnaroundMinutes(aircraftTypeCode));
  }

  public Interval rotation(int arrivalMinute, int departureMinute) {
    return new Interval(arrivalMinute - gapMinutes, departureMinute + gapMinutes);
  }
}

package com.standcapacity.engine.slot;

import java.time.OffsetDateTime;

/**
 * One fixed-duration slot of the operating day.
 *
 * @param index zero-based position in the day
 * @param start inclusive start
 * @param end exclusive end
 * @param minutes the same slot as minutes relative to the window start
 */
public record TimeSlot(int index, OffsetDateTime start, OffsetDateTime end, Interval minutes) {
  /** {@code HH:mm} label of the slot start. */
  public String label() {
    return start.toLocalTime().toString();
  }
}

package com.standcapacity.engine.reference;

import com.standcapacity.engine.error.ConfigException;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * Operating-day settings shared by every component of a run.
 *
 * <p>A {@code dayEnd} of {@code 00:00} means midnight at the end of the day.
 *
 * @param slotDurationMinutes duration of one slot
 * @param blockSizeSlots number of consecutive slots in a reporting block
 * @param dayStart start of the operating window, local time
 * @param dayEnd end of the operating window (exclusive), local time
 * @param defaultGapMinutes buffer kept between two occupancies of a stand
 * @param utcOffset offset in which local times are expressed
 */
public record OperationalSettings(
    int slotDurationMinutes,
    int blockSizeSlots,
    LocalTime dayStart,
    LocalTime dayEnd,
    int defaultGapMinutes,
    ZoneOffset utcOffset) {

  private static final int MINUTES_PER_DAY = 24 * 60;

  public OperationalSettings {
    Objects.requireNonNull(dayStart, "dayStart");
    Objects.requireNonNull(dayEnd, "dayEnd");
    if (utcOffset == null) {
      utcOffset = ZoneOffset.UTC;
    }
  }

  /**
   * Checks the invariants every slot computation relies on.
   *
   * @throws ConfigException when the window is empty or not on whole minutes, the slot duration
   *     does not divide it, or a numeric setting is out of range
   */
  public void validate() {
    if (slotDurationMinutes <= 0) {
      throw new ConfigException("slot duration must be > 0 minutes");
    }
    if (blockSizeSlots <= 0) {
      throw new ConfigException("block size must be > 0 slots");
    }
    if (defaultGapMinutes < 0) {
      throw new ConfigException("default gap must be >= 0 minutes");
    }
    requireWholeMinute(dayStart, "day start");
    requireWholeMinute(dayEnd, "day end");
    int window = endMinuteOfDay() - startMinuteOfDay();
    if (window <= 0) {
      throw new ConfigException("day end " + dayEnd + " must be after day start " + dayStart);
    }
    if (window % slotDurationMinutes != 0) {
      throw new ConfigException(
          "slot duration " + slotDurationMinutes + " does not evenly divide the "
              + window + " minute operating window");
    }
  }

  private static void requireWholeMinute(LocalTime time, String name) {
    if (time.getSecond() != 0 || time.getNano() != 0) {
      throw new ConfigException(name + " " + time + " must fall on a whole minute");
    }
  }

  public int startMinuteOfDay() {
    return dayStart.getHour() * 60 + dayStart.getMinute();
  }

  public int endMinuteOfDay() {
    if (LocalTime.MIDNIGHT.equals(dayEnd)) {
      return MINUTES_PER_DAY;
    }
    return dayEnd.getHour() * 60 + dayEnd.getMinute();
  }

  /** Length of the operating window in minutes; only meaningful after {@link #validate()}. */
  public int windowMinutes() {
    return endMinuteOfDay() - startMinuteOfDay();
  }
}

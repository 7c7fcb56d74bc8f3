package com.standcapacity.engine.slot;

import com.standcapacity.engine.reference.OperationalSettings;
import java.time.Duration;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Discrete slot schedule of one operating day.
 *
 * <p>Slots are contiguous, non-overlapping and cover {@code [dayStart, dayEnd)} with a fixed
 * duration. Internally every time is expressed in minutes relative to the window start
 * ({@link #origin()}), so interval arithmetic never touches time zones.
 */
public final class TimeSlotGrid {
  private final LocalDate day;
  private final OperationalSettings settings;
  private final OffsetDateTime origin;
  private final int windowMinutes;
  private final List<TimeSlot> slots;
  private final List<SlotBlock> blocks;

  private TimeSlotGrid(LocalDate day, OperationalSettings settings) {
    this.day = day;
    this.settings = settings;
    this.origin = day.atTime(settings.dayStart()).atOffset(settings.utcOffset());
    this.windowMinutes = settings.windowMinutes();

    int duration = settings.slotDurationMinutes();
    int count = windowMinutes / duration;
    List<TimeSlot> built = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      Interval minutes = new Interval(i * duration, (i + 1) * duration);
      built.add(new TimeSlot(i, timeAt(minutes.start()), timeAt(minutes.end()), minutes));
    }
    this.slots = List.copyOf(built);

    int blockSize = settings.blockSizeSlots();
    List<SlotBlock> builtBlocks = new ArrayList<>();
    for (int first = 0, index = 0; first < count; first += blockSize, index++) {
      int last = Math.min(first + blockSize, count);
      builtBlocks.add(new SlotBlock(
          index,
          new SlotRange(first, last),
          built.get(first).start(),
          built.get(last - 1).end()));
    }
    this.blocks = List.copyOf(builtBlocks);
  }

  /**
   * Builds the grid of a day.
   *
   * @param day operating day
   * @param settings operational settings
   * @return grid covering the operating window of {@code day}
   * @throws com.standcapacity.engine.error.ConfigException when the settings are malformed
   */
  public static TimeSlotGrid build(LocalDate day, OperationalSettings settings) {
    Objects.requireNonNull(day, "day");
    Objects.requireNonNull(settings, "settings");
    settings.validate();
    return new TimeSlotGrid(day, settings);
  }

  public LocalDate day() {
    return day;
  }

  public OperationalSettings settings() {
    return settings;
  }

  /** Start of the operating window; minute 0 of every {@link Interval}. */
  public OffsetDateTime origin() {
    return origin;
  }

  public int windowMinutes() {
    return windowMinutes;
  }

  public int slotDurationMinutes() {
    return settings.slotDurationMinutes();
  }

  public List<TimeSlot> slots() {
    return slots;
  }

  public TimeSlot slot(int index) {
    return slots.get(index);
  }

  public int slotCount() {
    return slots.size();
  }

  public List<SlotBlock> blocks() {
    return blocks;
  }

  public Interval window() {
    return new Interval(0, windowMinutes);
  }

  /** Minutes from the window start to {@code time}, rounded down to the minute. */
  public int minuteOf(OffsetDateTime time) {
    long seconds = Duration.between(origin, time).getSeconds();
    return Math.toIntExact(Math.floorDiv(seconds, 60L));
  }

  public OffsetDateTime timeAt(int minute) {
    return origin.plusMinutes(minute);
  }

  /**
   * Returns the slot containing a timestamp.
   *
   * @param time any timestamp
   * @return slot index, or empty when the timestamp lies outside the operating window
   */
  public OptionalInt slotIndexOf(OffsetDateTime time) {
    int minute = minuteOf(time);
    if (minute < 0 || minute >= windowMinutes) {
      return OptionalInt.empty();
    }
    return OptionalInt.of(minute / settings.slotDurationMinutes());
  }

  /**
   * Returns the slots covering an interval, rounded outward: the first slot starts at or before
   * {@code interval.start} and the last slot ends at or after {@code interval.end}.
   *
   * @param interval required occupancy
   * @return covering range, or empty when the interval is not inside the operating window
   */
  public Optional<SlotRange> slotRange(Interval interval) {
    if (!window().contains(interval)) {
      return Optional.empty();
    }
    int duration = settings.slotDurationMinutes();
    int first = Math.floorDiv(interval.start(), duration);
    int lastExclusive = -Math.floorDiv(-interval.end(), duration);
    return Optional.of(new SlotRange(first, lastExclusive));
  }

  /** Minutes spanned by a slot range. */
  public Interval toInterval(SlotRange range) {
    int duration = settings.slotDurationMinutes();
    return new Interval(range.first() * duration, range.lastExclusive() * duration);
  }

  /** Converts minutes relative to the window start into a timestamp interval start/end pair. */
  public OffsetDateTime startOf(Interval interval) {
    return timeAt(interval.start());
  }

  public OffsetDateTime endOf(Interval interval) {
    return timeAt(interval.end());
  }
}

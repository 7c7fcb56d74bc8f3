package com.standcapacity.engine.slot;

/**
 * Half-open interval {@code [start, end)} in minutes relative to the start of the operating
 * window. Values may fall outside the window.
 */
public record Interval(int start, int end) {
  public Interval {
    if (end <= start) {
      throw new IllegalArgumentException("interval end must be after start: " + start + ".." + end);
    }
  }

  public int length() {
    return end - start;
  }

  public boolean overlaps(Interval other) {
    return start < other.end && other.start < end;
  }

  /**
   * Returns whether the two intervals overlap once each is padded by {@code gap} minutes, which
   * is the separation rule between occupancies of one stand.
   */
  public boolean conflictsWith(Interval other, int gap) {
    return start < other.end + gap && other.start < end + gap;
  }

  public boolean contains(Interval other) {
    return start <= other.start && other.end <= end;
  }

  /** Intersection of the two intervals, or {@code null} when they do not overlap. */
  public Interval intersect(Interval other) {
    int from = Math.max(start, other.start);
    int to = Math.min(end, other.end);
    return from < to ? new Interval(from, to) : null;
  }
}

package com.standcapacity.engine.maintenance;

import com.standcapacity.engine.error.ConfigException;
import java.time.LocalDate;
import java.util.List;

/** Inclusive range of operating days. */
public record DateRange(LocalDate from, LocalDate to) {
  public DateRange {
    if (from == null || to == null || to.isBefore(from)) {
      throw new ConfigException("date range end must not be before its start");
    }
  }

  public static DateRange of(LocalDate day) {
    return new DateRange(day, day);
  }

  public List<LocalDate> days() {
    return from.datesUntil(to.plusDays(1)).toList();
  }

  public boolean contains(LocalDate day) {
    return !day.isBefore(from) && !day.isAfter(to);
  }
}

package com.standcapacity.engine.maintenance;

import com.standcapacity.engine.error.ConfigException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Maintenance repeated on a calendar pattern, e.g. a weekly apron inspection.
 *
 * <p>A window whose {@code endTime} is not after {@code startTime} ends on the following day.
 * Monthly schedules skip months without the requested day of month.
 *
 * @param id schedule id, prefix of the generated request ids
 * @param standId stand taken out of service
 * @param pattern recurrence pattern
 * @param dayOfWeek day for {@link RecurrencePattern#WEEKLY}
 * @param dayOfMonth day for {@link RecurrencePattern#MONTHLY}, 1 to 31
 * @param startTime local start of each window
 * @param endTime local end of each window
 * @param validFrom first day the schedule applies
 * @param validUntil last day the schedule applies, or {@code null} when open-ended
 * @param status status given to generated requests
 * @param title free text copied to generated requests
 */
public record RecurringMaintenanceSchedule(
    String id,
    String standId,
    RecurrencePattern pattern,
    DayOfWeek dayOfWeek,
    Integer dayOfMonth,
    LocalTime startTime,
    LocalTime endTime,
    LocalDate validFrom,
    LocalDate validUntil,
    MaintenanceStatus status,
    String title) {

  public RecurringMaintenanceSchedule {
    if (id == null || id.isBlank() || standId == null || standId.isBlank()) {
      throw new ConfigException("recurring maintenance requires an id and a stand");
    }
    if (pattern == null || startTime == null || endTime == null || validFrom == null) {
      throw new ConfigException(
          "recurring maintenance " + id + " requires a pattern, a time window and a start date");
    }
    if (pattern == RecurrencePattern.WEEKLY && dayOfWeek == null) {
      throw new ConfigException("weekly maintenance " + id + " requires a day of week");
    }
    if (pattern == RecurrencePattern.MONTHLY
        && (dayOfMonth == null || dayOfMonth < 1 || dayOfMonth > 31)) {
      throw new ConfigException("monthly maintenance " + id + " requires a day of month in 1..31");
    }
    if (validUntil != null && validUntil.isBefore(validFrom)) {
      throw new ConfigException("recurring maintenance " + id + " ends before it starts");
    }
    if (status == null) {
      status = MaintenanceStatus.APPROVED;
    }
  }

  /**
   * Generates one request per matching day in {@code range}.
   *
   * @param range days to expand
   * @param offset offset of the local times
   * @return generated requests, chronological; ids are {@code <scheduleId>@<date>}
   */
  public List<MaintenanceRequest> expand(DateRange range, ZoneOffset offset) {
    List<MaintenanceRequest> requests = new ArrayList<>();
    for (LocalDate day : range.days()) {
      if (!appliesOn(day)) {
        continue;
      }
      OffsetDateTime start = day.atTime(startTime).atOffset(offset);
      LocalDate endDay = endTime.isAfter(startTime) ? day : day.plusDays(1);
      OffsetDateTime end = endDay.atTime(endTime).atOffset(offset);
      requests.add(new MaintenanceRequest(id + "@" + day, standId, start, end, status, title));
    }
    return requests;
  }

  boolean appliesOn(LocalDate day) {
    if (day.isBefore(validFrom) || (validUntil != null && day.isAfter(validUntil))) {
      return false;
    }
    return switch (pattern) {
      case DAILY -> true;
      case WEEKLY -> day.getDayOfWeek() == dayOfWeek;
      case MONTHLY -> day.getDayOfMonth() == dayOfMonth;
    };
  }
}

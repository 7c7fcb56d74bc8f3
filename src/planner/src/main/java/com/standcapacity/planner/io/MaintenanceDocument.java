package com.standcapacity.planner.io;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** One-off maintenance requests and recurring schedules. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MaintenanceDocument(
  @JsonProperty("requests") List<RequestEntry> requests,
  @JsonProperty("schedules") List<ScheduleEntry> schedules
) {

  /** {@code status} is the numeric lifecycle code, 1 requested to 7 rejected. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record RequestEntry(
    @JsonProperty("id") String id,
    @JsonProperty("stand") String stand,
    @JsonProperty("start") String start,
    @JsonProperty("end") String end,
    @JsonProperty("status") int status,
    @JsonProperty("title") String title
  ) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record ScheduleEntry(
    @JsonProperty("id") String id,
    @JsonProperty("stand") String stand,
    @JsonProperty("pattern") String pattern,
    @JsonProperty("day_of_week") String dayOfWeek,
    @JsonProperty("day_of_month") Integer dayOfMonth,
    @JsonProperty("start_time") String startTime,
    @JsonProperty("end_time") String endTime,
    @JsonProperty("valid_from") String validFrom,
    @JsonProperty("valid_until") String validUntil,
    @JsonProperty("status") Integer status,
    @JsonProperty("title") String title
  ) {}
}

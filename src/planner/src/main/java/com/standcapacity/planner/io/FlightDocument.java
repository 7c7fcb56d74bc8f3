package com.standcapacity.planner.io;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Flight list of one operating day. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FlightDocument(
  @JsonProperty("day") String day,
  @JsonProperty("flights") List<FlightEntry> flights
) {

  /**
   * One scheduled movement. {@code scheduled_time} is ISO-8601 with an explicit offset and
   * {@code nature} is {@code A}/{@code D} or {@code arrival}/{@code departure}.
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record FlightEntry(
    @JsonProperty("id") String id,
    @JsonProperty("airline") String airline,
    @JsonProperty("flight_number") String flightNumber,
    @JsonProperty("scheduled_time") String scheduledTime,
    @JsonProperty("nature") String nature,
    @JsonProperty("aircraft_type") String aircraftType,
    @JsonProperty("origin_destination") String originDestination,
    @JsonProperty("seats") Integer seats,
    @JsonProperty("registration") String registration
  ) {}
}

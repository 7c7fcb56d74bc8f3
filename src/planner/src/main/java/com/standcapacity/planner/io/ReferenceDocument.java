package com.standcapacity.planner.io;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Reference data document as exchanged with the airport's master data export.
 *
 * <p>Unknown JSON attributes are ignored so newer exports keep loading. Absent lists are read as
 * empty; absent settings fall back to {@code planner.settings.*}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReferenceDocument(
  @JsonProperty("settings") SettingsEntry settings,
  @JsonProperty("size_categories") List<SizeCategoryEntry> sizeCategories,
  @JsonProperty("aircraft_types") List<AircraftTypeEntry> aircraftTypes,
  @JsonProperty("terminals") List<TerminalEntry> terminals,
  @JsonProperty("piers") List<PierEntry> piers,
  @JsonProperty("stands") List<StandEntry> stands,
  @JsonProperty("constraints") List<ConstraintEntry> constraints,
  @JsonProperty("adjacencies") List<AdjacencyEntry> adjacencies,
  @JsonProperty("turnaround_rules") List<TurnaroundEntry> turnaroundRules,
  @JsonProperty("airline_terminals") List<AirlineTerminalEntry> airlineTerminals
) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record SettingsEntry(
    @JsonProperty("slot_minutes") Integer slotMinutes,
    @JsonProperty("block_size") Integer blockSize,
    @JsonProperty("day_start") String dayStart,
    @JsonProperty("day_end") String dayEnd,
    @JsonProperty("gap_minutes") Integer gapMinutes,
    @JsonProperty("utc_offset") String utcOffset
  ) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record SizeCategoryEntry(
    @JsonProperty("code") String code,
    @JsonProperty("description") String description,
    @JsonProperty("min_wingspan_m") double minWingspanM,
    @JsonProperty("max_wingspan_m") double maxWingspanM,
    @JsonProperty("min_length_m") double minLengthM,
    @JsonProperty("max_length_m") double maxLengthM
  ) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record AircraftTypeEntry(
    @JsonProperty("code") String code,
    @JsonProperty("icao_code") String icaoCode,
    @JsonProperty("name") String name,
    @JsonProperty("wingspan_m") double wingspanM,
    @JsonProperty("length_m") double lengthM,
    @JsonProperty("size_category") String sizeCategory
  ) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record TerminalEntry(
    @JsonProperty("code") String code,
    @JsonProperty("name") String name
  ) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record PierEntry(
    @JsonProperty("id") String id,
    @JsonProperty("code") String code,
    @JsonProperty("terminal") String terminal,
    @JsonProperty("name") String name
  ) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record StandEntry(
    @JsonProperty("id") String id,
    @JsonProperty("code") String code,
    @JsonProperty("pier") String pier,
    @JsonProperty("max_wingspan_m") double maxWingspanM,
    @JsonProperty("max_length_m") double maxLengthM,
    @JsonProperty("max_size") String maxSize,
    @JsonProperty("jet_bridge") Boolean jetBridge,
    @JsonProperty("active") Boolean active,
    @JsonProperty("lat") Double lat,
    @JsonProperty("lon") Double lon
  ) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record ConstraintEntry(
    @JsonProperty("stand") String stand,
    @JsonProperty("aircraft_type") String aircraftType,
    @JsonProperty("allowed") boolean allowed,
    @JsonProperty("reason") String reason
  ) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record AdjacencyEntry(
    @JsonProperty("stand") String stand,
    @JsonProperty("adjacent_stand") String adjacentStand,
    @JsonProperty("direction") String direction,
    @JsonProperty("restriction") String restriction,
    @JsonProperty("trigger_size") String triggerSize,
    @JsonProperty("max_size_when_adjacent") String maxSizeWhenAdjacent,
    @JsonProperty("prohibited_aircraft_type") String prohibitedAircraftType,
    @JsonProperty("active") Boolean active
  ) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record TurnaroundEntry(
    @JsonProperty("aircraft_type") String aircraftType,
    @JsonProperty("minimum_minutes") int minimumMinutes
  ) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record AirlineTerminalEntry(
    @JsonProperty("airline") String airline,
    @JsonProperty("terminal") String terminal,
    @JsonProperty("requires_contact_stand") boolean requiresContactStand
  ) {}
}

package com.standcapacity.planner.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.standcapacity.engine.error.ConfigException;
import com.standcapacity.engine.flight.Flight;
import com.standcapacity.engine.flight.FlightNature;
import com.standcapacity.engine.maintenance.MaintenanceRequest;
import com.standcapacity.engine.maintenance.MaintenanceStatus;
import com.standcapacity.engine.maintenance.RecurrencePattern;
import com.standcapacity.engine.maintenance.RecurringMaintenanceSchedule;
import com.standcapacity.engine.reference.AdjacencyRestriction;
import com.standcapacity.engine.reference.AircraftType;
import com.standcapacity.engine.reference.AirlineTerminalAllocation;
import com.standcapacity.engine.reference.GeoPosition;
import com.standcapacity.engine.reference.ImpactDirection;
import com.standcapacity.engine.reference.OperationalSettings;
import com.standcapacity.engine.reference.Pier;
import com.standcapacity.engine.reference.ReferenceSnapshot;
import com.standcapacity.engine.reference.SizeCategory;
import com.standcapacity.engine.reference.Stand;
import com.standcapacity.engine.reference.StandAdjacency;
import com.standcapacity.engine.reference.StandAircraftConstraint;
import com.standcapacity.engine.reference.Terminal;
import com.standcapacity.engine.reference.TurnaroundRule;
import com.standcapacity.planner.config.PlannerProperties;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DayOfWeek;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Loads the JSON input documents and turns them into engine records.
 *
 * <p>Every parse failure surfaces as a {@link ConfigException} naming the document, so a bad
 * input fails the run as a configuration error rather than an internal one.
 */
@Component
public class PlanningInputReader {
  private static final Logger log = LoggerFactory.getLogger(PlanningInputReader.class);

  private final ObjectMapper objectMapper;
  private final PlannerProperties properties;

  public PlanningInputReader(ObjectMapper objectMapper, PlannerProperties properties) {
    this.objectMapper = objectMapper;
    this.properties = properties;
  }

  public ReferenceSnapshot readReference(Path path) {
    ReferenceDocument document = read(path, ReferenceDocument.class, "reference");
    ReferenceSnapshot.Builder builder = ReferenceSnapshot.builder().settings(settings(document.settings()));
    for (ReferenceDocument.SizeCategoryEntry entry : listOf(document.sizeCategories())) {
      builder.sizeCategory(new SizeCategory(
          entry.code(),
          entry.description(),
          entry.minWingspanM(),
          entry.maxWingspanM(),
          entry.minLengthM(),
          entry.maxLengthM()));
    }
    for (ReferenceDocument.AircraftTypeEntry entry : listOf(document.aircraftTypes())) {
      builder.aircraftType(new AircraftType(
          entry.code(), entry.icaoCode(), entry.name(), entry.wingspanM(), entry.lengthM(),
          entry.sizeCategory()));
    }
    for (ReferenceDocument.TerminalEntry entry : listOf(document.terminals())) {
      builder.terminal(new Terminal(entry.code(), entry.name()));
    }
    for (ReferenceDocument.PierEntry entry : listOf(document.piers())) {
      builder.pier(new Pier(entry.id(), entry.code(), entry.terminal(), entry.name()));
    }
    for (ReferenceDocument.StandEntry entry : listOf(document.stands())) {
      GeoPosition position = entry.lat() != null && entry.lon() != null
          ? new GeoPosition(entry.lat(), entry.lon())
          : null;
      builder.stand(new Stand(
          entry.id(),
          entry.code(),
          entry.pier(),
          entry.maxWingspanM(),
          entry.maxLengthM(),
          entry.maxSize(),
          Boolean.TRUE.equals(entry.jetBridge()),
          entry.active() == null || entry.active(),
          position));
    }
    for (ReferenceDocument.ConstraintEntry entry : listOf(document.constraints())) {
      builder.constraint(new StandAircraftConstraint(
          entry.stand(), entry.aircraftType(), entry.allowed(), entry.reason()));
    }
    for (ReferenceDocument.AdjacencyEntry entry : listOf(document.adjacencies())) {
      builder.adjacency(new StandAdjacency(
          entry.stand(),
          entry.adjacentStand(),
          entry.direction() == null
              ? null
              : parseEnum(entry.direction(), ImpactDirection::valueOf, "adjacency direction"),
          parseEnum(entry.restriction(), AdjacencyRestriction::valueOf, "adjacency restriction"),
          entry.triggerSize(),
          entry.maxSizeWhenAdjacent(),
          entry.prohibitedAircraftType(),
          entry.active() == null || entry.active()));
    }
    for (ReferenceDocument.TurnaroundEntry entry : listOf(document.turnaroundRules())) {
      builder.turnaroundRule(new TurnaroundRule(entry.aircraftType(), entry.minimumMinutes()));
    }
    for (ReferenceDocument.AirlineTerminalEntry entry : listOf(document.airlineTerminals())) {
      builder.airlineAllocation(new AirlineTerminalAllocation(
          entry.airline(), entry.terminal(), entry.requiresContactStand()));
    }
    ReferenceSnapshot snapshot = builder.build();
    log.info(
        "Loaded reference {}: {} stands, {} aircraft types, {} adjacencies",
        path,
        snapshot.stands().size(),
        snapshot.aircraftTypes().size(),
        snapshot.adjacencies().size());
    return snapshot;
  }

  public FlightInput readFlights(Path path) {
    FlightDocument document = read(path, FlightDocument.class, "flights");
    List<Flight> flights = new ArrayList<>();
    for (FlightDocument.FlightEntry entry : listOf(document.flights())) {
      flights.add(new Flight(
          entry.id(),
          entry.airline(),
          entry.flightNumber(),
          parseDateTime(entry.scheduledTime(), "scheduled time of flight " + entry.id()),
          FlightNature.parse(entry.nature()),
          entry.aircraftType(),
          entry.originDestination(),
          entry.seats() == null ? 0 : entry.seats(),
          entry.registration()));
    }
    LocalDate day = document.day() == null ? null : parseDate(document.day(), "flight list day");
    log.info("Loaded {} flights from {}", flights.size(), path);
    return new FlightInput(day, List.copyOf(flights));
  }

  public MaintenanceInput readMaintenance(Path path) {
    MaintenanceDocument document = read(path, MaintenanceDocument.class, "maintenance");
    List<MaintenanceRequest> requests = new ArrayList<>();
    for (MaintenanceDocument.RequestEntry entry : listOf(document.requests())) {
      requests.add(new MaintenanceRequest(
          entry.id(),
          entry.stand(),
          parseDateTime(entry.start(), "start of maintenance " + entry.id()),
          parseDateTime(entry.end(), "end of maintenance " + entry.id()),
          MaintenanceStatus.fromCode(entry.status()),
          entry.title()));
    }
    List<RecurringMaintenanceSchedule> schedules = new ArrayList<>();
    for (MaintenanceDocument.ScheduleEntry entry : listOf(document.schedules())) {
      String what = "maintenance schedule " + entry.id();
      schedules.add(new RecurringMaintenanceSchedule(
          entry.id(),
          entry.stand(),
          parseEnum(entry.pattern(), RecurrencePattern::valueOf, what + " pattern"),
          entry.dayOfWeek() == null
              ? null
              : parseEnum(entry.dayOfWeek(), DayOfWeek::valueOf, what + " day of week"),
          entry.dayOfMonth(),
          parseTime(entry.startTime(), what + " start time"),
          parseTime(entry.endTime(), what + " end time"),
          parseDate(entry.validFrom(), what + " valid-from date"),
          entry.validUntil() == null ? null : parseDate(entry.validUntil(), what + " valid-until date"),
          entry.status() == null ? null : MaintenanceStatus.fromCode(entry.status()),
          entry.title()));
    }
    log.info(
        "Loaded {} maintenance requests and {} recurring schedules from {}",
        requests.size(),
        schedules.size(),
        path);
    return new MaintenanceInput(List.copyOf(requests), List.copyOf(schedules));
  }

  private <T> T read(Path path, Class<T> type, String documentName) {
    try {
      T document = objectMapper.readValue(Files.readAllBytes(path), type);
      if (document == null) {
        throw new ConfigException(documentName + " document " + path + " is empty");
      }
      return document;
    } catch (JsonProcessingException ex) {
      throw new ConfigException(
          "malformed " + documentName + " document " + path + ": " + ex.getOriginalMessage(), ex);
    } catch (IOException ex) {
      throw new ConfigException("cannot read " + documentName + " document " + path, ex);
    }
  }

  private OperationalSettings settings(ReferenceDocument.SettingsEntry entry) {
    PlannerProperties.Settings defaults = properties.getSettings();
    if (entry == null) {
      try {
        return defaults.toOperationalSettings();
      } catch (DateTimeException ex) {
        throw new ConfigException("invalid planner.settings: " + ex.getMessage(), ex);
      }
    }
    return new OperationalSettings(
        entry.slotMinutes() != null ? entry.slotMinutes() : defaults.getSlotMinutes(),
        entry.blockSize() != null ? entry.blockSize() : defaults.getBlockSize(),
        parseTime(entry.dayStart() != null ? entry.dayStart() : defaults.getDayStart(), "day start"),
        parseTime(entry.dayEnd() != null ? entry.dayEnd() : defaults.getDayEnd(), "day end"),
        entry.gapMinutes() != null ? entry.gapMinutes() : defaults.getGapMinutes(),
        parseOffset(entry.utcOffset() != null ? entry.utcOffset() : defaults.getUtcOffset()));
  }

  private static <T> List<T> listOf(List<T> values) {
    return values == null ? List.of() : values;
  }

  private static OffsetDateTime parseDateTime(String raw, String what) {
    if (raw == null) {
      throw new ConfigException(what + " is missing");
    }
    try {
      return OffsetDateTime.parse(raw);
    } catch (DateTimeException ex) {
      throw new ConfigException(what + " must be ISO-8601 with an offset: " + raw, ex);
    }
  }

  private static LocalDate parseDate(String raw, String what) {
    if (raw == null) {
      throw new ConfigException(what + " is missing");
    }
    try {
      return LocalDate.parse(raw);
    } catch (DateTimeException ex) {
      throw new ConfigException(what + " must be an ISO-8601 date: " + raw, ex);
    }
  }

  private static LocalTime parseTime(String raw, String what) {
    if (raw == null) {
      throw new ConfigException(what + " is missing");
    }
    try {
      return LocalTime.parse(raw);
    } catch (DateTimeException ex) {
      throw new ConfigException(what + " must be HH:mm: " + raw, ex);
    }
  }

  private static ZoneOffset parseOffset(String raw) {
    try {
      return ZoneOffset.of(raw);
    } catch (DateTimeException ex) {
      throw new ConfigException("utc offset must look like +02:00 or Z: " + raw, ex);
    }
  }

  private static <E extends Enum<E>> E parseEnum(String raw, Function<String, E> valueOf, String what) {
    if (raw == null || raw.isBlank()) {
      throw new ConfigException(what + " is missing");
    }
    try {
      return valueOf.apply(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new ConfigException("unknown " + what + " " + raw, ex);
    }
  }
}

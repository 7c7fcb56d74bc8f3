package com.standcapacity.planner;

import com.standcapacity.engine.allocation.AllocationOptions;
import com.standcapacity.engine.error.ConfigException;
import com.standcapacity.engine.maintenance.DateRange;
import com.standcapacity.engine.reference.ReferenceSnapshot;
import com.standcapacity.engine.run.PlanningReport;
import com.standcapacity.engine.run.PlanningRequest;
import com.standcapacity.engine.run.RunOutcome;
import com.standcapacity.planner.config.PlannerProperties;
import com.standcapacity.planner.io.FlightInput;
import com.standcapacity.planner.io.MaintenanceInput;
import com.standcapacity.planner.io.PlanningInputReader;
import com.standcapacity.planner.service.PlanningRun;
import com.standcapacity.planner.service.PlanningRunService;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.LocalDate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Runs one pipeline over the configured input documents when the application starts. */
@Component
@ConditionalOnProperty(prefix = "planner.runner", name = "enabled", havingValue = "true")
public class PlanningCommandLineRunner implements ApplicationRunner {
  private static final Logger log = LoggerFactory.getLogger(PlanningCommandLineRunner.class);

  private final PlanningInputReader inputReader;
  private final PlanningRunService runService;
  private final PlannerProperties properties;

  public PlanningCommandLineRunner(
      PlanningInputReader inputReader, PlanningRunService runService, PlannerProperties properties) {
    this.inputReader = inputReader;
    this.runService = runService;
    this.properties = properties;
  }

  @Override
  public void run(ApplicationArguments args) {
    PlanningRequest request = buildRequest();
    PlanningRun run = runService.submit(request);
    RunOutcome<PlanningReport> outcome = run.outcome().join();
    log.info("Run {} finished with status {}", run.runId(), outcome.status());
  }

  PlanningRequest buildRequest() {
    PlannerProperties.Input input = properties.getInput();
    ReferenceSnapshot snapshot = inputReader.readReference(Path.of(input.getReference()));
    FlightInput flights = inputReader.readFlights(Path.of(input.getFlights()));
    MaintenanceInput maintenance = input.getMaintenance() == null || input.getMaintenance().isBlank()
        ? MaintenanceInput.EMPTY
        : inputReader.readMaintenance(Path.of(input.getMaintenance()));

    LocalDate day = resolveDay(flights, snapshot);
    int impactDays = Math.max(1, properties.getRunner().getImpactDays());
    return new PlanningRequest(
        snapshot,
        day,
        flights.flights(),
        maintenance.requests(),
        maintenance.schedules(),
        new DateRange(day, day.plusDays(impactDays - 1L)),
        properties.getCapacity().getMode(),
        new AllocationOptions(properties.getAllocation().isDisplacementEnabled()),
        properties.getMaintenance().isIncludePending());
  }

  private LocalDate resolveDay(FlightInput flights, ReferenceSnapshot snapshot) {
    String configured = properties.getRunner().getDay();
    if (configured != null && !configured.isBlank()) {
      try {
        return LocalDate.parse(configured);
      } catch (DateTimeException ex) {
        throw new ConfigException("planner.runner.day must be an ISO-8601 date: " + configured, ex);
      }
    }
    if (flights.day() != null) {
      return flights.day();
    }
    if (!flights.flights().isEmpty()) {
      return flights.flights().get(0).scheduledTime()
          .withOffsetSameInstant(snapshot.settings().utcOffset())
          .toLocalDate();
    }
    throw new ConfigException("no operating day: set planner.runner.day or a day in the flight list");
  }
}

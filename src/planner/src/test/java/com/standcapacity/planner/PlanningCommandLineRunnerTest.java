package com.standcapacity.planner;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.standcapacity.engine.capacity.CapacityMode;
import com.standcapacity.engine.error.ConfigException;
import com.standcapacity.engine.error.ErrorKind;
import com.standcapacity.engine.run.PlanningReport;
import com.standcapacity.engine.run.PlanningRequest;
import com.standcapacity.engine.run.RunControl;
import com.standcapacity.engine.run.RunOutcome;
import com.standcapacity.planner.config.PlannerProperties;
import com.standcapacity.planner.io.PlanningInputReader;
import com.standcapacity.planner.service.PlanningRun;
import com.standcapacity.planner.service.PlanningRunService;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.DefaultApplicationArguments;

class PlanningCommandLineRunnerTest {
  private PlannerProperties properties;
  private PlanningRunService runService;
  private PlanningCommandLineRunner runner;

  @BeforeEach
  void setUp() throws Exception {
    properties = new PlannerProperties();
    properties.getInput().setReference(fixture("reference.json").toString());
    properties.getInput().setFlights(fixture("flights.json").toString());
    properties.getInput().setMaintenance(fixture("maintenance.json").toString());
    runService = mock(PlanningRunService.class);
    runner = new PlanningCommandLineRunner(
        new PlanningInputReader(new ObjectMapper(), properties), runService, properties);
  }

  @Test
  void buildsRequestFromConfiguredDocuments() {
    properties.getRunner().setImpactDays(7);
    properties.getCapacity().setMode(CapacityMode.BY_SIZE_CATEGORY);
    properties.getAllocation().setDisplacementEnabled(true);

    PlanningRequest request = runner.buildRequest();

    assertEquals(LocalDate.of(2025, 6, 2), request.day());
    assertThat(request.flights()).hasSize(3);
    assertThat(request.maintenance()).hasSize(2);
    assertThat(request.schedules()).hasSize(1);
    assertEquals(LocalDate.of(2025, 6, 8), request.impactRange().to());
    assertEquals(CapacityMode.BY_SIZE_CATEGORY, request.mode());
    assertThat(request.allocationOptions().displacementEnabled()).isTrue();
  }

  @Test
  void configuredDayOverridesFlightDocument() {
    properties.getRunner().setDay("2025-06-03");
    properties.getInput().setMaintenance("");

    PlanningRequest request = runner.buildRequest();

    assertEquals(LocalDate.of(2025, 6, 3), request.day());
    assertThat(request.maintenance()).isEmpty();
  }

  @Test
  void derivesDayFromFirstFlightInLocalTime(@TempDir Path tempDir) throws Exception {
    Path flights = tempDir.resolve("flights.json");
    Files.writeString(flights, "{\"flights\": [{\"id\": \"AF1\", \"airline\": \"AF\","
        + " \"scheduled_time\": \"2025-06-02T23:30:00Z\", \"nature\": \"A\", \"aircraft_type\": \"A320\"}]}");
    properties.getInput().setFlights(flights.toString());

    PlanningRequest request = runner.buildRequest();

    // 23:30Z is 01:30 on the next day at the reference offset of +02:00
    assertEquals(LocalDate.of(2025, 6, 3), request.day());
  }

  @Test
  void invalidConfiguredDayIsConfigError() {
    properties.getRunner().setDay("tomorrow");

    assertThatThrownBy(() -> runner.buildRequest())
        .isInstanceOf(ConfigException.class)
        .hasMessageContaining("planner.runner.day");
  }

  @Test
  void runSubmitsAndWaitsForOutcome() throws Exception {
    Instant now = Instant.parse("2025-06-01T00:00:00Z");
    PlanningRun run = new PlanningRun(
        "2025-06-02-1",
        LocalDate.of(2025, 6, 2),
        new RunControl(),
        CompletableFuture.completedFuture(
            RunOutcome.<PlanningReport>failed(ErrorKind.INTERNAL, "stopped", null, now, now)));
    when(runService.submit(any())).thenReturn(run);

    runner.run(new DefaultApplicationArguments());

    verify(runService).submit(any());
  }

  private Path fixture(String name) throws Exception {
    return Path.of(getClass().getResource("/fixtures/" + name).toURI());
  }
}

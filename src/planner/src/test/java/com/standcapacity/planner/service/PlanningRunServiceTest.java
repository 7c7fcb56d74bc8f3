package com.standcapacity.planner.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.standcapacity.engine.allocation.AllocationResult;
import com.standcapacity.engine.allocation.UnallocatedFlight;
import com.standcapacity.engine.allocation.UnallocatedReason;
import com.standcapacity.engine.allocation.Utilisation;
import com.standcapacity.engine.error.ErrorKind;
import com.standcapacity.engine.reference.OperationalSettings;
import com.standcapacity.engine.reference.ReferenceSnapshot;
import com.standcapacity.engine.run.PlanningEngine;
import com.standcapacity.engine.run.PlanningReport;
import com.standcapacity.engine.run.PlanningRequest;
import com.standcapacity.engine.run.RunControl;
import com.standcapacity.engine.run.RunOutcome;
import com.standcapacity.engine.run.RunStatus;
import com.standcapacity.planner.config.PlannerProperties;
import com.standcapacity.planner.io.PlanningOutputWriter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PlanningRunServiceTest {
  private static final LocalDate DAY = LocalDate.of(2025, 6, 2);
  private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

  private PlanningEngine engine;
  private PlanningOutputWriter outputWriter;
  private SimpleMeterRegistry meterRegistry;
  private ExecutorService executor;
  private PlanningRunService service;

  @BeforeEach
  void setUp() {
    engine = mock(PlanningEngine.class);
    outputWriter = mock(PlanningOutputWriter.class);
    meterRegistry = new SimpleMeterRegistry();
    executor = Executors.newSingleThreadExecutor();
    service = new PlanningRunService(
        engine, executor, outputWriter, new PlannerProperties(), meterRegistry);
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void completedRunIsPersistedAndCounted() throws Exception {
    PlanningReport report = new PlanningReport(null, allocation(2), null);
    when(engine.runPipeline(any(), any())).thenReturn(RunOutcome.completed(report, NOW, NOW));

    PlanningRun run = service.submit(request());
    RunOutcome<PlanningReport> outcome = run.outcome().get(5, TimeUnit.SECONDS);

    assertEquals(RunStatus.COMPLETED, outcome.status());
    verify(outputWriter).write(run.runId(), report);
    assertThat(run.runId()).startsWith("2025-06-02-");
    assertEquals(1.0, meterRegistry.get("planner.runs.completed").counter().count());
    assertEquals(2.0, meterRegistry.get("planner.allocation.unallocated").counter().count());
    assertThat(service.find(run.runId())).contains(run);

    executor.shutdown();
    assertThat(executor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
    assertEquals(0.0, meterRegistry.get("planner.runs.active").gauge().value());
  }

  @Test
  void failedRunIsNotPersisted() throws Exception {
    when(engine.runPipeline(any(), any()))
        .thenReturn(RunOutcome.failed(ErrorKind.DATA, "unknown stand S9", "S9", NOW, NOW));

    RunOutcome<PlanningReport> outcome = service.submit(request()).outcome().get(5, TimeUnit.SECONDS);

    assertEquals(ErrorKind.DATA, outcome.errorKind());
    assertEquals("S9", outcome.offendingId());
    verify(outputWriter, never()).write(anyString(), any());
    assertEquals(1.0, meterRegistry.get("planner.runs.failed").counter().count());
    assertEquals(0.0, meterRegistry.get("planner.runs.completed").counter().count());
  }

  @Test
  void cancelStopsRunningPipeline() throws Exception {
    CountDownLatch started = new CountDownLatch(1);
    when(engine.runPipeline(any(), any())).thenAnswer(invocation -> {
      RunControl control = invocation.getArgument(1);
      control.flightsProcessed(3);
      started.countDown();
      while (!control.isCancelled()) {
        Thread.sleep(5);
      }
      return RunOutcome.cancelled(new PlanningReport(null, null, null), NOW, NOW);
    });

    PlanningRun run = service.submit(request());
    assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
    assertEquals(3.0, meterRegistry.get("planner.progress.flights").gauge().value());

    assertThat(service.cancel(run.runId())).isTrue();
    RunOutcome<PlanningReport> outcome = run.outcome().get(5, TimeUnit.SECONDS);

    assertEquals(RunStatus.CANCELLED, outcome.status());
    verify(outputWriter, never()).write(anyString(), any());
    assertEquals(1.0, meterRegistry.get("planner.runs.cancelled").counter().count());
    assertThat(service.cancel(run.runId())).isFalse();
  }

  @Test
  void cancelOfUnknownRunIsRejected() {
    assertThat(service.cancel("2025-06-02-99")).isFalse();
    assertThat(service.find("2025-06-02-99")).isEmpty();
  }

  @Test
  void persistenceFailureFailsTheRun() {
    PlanningReport report = new PlanningReport(null, allocation(0), null);
    when(engine.runPipeline(any(), any())).thenReturn(RunOutcome.completed(report, NOW, NOW));
    when(outputWriter.write(anyString(), eq(report)))
        .thenThrow(new UncheckedIOException(new IOException("disk full")));

    PlanningRun run = service.submit(request());

    assertThatThrownBy(() -> run.outcome().get(5, TimeUnit.SECONDS))
        .isInstanceOf(ExecutionException.class)
        .hasCauseInstanceOf(UncheckedIOException.class);
    assertThat(run.outcome()).isCompletedExceptionally();
    assertEquals(1.0, meterRegistry.get("planner.runs.failed").counter().count());
  }

  @Test
  void onlyMostRecentFinishedRunsAreRetained() throws Exception {
    PlannerProperties properties = new PlannerProperties();
    properties.getRuns().setRetained(2);
    PlanningRunService bounded = new PlanningRunService(
        engine, executor, outputWriter, properties, new SimpleMeterRegistry());
    when(engine.runPipeline(any(), any()))
        .thenReturn(RunOutcome.completed(new PlanningReport(null, allocation(0), null), NOW, NOW));

    List<PlanningRun> submitted = IntStream.range(0, 3)
        .mapToObj(i -> bounded.submit(request()))
        .toList();
    executor.shutdown();
    assertThat(executor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

    assertThat(submitted).allMatch(PlanningRun::isDone);
    assertThat(bounded.find(submitted.get(0).runId())).isEmpty();
    assertThat(bounded.find(submitted.get(1).runId())).contains(submitted.get(1));
    assertThat(bounded.find(submitted.get(2).runId())).contains(submitted.get(2));
    assertThat(bounded.cancel(submitted.get(0).runId())).isFalse();
  }

  private static PlanningRequest request() {
    ReferenceSnapshot snapshot = ReferenceSnapshot.builder()
        .settings(new OperationalSettings(
            15, 4, LocalTime.of(6, 0), LocalTime.of(23, 0), 15, ZoneOffset.UTC))
        .build();
    return new PlanningRequest(snapshot, DAY, List.of(), null, null, null, null, null, false);
  }

  private static AllocationResult allocation(int unallocated) {
    List<UnallocatedFlight> flights = IntStream.range(0, unallocated)
        .mapToObj(i -> new UnallocatedFlight("F" + i, null, UnallocatedReason.STAND_BUSY))
        .toList();
    return new AllocationResult(
        DAY, List.of(), flights, new Utilisation(List.of(), List.of()), List.of(), 0, true);
  }
}

package com.standcapacity.planner.service;

import com.standcapacity.engine.run.PlanningEngine;
import com.standcapacity.engine.run.PlanningReport;
import com.standcapacity.engine.run.PlanningRequest;
import com.standcapacity.engine.run.RunControl;
import com.standcapacity.engine.run.RunOutcome;
import com.standcapacity.planner.config.PlannerProperties;
import com.standcapacity.planner.io.PlanningOutputWriter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs planning pipelines on a bounded executor.
 *
 * <p>Runs share nothing but their immutable reference snapshot. Only completed runs are
 * persisted; cancelled and failed runs leave no output behind. Queued and running runs can always
 * be found; of the finished ones only the {@code planner.runs.retained} most recent are kept.
 */
@Service
public class PlanningRunService {
  private static final Logger log = LoggerFactory.getLogger(PlanningRunService.class);

  private final PlanningEngine engine;
  private final ExecutorService executor;
  private final PlanningOutputWriter outputWriter;
  private final Counter completedCounter;
  private final Counter failedCounter;
  private final Counter cancelledCounter;
  private final Counter unallocatedCounter;
  private final Map<String, PlanningRun> runs = new ConcurrentHashMap<>();
  private final Deque<String> finished = new ArrayDeque<>();
  private final int retained;
  private final AtomicInteger activeRuns = new AtomicInteger();
  private final AtomicLong sequence = new AtomicLong();

  public PlanningRunService(
      PlanningEngine engine,
      ExecutorService planningExecutor,
      PlanningOutputWriter outputWriter,
      PlannerProperties properties,
      MeterRegistry meterRegistry) {
    this.engine = engine;
    this.executor = planningExecutor;
    this.outputWriter = outputWriter;
    this.retained = Math.max(0, properties.getRuns().getRetained());
    this.completedCounter = meterRegistry.counter("planner.runs.completed");
    this.failedCounter = meterRegistry.counter("planner.runs.failed");
    this.cancelledCounter = meterRegistry.counter("planner.runs.cancelled");
    this.unallocatedCounter = meterRegistry.counter("planner.allocation.unallocated");

    meterRegistry.gauge("planner.runs.active", activeRuns);
    meterRegistry.gauge("planner.progress.flights", this, service -> service.flightsInProgress());
    meterRegistry.gauge("planner.progress.slots", this, service -> service.slotsInProgress());
  }

  /**
   * Queues a pipeline run.
   *
   * @param request run inputs
   * @return handle used to poll, cancel or await the run
   */
  public PlanningRun submit(PlanningRequest request) {
    String runId = request.day() + "-" + sequence.incrementAndGet();
    RunControl control = new RunControl();
    CompletableFuture<RunOutcome<PlanningReport>> outcome = new CompletableFuture<>();
    PlanningRun run = new PlanningRun(runId, request.day(), control, outcome);
    runs.put(runId, run);

    executor.execute(() -> {
      activeRuns.incrementAndGet();
      try {
        outcome.complete(execute(runId, request, control));
      } catch (RuntimeException ex) {
        // Only persistence can throw here; the engine converts its own failures.
        failedCounter.increment();
        log.error("Run {} could not be persisted", runId, ex);
        outcome.completeExceptionally(ex);
      } finally {
        activeRuns.decrementAndGet();
        retire(runId);
      }
    });
    log.info("Run {} submitted for {} with {} flights", runId, request.day(), request.flights().size());
    return run;
  }

  public Optional<PlanningRun> find(String runId) {
    return Optional.ofNullable(runs.get(runId));
  }

  /**
   * Requests cancellation; the run stops at its next slot or flight boundary.
   *
   * @param runId run identifier
   * @return {@code false} when the run is unknown or already finished
   */
  public boolean cancel(String runId) {
    PlanningRun run = runs.get(runId);
    if (run == null || run.isDone()) {
      return false;
    }
    run.control().cancel();
    log.info("Cancellation requested for run {}", runId);
    return true;
  }

  private void retire(String runId) {
    synchronized (finished) {
      finished.addLast(runId);
      while (finished.size() > retained) {
        String evicted = finished.removeFirst();
        runs.remove(evicted);
        log.debug("Run {} evicted from the run registry", evicted);
      }
    }
  }

  private RunOutcome<PlanningReport> execute(String runId, PlanningRequest request, RunControl control) {
    log.info("Run {} started", runId);
    RunOutcome<PlanningReport> outcome = engine.runPipeline(request, control);
    switch (outcome.status()) {
      case COMPLETED -> {
        PlanningReport report = outcome.result();
        outputWriter.write(runId, report);
        completedCounter.increment();
        unallocatedCounter.increment(report.allocation().unallocated().size());
        log.info(
            "Run {} completed: {} flights allocated, {} unallocated",
            runId,
            report.allocation().allocatedCount(),
            report.allocation().unallocated().size());
      }
      case CANCELLED -> {
        cancelledCounter.increment();
        log.info(
            "Run {} cancelled after {} flights and {} slots; nothing persisted",
            runId,
            control.flightsProcessed(),
            control.slotsProcessed());
      }
      case FAILED -> {
        failedCounter.increment();
        log.warn(
            "Run {} failed ({}): {}{}",
            runId,
            outcome.errorKind().code(),
            outcome.message(),
            outcome.offendingId() == null ? "" : " [" + outcome.offendingId() + "]");
      }
      default -> throw new IllegalStateException("Unexpected status " + outcome.status());
    }
    return outcome;
  }

  private double flightsInProgress() {
    return runs.values().stream()
        .filter(run -> !run.isDone())
        .mapToInt(run -> run.control().flightsProcessed())
        .sum();
  }

  private double slotsInProgress() {
    return runs.values().stream()
        .filter(run -> !run.isDone())
        .mapToInt(run -> run.control().slotsProcessed())
        .sum();
  }
}

package com.standcapacity.engine.run;

import com.standcapacity.engine.allocation.AllocationOptions;
import com.standcapacity.engine.allocation.AllocationResult;
import com.standcapacity.engine.allocation.AllocationScenario;
import com.standcapacity.engine.allocation.ScenarioStatus;
import com.standcapacity.engine.allocation.StandAllocator;
import com.standcapacity.engine.capacity.CapacityCalculator;
import com.standcapacity.engine.capacity.CapacityMode;
import com.standcapacity.engine.capacity.CapacityResult;
import com.standcapacity.engine.capacity.StandAvailability;
import com.standcapacity.engine.error.DataException;
import com.standcapacity.engine.error.ErrorKind;
import com.standcapacity.engine.error.PlanningException;
import com.standcapacity.engine.flight.Flight;
import com.standcapacity.engine.maintenance.DateRange;
import com.standcapacity.engine.maintenance.ImpactOptions;
import com.standcapacity.engine.maintenance.MaintenanceCalendar;
import com.standcapacity.engine.maintenance.MaintenanceImpact;
import com.standcapacity.engine.maintenance.MaintenanceImpactIntegrator;
import com.standcapacity.engine.maintenance.MaintenanceRequest;
import com.standcapacity.engine.maintenance.RecurringMaintenanceSchedule;
import com.standcapacity.engine.reference.ReferenceSnapshot;
import com.standcapacity.engine.slot.TimeSlotGrid;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Run boundary of the planning engine.
 *
 * <p>Every entry point runs synchronously on the calling thread and returns a {@link RunOutcome};
 * engine exceptions are converted here and never escape. The engine keeps no state between
 * runs, so one instance serves concurrent callers.
 */
public class PlanningEngine {
  private static final Logger log = LoggerFactory.getLogger(PlanningEngine.class);
  static final String INTERNAL_MESSAGE = "internal planning error";

  private final Clock clock;

  public PlanningEngine(Clock clock) {
    this.clock = clock;
  }

  public RunOutcome<CapacityResult> runCapacity(
      ReferenceSnapshot snapshot, LocalDate day, CapacityMode mode, RunControl control) {
    return execute("capacity", () -> {
      TimeSlotGrid grid = TimeSlotGrid.build(day, snapshot.settings());
      return new CapacityCalculator(snapshot)
          .calculate(grid, mode, StandAvailability.ALWAYS, control);
    });
  }

  public RunOutcome<AllocationResult> runAllocation(
      ReferenceSnapshot snapshot,
      LocalDate day,
      List<Flight> flights,
      List<MaintenanceRequest> maintenance,
      AllocationOptions options,
      RunControl control) {
    return runAllocation(
        new AllocationScenario(day.toString(), day),
        snapshot,
        flights,
        maintenance,
        options,
        control);
  }

  /**
   * Allocates the flights of a scenario's day and moves the scenario through its lifecycle.
   *
   * @param scenario scenario in {@code DRAFT} status
   * @param snapshot reference data
   * @param flights flights of the day
   * @param maintenance maintenance requests; only approved and in-progress ones block stands
   * @param options allocator switches
   * @param control cancellation and progress
   * @return outcome; the scenario ends {@code ALLOCATED}, {@code FAILED} or {@code CANCELLED},
   *     or keeps its status when it was not a draft and the run failed
   */
  public RunOutcome<AllocationResult> runAllocation(
      AllocationScenario scenario,
      ReferenceSnapshot snapshot,
      List<Flight> flights,
      List<MaintenanceRequest> maintenance,
      AllocationOptions options,
      RunControl control) {
    RunOutcome<AllocationResult> outcome = execute("allocation", () -> {
      scenario.startAllocating();
      TimeSlotGrid grid = TimeSlotGrid.build(scenario.getDay(), snapshot.settings());
      MaintenanceCalendar calendar = MaintenanceCalendar.approved(grid, maintenance, snapshot);
      return new StandAllocator(snapshot).allocate(grid, flights, calendar, options, control);
    });
    if (scenario.getStatus() != ScenarioStatus.ALLOCATING) {
      return outcome;
    }
    switch (outcome.status()) {
      case COMPLETED -> scenario.allocated(outcome.result());
      case CANCELLED -> scenario.cancelled(outcome.result());
      case FAILED -> scenario.failed(outcome.message());
      default -> throw new IllegalStateException("Unexpected status " + outcome.status());
    }
    return outcome;
  }

  public RunOutcome<MaintenanceImpact> runMaintenanceImpact(
      ReferenceSnapshot snapshot,
      DateRange range,
      List<MaintenanceRequest> requests,
      List<RecurringMaintenanceSchedule> schedules,
      ImpactOptions options,
      RunControl control) {
    return execute("maintenance-impact", () -> new MaintenanceImpactIntegrator(snapshot)
        .integrate(range, requests, schedules, options, control));
  }

  /**
   * Runs capacity, allocation and maintenance impact in sequence, stopping at the first
   * cancelled stage.
   *
   * @param request pipeline inputs
   * @param control cancellation and progress shared by all stages
   * @return outcome carrying every stage's result
   */
  public RunOutcome<PlanningReport> runPipeline(PlanningRequest request, RunControl control) {
    return execute("pipeline", () -> {
      ReferenceSnapshot snapshot = request.snapshot();
      TimeSlotGrid grid = TimeSlotGrid.build(request.day(), snapshot.settings());
      CapacityCalculator calculator = new CapacityCalculator(snapshot);
      CapacityResult capacity =
          calculator.calculate(grid, request.mode(), StandAvailability.ALWAYS, control);
      if (!capacity.complete()) {
        return new PlanningReport(capacity, null, null);
      }

      List<MaintenanceRequest> dayMaintenance = new ArrayList<>(request.maintenance());
      DateRange expansion = new DateRange(request.day().minusDays(1), request.day());
      for (RecurringMaintenanceSchedule schedule : request.schedules()) {
        dayMaintenance.addAll(schedule.expand(expansion, snapshot.settings().utcOffset()));
      }
      MaintenanceCalendar calendar = MaintenanceCalendar.approved(grid, dayMaintenance, snapshot);
      AllocationResult allocation = new StandAllocator(snapshot, calculator.matrix())
          .allocate(grid, request.flights(), calendar, request.allocationOptions(), control);
      if (!allocation.complete()) {
        return new PlanningReport(capacity, allocation, null);
      }

      MaintenanceImpact impact = new MaintenanceImpactIntegrator(snapshot, calculator).integrate(
          request.impactRange(),
          request.maintenance(),
          request.schedules(),
          new ImpactOptions(request.mode(), request.includePotentialImpact()),
          control);
      return new PlanningReport(capacity, allocation, impact);
    });
  }

  private <T extends RunResult> RunOutcome<T> execute(String stage, Supplier<T> body) {
    Instant startedAt = clock.instant();
    try {
      T result = body.get();
      Instant finishedAt = clock.instant();
      if (!result.complete()) {
        log.info("Run {} cancelled, partial result discarded from persistence", stage);
        return RunOutcome.cancelled(result, startedAt, finishedAt);
      }
      log.info("Run {} completed in {} ms", stage, finishedAt.toEpochMilli() - startedAt.toEpochMilli());
      return RunOutcome.completed(result, startedAt, finishedAt);
    } catch (PlanningException e) {
      String offendingId = e instanceof DataException data ? data.getOffendingId() : null;
      String message = e.getKind() == ErrorKind.INTERNAL ? INTERNAL_MESSAGE : e.getMessage();
      log.warn("Run {} failed ({}): {}", stage, e.getKind().code(), e.getMessage());
      return RunOutcome.failed(e.getKind(), message, offendingId, startedAt, clock.instant());
    } catch (RuntimeException e) {
      log.warn("Run {} failed with an unexpected error", stage, e);
      return RunOutcome.failed(ErrorKind.INTERNAL, INTERNAL_MESSAGE, null, startedAt, clock.instant());
    }
  }
}

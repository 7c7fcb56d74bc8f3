package com.standcapacity.planner.service;

import com.standcapacity.engine.run.PlanningReport;
import com.standcapacity.engine.run.RunControl;
import com.standcapacity.engine.run.RunOutcome;
import java.time.LocalDate;
import java.util.concurrent.CompletableFuture;

/**
 * Handle on a submitted run: cancellation, progress and the eventual outcome.
 *
 * @param runId run identifier
 * @param day operating day of the run
 * @param control cancellation flag and progress counters shared with the run thread
 * @param outcome completes once the run has finished and, when completed, been persisted
 */
public record PlanningRun(
    String runId,
    LocalDate day,
    RunControl control,
    CompletableFuture<RunOutcome<PlanningReport>> outcome) {

  public boolean isDone() {
    return outcome.isDone();
  }
}

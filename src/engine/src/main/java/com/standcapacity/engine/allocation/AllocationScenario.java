package com.standcapacity.engine.allocation;

import com.standcapacity.engine.error.InternalPlanningException;
import java.time.LocalDate;

/**
 * A schedule scenario moving through allocation. Unallocated flights do not fail a scenario;
 * only an aborted run does.
 */
public final class AllocationScenario {
  private final String id;
  private final LocalDate day;
  private ScenarioStatus status = ScenarioStatus.DRAFT;
  private AllocationResult result;
  private String failureMessage;

  public AllocationScenario(String id, LocalDate day) {
    this.id = id;
    this.day = day;
  }

  public String getId() {
    return id;
  }

  public LocalDate getDay() {
    return day;
  }

  public ScenarioStatus getStatus() {
    return status;
  }

  public AllocationResult getResult() {
    return result;
  }

  public String getFailureMessage() {
    return failureMessage;
  }

  public void startAllocating() {
    move(ScenarioStatus.DRAFT, ScenarioStatus.ALLOCATING);
  }

  public void allocated(AllocationResult allocationResult) {
    move(ScenarioStatus.ALLOCATING, ScenarioStatus.ALLOCATED);
    this.result = allocationResult;
  }

  public void failed(String message) {
    move(ScenarioStatus.ALLOCATING, ScenarioStatus.FAILED);
    this.failureMessage = message;
  }

  public void cancelled(AllocationResult partial) {
    move(ScenarioStatus.ALLOCATING, ScenarioStatus.CANCELLED);
    this.result = partial;
  }

  private void move(ScenarioStatus expected, ScenarioStatus next) {
    if (status != expected) {
      throw new InternalPlanningException(
          "scenario " + id + " cannot move to " + next + " from " + status);
    }
    status = next;
  }
}

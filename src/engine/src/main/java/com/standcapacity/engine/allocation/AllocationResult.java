package com.standcapacity.engine.allocation;

import com.standcapacity.engine.run.RunResult;
import java.time.LocalDate;
import java.util.List;

/**
 * Outcome of one allocation run.
 *
 * @param day operating day
 * @param assignments allocations ordered by start, stand order, flight id
 * @param unallocated flights left without a stand, ordered by flight id
 * @param utilisation per-stand and per-slot utilisation
 * @param issues non-fatal observations
 * @param displacedCount flights moved by the relocation pass
 * @param complete {@code false} when the run was cancelled before the last flight
 */
public record AllocationResult(
    LocalDate day,
    List<Allocation> assignments,
    List<UnallocatedFlight> unallocated,
    Utilisation utilisation,
    List<AllocationIssue> issues,
    int displacedCount,
    boolean complete)
    implements RunResult {

  public int allocatedCount() {
    return assignments.size();
  }

  public Allocation assignmentOf(String flightId) {
    return assignments.stream()
        .filter(a -> a.flightId().equals(flightId))
        .findFirst()
        .orElse(null);
  }

  public UnallocatedFlight unallocatedOf(String flightId) {
    return unallocated.stream()
        .filter(u -> u.flightId().equals(flightId))
        .findFirst()
        .orElse(null);
  }
}

package com.standcapacity.engine.run;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Cancellation flag and progress counters of one run.
 *
 * <p>The run thread checks {@link #isCancelled()} at slot and flight boundaries and bumps the
 * counters; any other thread may cancel or poll.
 */
public final class RunControl {
  private final AtomicBoolean cancelled = new AtomicBoolean();
  private final AtomicInteger flightsProcessed = new AtomicInteger();
  private final AtomicInteger slotsProcessed = new AtomicInteger();

  public void cancel() {
    cancelled.set(true);
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  public void flightsProcessed(int count) {
    flightsProcessed.addAndGet(count);
  }

  public void slotProcessed() {
    slotsProcessed.incrementAndGet();
  }

  public int flightsProcessed() {
    return flightsProcessed.get();
  }

  public int slotsProcessed() {
    return slotsProcessed.get();
  }
}

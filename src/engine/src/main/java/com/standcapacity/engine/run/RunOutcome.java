package com.standcapacity.engine.run;

import com.standcapacity.engine.error.ErrorKind;
import java.time.Instant;

/**
 * Typed result of a run. Exceptions never cross the run boundary; a failed run carries its
 * error kind and a message instead.
 *
 * @param status final status
 * @param result full result when completed, partial when cancelled, {@code null} when failed
 * @param errorKind failure classification, {@code null} unless failed or cancelled
 * @param message user-facing message; internal failures carry a generic one
 * @param offendingId id of the entity behind a data error, may be {@code null}
 * @param startedAt run start
 * @param finishedAt run end
 */
public record RunOutcome<T extends RunResult>(
    RunStatus status,
    T result,
    ErrorKind errorKind,
    String message,
    String offendingId,
    Instant startedAt,
    Instant finishedAt) {

  public static <T extends RunResult> RunOutcome<T> completed(
      T result, Instant startedAt, Instant finishedAt) {
    return new RunOutcome<>(RunStatus.COMPLETED, result, null, null, null, startedAt, finishedAt);
  }

  public static <T extends RunResult> RunOutcome<T> cancelled(
      T partial, Instant startedAt, Instant finishedAt) {
    return new RunOutcome<>(
        RunStatus.CANCELLED, partial, ErrorKind.CANCELLED, "run cancelled", null, startedAt, finishedAt);
  }

  public static <T extends RunResult> RunOutcome<T> failed(
      ErrorKind kind, String message, String offendingId, Instant startedAt, Instant finishedAt) {
    return new RunOutcome<>(RunStatus.FAILED, null, kind, message, offendingId, startedAt, finishedAt);
  }

  public boolean isCompleted() {
    return status == RunStatus.COMPLETED;
  }
}

package com.standcapacity.engine.error;

/** Stable classification of run-level failures, used in run outcomes and logs. */
public enum ErrorKind {
  CONFIG("config_error"),
  DATA("data_error"),
  CANCELLED("cancelled"),
  INTERNAL("internal_error");

  private final String code;

  ErrorKind(String code) {
    this.code = code;
  }

  /**
   * Returns the low-cardinality code used in serialized outcomes and metric tags.
   *
   * @return snake_case error code
   */
  public String code() {
    return code;
  }
}

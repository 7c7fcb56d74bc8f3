package com.standcapacity.engine.error;

/**
 * Raised when operational settings or schema invariants are violated.
 *
 * <p>The message is user-facing and describes the violated rule.
 */
public class ConfigException extends PlanningException {
  /**
   * Creates a configuration exception with a user-facing message.
   *
   * @param message validation error description
   */
  public ConfigException(String message) {
    super(ErrorKind.CONFIG, message);
  }

  /**
   * Creates a configuration exception wrapping a lower-level parse failure.
   *
   * @param message validation error description
   * @param cause underlying failure
   */
  public ConfigException(String message, Throwable cause) {
    super(ErrorKind.CONFIG, message, cause);
  }
}

package com.standcapacity.engine.reference;

import com.standcapacity.engine.error.ConfigException;

/** Passenger terminal; groups piers and has no capacity of its own. */
public record Terminal(String code, String name) {
  public Terminal {
    if (code == null || code.isBlank()) {
      throw new ConfigException("terminal code must not be blank");
    }
  }
}

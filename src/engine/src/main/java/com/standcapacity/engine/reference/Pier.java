package com.standcapacity.engine.reference;

import com.standcapacity.engine.error.ConfigException;

/**
 * Pier within a terminal.
 *
 * @param id opaque identifier referenced by stands
 * @param code code, unique within the terminal
 * @param terminalCode owning terminal
 * @param name display name
 */
public record Pier(String id, String code, String terminalCode, String name) {
  public Pier {
    if (id == null || id.isBlank() || code == null || code.isBlank()) {
      throw new ConfigException("pier id and code must not be blank");
    }
    if (terminalCode == null || terminalCode.isBlank()) {
      throw new ConfigException("pier " + id + " has no terminal");
    }
  }
}

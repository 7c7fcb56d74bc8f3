package com.standcapacity.engine.flight;

import com.standcapacity.engine.error.ConfigException;
import java.util.Locale;

/** Direction of a scheduled movement. */
public enum FlightNature {
  ARRIVAL("A"),
  DEPARTURE("D");

  private final String code;

  FlightNature(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }

  /**
   * Parses a nature code ({@code A}/{@code D}) or name ({@code arrival}/{@code departure}).
   *
   * @param raw raw value from an input document
   * @return parsed nature
   * @throws ConfigException when the value is not recognised
   */
  public static FlightNature parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new ConfigException("flight nature must not be blank");
    }
    String normalized = raw.trim().toUpperCase(Locale.ROOT);
    for (FlightNature nature : values()) {
      if (nature.code.equals(normalized) || nature.name().equals(normalized)) {
        return nature;
      }
    }
    throw new ConfigException("flight nature must be one of: A,D,arrival,departure");
  }
}

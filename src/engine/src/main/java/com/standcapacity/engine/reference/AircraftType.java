package com.standcapacity.engine.reference;

import com.standcapacity.engine.error.ConfigException;

/**
 * Aircraft type keyed by its IATA code.
 *
 * @param code IATA type code, used as the key by flights and constraints
 * @param icaoCode ICAO type designator, may be {@code null}
 * @param name display name
 * @param wingspanM wingspan in metres
 * @param lengthM overall length in metres
 * @param sizeCategoryCode code of the owning {@link SizeCategory}
 */
public record AircraftType(
    String code,
    String icaoCode,
    String name,
    double wingspanM,
    double lengthM,
    String sizeCategoryCode) {

  public AircraftType {
    if (code == null || code.isBlank()) {
      throw new ConfigException("aircraft type code must not be blank");
    }
    if (wingspanM <= 0 || lengthM <= 0) {
      throw new ConfigException("aircraft type " + code + " must have positive dimensions");
    }
    if (sizeCategoryCode == null || sizeCategoryCode.isBlank()) {
      throw new ConfigException("aircraft type " + code + " has no size category");
    }
  }
}

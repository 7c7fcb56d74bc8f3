package com.standcapacity.engine.reference;

import com.standcapacity.engine.error.ConfigException;

/**
 * Aircraft size category (ICAO aerodrome reference code letter).
 *
 * <p>Categories are totally ordered by {@code code}; {@code A < B < ... < F}. Bands are
 * half-open, {@code [min, max)}, and expressed in metres, so neighbouring categories may share
 * an endpoint without both accepting it.
 */
public record SizeCategory(
    String code,
    String description,
    double minWingspanM,
    double maxWingspanM,
    double minLengthM,
    double maxLengthM) {

  public SizeCategory {
    if (code == null || code.isBlank()) {
      throw new ConfigException("size category code must not be blank");
    }
    if (minWingspanM < 0 || maxWingspanM <= minWingspanM) {
      throw new ConfigException("size category " + code + " has an invalid wingspan band");
    }
    if (minLengthM < 0 || maxLengthM <= minLengthM) {
      throw new ConfigException("size category " + code + " has an invalid length band");
    }
  }

  /**
   * Returns whether the given dimensions fall inside this category's bands.
   *
   * @param wingspanM wingspan in metres
   * @param lengthM length in metres
   * @return {@code true} when both dimensions are at or above the lower bound and below the
   *     upper bound of their band
   */
  public boolean accepts(double wingspanM, double lengthM) {
    return wingspanM >= minWingspanM
        && wingspanM < maxWingspanM
        && lengthM >= minLengthM
        && lengthM < maxLengthM;
  }
}

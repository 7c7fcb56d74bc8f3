package com.standcapacity.engine.reference;

import com.standcapacity.engine.error.ConfigException;

/**
 * Aircraft parking position, leaf of the terminal, pier, stand hierarchy.
 *
 * <p>An inactive stand is never eligible for anything: capacity, allocation or impact.
 *
 * @param id opaque identifier used by constraints, adjacencies, maintenance and allocations
 * @param code stand code, unique within its pier
 * @param pierId owning pier id
 * @param maxWingspanM maximum wingspan accepted, metres
 * @param maxLengthM maximum aircraft length accepted, metres
 * @param maxSizeCategoryCode largest size category accepted
 * @param hasJetBridge whether the stand is a contact stand
 * @param active whether the stand is in service
 * @param position optional position, may be {@code null}
 */
public record Stand(
    String id,
    String code,
    String pierId,
    double maxWingspanM,
    double maxLengthM,
    String maxSizeCategoryCode,
    boolean hasJetBridge,
    boolean active,
    GeoPosition position) {

  public Stand {
    if (id == null || id.isBlank() || code == null || code.isBlank()) {
      throw new ConfigException("stand id and code must not be blank");
    }
    if (pierId == null || pierId.isBlank()) {
      throw new ConfigException("stand " + id + " has no pier");
    }
    if (maxWingspanM <= 0 || maxLengthM <= 0) {
      throw new ConfigException("stand " + id + " must have positive dimension limits");
    }
    if (maxSizeCategoryCode == null || maxSizeCategoryCode.isBlank()) {
      throw new ConfigException("stand " + id + " has no maximum size category");
    }
  }
}

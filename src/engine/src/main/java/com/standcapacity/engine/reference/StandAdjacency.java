package com.standcapacity.engine.reference;

import com.standcapacity.engine.error.ConfigException;

/**
 * Directed adjacency rule: while {@code standId} hosts an aircraft of category
 * {@code >= triggerSizeCode}, {@code adjacentStandId} is limited by {@code restriction}.
 *
 * <p>The rule is directed; a rule from A to B says nothing about B constraining A.
 *
 * @param standId primary stand
 * @param adjacentStandId stand limited by the rule
 * @param direction side of the adjacent stand, informational
 * @param restriction restriction kind
 * @param triggerSizeCode smallest category on the primary stand that activates the rule, or
 *     {@code null} when any occupancy activates it
 * @param maxSizeWhenAdjacentCode cap for {@link AdjacencyRestriction#MAX_SIZE_REDUCED}
 * @param prohibitedAircraftTypeCode type for {@link AdjacencyRestriction#AIRCRAFT_TYPE_PROHIBITED}
 * @param active inactive rules are ignored
 */
public record StandAdjacency(
    String standId,
    String adjacentStandId,
    ImpactDirection direction,
    AdjacencyRestriction restriction,
    String triggerSizeCode,
    String maxSizeWhenAdjacentCode,
    String prohibitedAircraftTypeCode,
    boolean active) {

  public StandAdjacency {
    if (standId == null || adjacentStandId == null || restriction == null) {
      throw new ConfigException("adjacency requires a stand, an adjacent stand and a restriction");
    }
    if (standId.equals(adjacentStandId)) {
      throw new ConfigException("stand " + standId + " cannot be adjacent to itself");
    }
    if (restriction == AdjacencyRestriction.MAX_SIZE_REDUCED && maxSizeWhenAdjacentCode == null) {
      throw new ConfigException(
          "adjacency " + standId + "->" + adjacentStandId + " needs a max size when adjacent");
    }
    if (restriction == AdjacencyRestriction.AIRCRAFT_TYPE_PROHIBITED
        && prohibitedAircraftTypeCode == null) {
      throw new ConfigException(
          "adjacency " + standId + "->" + adjacentStandId + " needs a prohibited aircraft type");
    }
    if (direction == null) {
      direction = ImpactDirection.OTHER;
    }
  }
}

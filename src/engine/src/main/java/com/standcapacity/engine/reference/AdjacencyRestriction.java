package com.standcapacity.engine.reference;

/** What an occupied primary stand imposes on its adjacent stand. */
public enum AdjacencyRestriction {
  /** The adjacent stand may not be used at all. */
  NO_USE,
  /** The adjacent stand may only host categories up to {@code maxSizeWhenAdjacentCode}. */
  MAX_SIZE_REDUCED,
  /** The adjacent stand may not host {@code prohibitedAircraftTypeCode}. */
  AIRCRAFT_TYPE_PROHIBITED
}

package com.standcapacity.engine.reference;

/** Physical side on which the adjacent stand lies relative to the primary stand. */
public enum ImpactDirection {
  LEFT,
  RIGHT,
  FRONT,
  BEHIND,
  OTHER
}

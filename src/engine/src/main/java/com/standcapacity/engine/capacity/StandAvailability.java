package com.standcapacity.engine.capacity;

import com.standcapacity.engine.reference.Stand;

/** Per-slot availability overlay applied on top of the static eligibility matrix. */
@FunctionalInterface
public interface StandAvailability {
  StandAvailability ALWAYS = (stand, slotIndex) -> true;

  boolean isAvailable(Stand stand, int slotIndex);
}

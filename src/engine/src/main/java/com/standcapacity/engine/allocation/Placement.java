package com.standcapacity.engine.allocation;

import com.standcapacity.engine.reference.Stand;
import com.standcapacity.engine.slot.Interval;

/** A demand placed on a stand over a slot-aligned window. */
record Placement(Demand demand, Stand stand, Interval window, int tightness) {}

package com.standcapacity.engine.allocation;

import com.standcapacity.engine.flight.Flight;

/** Arrival and later departure of the same aircraft, occupying one stand contiguously. */
public record Rotation(Flight arrival, Flight departure) {}

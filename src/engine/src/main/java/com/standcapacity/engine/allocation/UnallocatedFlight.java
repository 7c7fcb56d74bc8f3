package com.standcapacity.engine.allocation;

/** A flight the allocator could not place, with the most specific reason it met. */
public record UnallocatedFlight(String flightId, String linkedFlightId, UnallocatedReason reason) {}

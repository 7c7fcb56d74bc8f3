package com.standcapacity.engine.allocation;

/** Occupied over available minutes of one stand on the day. */
public record StandUtilisation(
    String standId, String standCode, int occupiedMinutes, int availableMinutes, double ratio) {}

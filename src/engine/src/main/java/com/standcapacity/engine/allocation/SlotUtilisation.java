package com.standcapacity.engine.allocation;

import java.time.OffsetDateTime;

/** Allocated aircraft over available stands in one slot. */
public record SlotUtilisation(
    int slotIndex, OffsetDateTime start, int allocated, int capacity, double ratio) {}

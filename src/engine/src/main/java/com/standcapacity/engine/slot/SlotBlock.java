package com.standcapacity.engine.slot;

import java.time.OffsetDateTime;

/** {@code blockSize} consecutive slots; the aggregation unit of capacity reports. */
public record SlotBlock(int index, SlotRange slots, OffsetDateTime start, OffsetDateTime end) {}

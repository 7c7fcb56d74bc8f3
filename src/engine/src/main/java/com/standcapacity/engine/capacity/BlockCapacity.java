package com.standcapacity.engine.capacity;

import java.time.OffsetDateTime;
import java.util.Map;

/** Stands supporting each category throughout a block, i.e. the minimum over its slots. */
public record BlockCapacity(
    int blockIndex, OffsetDateTime start, OffsetDateTime end, Map<String, Integer> countsByCategory) {}

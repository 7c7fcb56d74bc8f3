package com.standcapacity.engine.capacity;

import java.util.Map;

/** One row of the mode-dependent capacity pivot. */
public record PivotRow(String key, Map<String, Integer> values) {}

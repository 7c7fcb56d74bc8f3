package com.standcapacity.engine.capacity;

import java.time.OffsetDateTime;
import java.util.Map;

/** Stand-hours per category available within one clock hour. */
public record HourCapacity(OffsetDateTime hourStart, Map<String, Double> standHoursByCategory) {}

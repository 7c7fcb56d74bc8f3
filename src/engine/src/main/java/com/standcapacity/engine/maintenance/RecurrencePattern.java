package com.standcapacity.engine.maintenance;

public enum RecurrencePattern {
  DAILY,
  WEEKLY,
  MONTHLY
}

package com.standcapacity.engine.run;

public enum RunStatus {
  COMPLETED,
  FAILED,
  CANCELLED
}

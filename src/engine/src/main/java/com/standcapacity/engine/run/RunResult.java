package com.standcapacity.engine.run;

/** Output of a run stage. An incomplete result is the partial output of a cancelled run. */
public interface RunResult {
  boolean complete();
}

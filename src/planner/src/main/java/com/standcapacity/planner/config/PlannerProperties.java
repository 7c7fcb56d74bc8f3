package com.standcapacity.planner.config;

import com.standcapacity.engine.capacity.CapacityMode;
import com.standcapacity.engine.reference.OperationalSettings;
import java.time.LocalTime;
import java.time.ZoneOffset;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Typed configuration for the planner service.
 *
 * <p>Values are bound from {@code application.yml} and environment variables under the
 * {@code planner.*} prefix.
 */
@ConfigurationProperties(prefix = "planner")
public class PlannerProperties {
  private final Settings settings = new Settings();
  private final Allocation allocation = new Allocation();
  private final Capacity capacity = new Capacity();
  private final Maintenance maintenance = new Maintenance();
  private final Input input = new Input();
  private final Output output = new Output();
  private final Runner runner = new Runner();
  private final Executor executor = new Executor();
  private final Runs runs = new Runs();

  public Settings getSettings() {
    return settings;
  }

  public Allocation getAllocation() {
    return allocation;
  }

  public Capacity getCapacity() {
    return capacity;
  }

  public Maintenance getMaintenance() {
    return maintenance;
  }

  public Input getInput() {
    return input;
  }

  public Output getOutput() {
    return output;
  }

  public Runner getRunner() {
    return runner;
  }

  public Executor getExecutor() {
    return executor;
  }

  public Runs getRuns() {
    return runs;
  }

  /** Operational settings used when the reference document carries none. */
  public static class Settings {
    private int slotMinutes = 15;
    private int blockSize = 4;
    private String dayStart = "06:00";
    private String dayEnd = "23:00";
    private int gapMinutes = 15;
    private String utcOffset = "Z";

    public int getSlotMinutes() {
      return slotMinutes;
    }

    public void setSlotMinutes(int slotMinutes) {
      this.slotMinutes = slotMinutes;
    }

    public int getBlockSize() {
      return blockSize;
    }

    public void setBlockSize(int blockSize) {
      this.blockSize = blockSize;
    }

    public String getDayStart() {
      return dayStart;
    }

    public void setDayStart(String dayStart) {
      this.dayStart = dayStart;
    }

    public String getDayEnd() {
      return dayEnd;
    }

    public void setDayEnd(String dayEnd) {
      this.dayEnd = dayEnd;
    }

    public int getGapMinutes() {
      return gapMinutes;
    }

    public void setGapMinutes(int gapMinutes) {
      this.gapMinutes = gapMinutes;
    }

    public String getUtcOffset() {
      return utcOffset;
    }

    public void setUtcOffset(String utcOffset) {
      this.utcOffset = utcOffset;
    }

    public OperationalSettings toOperationalSettings() {
      return new OperationalSettings(
          slotMinutes,
          blockSize,
          LocalTime.parse(dayStart),
          LocalTime.parse(dayEnd),
          gapMinutes,
          ZoneOffset.of(utcOffset));
    }
  }

  public static class Allocation {
    private boolean displacementEnabled = false;

    public boolean isDisplacementEnabled() {
      return displacementEnabled;
    }

    public void setDisplacementEnabled(boolean displacementEnabled) {
      this.displacementEnabled = displacementEnabled;
    }
  }

  public static class Capacity {
    private CapacityMode mode = CapacityMode.BY_TIME_SLOT;

    public CapacityMode getMode() {
      return mode;
    }

    public void setMode(CapacityMode mode) {
      this.mode = mode;
    }
  }

  public static class Maintenance {
    private boolean includePending = false;

    public boolean isIncludePending() {
      return includePending;
    }

    public void setIncludePending(boolean includePending) {
      this.includePending = includePending;
    }
  }

  /** Locations of the JSON input documents. */
  public static class Input {
    private String reference = "data/reference.json";
    private String flights = "data/flights.json";
    private String maintenance = "";

    public String getReference() {
      return reference;
    }

    public void setReference(String reference) {
      this.reference = reference;
    }

    public String getFlights() {
      return flights;
    }

    public void setFlights(String flights) {
      this.flights = flights;
    }

    public String getMaintenance() {
      return maintenance;
    }

    public void setMaintenance(String maintenance) {
      this.maintenance = maintenance;
    }
  }

  public static class Output {
    private String directory = "out";

    public String getDirectory() {
      return directory;
    }

    public void setDirectory(String directory) {
      this.directory = directory;
    }
  }

  /** One-shot pipeline run on startup, off by default. */
  public static class Runner {
    private boolean enabled = false;
    private String day = "";
    private int impactDays = 1;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getDay() {
      return day;
    }

    public void setDay(String day) {
      this.day = day;
    }

    public int getImpactDays() {
      return impactDays;
    }

    public void setImpactDays(int impactDays) {
      this.impactDays = impactDays;
    }
  }

  public static class Executor {
    private int threads = 2;

    public int getThreads() {
      return threads;
    }

    public void setThreads(int threads) {
      this.threads = threads;
    }
  }

  /** Bookkeeping of submitted runs. */
  public static class Runs {
    /** Finished runs kept for lookup; older ones are forgotten first. */
    private int retained = 100;

    public int getRetained() {
      return retained;
    }

    public void setRetained(int retained) {
      this.retained = retained;
    }
  }
}

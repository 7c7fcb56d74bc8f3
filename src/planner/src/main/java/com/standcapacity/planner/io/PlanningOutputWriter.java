package com.standcapacity.planner.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.standcapacity.engine.run.PlanningReport;
import com.standcapacity.planner.config.PlannerProperties;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

/**
 * Persists the results of a completed run as pretty-printed JSON under
 * {@code <planner.output.directory>/<runId>/}.
 *
 * <p>All files of a run are written into a staging sibling {@code <runId>.tmp} that is renamed
 * into place once every file is on disk. A failed write removes the staging directory, and earlier
 * output of the run is only replaced after every new file has been written.
 */
@Component
public class PlanningOutputWriter {
  private static final Logger log = LoggerFactory.getLogger(PlanningOutputWriter.class);

  static final String CAPACITY_FILE = "capacity.json";
  static final String ALLOCATION_FILE = "allocation.json";
  static final String IMPACT_FILE = "maintenance-impact.json";
  static final String STAGING_SUFFIX = ".tmp";

  private final ObjectWriter writer;
  private final Path outputDirectory;

  public PlanningOutputWriter(ObjectMapper objectMapper, PlannerProperties properties) {
    this.writer = objectMapper.writerWithDefaultPrettyPrinter();
    this.outputDirectory = Path.of(properties.getOutput().getDirectory());
  }

  /**
   * Writes every stage result of a report, replacing earlier output of the same run.
   *
   * @param runId run identifier, used as the directory name
   * @param report completed report
   * @return directory holding the written files
   * @throws IllegalArgumentException when the report is not complete
   * @throws UncheckedIOException when a file cannot be written; nothing new is left on disk
   */
  public Path write(String runId, PlanningReport report) {
    if (!report.complete()) {
      throw new IllegalArgumentException("run " + runId + " is incomplete and cannot be persisted");
    }
    Path runDirectory = outputDirectory.resolve(runId);
    Path staging = outputDirectory.resolve(runId + STAGING_SUFFIX);
    try {
      FileSystemUtils.deleteRecursively(staging);
      Files.createDirectories(staging);
      writer.writeValue(staging.resolve(CAPACITY_FILE).toFile(), report.capacity());
      writer.writeValue(staging.resolve(ALLOCATION_FILE).toFile(), report.allocation());
      writer.writeValue(staging.resolve(IMPACT_FILE).toFile(), report.impact());
      FileSystemUtils.deleteRecursively(runDirectory);
      Files.move(staging, runDirectory, StandardCopyOption.ATOMIC_MOVE);
    } catch (IOException ex) {
      UncheckedIOException failure = new UncheckedIOException("Failed to persist run " + runId, ex);
      try {
        FileSystemUtils.deleteRecursively(staging);
      } catch (IOException cleanup) {
        failure.addSuppressed(cleanup);
      }
      throw failure;
    }
    log.info("Persisted run {} to {}", runId, runDirectory);
    return runDirectory;
  }
}

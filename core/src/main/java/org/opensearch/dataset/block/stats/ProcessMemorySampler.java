/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataset.block.stats;

import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.OptionalLong;
import lombok.extern.log4j.Log4j2;

/**
 * Samples peak resident memory from the operating system's per-process status file. The file
 * reports kilobytes, which are scaled by 1000 rather than 1024. Where the status file is
 * unavailable the sampler reports the JVM's current heap and non-heap usage instead.
 */
@Log4j2
public class ProcessMemorySampler implements MemorySampler {

  static final Path PROC_SELF_STATUS = Paths.get("/proc/self/status");

  private static final String PEAK_RSS_FIELD = "VmHWM:";

  private final Path statusFile;

  public ProcessMemorySampler() {
    this(PROC_SELF_STATUS);
  }

  ProcessMemorySampler(Path statusFile) {
    this.statusFile = statusFile;
  }

  @Override
  public long maxRssBytes() {
    OptionalLong peakKb = readPeakRssKb();
    if (peakKb.isPresent()) {
      return peakKb.getAsLong() * 1000L;
    }
    MemoryMXBean memory = ManagementFactory.getMemoryMXBean();
    return memory.getHeapMemoryUsage().getUsed() + memory.getNonHeapMemoryUsage().getUsed();
  }

  private OptionalLong readPeakRssKb() {
    if (!Files.isReadable(statusFile)) {
      return OptionalLong.empty();
    }
    try {
      List<String> lines = Files.readAllLines(statusFile, StandardCharsets.UTF_8);
      for (String line : lines) {
        if (line.startsWith(PEAK_RSS_FIELD)) {
          String[] parts = line.substring(PEAK_RSS_FIELD.length()).trim().split("\\s+");
          return OptionalLong.of(Long.parseLong(parts[0]));
        }
      }
      log.debug("No {} entry in {}", PEAK_RSS_FIELD, statusFile);
    } catch (IOException | NumberFormatException e) {
      log.debug("Failed to read peak memory from {}, using JVM memory usage", statusFile, e);
    }
    return OptionalLong.empty();
  }
}

/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataset.block.stats;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Ticker;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.LongSupplier;
import lombok.Value;
import lombok.With;
import org.opensearch.dataset.common.runtime.RuntimeContext;

/**
 * Execution stats of the unit of work that produced a block. Times are in seconds; start and end
 * are readings of a monotonic clock and only meaningful relative to each other.
 */
@Value
public class ExecutionStats {

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  double startTimeS;

  double endTimeS;

  /** Wall-clock time it took to compute the block. */
  double wallTimeS;

  /** CPU time it took to compute the block. */
  double cpuTimeS;

  /** Part of the wall-clock time spent in user defined functions. */
  @With double udfTimeS;

  /** Id of the node that computed the block. */
  String nodeId;

  /**
   * Peak resident memory of the process. May overestimate the block's own usage since earlier work
   * in the same process is not told apart.
   */
  long maxRssBytes;

  @With Integer taskIdx;

  /** Opens a stats scope on the local node, reading the system clocks. */
  public static ExecutionStatsBuilder builder() {
    return new ExecutionStatsBuilder(
        RuntimeContext.local(),
        Ticker.systemTicker(),
        CpuClock::processCpuNanos,
        new ProcessMemorySampler());
  }

  /** Opens a stats scope with explicit collaborators. */
  public static ExecutionStatsBuilder builder(
      RuntimeContext context, Ticker ticker, LongSupplier cpuNanos, MemorySampler sampler) {
    return new ExecutionStatsBuilder(context, ticker, cpuNanos, sampler);
  }

  @Override
  public String toString() {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("wall_time_s", wallTimeS);
    fields.put("cpu_time_s", cpuTimeS);
    fields.put("udf_time_s", udfTimeS);
    fields.put("node_id", nodeId);
    try {
      return OBJECT_MAPPER.writeValueAsString(fields);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to render execution stats", e);
    }
  }
}

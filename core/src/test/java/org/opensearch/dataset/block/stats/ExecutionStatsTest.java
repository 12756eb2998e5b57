/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataset.block.stats;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Ticker;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.opensearch.dataset.common.runtime.RuntimeContext;

@ExtendWith(MockitoExtension.class)
@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class ExecutionStatsTest {

  @Mock private RuntimeContext context;
  @Mock private Ticker ticker;
  @Mock private MemorySampler sampler;

  private final AtomicLong cpuNanos = new AtomicLong();

  @BeforeEach
  void setUp() {
    lenient().when(ticker.read()).thenReturn(2_000_000_000L, 4_500_000_000L);
  }

  @Test
  void should_measure_durations_between_builder_and_build() {
    when(context.getNodeId()).thenReturn("node-1");
    when(sampler.maxRssBytes()).thenReturn(4096L);
    cpuNanos.set(100_000_000L);
    ExecutionStatsBuilder builder =
        ExecutionStats.builder(context, ticker, cpuNanos::get, sampler);
    cpuNanos.set(1_100_000_000L);

    ExecutionStats stats = builder.build();

    assertEquals(2.0, stats.getStartTimeS(), 1e-9);
    assertEquals(4.5, stats.getEndTimeS(), 1e-9);
    assertEquals(2.5, stats.getWallTimeS(), 1e-9);
    assertEquals(1.0, stats.getCpuTimeS(), 1e-9);
    assertEquals(0.0, stats.getUdfTimeS());
    assertEquals("node-1", stats.getNodeId());
    assertEquals(4096L, stats.getMaxRssBytes());
    assertNull(stats.getTaskIdx());
    verify(sampler).maxRssBytes();
  }

  @Test
  void should_accumulate_udf_time() {
    ExecutionStatsBuilder builder =
        ExecutionStats.builder(context, ticker, cpuNanos::get, sampler);
    builder.addUdfTime(0.25).addUdfTime(0.5);

    assertEquals(0.75, builder.build().getUdfTimeS(), 1e-9);
  }

  @Test
  void should_reject_negative_udf_time() {
    ExecutionStatsBuilder builder =
        ExecutionStats.builder(context, ticker, cpuNanos::get, sampler);

    assertThrows(IllegalArgumentException.class, () -> builder.addUdfTime(-1));
  }

  @Test
  void should_allow_build_only_once() {
    ExecutionStatsBuilder builder =
        ExecutionStats.builder(context, ticker, cpuNanos::get, sampler);
    builder.build();

    assertThrows(IllegalStateException.class, builder::build);
  }

  @Test
  void should_render_stats_as_json() throws Exception {
    when(context.getNodeId()).thenReturn("node-1");
    ExecutionStats stats =
        ExecutionStats.builder(context, ticker, cpuNanos::get, sampler).build().withUdfTimeS(0.5);

    JsonNode json = new ObjectMapper().readTree(stats.toString());

    assertEquals(2.5, json.get("wall_time_s").asDouble(), 1e-9);
    assertEquals(0.0, json.get("cpu_time_s").asDouble(), 1e-9);
    assertEquals(0.5, json.get("udf_time_s").asDouble(), 1e-9);
    assertEquals("node-1", json.get("node_id").asText());
  }

  @Test
  void should_copy_with_task_index() {
    ExecutionStats stats =
        ExecutionStats.builder(context, ticker, cpuNanos::get, sampler).build();

    ExecutionStats withTask = stats.withTaskIdx(3);

    assertEquals(3, withTask.getTaskIdx());
    assertNull(stats.getTaskIdx());
    assertEquals(stats.getWallTimeS(), withTask.getWallTimeS());
  }

  @Test
  void should_measure_real_clocks_by_default() {
    ExecutionStats stats = ExecutionStats.builder().build();

    assertTrue(stats.getWallTimeS() >= 0);
    assertTrue(stats.getCpuTimeS() >= 0);
    assertTrue(stats.getMaxRssBytes() > 0);
    assertEquals(RuntimeContext.local().getNodeId(), stats.getNodeId());
  }
}

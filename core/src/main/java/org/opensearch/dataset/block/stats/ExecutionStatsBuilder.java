/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataset.block.stats;

import com.google.common.base.Preconditions;
import com.google.common.base.Ticker;
import java.util.function.LongSupplier;
import org.opensearch.dataset.common.runtime.RuntimeContext;

/**
 * Measures one unit of block-producing work. The start readings are taken when the builder is
 * created; {@link #build()} takes the end readings and may be called only once. A builder belongs
 * to a single unit of work and must not be shared between threads.
 */
public class ExecutionStatsBuilder {

  private static final double NANOS_PER_SECOND = 1_000_000_000d;

  private final RuntimeContext context;
  private final Ticker ticker;
  private final LongSupplier cpuNanos;
  private final MemorySampler sampler;

  private final long startNanos;
  private final long startCpuNanos;
  private double udfTimeS;
  private boolean built;

  ExecutionStatsBuilder(
      RuntimeContext context, Ticker ticker, LongSupplier cpuNanos, MemorySampler sampler) {
    this.context = context;
    this.ticker = ticker;
    this.cpuNanos = cpuNanos;
    this.sampler = sampler;
    this.startNanos = ticker.read();
    this.startCpuNanos = cpuNanos.getAsLong();
  }

  /** Attributes part of the elapsed time to user defined functions. */
  public ExecutionStatsBuilder addUdfTime(double seconds) {
    Preconditions.checkArgument(seconds >= 0, "UDF time must be non-negative: %s", seconds);
    udfTimeS += seconds;
    return this;
  }

  /**
   * Closes the scope and returns the stats.
   *
   * @throws IllegalStateException if called more than once
   */
  public ExecutionStats build() {
    Preconditions.checkState(!built, "ExecutionStatsBuilder.build() may only be called once");
    built = true;
    long endNanos = ticker.read();
    long endCpuNanos = cpuNanos.getAsLong();
    return new ExecutionStats(
        startNanos / NANOS_PER_SECOND,
        endNanos / NANOS_PER_SECOND,
        (endNanos - startNanos) / NANOS_PER_SECOND,
        Math.max(0L, endCpuNanos - startCpuNanos) / NANOS_PER_SECOND,
        udfTimeS,
        context.getNodeId(),
        sampler.maxRssBytes(),
        null);
  }
}

/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataset.block.stats;

/** Source of the memory figure recorded in {@link ExecutionStats#getMaxRssBytes()}. */
@FunctionalInterface
public interface MemorySampler {

  /** Returns the peak resident memory of the process in bytes, or the best available estimate. */
  long maxRssBytes();
}

/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataset.block.aggregate;

import java.util.List;
import java.util.Map;

/**
 * Folds the rows of a group into an accumulator. Aggregation runs in two phases: each block is
 * combined into one accumulator row per group, then accumulators of the same group from different
 * blocks are merged and finished. Accumulators are stored in blocks between the phases, so they
 * must be values a block column can hold.
 *
 * @param <A> accumulator type
 */
public interface AggregateFunction<A> {

  /** Returns the name of the output column. */
  String getName();

  /** Returns the accumulator of an empty group with the given key. */
  A init(List<Object> key);

  /** Folds one row into the accumulator. */
  A accumulateRow(A accumulator, Map<String, Object> row);

  /** Merges two partial accumulators of the same group. */
  A merge(A accumulator1, A accumulator2);

  /** Returns the aggregate value of a fully merged accumulator. */
  Object finish(A accumulator);
}

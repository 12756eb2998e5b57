/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataset.block;

import java.util.Map;

/** Accumulates rows and blocks into a single block of one representation. */
public interface BlockBuilder {

  /** Appends a row. Columns missing from the row are null. */
  void add(Map<String, Object> row);

  /**
   * Appends every row of a block.
   *
   * @throws org.opensearch.dataset.exception.BlockTypeMismatchException if the block is not of
   *     this builder's representation
   */
  void addBlock(Block block);

  /** Builds the block holding every row added so far. */
  Block build();

  int getNumRows();

  /** Returns the approximate memory held by the accumulated rows. */
  long getEstimatedMemoryUsage();

  BlockType getBlockType();
}

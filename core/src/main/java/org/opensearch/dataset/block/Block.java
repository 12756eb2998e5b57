/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataset.block;

import java.util.List;

/**
 * The unit of tabular storage moved between operators. A block is one of exactly two columnar
 * representations, {@link ArrowTable} or {@link DataFrame}, and never changes representation once
 * created. Operators work on blocks through a {@link BlockAccessor} obtained from {@link
 * BlockAccessors#forBlock(Block)}.
 */
public sealed interface Block permits ArrowTable, DataFrame {

  /** Returns the representation of this block. */
  BlockType getType();

  /** Returns the number of rows in this block. */
  int getRowCount();

  /** Returns the column names in order. */
  List<String> getColumnNames();
}

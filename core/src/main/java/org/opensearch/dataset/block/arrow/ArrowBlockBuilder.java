/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataset.block.arrow;

import java.util.List;
import java.util.Map;
import org.opensearch.dataset.block.ArrowTable;
import org.opensearch.dataset.block.BlockType;
import org.opensearch.dataset.block.TableBlockBuilder;

/**
 * Builds Arrow tables. Column types are inferred when the table is built.
 *
 * @see ArrowConversions#tableFromColumns(Map)
 */
public class ArrowBlockBuilder extends TableBlockBuilder {

  /**
   * {@inheritDoc}
   *
   * @throws org.opensearch.dataset.exception.ArrowConversionException if a column holds values
   *     Arrow cannot store together
   */
  @Override
  public ArrowTable build() {
    return (ArrowTable) super.build();
  }

  @Override
  protected ArrowTable buildFromColumns(Map<String, List<Object>> columns) {
    return ArrowConversions.tableFromColumns(columns).getOrThrow();
  }

  @Override
  public BlockType getBlockType() {
    return BlockType.ARROW;
  }
}

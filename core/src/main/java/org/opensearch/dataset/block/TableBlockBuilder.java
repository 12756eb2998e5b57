/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataset.block;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.opensearch.dataset.exception.BlockTypeMismatchException;

/**
 * Block builder that accumulates values column by column. Columns keep the order in which they are
 * first seen; a column first seen after some rows were added is back-filled with nulls.
 */
public abstract class TableBlockBuilder implements BlockBuilder {

  private final Map<String, List<Object>> columns = new LinkedHashMap<>();
  private int numRows;
  private long estimatedBytes;

  @Override
  public void add(Map<String, Object> row) {
    for (String name : row.keySet()) {
      if (!columns.containsKey(name)) {
        columns.put(name, new ArrayList<>(Collections.nCopies(numRows, null)));
      }
    }
    for (Map.Entry<String, List<Object>> column : columns.entrySet()) {
      Object value = row.get(column.getKey());
      column.getValue().add(value);
      estimatedBytes += SizeEstimator.estimate(value);
    }
    numRows++;
  }

  @Override
  public void addBlock(Block block) {
    if (block.getType() != getBlockType()) {
      throw new BlockTypeMismatchException(
          String.format(
              "Cannot add a block of type %s to a %s block builder",
              block.getType().getName(), getBlockType().getName()));
    }
    for (String name : block.getColumnNames()) {
      columns.computeIfAbsent(name, k -> new ArrayList<>(Collections.nCopies(numRows, null)));
    }
    Iterator<Map<String, Object>> rows = BlockAccessors.forBlock(block).iterRows(false);
    while (rows.hasNext()) {
      add(rows.next());
    }
  }

  @Override
  public Block build() {
    Map<String, List<Object>> snapshot = new LinkedHashMap<>();
    columns.forEach((name, values) -> snapshot.put(name, new ArrayList<>(values)));
    return buildFromColumns(snapshot);
  }

  /** Creates the block from columns of equal length. */
  protected abstract Block buildFromColumns(Map<String, List<Object>> columns);

  @Override
  public int getNumRows() {
    return numRows;
  }

  @Override
  public long getEstimatedMemoryUsage() {
    return estimatedBytes;
  }
}

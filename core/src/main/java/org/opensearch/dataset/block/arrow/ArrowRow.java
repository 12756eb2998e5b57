/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataset.block.arrow;

import java.util.List;
import lombok.RequiredArgsConstructor;
import org.opensearch.dataset.block.ArrowTable;
import org.opensearch.dataset.block.TableRow;

/** Row of an Arrow table, decoded on access. */
@RequiredArgsConstructor
public class ArrowRow extends TableRow {

  private final ArrowTable table;
  private final int row;

  @Override
  protected List<String> columnNames() {
    return table.getColumnNames();
  }

  @Override
  protected Object valueAt(int column) {
    return table.getValue(row, column);
  }

  @Override
  protected int indexOf(String name) {
    return table.getColumnNames().indexOf(name);
  }
}

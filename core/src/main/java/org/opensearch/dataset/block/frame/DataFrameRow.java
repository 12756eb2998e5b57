/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataset.block.frame;

import java.util.List;
import lombok.RequiredArgsConstructor;
import org.opensearch.dataset.block.DataFrame;
import org.opensearch.dataset.block.TableRow;

/** Row of a data frame. */
@RequiredArgsConstructor
public class DataFrameRow extends TableRow {

  private final DataFrame frame;
  private final int row;

  @Override
  protected List<String> columnNames() {
    return frame.getColumnNames();
  }

  @Override
  protected Object valueAt(int column) {
    return frame.getValue(row, column);
  }

  @Override
  protected int indexOf(String name) {
    return frame.hasColumn(name) ? frame.getColumnIndex(name) : -1;
  }
}

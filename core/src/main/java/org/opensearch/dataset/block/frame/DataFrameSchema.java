/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataset.block.frame;

import java.util.ArrayList;
import java.util.List;
import lombok.Value;
import org.opensearch.dataset.block.BlockSchema;
import org.opensearch.dataset.block.DataFrame;

/**
 * Schema of a data frame: the column names and, per column, the class shared by its non-null
 * values. A column that is empty, all null or of mixed classes has type {@code Object}.
 */
@Value
public class DataFrameSchema implements BlockSchema {

  List<String> names;

  List<Class<?>> types;

  public static DataFrameSchema of(DataFrame frame) {
    List<Class<?>> types = new ArrayList<>(frame.getColumnCount());
    for (int column = 0; column < frame.getColumnCount(); column++) {
      types.add(columnType(frame, column));
    }
    return new DataFrameSchema(frame.getColumnNames(), types);
  }

  private static Class<?> columnType(DataFrame frame, int column) {
    Class<?> type = null;
    for (int row = 0; row < frame.getRowCount(); row++) {
      Object value = frame.getValue(row, column);
      if (value == null) {
        continue;
      }
      if (type == null) {
        type = value.getClass();
      } else if (type != value.getClass()) {
        return Object.class;
      }
    }
    return type == null ? Object.class : type;
  }
}

/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataset.block;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.opensearch.dataset.exception.SchemaException;
import org.opensearch.dataset.exception.ShapeMismatchException;

/**
 * Column-major table of Java objects. Each column is an object array; a data frame may be a view
 * over a row range of arrays shared with another data frame, which is how zero-copy slices are
 * represented. The arrays are never written after construction.
 */
public final class DataFrame implements Block {

  private final List<String> columnNames;
  private final Map<String, Integer> columnIndex;
  private final Object[][] columns;
  private final int offset;
  private final int rowCount;

  private DataFrame(List<String> columnNames, Object[][] columns, int offset, int rowCount) {
    this.columnNames = Collections.unmodifiableList(new ArrayList<>(columnNames));
    this.columnIndex = new HashMap<>();
    for (int i = 0; i < columnNames.size(); i++) {
      if (columnIndex.put(columnNames.get(i), i) != null) {
        throw new SchemaException("Duplicate column name: " + columnNames.get(i));
      }
    }
    this.columns = columns;
    this.offset = offset;
    this.rowCount = rowCount;
  }

  /**
   * Creates a data frame from columns keyed by name, in the map's iteration order.
   *
   * @param columns column name to array or list
   * @return a data frame owning copies of the column values
   * @throws ShapeMismatchException if the columns differ in length
   */
  public static DataFrame of(Map<String, ?> columns) {
    List<String> names = new ArrayList<>(columns.size());
    Object[][] data = new Object[columns.size()][];
    int i = 0;
    for (Map.Entry<String, ?> entry : columns.entrySet()) {
      names.add(entry.getKey());
      data[i++] = ColumnArrays.toObjectArray(entry.getKey(), entry.getValue());
    }
    return new DataFrame(names, data, 0, checkedRowCount(names, data));
  }

  /**
   * Creates a data frame that takes ownership of the given column arrays.
   *
   * @param names column names
   * @param columns one array per name, all of equal length
   */
  public static DataFrame fromColumns(List<String> names, Object[][] columns) {
    if (names.size() != columns.length) {
      throw new ShapeMismatchException(
          String.format("Got %d column names for %d columns", names.size(), columns.length));
    }
    return new DataFrame(names, columns, 0, checkedRowCount(names, columns));
  }

  /** Creates a data frame with the given columns and no rows. */
  public static DataFrame empty(List<String> names) {
    Object[][] data = new Object[names.size()][];
    Arrays.fill(data, new Object[0]);
    return new DataFrame(names, data, 0, 0);
  }

  private static int checkedRowCount(List<String> names, Object[][] columns) {
    if (columns.length == 0) {
      return 0;
    }
    int length = columns[0].length;
    for (int i = 1; i < columns.length; i++) {
      if (columns[i].length != length) {
        throw new ShapeMismatchException(
            String.format(
                "All columns must have the same length, but column %s has %d rows and column %s"
                    + " has %d rows",
                names.get(0), length, names.get(i), columns[i].length));
      }
    }
    return length;
  }

  @Override
  public BlockType getType() {
    return BlockType.DATAFRAME;
  }

  @Override
  public int getRowCount() {
    return rowCount;
  }

  @Override
  public List<String> getColumnNames() {
    return columnNames;
  }

  public int getColumnCount() {
    return columnNames.size();
  }

  /**
   * Returns the position of the named column.
   *
   * @throws SchemaException if there is no such column
   */
  public int getColumnIndex(String name) {
    Integer index = columnIndex.get(name);
    if (index == null) {
      throw new SchemaException(
          String.format("Column %s does not exist, available columns are %s", name, columnNames));
    }
    return index;
  }

  public boolean hasColumn(String name) {
    return columnIndex.containsKey(name);
  }

  /**
   * Returns the value at the given row and column.
   *
   * @param row the row index (0-based)
   * @param column the column index (0-based)
   */
  public Object getValue(int row, int column) {
    if (row < 0 || row >= rowCount) {
      throw new IndexOutOfBoundsException(
          "Position " + row + " out of range [0, " + rowCount + ")");
    }
    return columns[column][offset + row];
  }

  /** Returns a copy of the values of the named column. */
  public Object[] getColumn(String name) {
    Object[] column = columns[getColumnIndex(name)];
    return Arrays.copyOfRange(column, offset, offset + rowCount);
  }

  /** Returns the approximate heap footprint of the values in this frame. */
  public long estimateSizeBytes() {
    long total = 0;
    for (Object[] column : columns) {
      total += SizeEstimator.estimate(column, offset, rowCount);
    }
    return total;
  }

  /**
   * Returns the rows {@code [start, end)}.
   *
   * @param copy when false the result shares the column arrays of this frame
   */
  public DataFrame slice(int start, int end, boolean copy) {
    if (start < 0 || end > rowCount || start > end) {
      throw new IndexOutOfBoundsException(
          "Region [" + start + ", " + end + ") out of range [0, " + rowCount + ")");
    }
    if (!copy) {
      return new DataFrame(columnNames, columns, offset + start, end - start);
    }
    Object[][] data = new Object[columns.length][];
    for (int i = 0; i < columns.length; i++) {
      data[i] = Arrays.copyOfRange(columns[i], offset + start, offset + end);
    }
    return new DataFrame(columnNames, data, 0, end - start);
  }

  /** Returns a new frame holding the given rows in the given order. */
  public DataFrame take(List<Integer> indices) {
    Object[][] data = new Object[columns.length][indices.size()];
    for (int j = 0; j < indices.size(); j++) {
      int row = indices.get(j);
      if (row < 0 || row >= rowCount) {
        throw new IndexOutOfBoundsException(
            "Position " + row + " out of range [0, " + rowCount + ")");
      }
      for (int i = 0; i < columns.length; i++) {
        data[i][j] = columns[i][offset + row];
      }
    }
    return new DataFrame(columnNames, data, 0, indices.size());
  }

  /** Returns a frame restricted to the named columns, in the given order, sharing storage. */
  public DataFrame select(List<String> names) {
    Object[][] data = new Object[names.size()][];
    for (int i = 0; i < names.size(); i++) {
      data[i] = columns[getColumnIndex(names.get(i))];
    }
    return new DataFrame(names, data, offset, rowCount);
  }

  /**
   * Returns a frame holding the columns of this frame followed by the columns of {@code other},
   * renamed to {@code names}. Both sides must have the same number of rows.
   */
  public DataFrame withColumns(List<String> names, DataFrame other) {
    List<String> allNames = new ArrayList<>(columnNames);
    allNames.addAll(names);
    Object[][] data = new Object[columns.length + other.columns.length][];
    for (int i = 0; i < columns.length; i++) {
      data[i] = Arrays.copyOfRange(columns[i], offset, offset + rowCount);
    }
    for (int i = 0; i < other.columns.length; i++) {
      data[columns.length + i] =
          Arrays.copyOfRange(other.columns[i], other.offset, other.offset + other.rowCount);
    }
    return new DataFrame(allNames, data, 0, rowCount);
  }

  /** Returns the columns as an ordered map of value copies. */
  public Map<String, Object[]> toColumnMap() {
    Map<String, Object[]> result = new LinkedHashMap<>();
    for (String name : columnNames) {
      result.put(name, getColumn(name));
    }
    return result;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof DataFrame other)) {
      return false;
    }
    if (rowCount != other.rowCount || !columnNames.equals(other.columnNames)) {
      return false;
    }
    for (int i = 0; i < columns.length; i++) {
      for (int row = 0; row < rowCount; row++) {
        if (!Objects.deepEquals(
            columns[i][offset + row], other.columns[i][other.offset + row])) {
          return false;
        }
      }
    }
    return true;
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(columnNames, rowCount);
    for (Object[] column : columns) {
      for (int row = 0; row < rowCount; row++) {
        result = 31 * result + Arrays.deepHashCode(new Object[] {column[offset + row]});
      }
    }
    return result;
  }

  @Override
  public String toString() {
    return "DataFrame(columns=" + columnNames + ", rows=" + rowCount + ")";
  }
}

/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataset.block;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.Schema;
import org.opensearch.dataset.block.arrow.ArrowVectors;
import org.opensearch.dataset.exception.SchemaException;

/**
 * Arrow columnar table. Wraps a {@link VectorSchemaRoot} that is not modified after the table is
 * created. Closing the table releases its Arrow buffers; buffers shared with tables derived by
 * zero-copy operations stay alive until every sharer is closed.
 */
public final class ArrowTable implements Block, AutoCloseable {

  private final VectorSchemaRoot root;
  private final List<String> columnNames;

  private ArrowTable(VectorSchemaRoot root) {
    this.root = root;
    List<String> names = new ArrayList<>();
    for (Field field : root.getSchema().getFields()) {
      names.add(field.getName());
    }
    this.columnNames = Collections.unmodifiableList(names);
  }

  /**
   * Wraps a populated root. The table takes ownership of the root.
   *
   * @param root root whose row count is already set
   * @return the table
   */
  public static ArrowTable wrap(VectorSchemaRoot root) {
    return new ArrowTable(root);
  }

  public VectorSchemaRoot getRoot() {
    return root;
  }

  public Schema getSchema() {
    return root.getSchema();
  }

  @Override
  public BlockType getType() {
    return BlockType.ARROW;
  }

  @Override
  public int getRowCount() {
    return root.getRowCount();
  }

  @Override
  public List<String> getColumnNames() {
    return columnNames;
  }

  /**
   * Returns the vector of the named column.
   *
   * @throws SchemaException if there is no such column
   */
  public FieldVector getVector(String name) {
    FieldVector vector = root.getVector(name);
    if (vector == null) {
      throw new SchemaException(
          String.format("Column %s does not exist, available columns are %s", name, columnNames));
    }
    return vector;
  }

  /**
   * Returns the Java value at the given row and column.
   *
   * @param row the row index (0-based)
   * @param column the column index (0-based)
   */
  public Object getValue(int row, int column) {
    if (row < 0 || row >= getRowCount()) {
      throw new IndexOutOfBoundsException(
          "Position " + row + " out of range [0, " + getRowCount() + ")");
    }
    return ArrowVectors.getValue(root.getVector(column), row);
  }

  @Override
  public void close() {
    root.close();
  }

  @Override
  public String toString() {
    return "ArrowTable(schema=" + root.getSchema() + ", rows=" + getRowCount() + ")";
  }
}

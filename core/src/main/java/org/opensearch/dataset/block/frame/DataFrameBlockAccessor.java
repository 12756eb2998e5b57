/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataset.block.frame;

import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import lombok.RequiredArgsConstructor;
import org.opensearch.dataset.block.ArrowTable;
import org.opensearch.dataset.block.Block;
import org.opensearch.dataset.block.BlockType;
import org.opensearch.dataset.block.ColumnArrays;
import org.opensearch.dataset.block.DataFrame;
import org.opensearch.dataset.block.TableBlockAccessor;
import org.opensearch.dataset.block.arrow.ArrowConversions;

/** Accessor of {@link DataFrame} blocks. */
@RequiredArgsConstructor
public class DataFrameBlockAccessor extends TableBlockAccessor {

  private final DataFrame frame;

  @Override
  public int numRows() {
    return frame.getRowCount();
  }

  @Override
  public long sizeBytes() {
    return frame.estimateSizeBytes();
  }

  @Override
  public DataFrameSchema schema() {
    return DataFrameSchema.of(frame);
  }

  @Override
  public Iterator<Map<String, Object>> iterRows(boolean publicRowFormat) {
    int rowCount = numRows();
    return new Iterator<>() {
      private int row;

      @Override
      public boolean hasNext() {
        return row < rowCount;
      }

      @Override
      public Map<String, Object> next() {
        if (!hasNext()) {
          throw new NoSuchElementException();
        }
        DataFrameRow view = new DataFrameRow(frame, row++);
        return publicRowFormat ? view.toPublic() : view;
      }
    };
  }

  @Override
  public DataFrame slice(int start, int end, boolean copy) {
    return frame.slice(start, end, copy);
  }

  @Override
  public DataFrame take(List<Integer> indices) {
    return frame.take(indices);
  }

  @Override
  public DataFrame select(List<String> columns) {
    return frame.select(columns);
  }

  @Override
  public DataFrame randomShuffle(Long seed) {
    return (DataFrame) super.randomShuffle(seed);
  }

  @Override
  public DataFrame toDataFrame() {
    return frame;
  }

  @Override
  public Object toNumpy(String column) {
    return ColumnArrays.toTypedArray(Arrays.asList(frame.getColumn(column)));
  }

  @Override
  public Map<String, Object> toNumpy(List<String> columns) {
    Map<String, Object> arrays = new LinkedHashMap<>();
    for (String column : columns) {
      arrays.put(column, toNumpy(column));
    }
    return arrays;
  }

  /**
   * {@inheritDoc}
   *
   * @throws org.opensearch.dataset.exception.ArrowConversionException if a column holds values
   *     Arrow cannot store together
   */
  @Override
  public ArrowTable toArrow() {
    return ArrowConversions.fromDataFrame(frame);
  }

  @Override
  public DataFrame toBlock() {
    return frame;
  }

  @Override
  public DataFrame zip(Block other) {
    checkZippable(other);
    DataFrame right = (DataFrame) other;
    return frame.withColumns(zipColumnNames(frame.getColumnNames(), right.getColumnNames()), right);
  }

  @Override
  public DataFrameBlockBuilder builder() {
    return new DataFrameBlockBuilder();
  }

  @Override
  public BlockType blockType() {
    return BlockType.DATAFRAME;
  }
}

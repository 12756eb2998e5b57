/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataset.block;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import org.opensearch.dataset.block.aggregate.AggregateFunction;
import org.opensearch.dataset.block.sort.SortKey;
import org.opensearch.dataset.block.stats.ExecutionStats;

/**
 * Operations on a block that do not depend on its representation. An accessor wraps one block and
 * never modifies it: every operation returns a new block, or the wrapped block itself where no
 * change is needed. Accessors are obtained from {@link BlockAccessors#forBlock(Object)}.
 */
public abstract class BlockAccessor {

  /** Returns the number of rows. Constant time. */
  public abstract int numRows();

  /**
   * Returns the approximate in-memory size of the block. A block produced by {@link #slice} or by
   * {@link #take} of distinct rows never reports more than its parent.
   */
  public abstract long sizeBytes();

  /** Returns the column description of the block. */
  public abstract BlockSchema schema();

  /**
   * Iterates over the rows. Every call returns a new iterator.
   *
   * @param publicRowFormat when true every row is an independent {@code LinkedHashMap}; otherwise
   *     rows are read-only views that are only valid while the block is
   */
  public abstract Iterator<Map<String, Object>> iterRows(boolean publicRowFormat);

  /**
   * Returns rows {@code [start, end)}.
   *
   * @param copy when false the result may share storage with this block; when true it never does
   * @throws IndexOutOfBoundsException if the range is not within the block
   */
  public abstract Block slice(int start, int end, boolean copy);

  /** Returns the rows at the given positions, in the given order. */
  public abstract Block take(List<Integer> indices);

  /**
   * Returns the named columns, in the given order.
   *
   * @throws org.opensearch.dataset.exception.SchemaException if a column does not exist
   */
  public abstract Block select(List<String> columns);

  /**
   * Returns the rows in random order.
   *
   * @param seed fixes the order when non-null
   */
  public abstract Block randomShuffle(Long seed);

  public abstract DataFrame toDataFrame();

  /** Returns every column as a Java array, keyed by column name in column order. */
  public Map<String, Object> toNumpy() {
    return toNumpy(toBlock().getColumnNames());
  }

  /** Returns one column as a Java array. */
  public abstract Object toNumpy(String column);

  /** Returns the given columns as Java arrays, keyed by column name in the given order. */
  public abstract Map<String, Object> toNumpy(List<String> columns);

  public abstract ArrowTable toArrow();

  /** Returns the wrapped block. */
  public abstract Block toBlock();

  /** Returns the block in its native representation. */
  public Block toDefault() {
    return toBlock();
  }

  /**
   * Converts the block to a batch format.
   *
   * @param batchFormat one of {@link BatchFormat#allNames()}, or null for the block itself
   * @throws org.opensearch.dataset.exception.InvalidArgumentException if the format is unknown
   */
  public Object toBatchFormat(String batchFormat) {
    if (batchFormat == null) {
      return toBlock();
    }
    return switch (BatchFormat.of(batchFormat)) {
      case NATIVE -> toDefault();
      case PANDAS -> toDataFrame();
      case PYARROW -> toArrow();
      case NUMPY -> toNumpy();
    };
  }

  /**
   * Describes the block.
   *
   * @param inputFiles files the block was read from, or null
   * @param execStats stats of the work that produced the block, or null
   */
  public BlockMetadata getMetadata(List<String> inputFiles, ExecutionStats execStats) {
    return BlockMetadata.builder()
        .numRows((long) numRows())
        .sizeBytes(sizeBytes())
        .schema(schema())
        .inputFiles(inputFiles)
        .execStats(execStats)
        .build();
  }

  public BlockMetadata getMetadata() {
    return getMetadata(null, null);
  }

  /**
   * Appends the columns of another block of the same representation and row count. A column whose
   * name is taken is renamed with a numeric suffix.
   *
   * @throws org.opensearch.dataset.exception.ShapeMismatchException if the blocks differ in row
   *     count or representation
   */
  public abstract Block zip(Block other);

  /** Returns a builder producing blocks of this representation. */
  public abstract BlockBuilder builder();

  /**
   * Returns up to {@code n} rows drawn at random without replacement, restricted to the key
   * columns.
   */
  public abstract Block sample(int n, SortKey sortKey);

  /**
   * Sorts the block and splits it at the given boundaries.
   *
   * @param boundaries sorted key values; partition {@code i} holds the rows whose key sorts before
   *     boundary {@code i} and not before boundary {@code i - 1}
   * @return {@code boundaries.size() + 1} sorted blocks
   */
  public abstract List<Block> sortAndPartition(List<List<Object>> boundaries, SortKey sortKey);

  /**
   * Combines each run of rows with equal keys into one row of partial accumulators. The block must
   * be sorted by the key. The output holds the key columns followed by one column per aggregate.
   */
  public abstract Block combine(SortKey sortKey, List<AggregateFunction<?>> aggs);

  public abstract BlockType blockType();
}

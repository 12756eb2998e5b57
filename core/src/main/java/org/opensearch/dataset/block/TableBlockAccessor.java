/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataset.block;

import static org.opensearch.dataset.common.utils.StringUtils.truncatedRepr;

import com.google.common.collect.Iterators;
import com.google.common.collect.Lists;
import com.google.common.collect.PeekingIterator;
import com.google.common.collect.Streams;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.opensearch.dataset.block.aggregate.AggregateFunction;
import org.opensearch.dataset.block.sort.SortKey;
import org.opensearch.dataset.block.stats.ExecutionStats;
import org.opensearch.dataset.block.stats.ExecutionStatsBuilder;
import org.opensearch.dataset.exception.InvalidArgumentException;
import org.opensearch.dataset.exception.ShapeMismatchException;

/**
 * Accessor of a columnar table. Implements the sampling, sorting and aggregation operations on top
 * of the row iteration, slicing and take primitives of the concrete representation.
 */
public abstract class TableBlockAccessor extends BlockAccessor {

  /** Column names of the wrapped block. */
  protected List<String> columnNames() {
    return toBlock().getColumnNames();
  }

  /** Releases an intermediate block created by this accessor. */
  protected void discard(Block intermediate) {}

  /** A row of one of several blocks being merged, with its position in that block. */
  protected record RowRef(int block, int row, Map<String, Object> values) {}

  /**
   * Collects rows of several blocks, in the given order, into one block of this representation.
   * Column types are inferred again from the row values; representations with a typed schema
   * override this to copy the rows instead.
   *
   * @param blocks the blocks the rows refer to, the wrapped block first
   * @param rows rows in output order
   */
  protected Block gather(List<Block> blocks, List<RowRef> rows) {
    BlockBuilder builder = builder();
    rows.forEach(row -> builder.add(row.values()));
    return builder.build();
  }

  @Override
  public Block randomShuffle(Long seed) {
    List<Integer> indices = allIndices(numRows());
    Collections.shuffle(indices, seed == null ? new Random() : new Random(seed));
    return take(indices);
  }

  @Override
  public Block sample(int n, SortKey sortKey) {
    sortKey.validateSchema(columnNames());
    List<Integer> indices = allIndices(numRows());
    Collections.shuffle(indices);
    Block drawn = take(indices.subList(0, Math.min(Math.max(n, 0), indices.size())));
    Block sample = BlockAccessors.forBlock(drawn).select(sortKey.getColumns());
    discard(drawn);
    return sample;
  }

  @Override
  public List<Block> sortAndPartition(List<List<Object>> boundaries, SortKey sortKey) {
    sortKey.validateSchema(columnNames());
    Comparator<List<Object>> comparator = sortKey.keyComparator();
    for (int i = 0; i < boundaries.size(); i++) {
      if (boundaries.get(i).size() != sortKey.getColumns().size()) {
        throw new InvalidArgumentException(
            String.format(
                "Partition boundary %s does not match the sort columns %s",
                truncatedRepr(boundaries.get(i)), sortKey.getColumns()));
      }
      if (i > 0 && comparator.compare(boundaries.get(i - 1), boundaries.get(i)) > 0) {
        throw new InvalidArgumentException(
            "The partition boundaries must be sorted, got: " + truncatedRepr(boundaries));
      }
    }

    List<Block> partitions = new ArrayList<>(boundaries.size() + 1);
    if (numRows() == 0) {
      for (int i = 0; i <= boundaries.size(); i++) {
        partitions.add(slice(0, 0, true));
      }
      return partitions;
    }

    List<List<Object>> keys = new ArrayList<>(numRows());
    iterRows(false).forEachRemaining(row -> keys.add(sortKey.extractKey(row)));
    List<Integer> order = allIndices(numRows());
    order.sort(Comparator.comparing(keys::get, comparator));
    List<List<Object>> sortedKeys = order.stream().map(keys::get).collect(Collectors.toList());

    Block sorted = take(order);
    BlockAccessor sortedAccessor = BlockAccessors.forBlock(sorted);
    int start = 0;
    for (List<Object> boundary : boundaries) {
      int end = lowerBound(sortedKeys, start, boundary, comparator);
      partitions.add(sortedAccessor.slice(start, end, false));
      start = end;
    }
    partitions.add(sortedAccessor.slice(start, sortedKeys.size(), false));
    discard(sorted);
    return partitions;
  }

  @Override
  public Block combine(SortKey sortKey, List<AggregateFunction<?>> aggs) {
    sortKey.validateSchema(columnNames());
    List<String> aggNames = resolveAggregateNames(aggs);
    Comparator<List<Object>> comparator = sortKey.keyComparator();
    BlockBuilder aggregates = builder();
    List<Integer> groupStarts = new ArrayList<>();
    PeekingIterator<Map<String, Object>> rows = Iterators.peekingIterator(iterRows(false));
    int position = 0;
    // A global aggregation is a single group, even over no rows.
    boolean first = true;
    while (rows.hasNext() || (first && sortKey.isEmpty())) {
      first = false;
      groupStarts.add(position);
      List<Object> key = rows.hasNext() ? sortKey.extractKey(rows.peek()) : List.of();
      Object[] accumulators = new Object[aggs.size()];
      for (int i = 0; i < aggs.size(); i++) {
        accumulators[i] = aggs.get(i).init(key);
      }
      while (rows.hasNext()
          && comparator.compare(sortKey.extractKey(rows.peek()), key) == 0) {
        Map<String, Object> row = rows.next();
        position++;
        for (int i = 0; i < aggs.size(); i++) {
          accumulators[i] = accumulate(aggs.get(i), accumulators[i], row);
        }
      }
      aggregates.add(aggregateRow(aggNames, Arrays.asList(accumulators)));
    }
    if (sortKey.isEmpty()) {
      return aggregates.build();
    }
    return withKeyColumns(take(groupStarts), sortKey, aggregates.build());
  }

  /**
   * Merges blocks each sorted by the key into one sorted block. Empty blocks are skipped; the
   * result has the representation of the first non-empty block.
   */
  public static BlockAndMetadata mergeSortedBlocks(List<Block> blocks, SortKey sortKey) {
    ExecutionStatsBuilder stats = ExecutionStats.builder();
    List<Block> nonEmpty = nonEmpty(blocks, sortKey);
    Block result;
    if (nonEmpty.isEmpty()) {
      result =
          blocks.isEmpty()
              ? BlockAccessors.emptyBlock(BlockType.ARROW)
              : BlockAccessors.forBlock(blocks.get(0)).slice(0, 0, true);
    } else {
      List<RowRef> rows = Lists.newArrayList(mergedRows(nonEmpty, sortKey));
      result = tableAccessor(nonEmpty.get(0)).gather(nonEmpty, rows);
    }
    return new BlockAndMetadata(
        result, BlockAccessors.forBlock(result).getMetadata(null, stats.build()));
  }

  /**
   * Merges blocks produced by {@link #combine}, each sorted by the key, and finishes the
   * accumulators of every group. A global aggregation over no rows yields a single row of finished
   * initial accumulators.
   */
  public static BlockAndMetadata aggregateCombinedBlocks(
      List<Block> blocks, SortKey sortKey, List<AggregateFunction<?>> aggs) {
    ExecutionStatsBuilder stats = ExecutionStats.builder();
    List<String> aggNames = resolveAggregateNames(aggs);
    List<Block> nonEmpty = nonEmpty(blocks, sortKey);
    BlockType type =
        !nonEmpty.isEmpty()
            ? nonEmpty.get(0).getType()
            : blocks.isEmpty() ? BlockType.ARROW : blocks.get(0).getType();
    BlockBuilder aggregates = BlockAccessors.builderFor(type);
    List<RowRef> groups = new ArrayList<>();
    Comparator<List<Object>> comparator = sortKey.keyComparator();
    PeekingIterator<RowRef> rows = Iterators.peekingIterator(mergedRows(nonEmpty, sortKey));

    if (sortKey.isEmpty() && !rows.hasNext()) {
      List<Object> finished = new ArrayList<>(aggs.size());
      for (AggregateFunction<?> agg : aggs) {
        finished.add(initAndFinish(agg));
      }
      aggregates.add(aggregateRow(aggNames, finished));
    }
    while (rows.hasNext()) {
      RowRef first = rows.next();
      groups.add(first);
      List<Object> key = sortKey.extractKey(first.values());
      Object[] accumulators = new Object[aggs.size()];
      for (int i = 0; i < aggs.size(); i++) {
        accumulators[i] = first.values().get(aggNames.get(i));
      }
      while (rows.hasNext()
          && comparator.compare(sortKey.extractKey(rows.peek().values()), key) == 0) {
        Map<String, Object> row = rows.next().values();
        for (int i = 0; i < aggs.size(); i++) {
          accumulators[i] = merge(aggs.get(i), accumulators[i], row.get(aggNames.get(i)));
        }
      }
      List<Object> finished = new ArrayList<>(aggs.size());
      for (int i = 0; i < aggs.size(); i++) {
        finished.add(finish(aggs.get(i), accumulators[i]));
      }
      aggregates.add(aggregateRow(aggNames, finished));
    }
    Block result = aggregates.build();
    if (!sortKey.isEmpty() && !groups.isEmpty()) {
      Block keyRows = tableAccessor(nonEmpty.get(0)).gather(nonEmpty, groups);
      result = withKeyColumns(keyRows, sortKey, result);
    }
    return new BlockAndMetadata(
        result, BlockAccessors.forBlock(result).getMetadata(null, stats.build()));
  }

  /**
   * Returns the output column name of each aggregate. Repeated names get a suffix counting their
   * occurrences, so the second {@code sum(x)} is named {@code sum(x)_2}.
   */
  static List<String> resolveAggregateNames(List<AggregateFunction<?>> aggs) {
    Map<String, Integer> counts = new HashMap<>();
    List<String> names = new ArrayList<>(aggs.size());
    for (AggregateFunction<?> agg : aggs) {
      int count = counts.merge(agg.getName(), 1, Integer::sum);
      names.add(count == 1 ? agg.getName() : agg.getName() + "_" + count);
    }
    return names;
  }

  /**
   * Returns the names under which the right-hand columns of a zip are appended. A name already
   * taken gets the first free suffix {@code _1}, {@code _2} and so on.
   */
  protected static List<String> zipColumnNames(List<String> left, List<String> right) {
    Set<String> taken = new HashSet<>(left);
    List<String> names = new ArrayList<>(right.size());
    for (String name : right) {
      String candidate = name;
      int suffix = 1;
      while (taken.contains(candidate)) {
        candidate = name + "_" + suffix++;
      }
      taken.add(candidate);
      names.add(candidate);
    }
    return names;
  }

  /** Checks that {@code other} can be zipped with the wrapped block. */
  protected void checkZippable(Block other) {
    if (other.getType() != blockType()) {
      throw new ShapeMismatchException(
          String.format(
              "Cannot zip a %s block with a %s block",
              blockType().getName(), other.getType().getName()));
    }
    if (other.getRowCount() != numRows()) {
      throw new ShapeMismatchException(
          String.format(
              "Cannot zip blocks with different number of rows: %d != %d",
              numRows(), other.getRowCount()));
    }
  }

  /**
   * Checks a row range.
   *
   * @throws IndexOutOfBoundsException if the range is not within the block
   */
  protected void checkRange(int start, int end) {
    if (start < 0 || end > numRows() || start > end) {
      throw new IndexOutOfBoundsException(
          "Region [" + start + ", " + end + ") out of range [0, " + numRows() + ")");
    }
  }

  /**
   * Checks row positions.
   *
   * @throws IndexOutOfBoundsException if a position is not within the block
   */
  protected void checkIndices(List<Integer> indices) {
    for (int index : indices) {
      if (index < 0 || index >= numRows()) {
        throw new IndexOutOfBoundsException(
            "Position " + index + " out of range [0, " + numRows() + ")");
      }
    }
  }

  private static List<Integer> allIndices(int count) {
    return IntStream.range(0, count).boxed().collect(Collectors.toCollection(ArrayList::new));
  }

  private static int lowerBound(
      List<List<Object>> keys, int from, List<Object> boundary, Comparator<List<Object>> cmp) {
    int low = from;
    int high = keys.size();
    while (low < high) {
      int mid = (low + high) >>> 1;
      if (cmp.compare(keys.get(mid), boundary) < 0) {
        low = mid + 1;
      } else {
        high = mid;
      }
    }
    return low;
  }

  private static List<Block> nonEmpty(List<Block> blocks, SortKey sortKey) {
    List<Block> nonEmpty = new ArrayList<>();
    for (Block block : blocks) {
      if (block.getRowCount() > 0) {
        sortKey.validateSchema(block.getColumnNames());
        nonEmpty.add(block);
      }
    }
    return nonEmpty;
  }

  private static TableBlockAccessor tableAccessor(Block block) {
    return (TableBlockAccessor) BlockAccessors.forBlock(block);
  }

  /** Merges the native rows of sorted blocks, remembering where each row came from. */
  private static Iterator<RowRef> mergedRows(List<Block> blocks, SortKey sortKey) {
    List<Iterator<RowRef>> iterators = new ArrayList<>(blocks.size());
    for (int i = 0; i < blocks.size(); i++) {
      int block = i;
      iterators.add(
          Streams.mapWithIndex(
                  Streams.stream(BlockAccessors.forBlock(blocks.get(i)).iterRows(false)),
                  (row, index) -> new RowRef(block, (int) index, row))
              .iterator());
    }
    Comparator<RowRef> order = Comparator.comparing(RowRef::values, sortKey.rowComparator());
    return Iterators.mergeSorted(iterators, order);
  }

  /**
   * Prepends the key columns of {@code groupRows}, one row per group, to the aggregate columns. Key
   * columns are taken from the group rows, so they keep the source column types.
   */
  private static Block withKeyColumns(Block groupRows, SortKey sortKey, Block aggregates) {
    TableBlockAccessor groupAccessor = tableAccessor(groupRows);
    Block keys = groupAccessor.select(sortKey.getColumns());
    if (aggregates.getColumnNames().isEmpty()) {
      groupAccessor.discard(groupRows);
      return keys;
    }
    Block result = tableAccessor(keys).zip(aggregates);
    groupAccessor.discard(groupRows);
    groupAccessor.discard(keys);
    groupAccessor.discard(aggregates);
    return result;
  }

  private static Map<String, Object> aggregateRow(List<String> aggNames, List<Object> values) {
    Map<String, Object> row = new LinkedHashMap<>();
    for (int i = 0; i < aggNames.size(); i++) {
      row.put(aggNames.get(i), values.get(i));
    }
    return row;
  }

  @SuppressWarnings("unchecked")
  private static <A> Object accumulate(
      AggregateFunction<A> agg, Object accumulator, Map<String, Object> row) {
    return agg.accumulateRow((A) accumulator, row);
  }

  @SuppressWarnings("unchecked")
  private static <A> Object merge(AggregateFunction<A> agg, Object acc1, Object acc2) {
    return agg.merge((A) acc1, (A) acc2);
  }

  @SuppressWarnings("unchecked")
  private static <A> Object finish(AggregateFunction<A> agg, Object accumulator) {
    return agg.finish((A) accumulator);
  }

  private static <A> Object initAndFinish(AggregateFunction<A> agg) {
    return agg.finish(agg.init(List.of()));
  }
}

/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataset.block;

import static org.opensearch.dataset.common.utils.StringUtils.truncatedRepr;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.log4j.Log4j2;
import org.opensearch.dataset.block.aggregate.AggregateFunction;
import org.opensearch.dataset.block.arrow.ArrowBlockAccessor;
import org.opensearch.dataset.block.arrow.ArrowBlockBuilder;
import org.opensearch.dataset.block.arrow.ArrowConversions;
import org.opensearch.dataset.block.frame.DataFrameBlockAccessor;
import org.opensearch.dataset.block.frame.DataFrameBlockBuilder;
import org.opensearch.dataset.block.sort.SortKey;
import org.opensearch.dataset.common.utils.LogOnce;
import org.opensearch.dataset.exception.ArrowConversionException;
import org.opensearch.dataset.exception.BlockTypeMismatchException;
import org.opensearch.dataset.exception.InvalidFormatException;

/**
 * Entry points that work on any block: accessor lookup, conversion of user batches into blocks,
 * and the merge steps of distributed sort and aggregation.
 */
@Log4j2
public final class BlockAccessors {

  static final String FALLBACK_WARNING_KEY = "fallback_to_dataframe_block_warning";

  private BlockAccessors() {}

  /**
   * Returns the accessor of a block value. Besides blocks, accepts the Arrow stream bytes written
   * by {@link ArrowBlockAccessor#toBytes()}.
   *
   * @throws InvalidFormatException if the value is a bare list, or malformed bytes
   * @throws BlockTypeMismatchException if the value is not a block
   */
  public static BlockAccessor forBlock(Object block) {
    if (block instanceof Block typed) {
      return forBlock(typed);
    }
    if (block instanceof byte[] bytes) {
      return ArrowBlockAccessor.fromBytes(bytes);
    }
    if (block instanceof List) {
      throw new InvalidFormatException(
          String.format(
              "Error validating %s: standalone Java objects are not allowed as blocks. To use"
                  + " Java objects in a dataset, wrap them in a map of column name to values,"
                  + " e.g. return {\"item\": batch} instead of just batch.",
              truncatedRepr(block)));
    }
    throw notABlock(block);
  }

  /** Returns the accessor of a block. */
  public static BlockAccessor forBlock(Block block) {
    if (block == null) {
      throw notABlock(null);
    }
    return switch (block.getType()) {
      case ARROW -> new ArrowBlockAccessor((ArrowTable) block);
      case DATAFRAME -> new DataFrameBlockAccessor((DataFrame) block);
    };
  }

  /** Returns an empty builder of the given representation. */
  public static BlockBuilder builderFor(BlockType type) {
    return switch (type) {
      case ARROW -> new ArrowBlockBuilder();
      case DATAFRAME -> new DataFrameBlockBuilder();
    };
  }

  /** Returns a block of the given representation without columns or rows. */
  public static Block emptyBlock(BlockType type) {
    return switch (type) {
      case ARROW -> ArrowBlockAccessor.emptyTable();
      case DATAFRAME -> DataFrame.empty(List.of());
    };
  }

  /** Same as {@link #batchToBlock(Object, BlockType)} without a preferred representation. */
  public static Block batchToBlock(Object batch) {
    return batchToBlock(batch, null);
  }

  /**
   * Converts a user batch into a block. A column map becomes an Arrow table when possible. If
   * Arrow cannot store the columns, the batch becomes a data frame unless Arrow was requested.
   *
   * @param batch a block, or a map of column name to array or list
   * @param preferred representation to produce, or null to let the conversion choose
   * @throws InvalidFormatException if the batch is a bare array or a map with non-string keys
   * @throws ArrowConversionException if Arrow was requested and cannot store the columns
   * @throws org.opensearch.dataset.exception.ShapeMismatchException if the columns differ in
   *     length
   * @throws BlockTypeMismatchException if the batch is of any other type
   */
  public static Block batchToBlock(Object batch, BlockType preferred) {
    if (batch instanceof Block block) {
      return block;
    }
    if (batch != null && batch.getClass().isArray()) {
      throw new InvalidFormatException(
          String.format(
              "Error validating %s: standalone arrays are not allowed as batches. Return a map"
                  + " of column name to array, e.g. {\"data\": array} instead of array.",
              truncatedRepr(batch)));
    }
    if (!(batch instanceof Map<?, ?> map)) {
      throw notABlock(batch);
    }
    Map<String, ?> columns = columnMap(map);
    if (preferred == BlockType.DATAFRAME) {
      return DataFrame.of(columns);
    }
    ConversionResult<ArrowTable> arrow = ArrowConversions.tableFromColumns(columns);
    if (arrow.isSuccess()) {
      return arrow.getValue();
    }
    if (preferred == BlockType.ARROW) {
      throw arrow.getFailure();
    }
    if (LogOnce.shouldLog(FALLBACK_WARNING_KEY)) {
      log.warn(
          "Failed to convert batch to Arrow due to: {}; falling back to a data frame block",
          arrow.getFailure().getMessage());
    }
    return DataFrame.of(columns);
  }

  /**
   * Converts a column map into an Arrow table.
   *
   * @throws ArrowConversionException if Arrow cannot store the columns
   */
  public static ArrowTable batchToArrowBlock(Map<String, ?> batch) {
    return (ArrowTable) batchToBlock(batch, BlockType.ARROW);
  }

  /** Converts a column map into a data frame. */
  public static DataFrame batchToDataFrameBlock(Map<String, ?> batch) {
    return (DataFrame) batchToBlock(batch, BlockType.DATAFRAME);
  }

  /** @see TableBlockAccessor#mergeSortedBlocks(List, SortKey) */
  public static BlockAndMetadata mergeSortedBlocks(List<Block> blocks, SortKey sortKey) {
    return TableBlockAccessor.mergeSortedBlocks(blocks, sortKey);
  }

  /** @see TableBlockAccessor#aggregateCombinedBlocks(List, SortKey, List) */
  public static BlockAndMetadata aggregateCombinedBlocks(
      List<Block> blocks, SortKey sortKey, List<AggregateFunction<?>> aggs) {
    return TableBlockAccessor.aggregateCombinedBlocks(blocks, sortKey, aggs);
  }

  private static Map<String, ?> columnMap(Map<?, ?> batch) {
    Map<String, Object> columns = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : batch.entrySet()) {
      if (!(entry.getKey() instanceof String name)) {
        throw new InvalidFormatException(
            String.format(
                "Batch column names must be strings, got %s in batch %s",
                truncatedRepr(entry.getKey()), truncatedRepr(batch)));
      }
      columns.put(name, entry.getValue());
    }
    return columns;
  }

  private static BlockTypeMismatchException notABlock(Object value) {
    return new BlockTypeMismatchException(
        String.format(
            "Not a block type: %s (%s)",
            truncatedRepr(value), value == null ? "null" : value.getClass().getName()));
  }
}

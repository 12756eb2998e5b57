/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataset.block;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.List;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.opensearch.dataset.block.stats.ExecutionStats;

/**
 * Describes a block without requiring it to be materialized. A null row count, size or schema
 * means the value is not known yet; schedulers branch on that, so unknown is never replaced by a
 * default.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class BlockMetadata {

  /** Number of rows, or null if unknown. */
  private final Long numRows;

  /** Approximate size in bytes, or null if unknown. */
  private final Long sizeBytes;

  /** Column description, or null if unknown. */
  private final BlockSchema schema;

  /** Paths of the files the block was read from. Never null. */
  private final List<String> inputFiles;

  /** Stats of the work that produced the block, or null. */
  private final ExecutionStats execStats;

  @Builder(toBuilder = true)
  private BlockMetadata(
      Long numRows,
      Long sizeBytes,
      BlockSchema schema,
      List<String> inputFiles,
      ExecutionStats execStats) {
    Preconditions.checkArgument(
        numRows == null || numRows >= 0, "numRows must be non-negative: %s", numRows);
    Preconditions.checkArgument(
        sizeBytes == null || sizeBytes >= 0, "sizeBytes must be non-negative: %s", sizeBytes);
    this.numRows = numRows;
    this.sizeBytes = sizeBytes;
    this.schema = schema;
    this.inputFiles = inputFiles == null ? ImmutableList.of() : ImmutableList.copyOf(inputFiles);
    this.execStats = execStats;
  }

  /** Returns a copy of this metadata carrying the given stats. */
  public BlockMetadata withExecStats(ExecutionStats execStats) {
    return toBuilder().execStats(execStats).build();
  }

  /** Builder of {@link BlockMetadata}; sizes may be given as any integral number type. */
  public static class BlockMetadataBuilder {

    /**
     * Sets the size from a byte count of any integral number type.
     *
     * @throws IllegalArgumentException if the value is not an integral type or does not fit a long
     */
    public BlockMetadataBuilder sizeBytes(Number sizeBytes) {
      this.sizeBytes = checkSizeBytes(sizeBytes);
      return this;
    }
  }

  /**
   * Narrows a byte count of any integral number type to a {@code Long}. Floating point and decimal
   * values are rejected rather than rounded.
   */
  private static Long checkSizeBytes(Number sizeBytes) {
    if (sizeBytes == null) {
      return null;
    }
    if (sizeBytes instanceof Long
        || sizeBytes instanceof Integer
        || sizeBytes instanceof Short
        || sizeBytes instanceof Byte) {
      return sizeBytes.longValue();
    }
    if (sizeBytes instanceof BigInteger value) {
      Preconditions.checkArgument(
          value.bitLength() < Long.SIZE, "sizeBytes does not fit a long: %s", value);
      return value.longValue();
    }
    throw new IllegalArgumentException(
        String.format(
            "sizeBytes must be an integer, got %s of type %s",
            sizeBytes, sizeBytes.getClass().getSimpleName()));
  }
}

/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataset.block.arrow;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.DateDayVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.NullVector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.complex.ListVector;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.util.TransferPair;

/** Vector-level helpers shared by the Arrow accessor, builder and serialization code. */
public final class ArrowVectors {

  private ArrowVectors() {}

  /**
   * Reads one value as a plain Java object. Strings are returned as {@link String}, day dates as
   * {@link LocalDate} and lists as {@link ArrayList}; other types use the vector's own object form.
   */
  public static Object getValue(FieldVector vector, int index) {
    if (vector.isNull(index)) {
      return null;
    }
    if (vector instanceof VarCharVector varChars) {
      return new String(varChars.get(index), StandardCharsets.UTF_8);
    }
    if (vector instanceof DateDayVector dates) {
      return LocalDate.ofEpochDay(dates.get(index));
    }
    if (vector instanceof ListVector lists) {
      return new ArrayList<>(lists.getObject(index));
    }
    return vector.getObject(index);
  }

  /**
   * Copies the given rows of {@code source}, in order, into a new root that owns its buffers.
   *
   * @param source root to read
   * @param indices row positions, duplicates allowed
   * @param allocator allocator of the new root
   */
  public static VectorSchemaRoot copyRows(
      VectorSchemaRoot source, List<Integer> indices, BufferAllocator allocator) {
    return copyRows(List.of(source), Collections.nCopies(indices.size(), 0), indices, allocator);
  }

  /**
   * Copies rows of several roots with the same schema into a new root that owns its buffers. Row
   * {@code i} of the result is row {@code rows.get(i)} of {@code sources.get(sourceOf.get(i))}.
   *
   * @param sources roots to read, the first one providing the schema
   * @param sourceOf index into {@code sources} of each copied row
   * @param rows row position of each copied row within its source
   * @param allocator allocator of the new root
   */
  public static VectorSchemaRoot copyRows(
      List<VectorSchemaRoot> sources,
      List<Integer> sourceOf,
      List<Integer> rows,
      BufferAllocator allocator) {
    VectorSchemaRoot target = VectorSchemaRoot.create(sources.get(0).getSchema(), allocator);
    target.allocateNew();
    for (int column = 0; column < target.getFieldVectors().size(); column++) {
      FieldVector to = target.getVector(column);
      if (to instanceof NullVector) {
        continue;
      }
      for (int i = 0; i < rows.size(); i++) {
        to.copyFromSafe(rows.get(i), i, sources.get(sourceOf.get(i)).getVector(column));
      }
    }
    target.setRowCount(rows.size());
    return target;
  }

  /**
   * Appends every row of {@code source} to {@code target}. Both roots must have the same schema.
   */
  public static void appendRows(VectorSchemaRoot target, VectorSchemaRoot source) {
    int base = target.getRowCount();
    int count = source.getRowCount();
    for (int column = 0; column < source.getFieldVectors().size(); column++) {
      FieldVector from = source.getVector(column);
      FieldVector to = target.getVector(column);
      if (from instanceof NullVector) {
        continue;
      }
      for (int i = 0; i < count; i++) {
        to.copyFromSafe(i, base + i, from);
      }
    }
    target.setRowCount(base + count);
  }

  /**
   * Returns a vector holding rows {@code [start, start + length)} of {@code vector} that shares its
   * buffers instead of copying them.
   *
   * @param name name of the returned vector
   */
  public static FieldVector share(
      FieldVector vector, String name, int start, int length, BufferAllocator allocator) {
    TransferPair pair = vector.getTransferPair(name, allocator);
    pair.splitAndTransfer(start, length);
    return (FieldVector) pair.getTo();
  }

  /** Assembles a root from vectors that all hold {@code rowCount} values. */
  public static VectorSchemaRoot rootOf(List<FieldVector> vectors, int rowCount) {
    List<Field> fields = new ArrayList<>(vectors.size());
    for (FieldVector vector : vectors) {
      fields.add(vector.getField());
    }
    return new VectorSchemaRoot(fields, vectors, rowCount);
  }

  /** Returns the number of bytes held by the buffers of all vectors of the root. */
  public static long bufferSize(VectorSchemaRoot root) {
    long total = 0;
    for (FieldVector vector : root.getFieldVectors()) {
      total += vector.getBufferSize();
    }
    return total;
  }
}

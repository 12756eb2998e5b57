/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataset.block.arrow;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.arrow.memory.ReferenceManager;
import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.DecimalVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.types.pojo.Field;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.dataset.block.ArrowTable;
import org.opensearch.dataset.block.BlockAccessors;
import org.opensearch.dataset.block.BlockType;
import org.opensearch.dataset.block.DataFrame;
import org.opensearch.dataset.block.aggregate.AggregateFunction;
import org.opensearch.dataset.block.aggregate.Count;
import org.opensearch.dataset.block.sort.SortKey;
import org.opensearch.dataset.exception.InvalidArgumentException;
import org.opensearch.dataset.exception.InvalidFormatException;
import org.opensearch.dataset.exception.SchemaException;
import org.opensearch.dataset.exception.ShapeMismatchException;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class ArrowBlockAccessorTest {

  private ArrowTable table;
  private ArrowBlockAccessor accessor;

  @BeforeEach
  void setUp() {
    table =
        BlockAccessors.batchToArrowBlock(
            ImmutableMap.of(
                "id", new long[] {0, 1, 2, 3, 4},
                "name", Arrays.asList("a", "b", null, "d", "e")));
    accessor = new ArrowBlockAccessor(table);
  }

  @AfterEach
  void tearDown() {
    table.close();
  }

  @Test
  void should_describe_table() {
    assertEquals(5, accessor.numRows());
    assertEquals(BlockType.ARROW, accessor.blockType());
    assertEquals(List.of("id", "name"), accessor.schema().getNames());
    assertSame(table, accessor.toBlock());
    assertSame(table, BlockAccessors.forBlock(table).toBlock());
  }

  @Test
  void should_iterate_native_and_public_rows() {
    List<Map<String, Object>> rows = Lists.newArrayList(accessor.iterRows(false));
    Map<String, Object> publicRow = accessor.iterRows(true).next();

    assertEquals(5, rows.size());
    assertInstanceOf(ArrowRow.class, rows.get(0));
    assertEquals(ImmutableMap.of("id", 0L, "name", "a"), rows.get(0));
    assertEquals(2L, rows.get(2).get("id"));
    assertEquals(null, rows.get(2).get("name"));
    assertInstanceOf(LinkedHashMap.class, publicRow);
    assertEquals(rows.get(0), publicRow);
    assertEquals(5, Lists.newArrayList(accessor.iterRows(true)).size());
  }

  @Test
  void should_slice_with_and_without_copy() {
    try (ArrowTable shared = accessor.slice(1, 4, false);
        ArrowTable copied = accessor.slice(1, 4, true)) {
      assertEquals(3, shared.getRowCount());
      assertEquals(3, copied.getRowCount());
      assertEquals(rows(shared), rows(copied));
      assertEquals(1L, shared.getValue(0, 0));
      assertEquals("d", copied.getValue(2, 1));
      assertTrue(new ArrowBlockAccessor(copied).sizeBytes() <= accessor.sizeBytes());
      assertTrue(new ArrowBlockAccessor(shared).sizeBytes() <= accessor.sizeBytes());
    }
    assertThrows(IndexOutOfBoundsException.class, () -> accessor.slice(3, 6, true));
  }

  @Test
  void should_keep_copied_slice_valid_after_parent_is_closed() {
    ArrowTable parent =
        BlockAccessors.batchToArrowBlock(ImmutableMap.of("x", new int[] {7, 8, 9}));
    try (ArrowTable copied = new ArrowBlockAccessor(parent).slice(1, 3, true)) {
      parent.close();

      assertEquals(8, copied.getValue(0, 0));
      assertEquals(9, copied.getValue(1, 0));
    }
  }

  @Test
  void should_take_rows_in_index_order() {
    try (ArrowTable taken = accessor.take(List.of(2, 0, 1))) {
      assertArrayEquals(new long[] {2, 0, 1}, (long[]) new ArrowBlockAccessor(taken).toNumpy("id"));
    }
    assertThrows(IndexOutOfBoundsException.class, () -> accessor.take(List.of(5)));
  }

  @Test
  void should_select_columns_in_given_order() {
    try (ArrowTable selected = accessor.select(List.of("name", "id"))) {
      assertEquals(List.of("name", "id"), selected.getColumnNames());
      assertEquals(5, selected.getRowCount());
      assertEquals("e", selected.getValue(4, 0));
    }
    assertThrows(SchemaException.class, () -> accessor.select(List.of("missing")));
  }

  @Test
  void should_not_hold_buffers_when_selecting_unknown_column() {
    ReferenceManager ids = table.getVector("id").getDataBuffer().getReferenceManager();
    int refCount = ids.getRefCount();

    assertThrows(SchemaException.class, () -> accessor.select(List.of("id", "name", "missing")));

    assertEquals(refCount, ids.getRefCount());
    assertEquals(3L, table.getValue(3, 0));
  }

  @Test
  void should_merge_sorted_tables_keeping_arrow_types() {
    try (ArrowTable first = typedTable(new long[] {1, 3}, "1.50", "3.25");
        ArrowTable second = typedTable(new long[] {2}, "2.00");
        ArrowTable merged =
            (ArrowTable)
                BlockAccessors.mergeSortedBlocks(List.of(first, second), SortKey.of("k"))
                    .block()) {
      assertEquals(first.getSchema().getFields(), merged.getSchema().getFields());
      assertInstanceOf(BigIntVector.class, merged.getVector("missing"));
      assertArrayEquals(
          new Object[] {1L, 2L, 3L}, BlockAccessors.forBlock(merged).toDataFrame().getColumn("k"));
      assertEquals(new BigDecimal("1.50"), merged.getValue(0, 1));
      assertEquals(new BigDecimal("2.00"), merged.getValue(1, 1));
      assertEquals(new BigDecimal("3.25"), merged.getValue(2, 1));
      assertNull(merged.getValue(2, 2));
    }
  }

  @Test
  void should_combine_and_aggregate_keeping_key_types() {
    SortKey key = SortKey.of("d");
    List<AggregateFunction<?>> aggs = List.of(new Count());
    try (ArrowTable source = typedTable(new long[] {1, 2, 3}, "1.50", "1.50", "2.00");
        ArrowTable combined = (ArrowTable) BlockAccessors.forBlock(source).combine(key, aggs);
        ArrowTable aggregated =
            (ArrowTable)
                BlockAccessors.aggregateCombinedBlocks(List.of(combined, combined), key, aggs)
                    .block()) {
      Field decimal = source.getSchema().findField("d");

      assertEquals(List.of("d", "count()"), combined.getColumnNames());
      assertEquals(decimal, combined.getSchema().findField("d"));
      assertEquals(decimal, aggregated.getSchema().findField("d"));
      assertEquals(
          List.of(
              ImmutableMap.of("d", new BigDecimal("1.50"), "count()", 4L),
              ImmutableMap.of("d", new BigDecimal("2.00"), "count()", 2L)),
          rows(aggregated));
    }
  }

  @Test
  void should_shuffle_deterministically_with_seed() {
    try (ArrowTable first = accessor.randomShuffle(42L);
        ArrowTable second = accessor.randomShuffle(42L)) {
      long[] ids = (long[]) new ArrowBlockAccessor(first).toNumpy("id");

      assertArrayEquals(ids, (long[]) new ArrowBlockAccessor(second).toNumpy("id"));
      long[] sorted = ids.clone();
      Arrays.sort(sorted);
      assertArrayEquals(new long[] {0, 1, 2, 3, 4}, sorted);
    }
  }

  @Test
  void should_convert_to_numpy_arrays() {
    Map<String, Object> arrays = accessor.toNumpy();

    assertEquals(List.of("id", "name"), new ArrayList<>(arrays.keySet()));
    assertArrayEquals(new long[] {0, 1, 2, 3, 4}, (long[]) arrays.get("id"));
    assertArrayEquals(new String[] {"a", "b", null, "d", "e"}, (String[]) arrays.get("name"));
    assertArrayEquals(new long[] {0, 1, 2, 3, 4}, (long[]) accessor.toNumpy("id"));
    assertEquals(List.of("name"), new ArrayList<>(accessor.toNumpy(List.of("name")).keySet()));
  }

  @Test
  void should_convert_to_each_batch_format() {
    assertSame(table, accessor.toBatchFormat(null));
    assertSame(table, accessor.toBatchFormat("default"));
    assertSame(table, accessor.toBatchFormat("native"));
    assertSame(table, accessor.toBatchFormat("pyarrow"));
    assertInstanceOf(DataFrame.class, accessor.toBatchFormat("pandas"));
    assertInstanceOf(Map.class, accessor.toBatchFormat("numpy"));
    InvalidArgumentException e =
        assertThrows(InvalidArgumentException.class, () -> accessor.toBatchFormat("csv"));
    assertTrue(e.getMessage().contains("[default, native, pandas, pyarrow, numpy, null]"));
  }

  @Test
  void should_zip_tables_renaming_duplicate_columns() {
    try (ArrowTable other =
            BlockAccessors.batchToArrowBlock(
                ImmutableMap.of(
                    "id", new long[] {5, 6, 7, 8, 9}, "id_1", new long[] {0, 0, 0, 0, 0}));
        ArrowTable zipped = accessor.zip(other)) {
      assertEquals(List.of("id", "name", "id_1", "id_1_1"), zipped.getColumnNames());
      assertEquals(9L, zipped.getValue(4, 2));
      assertEquals("a", zipped.getValue(0, 1));
    }
  }

  @Test
  void should_reject_zip_with_mismatched_shape() {
    try (ArrowTable shorter = accessor.slice(0, 2, true)) {
      assertThrows(ShapeMismatchException.class, () -> accessor.zip(shorter));
    }
    DataFrame frame = accessor.toDataFrame();
    assertThrows(ShapeMismatchException.class, () -> accessor.zip(frame));
  }

  @Test
  void should_round_trip_through_arrow_stream_bytes() {
    byte[] bytes = accessor.toBytes();

    ArrowBlockAccessor restored = (ArrowBlockAccessor) BlockAccessors.forBlock((Object) bytes);
    try (ArrowTable copy = restored.toBlock()) {
      assertEquals(accessor.toDataFrame(), restored.toDataFrame());
      assertEquals(table.getColumnNames(), copy.getColumnNames());
    }
  }

  @Test
  void should_reject_malformed_bytes() {
    assertThrows(
        InvalidFormatException.class, () -> ArrowBlockAccessor.fromBytes(new byte[] {1, 2, 3}));
    assertThrows(InvalidFormatException.class, () -> ArrowBlockAccessor.fromBytes(new byte[0]));
  }

  @Test
  void should_build_tables() {
    ArrowBlockBuilder builder = accessor.builder();
    builder.add(ImmutableMap.of("a", 1));
    builder.add(ImmutableMap.of("b", "x"));
    builder.addBlock(table);

    try (ArrowTable built = builder.build()) {
      assertEquals(7, builder.getNumRows());
      assertEquals(List.of("a", "b", "id", "name"), built.getColumnNames());
      assertEquals(1, built.getValue(0, 0));
      assertEquals(null, built.getValue(1, 0));
      assertEquals("x", built.getValue(1, 1));
      assertEquals(null, built.getValue(0, 2));
      assertEquals(4L, built.getValue(6, 2));
      assertTrue(builder.getEstimatedMemoryUsage() > 0);
    }
  }

  /** Builds a table with an Int64 key, a decimal column and an all-null Int64 column. */
  private static ArrowTable typedTable(long[] keys, String... amounts) {
    BigIntVector k = new BigIntVector("k", ArrowAllocators.root());
    DecimalVector d = new DecimalVector("d", ArrowAllocators.root(), 10, 2);
    BigIntVector missing = new BigIntVector("missing", ArrowAllocators.root());
    k.allocateNew(keys.length);
    d.allocateNew(keys.length);
    missing.allocateNew(keys.length);
    for (int i = 0; i < keys.length; i++) {
      k.set(i, keys[i]);
      d.setSafe(i, new BigDecimal(amounts[i]));
      missing.setNull(i);
    }
    k.setValueCount(keys.length);
    d.setValueCount(keys.length);
    missing.setValueCount(keys.length);
    return ArrowTable.wrap(ArrowVectors.rootOf(List.<FieldVector>of(k, d, missing), keys.length));
  }

  private static List<Map<String, Object>> rows(ArrowTable table) {
    return Lists.newArrayList(new ArrowBlockAccessor(table).iterRows(true));
  }
}

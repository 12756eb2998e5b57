/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataset.block;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.common.collect.ImmutableMap;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.Logger;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Property;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.dataset.block.arrow.ArrowBlockAccessor;
import org.opensearch.dataset.block.frame.DataFrameBlockAccessor;
import org.opensearch.dataset.common.utils.LogOnce;
import org.opensearch.dataset.exception.ArrowConversionException;
import org.opensearch.dataset.exception.BlockTypeMismatchException;
import org.opensearch.dataset.exception.InvalidFormatException;
import org.opensearch.dataset.exception.ShapeMismatchException;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class BlockAccessorsTest {

  private static final Map<String, Object> MIXED =
      ImmutableMap.of("value", Arrays.asList(1, "two", 3.0));

  @Test
  void should_resolve_accessor_for_each_representation() {
    DataFrame frame = DataFrame.of(ImmutableMap.of("x", List.of(1)));
    try (ArrowTable table = BlockAccessors.batchToArrowBlock(ImmutableMap.of("x", List.of(1)))) {
      assertInstanceOf(ArrowBlockAccessor.class, BlockAccessors.forBlock(table));
      assertInstanceOf(ArrowBlockAccessor.class, BlockAccessors.forBlock((Object) table));
      assertInstanceOf(DataFrameBlockAccessor.class, BlockAccessors.forBlock(frame));
      assertSame(frame, BlockAccessors.forBlock(frame).toBlock());
    }
  }

  @Test
  void should_reject_bare_lists_with_wrapping_hint() {
    InvalidFormatException e =
        assertThrows(
            InvalidFormatException.class, () -> BlockAccessors.forBlock((Object) List.of(1, 2)));
    assertTrue(e.getMessage().contains("[1, 2]"));
    assertTrue(e.getMessage().contains("{\"item\": batch}"));
  }

  @Test
  void should_reject_values_that_are_not_blocks() {
    BlockTypeMismatchException e =
        assertThrows(BlockTypeMismatchException.class, () -> BlockAccessors.forBlock("text"));
    assertEquals("Not a block type: text (java.lang.String)", e.getMessage());
    assertThrows(BlockTypeMismatchException.class, () -> BlockAccessors.forBlock((Object) null));
    assertThrows(BlockTypeMismatchException.class, () -> BlockAccessors.forBlock((Block) null));
  }

  @Test
  void should_convert_column_map_to_arrow_by_default() {
    Block block = BlockAccessors.batchToBlock(ImmutableMap.of("x", List.of(1, 2, 3)));

    assertInstanceOf(ArrowTable.class, block);
    assertEquals(3, block.getRowCount());
    ((ArrowTable) block).close();
  }

  @Test
  void should_convert_column_map_to_data_frame_when_requested() {
    Block block =
        BlockAccessors.batchToBlock(ImmutableMap.of("x", List.of(1, 2, 3)), BlockType.DATAFRAME);

    assertInstanceOf(DataFrame.class, block);
    assertArrayEquals(new Object[] {1, 2, 3}, ((DataFrame) block).getColumn("x"));
  }

  @Test
  void should_fall_back_to_data_frame_and_warn_only_once() {
    CapturingAppender appender = new CapturingAppender();
    Logger logger = (Logger) LogManager.getLogger(BlockAccessors.class);
    appender.start();
    logger.addAppender(appender);
    try {
      Block block = BlockAccessors.batchToBlock(MIXED);
      Block outOfRange = BlockAccessors.batchToBlock(ImmutableMap.of("d", List.of(LocalDate.MAX)));

      assertInstanceOf(DataFrame.class, block);
      assertArrayEquals(new Object[] {1, "two", 3.0}, ((DataFrame) block).getColumn("value"));
      assertInstanceOf(DataFrame.class, outOfRange);
      assertArrayEquals(new Object[] {LocalDate.MAX}, ((DataFrame) outOfRange).getColumn("d"));

      List<LogEvent> warnings =
          appender.events.stream()
              .filter(event -> event.getLevel() == Level.WARN)
              .collect(Collectors.toList());
      assertEquals(1, warnings.size());
      String message = warnings.get(0).getMessage().getFormattedMessage();
      assertTrue(message.startsWith("Failed to convert batch to Arrow due to: "));
      assertTrue(message.endsWith("falling back to a data frame block"));
      assertFalse(LogOnce.shouldLog(BlockAccessors.FALLBACK_WARNING_KEY));
    } finally {
      logger.removeAppender(appender);
      appender.stop();
    }
  }

  @Test
  void should_propagate_conversion_failure_when_arrow_requested() {
    ArrowConversionException e =
        assertThrows(
            ArrowConversionException.class,
            () -> BlockAccessors.batchToBlock(MIXED, BlockType.ARROW));
    assertTrue(e.getMessage().contains("value"));
    assertThrows(ArrowConversionException.class, () -> BlockAccessors.batchToArrowBlock(MIXED));
  }

  @Test
  void should_reject_bare_arrays() {
    InvalidFormatException e =
        assertThrows(
            InvalidFormatException.class, () -> BlockAccessors.batchToBlock(new int[] {1, 2}));
    assertTrue(e.getMessage().contains("{\"data\": array}"));
    assertThrows(
        InvalidFormatException.class, () -> BlockAccessors.batchToBlock(new Object[] {"a"}));
  }

  @Test
  void should_reject_non_string_column_names() {
    Map<Object, Object> batch = new HashMap<>();
    batch.put(1, List.of(1));

    assertThrows(InvalidFormatException.class, () -> BlockAccessors.batchToBlock(batch));
  }

  @Test
  void should_reject_columns_of_unequal_length_in_any_representation() {
    Map<String, Object> batch = ImmutableMap.of("a", List.of(1, 2), "b", List.of(1));

    assertThrows(ShapeMismatchException.class, () -> BlockAccessors.batchToBlock(batch));
    assertThrows(
        ShapeMismatchException.class,
        () -> BlockAccessors.batchToBlock(batch, BlockType.DATAFRAME));
  }

  @Test
  void should_pass_blocks_through_unchanged() {
    DataFrame frame = DataFrame.of(ImmutableMap.of("x", List.of(1)));

    assertSame(frame, BlockAccessors.batchToBlock(frame, BlockType.ARROW));
    assertThrows(BlockTypeMismatchException.class, () -> BlockAccessors.batchToBlock(42));
  }

  @Test
  void should_convert_two_column_block_to_numpy_map_and_single_column_to_array() {
    DataFrame frame =
        DataFrame.of(ImmutableMap.of("a", List.of(1L, 2L), "b", List.of(true, false)));
    BlockAccessor accessor = BlockAccessors.forBlock(frame);

    Map<?, ?> arrays = (Map<?, ?>) accessor.toBatchFormat("numpy");

    assertEquals(List.of("a", "b"), List.copyOf(arrays.keySet()));
    assertArrayEquals(new boolean[] {true, false}, (boolean[]) arrays.get("b"));
    assertArrayEquals(new long[] {1, 2}, (long[]) accessor.toNumpy("a"));
  }

  /** Keeps every event logged through the logger it is attached to. */
  private static class CapturingAppender extends AbstractAppender {
    private final List<LogEvent> events = new CopyOnWriteArrayList<>();

    CapturingAppender() {
      super("capturing", null, null, true, Property.EMPTY_ARRAY);
    }

    @Override
    public void append(LogEvent event) {
      events.add(event.toImmutable());
    }
  }
}

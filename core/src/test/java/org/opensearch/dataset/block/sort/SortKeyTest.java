/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataset.block.sort;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.opensearch.dataset.exception.InvalidArgumentException;
import org.opensearch.dataset.exception.SchemaException;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class SortKeyTest {

  @Test
  void should_sort_ascending_with_nulls_last() {
    List<List<Object>> keys = new ArrayList<>();
    keys.add(Arrays.asList(3L));
    keys.add(Arrays.asList((Object) null));
    keys.add(Arrays.asList(1L));

    keys.sort(SortKey.of("a").keyComparator());

    assertEquals(
        Arrays.asList(Arrays.asList(1L), Arrays.asList(3L), Arrays.asList((Object) null)), keys);
  }

  @Test
  void should_sort_descending_with_nulls_last() {
    List<List<Object>> keys = new ArrayList<>();
    keys.add(Arrays.asList((Object) null));
    keys.add(Arrays.asList(1L));
    keys.add(Arrays.asList(3L));

    keys.sort(SortKey.of(List.of("a"), List.of(true)).keyComparator());

    assertEquals(
        Arrays.asList(Arrays.asList(3L), Arrays.asList(1L), Arrays.asList((Object) null)), keys);
  }

  @Test
  void should_break_ties_on_later_columns() {
    SortKey key = SortKey.of(List.of("a", "b"), List.of(false, true));
    Map<String, Object> row1 = row("x", 1);
    Map<String, Object> row2 = row("x", 2);
    Map<String, Object> row3 = row("w", 0);

    List<Map<String, Object>> rows = new ArrayList<>(List.of(row1, row2, row3));
    rows.sort(key.rowComparator());

    assertEquals(List.of(row3, row2, row1), rows);
  }

  @Test
  void should_compare_numbers_across_box_types() {
    assertEquals(0, SortKey.compareValues(2, 2L));
    assertTrue(SortKey.compareValues(1, 1.5) < 0);
    assertTrue(SortKey.compareValues(2.5f, 2L) > 0);
  }

  @Test
  void should_fall_back_to_string_order_for_unrelated_types() {
    assertTrue(SortKey.compareValues("10", 9) < 0);
    assertTrue(SortKey.compareValues(List.of(1), List.of(2)) < 0);
  }

  @Test
  void should_validate_schema() {
    SortKey key = SortKey.of("a", "missing");

    SchemaException e =
        assertThrows(SchemaException.class, () -> key.validateSchema(List.of("a", "b")));
    assertTrue(e.getMessage().contains("missing"));
  }

  @Test
  void should_reject_direction_count_mismatch() {
    assertThrows(
        InvalidArgumentException.class, () -> SortKey.of(List.of("a", "b"), List.of(true)));
  }

  @Test
  void should_group_everything_under_empty_key() {
    assertTrue(SortKey.none().isEmpty());
    assertEquals(List.of(), SortKey.none().extractKey(row("x", 1)));
  }

  private static Map<String, Object> row(Object a, Object b) {
    Map<String, Object> row = new HashMap<>();
    row.put("a", a);
    row.put("b", b);
    return row;
  }
}

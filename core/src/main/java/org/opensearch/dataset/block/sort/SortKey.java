/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataset.block.sort;

import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.opensearch.dataset.exception.InvalidArgumentException;
import org.opensearch.dataset.exception.SchemaException;

/**
 * Orders rows by one or more columns. Each column sorts ascending or descending; nulls sort last in
 * both directions. A key without columns puts every row in a single group.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class SortKey {

  private static final SortKey NONE = new SortKey(ImmutableList.of(), ImmutableList.of());

  private final List<String> columns;

  private final List<Boolean> descending;

  private SortKey(List<String> columns, List<Boolean> descending) {
    this.columns = columns;
    this.descending = descending;
  }

  /** Returns the key of a global aggregation. */
  public static SortKey none() {
    return NONE;
  }

  /** Sorts ascending by the given columns. */
  public static SortKey of(String... columns) {
    return of(ImmutableList.copyOf(columns), Collections.nCopies(columns.length, false));
  }

  /**
   * Sorts by the given columns in the given directions.
   *
   * @throws InvalidArgumentException if there is not exactly one direction per column
   */
  public static SortKey of(List<String> columns, List<Boolean> descending) {
    if (columns.size() != descending.size()) {
      throw new InvalidArgumentException(
          String.format(
              "Got %d sort directions for %d sort columns %s",
              descending.size(), columns.size(), columns));
    }
    return new SortKey(ImmutableList.copyOf(columns), ImmutableList.copyOf(descending));
  }

  public boolean isEmpty() {
    return columns.isEmpty();
  }

  /**
   * Checks that every key column exists.
   *
   * @throws SchemaException naming the first missing column
   */
  public void validateSchema(List<String> columnNames) {
    for (String column : columns) {
      if (!columnNames.contains(column)) {
        throw new SchemaException(
            String.format(
                "The sort column %s does not exist, available columns are %s",
                column, columnNames));
      }
    }
  }

  /** Returns the key column values of a row, in key order. */
  public List<Object> extractKey(Map<String, Object> row) {
    List<Object> key = new ArrayList<>(columns.size());
    for (String column : columns) {
      key.add(row.get(column));
    }
    return key;
  }

  /** Compares keys produced by {@link #extractKey(Map)}. */
  public Comparator<List<Object>> keyComparator() {
    return (key1, key2) -> {
      for (int i = 0; i < columns.size(); i++) {
        Object v1 = key1.get(i);
        Object v2 = key2.get(i);
        if (v1 == null && v2 == null) {
          continue;
        }
        if (v1 == null) {
          return 1;
        }
        if (v2 == null) {
          return -1;
        }
        int cmp = compareValues(v1, v2);
        if (cmp != 0) {
          return descending.get(i) ? -cmp : cmp;
        }
      }
      return 0;
    };
  }

  /** Compares rows by their keys. */
  public Comparator<Map<String, Object>> rowComparator() {
    return Comparator.comparing(this::extractKey, keyComparator());
  }

  /**
   * Compares two non-null values. Numbers compare by numeric value whatever their box type, other
   * {@link Comparable} values by their natural order, and anything else by string form.
   */
  @SuppressWarnings("unchecked")
  public static int compareValues(Object v1, Object v2) {
    if (v1 instanceof Number n1 && v2 instanceof Number n2) {
      return compareNumbers(n1, n2);
    }
    if (v1 instanceof Comparable && v2 instanceof Comparable) {
      try {
        return ((Comparable<Object>) v1).compareTo(v2);
      } catch (ClassCastException e) {
        return v1.toString().compareTo(v2.toString());
      }
    }
    return v1.toString().compareTo(v2.toString());
  }

  private static int compareNumbers(Number n1, Number n2) {
    if (isIntegral(n1) && isIntegral(n2)) {
      return Long.compare(n1.longValue(), n2.longValue());
    }
    if (n1 instanceof BigDecimal || n2 instanceof BigDecimal || n1 instanceof BigInteger
        || n2 instanceof BigInteger) {
      return new BigDecimal(n1.toString()).compareTo(new BigDecimal(n2.toString()));
    }
    return Double.compare(n1.doubleValue(), n2.doubleValue());
  }

  private static boolean isIntegral(Number n) {
    return n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte;
  }
}

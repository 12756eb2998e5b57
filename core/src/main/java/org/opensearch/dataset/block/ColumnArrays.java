/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataset.block;

import static org.opensearch.dataset.common.utils.StringUtils.truncatedRepr;

import java.lang.reflect.Array;
import java.util.Collection;
import java.util.List;
import org.opensearch.dataset.exception.InvalidFormatException;

/**
 * Conversions between the one-dimensional columns accepted in user batches (Java arrays and lists)
 * and the object columns stored in blocks.
 */
public final class ColumnArrays {

  private ColumnArrays() {}

  /**
   * Copies a batch column into a fresh object array, boxing primitives.
   *
   * @param name column name, for error messages
   * @param column a Java array or a collection
   * @return boxed values in column order
   * @throws InvalidFormatException if the value is not one-dimensional column data
   */
  public static Object[] toObjectArray(String name, Object column) {
    if (column instanceof Collection<?> values) {
      return values.toArray();
    }
    if (column == null || !column.getClass().isArray()) {
      throw new InvalidFormatException(
          String.format(
              "Column %s must be a one-dimensional array or list, got: %s",
              name, truncatedRepr(column)));
    }
    int length = Array.getLength(column);
    Object[] values = new Object[length];
    for (int i = 0; i < length; i++) {
      values[i] = Array.get(column, i);
    }
    return values;
  }

  /**
   * Packs column values into the narrowest array type that holds them all: a primitive array for a
   * homogeneous null-free numeric or boolean column, a {@code String[]} for strings, an {@code
   * Object[]} otherwise.
   */
  public static Object toTypedArray(List<?> values) {
    Class<?> common = commonClass(values);
    int size = values.size();
    if (common == Long.class) {
      long[] array = new long[size];
      for (int i = 0; i < size; i++) {
        array[i] = (Long) values.get(i);
      }
      return array;
    } else if (common == Integer.class) {
      int[] array = new int[size];
      for (int i = 0; i < size; i++) {
        array[i] = (Integer) values.get(i);
      }
      return array;
    } else if (common == Double.class) {
      double[] array = new double[size];
      for (int i = 0; i < size; i++) {
        array[i] = (Double) values.get(i);
      }
      return array;
    } else if (common == Boolean.class) {
      boolean[] array = new boolean[size];
      for (int i = 0; i < size; i++) {
        array[i] = (Boolean) values.get(i);
      }
      return array;
    } else if (common == String.class) {
      return values.toArray(new String[0]);
    }
    return values.toArray();
  }

  /**
   * Returns the class shared by every value, or null if the values are empty, contain nulls (other
   * than for strings) or differ in class.
   */
  private static Class<?> commonClass(List<?> values) {
    Class<?> common = null;
    boolean hasNull = false;
    for (Object value : values) {
      if (value == null) {
        hasNull = true;
        continue;
      }
      if (common == null) {
        common = value.getClass();
      } else if (common != value.getClass()) {
        return null;
      }
    }
    if (hasNull && common != String.class) {
      return null;
    }
    return common;
  }
}

/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataset.common.utils;

import java.util.Arrays;

public final class StringUtils {

  /** Longest rendering returned by {@link #truncatedRepr(Object)}, ellipsis included. */
  public static final int MAX_REPR_LENGTH = 200;

  private StringUtils() {}

  /**
   * Renders a value for an error message. Arrays are rendered element by element, and the result is
   * cut to {@link #MAX_REPR_LENGTH} characters.
   *
   * @param value any value, possibly null or an array
   * @return readable, bounded rendering
   */
  public static String truncatedRepr(Object value) {
    return org.apache.commons.lang3.StringUtils.abbreviate(repr(value), MAX_REPR_LENGTH);
  }

  private static String repr(Object value) {
    if (value == null) {
      return "null";
    }
    if (!value.getClass().isArray()) {
      return String.valueOf(value);
    }
    if (value instanceof Object[] array) {
      return Arrays.deepToString(array);
    } else if (value instanceof long[] array) {
      return Arrays.toString(array);
    } else if (value instanceof int[] array) {
      return Arrays.toString(array);
    } else if (value instanceof short[] array) {
      return Arrays.toString(array);
    } else if (value instanceof byte[] array) {
      return Arrays.toString(array);
    } else if (value instanceof double[] array) {
      return Arrays.toString(array);
    } else if (value instanceof float[] array) {
      return Arrays.toString(array);
    } else if (value instanceof boolean[] array) {
      return Arrays.toString(array);
    } else {
      return Arrays.toString((char[]) value);
    }
  }
}

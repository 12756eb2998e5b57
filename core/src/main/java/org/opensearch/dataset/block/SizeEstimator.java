/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataset.block;

import java.util.Collection;
import java.util.Map;

/**
 * Approximates the heap footprint of the Java values held by data frames and block builders. The
 * size of a subset of values never exceeds the size of the whole set.
 */
public final class SizeEstimator {

  /** Reference slot plus object header of a boxed scalar. */
  static final long SCALAR_BYTES = 16L;

  static final long STRING_HEADER_BYTES = 40L;

  static final long ARRAY_HEADER_BYTES = 16L;

  private SizeEstimator() {}

  /** Returns the approximate number of bytes retained by the value. */
  public static long estimate(Object value) {
    if (value == null) {
      return 8L;
    }
    if (value instanceof String string) {
      return STRING_HEADER_BYTES + string.length();
    }
    if (value instanceof byte[] bytes) {
      return ARRAY_HEADER_BYTES + bytes.length;
    }
    if (value instanceof double[] doubles) {
      return ARRAY_HEADER_BYTES + 8L * doubles.length;
    }
    if (value instanceof Collection<?> elements) {
      long total = ARRAY_HEADER_BYTES;
      for (Object element : elements) {
        total += estimate(element);
      }
      return total;
    }
    if (value instanceof Map<?, ?> map) {
      long total = ARRAY_HEADER_BYTES;
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        total += estimate(entry.getKey()) + estimate(entry.getValue());
      }
      return total;
    }
    return SCALAR_BYTES;
  }

  /** Returns the sum of {@link #estimate(Object)} over the given range of values. */
  public static long estimate(Object[] values, int offset, int length) {
    long total = 0;
    for (int i = offset; i < offset + length; i++) {
      total += estimate(values[i]);
    }
    return total;
  }
}

/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataset.block.aggregate;

import java.util.Map;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Aggregate over the values of one column. Null values are skipped. */
@RequiredArgsConstructor
public abstract class ColumnAggregateFunction<A> implements AggregateFunction<A> {

  @Getter private final String column;

  /** Returns the name of the function, for example {@code sum}. */
  protected abstract String functionName();

  /** Folds one non-null value into the accumulator. */
  protected abstract A accumulate(A accumulator, Object value);

  @Override
  public String getName() {
    return functionName() + "(" + column + ")";
  }

  @Override
  public A accumulateRow(A accumulator, Map<String, Object> row) {
    Object value = row.get(column);
    return value == null ? accumulator : accumulate(accumulator, value);
  }

  static Number add(Number n1, Number n2) {
    if (isIntegral(n1) && isIntegral(n2)) {
      return n1.longValue() + n2.longValue();
    }
    return n1.doubleValue() + n2.doubleValue();
  }

  private static boolean isIntegral(Number n) {
    return n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte;
  }
}

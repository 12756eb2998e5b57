/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataset.block.aggregate;

import java.util.List;

/** Sums a numeric column. Integral values sum as longs, anything else as doubles. */
public class Sum extends ColumnAggregateFunction<Number> {

  public Sum(String column) {
    super(column);
  }

  @Override
  protected String functionName() {
    return "sum";
  }

  @Override
  public Number init(List<Object> key) {
    return 0L;
  }

  @Override
  protected Number accumulate(Number accumulator, Object value) {
    return add(accumulator, (Number) value);
  }

  @Override
  public Number merge(Number accumulator1, Number accumulator2) {
    return add(accumulator1, accumulator2);
  }

  @Override
  public Object finish(Number accumulator) {
    return accumulator;
  }
}

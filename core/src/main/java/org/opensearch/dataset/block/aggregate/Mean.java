/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataset.block.aggregate;

import java.util.Arrays;
import java.util.List;

/**
 * Arithmetic mean of a numeric column. The accumulator is the list {@code [sum, count]}, which
 * Arrow blocks store as a list of doubles.
 */
public class Mean extends ColumnAggregateFunction<List<Double>> {

  public Mean(String column) {
    super(column);
  }

  @Override
  protected String functionName() {
    return "mean";
  }

  @Override
  public List<Double> init(List<Object> key) {
    return Arrays.asList(0d, 0d);
  }

  @Override
  protected List<Double> accumulate(List<Double> accumulator, Object value) {
    double sum = accumulator.get(0) + ((Number) value).doubleValue();
    return Arrays.asList(sum, accumulator.get(1) + 1);
  }

  @Override
  public List<Double> merge(List<Double> accumulator1, List<Double> accumulator2) {
    return Arrays.asList(
        accumulator1.get(0) + accumulator2.get(0), accumulator1.get(1) + accumulator2.get(1));
  }

  @Override
  public Object finish(List<Double> accumulator) {
    return accumulator.get(1) == 0 ? null : accumulator.get(0) / accumulator.get(1);
  }
}

/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataset.block.aggregate;

import java.util.List;
import org.opensearch.dataset.block.sort.SortKey;

/** Largest value of a column, or null if the group has no non-null value. */
public class Max extends ColumnAggregateFunction<Object> {

  public Max(String column) {
    super(column);
  }

  @Override
  protected String functionName() {
    return "max";
  }

  @Override
  public Object init(List<Object> key) {
    return null;
  }

  @Override
  protected Object accumulate(Object accumulator, Object value) {
    return merge(accumulator, value);
  }

  @Override
  public Object merge(Object accumulator1, Object accumulator2) {
    if (accumulator1 == null) {
      return accumulator2;
    }
    if (accumulator2 == null) {
      return accumulator1;
    }
    return SortKey.compareValues(accumulator1, accumulator2) >= 0 ? accumulator1 : accumulator2;
  }

  @Override
  public Object finish(Object accumulator) {
    return accumulator;
  }
}

/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataset.block.aggregate;

import java.util.List;
import java.util.Map;

/** Counts rows. */
public class Count implements AggregateFunction<Long> {

  @Override
  public String getName() {
    return "count()";
  }

  @Override
  public Long init(List<Object> key) {
    return 0L;
  }

  @Override
  public Long accumulateRow(Long accumulator, Map<String, Object> row) {
    return accumulator + 1;
  }

  @Override
  public Long merge(Long accumulator1, Long accumulator2) {
    return accumulator1 + accumulator2;
  }

  @Override
  public Object finish(Long accumulator) {
    return accumulator;
  }
}

/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataset.block.frame;

import java.util.List;
import java.util.Map;
import org.opensearch.dataset.block.BlockType;
import org.opensearch.dataset.block.DataFrame;
import org.opensearch.dataset.block.TableBlockBuilder;

/** Builds data frames. */
public class DataFrameBlockBuilder extends TableBlockBuilder {

  @Override
  public DataFrame build() {
    return (DataFrame) super.build();
  }

  @Override
  protected DataFrame buildFromColumns(Map<String, List<Object>> columns) {
    return DataFrame.of(columns);
  }

  @Override
  public BlockType getBlockType() {
    return BlockType.DATAFRAME;
  }
}

/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataset.block;

import java.util.List;

/**
 * Structural description of the columns of a block. Each representation has its own schema type:
 * Arrow blocks carry the Arrow schema, data frames carry inferred Java types.
 */
public interface BlockSchema {

  /** Returns the column names in order. */
  List<String> getNames();
}

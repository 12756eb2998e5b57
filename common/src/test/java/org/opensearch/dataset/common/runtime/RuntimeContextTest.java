/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataset.common.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;

import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class RuntimeContextTest {

  @Test
  void should_share_one_local_context_per_process() {
    assertSame(RuntimeContext.local(), RuntimeContext.local());
    assertEquals(RuntimeContext.local().getNodeId(), RuntimeContext.local().getNodeId());
  }

  @Test
  void should_use_compact_node_id() {
    String nodeId = RuntimeContext.local().getNodeId();

    assertEquals(32, nodeId.length());
    assertFalse(nodeId.contains("-"));
  }
}

/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataset.common.runtime;

import java.util.UUID;

/** {@link RuntimeContext} of a standalone JVM. The node id is generated once per process. */
final class LocalRuntimeContext implements RuntimeContext {

  static final LocalRuntimeContext INSTANCE = new LocalRuntimeContext();

  private final String nodeId = UUID.randomUUID().toString().replace("-", "");

  private LocalRuntimeContext() {}

  @Override
  public String getNodeId() {
    return nodeId;
  }
}

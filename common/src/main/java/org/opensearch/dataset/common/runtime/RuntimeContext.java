/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataset.common.runtime;

/** Information about the node the current process runs on. */
public interface RuntimeContext {

  /** Returns a unique id for the node executing this process. */
  String getNodeId();

  /** Returns the context of the local JVM. */
  static RuntimeContext local() {
    return LocalRuntimeContext.INSTANCE;
  }
}

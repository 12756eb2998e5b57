/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataset.block.arrow;

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;

/** Holder of the process-wide Arrow allocator all Arrow blocks are allocated from. */
public final class ArrowAllocators {

  private static final BufferAllocator ROOT = new RootAllocator(Long.MAX_VALUE);

  private ArrowAllocators() {}

  /** Returns the shared root allocator. It lives as long as the process. */
  public static BufferAllocator root() {
    return ROOT;
  }
}

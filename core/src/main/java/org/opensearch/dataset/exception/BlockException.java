/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataset.exception;

/** Base class of all errors raised by the block layer. */
public class BlockException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public BlockException(String message) {
    super(message);
  }

  public BlockException(String message, Throwable cause) {
    super(message, cause);
  }
}

/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataset.exception;

/** A block or batch value is not of any known representation. */
public class BlockTypeMismatchException extends BlockException {

  private static final long serialVersionUID = 1L;

  public BlockTypeMismatchException(String message) {
    super(message);
  }

  public BlockTypeMismatchException(String message, Throwable cause) {
    super(message, cause);
  }
}

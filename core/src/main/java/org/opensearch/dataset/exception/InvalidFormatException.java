/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataset.exception;

/** The caller supplied a deprecated or ambiguous shape, such as a bare array or list. */
public class InvalidFormatException extends BlockException {

  private static final long serialVersionUID = 1L;

  public InvalidFormatException(String message) {
    super(message);
  }

  public InvalidFormatException(String message, Throwable cause) {
    super(message, cause);
  }
}

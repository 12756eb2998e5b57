/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataset.exception;

/**
 * A column mapping could not be converted into an Arrow table, typically because a column holds
 * values of mixed or unsupported types.
 */
public class ArrowConversionException extends BlockException {

  private static final long serialVersionUID = 1L;

  public ArrowConversionException(String message) {
    super(message);
  }
}

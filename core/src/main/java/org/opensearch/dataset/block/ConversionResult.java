/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataset.block;

import org.opensearch.dataset.exception.ArrowConversionException;

/**
 * Outcome of converting user data into an Arrow representation: either the converted value or the
 * structured reason the conversion is impossible. Callers decide explicitly whether a failure is
 * recovered or rethrown.
 *
 * @param <T> type of the converted value
 */
public final class ConversionResult<T> {

  private final T value;
  private final ArrowConversionException failure;

  private ConversionResult(T value, ArrowConversionException failure) {
    this.value = value;
    this.failure = failure;
  }

  public static <T> ConversionResult<T> success(T value) {
    return new ConversionResult<>(value, null);
  }

  public static <T> ConversionResult<T> failure(ArrowConversionException failure) {
    return new ConversionResult<>(null, failure);
  }

  public boolean isSuccess() {
    return failure == null;
  }

  /**
   * Returns the converted value.
   *
   * @throws IllegalStateException if the conversion failed
   */
  public T getValue() {
    if (failure != null) {
      throw new IllegalStateException("Conversion failed", failure);
    }
    return value;
  }

  /**
   * Returns the failure.
   *
   * @throws IllegalStateException if the conversion succeeded
   */
  public ArrowConversionException getFailure() {
    if (failure == null) {
      throw new IllegalStateException("Conversion succeeded");
    }
    return failure;
  }

  /** Returns the converted value, or throws the conversion failure. */
  public T getOrThrow() {
    if (failure != null) {
      throw failure;
    }
    return value;
  }
}

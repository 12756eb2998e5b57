/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataset.block;

import java.util.Arrays;
import java.util.List;
import org.opensearch.dataset.common.setting.Settings;
import org.opensearch.dataset.exception.InvalidArgumentException;

/** Resolves the batch format and batch size options of batch-oriented operators. */
public final class BatchOptions {

  /** Value asking for the configured default. */
  public static final String DEFAULT = "default";

  /** Formats an operator may run with; null means the native block. */
  public static final List<String> VALID_BATCH_FORMATS =
      Arrays.asList("pandas", "pyarrow", "numpy", null);

  private BatchOptions() {}

  /**
   * Resolves {@code "default"} to the configured default format and checks the result.
   *
   * @param given format name, {@code "default"} or null
   * @return the format to use, possibly null
   * @throws InvalidArgumentException if the format is not allowed
   */
  public static String applyBatchFormat(String given, Settings settings) {
    String format =
        DEFAULT.equals(given) ? settings.getSettingValue(Settings.Key.DEFAULT_BATCH_FORMAT) : given;
    if (!VALID_BATCH_FORMATS.contains(format)) {
      throw new InvalidArgumentException(
          String.format(
              "The given batch format %s isn't allowed (must be one of %s).",
              format, VALID_BATCH_FORMATS));
    }
    return format;
  }

  /**
   * Resolves {@code "default"} to the configured default batch size.
   *
   * @param given a positive {@link Integer}, {@code "default"} or null for unbounded batches
   * @return the batch size, or null for unbounded batches
   * @throws InvalidArgumentException if the value is neither
   */
  public static Integer applyBatchSize(Object given, Settings settings) {
    if (given == null) {
      return null;
    }
    if (DEFAULT.equals(given)) {
      return settings.getSettingValue(Settings.Key.DEFAULT_BATCH_SIZE);
    }
    if (given instanceof Integer size && size > 0) {
      return size;
    }
    throw new InvalidArgumentException(
        String.format(
            "The batch size must be a positive integer, \"%s\" or null, got: %s", DEFAULT, given));
  }
}

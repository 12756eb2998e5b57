/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataset.common.setting;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;
import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Setting. */
public abstract class Settings {
  @RequiredArgsConstructor
  public enum Key {

    /** Number of rows per batch when the caller asks for the "default" batch size. */
    DEFAULT_BATCH_SIZE("plugins.dataset.batch_size.default"),

    /** Batch format used when the caller asks for the "default" batch format. */
    DEFAULT_BATCH_FORMAT("plugins.dataset.batch_format.default");

    @Getter private final String keyValue;

    private static final Map<String, Key> ALL_KEYS;

    static {
      ALL_KEYS =
          Arrays.stream(Key.values())
              .collect(ImmutableMap.toImmutableMap(Key::getKeyValue, Function.identity()));
    }

    public static Optional<Key> of(String keyValue) {
      String key = Strings.isNullOrEmpty(keyValue) ? "" : keyValue.toLowerCase();
      return Optional.ofNullable(ALL_KEYS.get(key));
    }

    /** Returns every key value, for error messages. */
    public static String allKeyValues() {
      return ALL_KEYS.keySet().stream().collect(Collectors.joining(", ", "[", "]"));
    }
  }

  /** Get Setting Value. */
  public abstract <T> T getSettingValue(Key key);
}

/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataset.common.setting;

import com.google.common.collect.ImmutableMap;
import java.util.EnumMap;
import java.util.Map;
import java.util.Properties;
import lombok.extern.log4j.Log4j2;

/**
 * In-process {@link Settings} backed by built-in defaults. Individual values can be overridden
 * from a map or from {@link Properties} using the {@link Settings.Key#getKeyValue()} names.
 */
@Log4j2
public class DatasetSettings extends Settings {

  public static final int DEFAULT_BATCH_SIZE = 1024;

  public static final String DEFAULT_BATCH_FORMAT = "numpy";

  private static final Map<Key, Object> DEFAULTS =
      ImmutableMap.of(
          Key.DEFAULT_BATCH_SIZE, DEFAULT_BATCH_SIZE,
          Key.DEFAULT_BATCH_FORMAT, DEFAULT_BATCH_FORMAT);

  private final Map<Key, Object> values;

  public DatasetSettings() {
    this(Map.of());
  }

  public DatasetSettings(Map<Key, Object> overrides) {
    this.values = new EnumMap<>(DEFAULTS);
    this.values.putAll(overrides);
  }

  /**
   * Creates settings from properties. Unknown property names are ignored with a warning.
   *
   * @param properties property names are {@link Settings.Key} values
   * @return settings holding the parsed overrides
   */
  public static DatasetSettings fromProperties(Properties properties) {
    Map<Key, Object> overrides = new EnumMap<>(Key.class);
    for (String name : properties.stringPropertyNames()) {
      String raw = properties.getProperty(name).trim();
      Key key = Key.of(name).orElse(null);
      if (key == null) {
        log.warn("Ignoring unknown setting {}, known settings are {}", name, Key.allKeyValues());
        continue;
      }
      overrides.put(key, parse(key, raw));
    }
    return new DatasetSettings(overrides);
  }

  private static Object parse(Key key, String raw) {
    switch (key) {
      case DEFAULT_BATCH_SIZE:
        try {
          return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
          throw new IllegalArgumentException(
              String.format("Setting %s must be an integer, got: %s", key.getKeyValue(), raw), e);
        }
      default:
        return raw;
    }
  }

  @Override
  @SuppressWarnings("unchecked")
  public <T> T getSettingValue(Key key) {
    return (T) values.get(key);
  }
}

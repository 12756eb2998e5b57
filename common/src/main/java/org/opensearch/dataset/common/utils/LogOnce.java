/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataset.common.utils;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide registry of log messages that must be emitted at most once. The registry starts
 * empty when the class is loaded and is never cleared, so a key fires once per JVM. The check and
 * the registration are a single atomic set insertion.
 */
public final class LogOnce {

  private static final Set<String> LOGGED_KEYS = ConcurrentHashMap.newKeySet();

  private LogOnce() {}

  /**
   * Returns true the first time it is called with the given key, and false afterwards.
   *
   * @param key identifies the message
   * @return whether the caller should log now
   */
  public static boolean shouldLog(String key) {
    return LOGGED_KEYS.add(key);
  }
}

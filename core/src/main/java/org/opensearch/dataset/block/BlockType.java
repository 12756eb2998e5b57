/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataset.block;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.opensearch.dataset.exception.InvalidArgumentException;

/** The two block representations. */
@RequiredArgsConstructor
public enum BlockType {
  /** Arrow columnar table, see {@link ArrowTable}. */
  ARROW("arrow"),

  /** Column-major table of Java objects, see {@link DataFrame}. */
  DATAFRAME("dataframe");

  /** Legacy name of {@link #DATAFRAME}. */
  private static final String PANDAS_ALIAS = "pandas";

  @Getter private final String name;

  /**
   * Resolves a block type by name.
   *
   * @param name "arrow", "dataframe" or "pandas"
   * @return the block type
   * @throws InvalidArgumentException if the name is unknown
   */
  public static BlockType of(String name) {
    String normalized = name == null ? "" : name.toLowerCase(Locale.ROOT);
    if (PANDAS_ALIAS.equals(normalized)) {
      return DATAFRAME;
    }
    for (BlockType type : values()) {
      if (type.name.equals(normalized)) {
        return type;
      }
    }
    throw new InvalidArgumentException(
        String.format(
            "The block type must be one of %s, got: %s",
            Arrays.stream(values()).map(BlockType::getName).collect(Collectors.toList()), name));
  }
}

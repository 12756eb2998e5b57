/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataset.block;

import com.google.common.collect.ImmutableList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import lombok.Getter;
import org.opensearch.dataset.exception.InvalidArgumentException;

/** Forms a block can be handed to user code in. */
public enum BatchFormat {
  /** The block's own representation. */
  NATIVE("default", "native"),

  /** A {@link DataFrame}. */
  PANDAS("pandas"),

  /** An {@link ArrowTable}. */
  PYARROW("pyarrow"),

  /** A map of column name to Java array. */
  NUMPY("numpy");

  @Getter private final List<String> names;

  BatchFormat(String... names) {
    this.names = ImmutableList.copyOf(names);
  }

  /** Returns every accepted format name, in declaration order. */
  public static List<String> allNames() {
    return Arrays.stream(values())
        .flatMap(format -> format.names.stream())
        .collect(ImmutableList.toImmutableList());
  }

  /**
   * Resolves a format by name.
   *
   * @throws InvalidArgumentException if the name is not an accepted format
   */
  public static BatchFormat of(String name) {
    for (BatchFormat format : values()) {
      if (format.names.contains(name)) {
        return format;
      }
    }
    throw new InvalidArgumentException(
        String.format(
            "The batch format must be one of %s, got: %s",
            allNames().stream().collect(Collectors.joining(", ", "[", ", null]")), name));
  }
}

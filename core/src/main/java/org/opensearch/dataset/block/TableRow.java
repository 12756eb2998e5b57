/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataset.block;

import java.util.AbstractMap;
import java.util.AbstractSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * Read-only view of one row of a block, keyed by column name in column order. Values are read from
 * the block on access, so a row is only valid while the block is.
 */
public abstract class TableRow extends AbstractMap<String, Object> {

  /** Returns the column names of the underlying block. */
  protected abstract List<String> columnNames();

  /** Returns the value of the column at the given position. */
  protected abstract Object valueAt(int column);

  /** Returns the position of the named column, or -1. */
  protected abstract int indexOf(String name);

  @Override
  public Object get(Object key) {
    if (!(key instanceof String name)) {
      return null;
    }
    int index = indexOf(name);
    return index < 0 ? null : valueAt(index);
  }

  @Override
  public boolean containsKey(Object key) {
    return key instanceof String name && indexOf(name) >= 0;
  }

  @Override
  public int size() {
    return columnNames().size();
  }

  @Override
  public Set<Map.Entry<String, Object>> entrySet() {
    return new AbstractSet<>() {
      @Override
      public Iterator<Map.Entry<String, Object>> iterator() {
        return new Iterator<>() {
          private int column;

          @Override
          public boolean hasNext() {
            return column < columnNames().size();
          }

          @Override
          public Map.Entry<String, Object> next() {
            if (!hasNext()) {
              throw new NoSuchElementException();
            }
            int current = column++;
            return new SimpleImmutableEntry<>(columnNames().get(current), valueAt(current));
          }
        };
      }

      @Override
      public int size() {
        return TableRow.this.size();
      }
    };
  }

  /** Returns an independent copy of this row. */
  public Map<String, Object> toPublic() {
    return new LinkedHashMap<>(this);
  }
}

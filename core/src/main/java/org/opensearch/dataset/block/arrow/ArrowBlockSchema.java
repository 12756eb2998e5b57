/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataset.block.arrow;

import java.util.List;
import java.util.stream.Collectors;
import lombok.Value;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.Schema;
import org.opensearch.dataset.block.BlockSchema;

/** Schema of an Arrow block. */
@Value
public class ArrowBlockSchema implements BlockSchema {

  Schema schema;

  @Override
  public List<String> getNames() {
    return schema.getFields().stream().map(Field::getName).collect(Collectors.toList());
  }
}

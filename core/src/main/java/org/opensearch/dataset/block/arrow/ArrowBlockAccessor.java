/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataset.block.arrow;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.Channels;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.ipc.ArrowStreamReader;
import org.apache.arrow.vector.ipc.ArrowStreamWriter;
import org.apache.arrow.vector.util.ByteArrayReadableSeekableByteChannel;
import org.opensearch.dataset.block.ArrowTable;
import org.opensearch.dataset.block.Block;
import org.opensearch.dataset.block.BlockType;
import org.opensearch.dataset.block.ColumnArrays;
import org.opensearch.dataset.block.DataFrame;
import org.opensearch.dataset.block.TableBlockAccessor;
import org.opensearch.dataset.exception.InvalidFormatException;

/**
 * Accessor of {@link ArrowTable} blocks. Zero-copy slices and column selections share the Arrow
 * buffers of the wrapped table; copies and takes own fresh buffers from the shared allocator.
 */
@Log4j2
@RequiredArgsConstructor
public class ArrowBlockAccessor extends TableBlockAccessor {

  private final ArrowTable table;

  /** Returns a table without columns or rows. */
  public static ArrowTable emptyTable() {
    return ArrowTable.wrap(ArrowVectors.rootOf(new ArrayList<>(), 0));
  }

  /**
   * Reads a table written by {@link #toBytes()} in the Arrow IPC stream format.
   *
   * @throws InvalidFormatException if the bytes are not a readable Arrow stream
   */
  public static ArrowBlockAccessor fromBytes(byte[] bytes) {
    BufferAllocator allocator = ArrowAllocators.root();
    VectorSchemaRoot target = null;
    try (ArrowStreamReader reader =
        new ArrowStreamReader(new ByteArrayReadableSeekableByteChannel(bytes), allocator)) {
      VectorSchemaRoot batch = reader.getVectorSchemaRoot();
      target = VectorSchemaRoot.create(batch.getSchema(), allocator);
      target.allocateNew();
      target.setRowCount(0);
      while (reader.loadNextBatch()) {
        ArrowVectors.appendRows(target, batch);
      }
      return new ArrowBlockAccessor(ArrowTable.wrap(target));
    } catch (IOException | RuntimeException e) {
      if (target != null) {
        target.close();
      }
      log.debug("Failed to read an Arrow stream of {} bytes", bytes.length, e);
      throw new InvalidFormatException(
          String.format("Could not read a block from %d bytes of Arrow stream data", bytes.length),
          e);
    }
  }

  /** Writes the table in the Arrow IPC stream format. */
  public byte[] toBytes() {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try (ArrowStreamWriter writer =
        new ArrowStreamWriter(table.getRoot(), null, Channels.newChannel(out))) {
      writer.start();
      writer.writeBatch();
      writer.end();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write Arrow block", e);
    }
    return out.toByteArray();
  }

  @Override
  public int numRows() {
    return table.getRowCount();
  }

  @Override
  public long sizeBytes() {
    return ArrowVectors.bufferSize(table.getRoot());
  }

  @Override
  public ArrowBlockSchema schema() {
    return new ArrowBlockSchema(table.getSchema());
  }

  @Override
  public Iterator<Map<String, Object>> iterRows(boolean publicRowFormat) {
    int rowCount = numRows();
    return new Iterator<>() {
      private int row;

      @Override
      public boolean hasNext() {
        return row < rowCount;
      }

      @Override
      public Map<String, Object> next() {
        if (!hasNext()) {
          throw new NoSuchElementException();
        }
        ArrowRow view = new ArrowRow(table, row++);
        return publicRowFormat ? view.toPublic() : view;
      }
    };
  }

  @Override
  public ArrowTable slice(int start, int end, boolean copy) {
    checkRange(start, end);
    VectorSchemaRoot root = table.getRoot();
    if (copy) {
      List<Integer> indices = new ArrayList<>(end - start);
      for (int i = start; i < end; i++) {
        indices.add(i);
      }
      return ArrowTable.wrap(ArrowVectors.copyRows(root, indices, ArrowAllocators.root()));
    }
    List<FieldVector> vectors = new ArrayList<>(root.getFieldVectors().size());
    for (FieldVector vector : root.getFieldVectors()) {
      vectors.add(
          ArrowVectors.share(
              vector, vector.getName(), start, end - start, ArrowAllocators.root()));
    }
    return ArrowTable.wrap(ArrowVectors.rootOf(vectors, end - start));
  }

  @Override
  public ArrowTable take(List<Integer> indices) {
    checkIndices(indices);
    return ArrowTable.wrap(
        ArrowVectors.copyRows(table.getRoot(), indices, ArrowAllocators.root()));
  }

  @Override
  public ArrowTable select(List<String> columns) {
    List<FieldVector> selected = new ArrayList<>(columns.size());
    for (String column : columns) {
      selected.add(table.getVector(column));
    }
    List<FieldVector> vectors = new ArrayList<>(columns.size());
    for (int i = 0; i < columns.size(); i++) {
      vectors.add(share(selected.get(i), columns.get(i)));
    }
    return ArrowTable.wrap(ArrowVectors.rootOf(vectors, numRows()));
  }

  @Override
  public ArrowTable randomShuffle(Long seed) {
    return (ArrowTable) super.randomShuffle(seed);
  }

  @Override
  public DataFrame toDataFrame() {
    return ArrowConversions.toDataFrame(table);
  }

  @Override
  public Object toNumpy(String column) {
    FieldVector vector = table.getVector(column);
    List<Object> values = new ArrayList<>(numRows());
    for (int row = 0; row < numRows(); row++) {
      values.add(ArrowVectors.getValue(vector, row));
    }
    return ColumnArrays.toTypedArray(values);
  }

  @Override
  public Map<String, Object> toNumpy(List<String> columns) {
    Map<String, Object> arrays = new LinkedHashMap<>();
    for (String column : columns) {
      arrays.put(column, toNumpy(column));
    }
    return arrays;
  }

  @Override
  public ArrowTable toArrow() {
    return table;
  }

  @Override
  public ArrowTable toBlock() {
    return table;
  }

  @Override
  public ArrowTable zip(Block other) {
    checkZippable(other);
    ArrowTable right = (ArrowTable) other;
    List<String> names = zipColumnNames(table.getColumnNames(), right.getColumnNames());
    List<FieldVector> vectors = new ArrayList<>();
    for (FieldVector vector : table.getRoot().getFieldVectors()) {
      vectors.add(share(vector, vector.getName()));
    }
    for (int i = 0; i < names.size(); i++) {
      vectors.add(share(right.getRoot().getVector(i), names.get(i)));
    }
    return ArrowTable.wrap(ArrowVectors.rootOf(vectors, numRows()));
  }

  @Override
  public ArrowBlockBuilder builder() {
    return new ArrowBlockBuilder();
  }

  @Override
  public BlockType blockType() {
    return BlockType.ARROW;
  }

  /** Copies the rows with their Arrow types when every block has the schema of this table. */
  @Override
  protected Block gather(List<Block> blocks, List<RowRef> rows) {
    List<VectorSchemaRoot> sources = new ArrayList<>(blocks.size());
    for (Block block : blocks) {
      if (!(block instanceof ArrowTable other)
          || !other.getSchema().getFields().equals(table.getSchema().getFields())) {
        log.debug("Gathering rows of blocks with different schemas by value");
        return super.gather(blocks, rows);
      }
      sources.add(other.getRoot());
    }
    List<Integer> sourceOf = new ArrayList<>(rows.size());
    List<Integer> positions = new ArrayList<>(rows.size());
    for (RowRef row : rows) {
      sourceOf.add(row.block());
      positions.add(row.row());
    }
    return ArrowTable.wrap(
        ArrowVectors.copyRows(sources, sourceOf, positions, ArrowAllocators.root()));
  }

  @Override
  protected void discard(Block intermediate) {
    if (intermediate instanceof ArrowTable arrow) {
      arrow.close();
    }
  }

  private FieldVector share(FieldVector vector, String name) {
    return ArrowVectors.share(vector, name, 0, vector.getValueCount(), ArrowAllocators.root());
  }
}

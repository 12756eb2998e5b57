/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataset.block.arrow;

import static org.opensearch.dataset.common.utils.StringUtils.truncatedRepr;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.opensearch.dataset.block.ArrowTable;
import org.opensearch.dataset.block.ColumnArrays;
import org.opensearch.dataset.block.ConversionResult;
import org.opensearch.dataset.block.DataFrame;
import org.opensearch.dataset.exception.ArrowConversionException;
import org.opensearch.dataset.exception.ShapeMismatchException;

/**
 * Conversions between Java column data and Arrow tables. Arrow columns are strictly typed, so
 * columns holding values of unrelated types cannot be converted; such failures are reported as a
 * {@link ConversionResult} rather than thrown, leaving the fallback decision to the caller.
 */
@Log4j2
public final class ArrowConversions {

  private static final Map<Class<?>, ArrowColumnType> PRIMITIVE_ARRAY_TYPES =
      ImmutableMap.<Class<?>, ArrowColumnType>builder()
          .put(byte[].class, ArrowColumnType.TINYINT)
          .put(short[].class, ArrowColumnType.SMALLINT)
          .put(int[].class, ArrowColumnType.INT)
          .put(long[].class, ArrowColumnType.BIGINT)
          .put(float[].class, ArrowColumnType.FLOAT)
          .put(double[].class, ArrowColumnType.DOUBLE)
          .put(boolean[].class, ArrowColumnType.BOOLEAN)
          .build();

  /** Integral box types, narrowest first. */
  private static final List<Class<?>> INTEGRAL_TYPES =
      ImmutableList.of(Byte.class, Short.class, Integer.class, Long.class);

  private static final List<ArrowColumnType> INTEGRAL_COLUMN_TYPES =
      ImmutableList.of(
          ArrowColumnType.TINYINT,
          ArrowColumnType.SMALLINT,
          ArrowColumnType.INT,
          ArrowColumnType.BIGINT);

  private static final Set<Class<?>> FLOATING_TYPES = ImmutableSet.of(Float.class, Double.class);

  private static final Map<Class<?>, ArrowColumnType> SCALAR_TYPES =
      ImmutableMap.<Class<?>, ArrowColumnType>builder()
          .put(String.class, ArrowColumnType.STRING)
          .put(Boolean.class, ArrowColumnType.BOOLEAN)
          .put(byte[].class, ArrowColumnType.BINARY)
          .put(LocalDate.class, ArrowColumnType.DATE)
          .put(LocalDateTime.class, ArrowColumnType.TIMESTAMP)
          .build();

  private ArrowConversions() {}

  /**
   * Converts columns keyed by name into an Arrow table allocated from the shared allocator.
   *
   * @param columns column name to Java array or list, in column order
   * @return the table, or the reason a column cannot be represented in Arrow
   * @throws ShapeMismatchException if the columns differ in length
   */
  public static ConversionResult<ArrowTable> tableFromColumns(Map<String, ?> columns) {
    return tableFromColumns(columns, ArrowAllocators.root());
  }

  static ConversionResult<ArrowTable> tableFromColumns(
      Map<String, ?> columns, BufferAllocator allocator) {
    Map<String, Object[]> values = new LinkedHashMap<>();
    List<ArrowColumnType> types = new ArrayList<>(columns.size());
    int rowCount = -1;
    String firstColumn = null;
    for (Map.Entry<String, ?> entry : columns.entrySet()) {
      String name = entry.getKey();
      Object[] boxed = ColumnArrays.toObjectArray(name, entry.getValue());
      if (rowCount < 0) {
        rowCount = boxed.length;
        firstColumn = name;
      } else if (boxed.length != rowCount) {
        throw new ShapeMismatchException(
            String.format(
                "All columns must have the same length, but column %s has %d rows and column %s"
                    + " has %d rows",
                firstColumn, rowCount, name, boxed.length));
      }
      ArrowColumnType primitive = PRIMITIVE_ARRAY_TYPES.get(entry.getValue().getClass());
      ConversionResult<ArrowColumnType> type =
          primitive != null ? ConversionResult.success(primitive) : inferType(name, boxed);
      if (!type.isSuccess()) {
        return ConversionResult.failure(type.getFailure());
      }
      values.put(name, boxed);
      types.add(type.getValue());
    }
    return ConversionResult.success(
        ArrowTable.wrap(buildRoot(values, types, Math.max(rowCount, 0), allocator)));
  }

  /**
   * Converts a data frame into an Arrow table.
   *
   * @throws ArrowConversionException if a column cannot be represented in Arrow
   */
  public static ArrowTable fromDataFrame(DataFrame frame) {
    return tableFromColumns(frame.toColumnMap()).getOrThrow();
  }

  /** Converts an Arrow table into a data frame holding plain Java values. */
  public static DataFrame toDataFrame(ArrowTable table) {
    VectorSchemaRoot root = table.getRoot();
    int rowCount = root.getRowCount();
    Object[][] columns = new Object[root.getFieldVectors().size()][rowCount];
    for (int column = 0; column < columns.length; column++) {
      FieldVector vector = root.getVector(column);
      for (int row = 0; row < rowCount; row++) {
        columns[column][row] = ArrowVectors.getValue(vector, row);
      }
    }
    return DataFrame.fromColumns(table.getColumnNames(), columns);
  }

  private static VectorSchemaRoot buildRoot(
      Map<String, Object[]> values,
      List<ArrowColumnType> types,
      int rowCount,
      BufferAllocator allocator) {
    List<FieldVector> vectors = new ArrayList<>(values.size());
    try {
      int i = 0;
      for (Map.Entry<String, Object[]> entry : values.entrySet()) {
        vectors.add(types.get(i++).createVector(entry.getKey(), entry.getValue(), allocator));
      }
    } catch (RuntimeException e) {
      vectors.forEach(FieldVector::close);
      throw e;
    }
    return ArrowVectors.rootOf(vectors, rowCount);
  }

  /** Picks the Arrow type able to hold every non-null value of the column. */
  static ConversionResult<ArrowColumnType> inferType(String name, Object[] values) {
    Set<Class<?>> classes = new LinkedHashSet<>();
    boolean numericLists = true;
    boolean integralLists = true;
    for (Object value : values) {
      if (value == null) {
        continue;
      }
      if (value instanceof List<?> list) {
        classes.add(List.class);
        numericLists &= list.stream().allMatch(e -> e instanceof Number);
        integralLists &=
            list.stream().allMatch(e -> e != null && INTEGRAL_TYPES.contains(e.getClass()));
      } else {
        classes.add(value.getClass());
      }
    }

    if (classes.isEmpty()) {
      return ConversionResult.success(ArrowColumnType.NULL);
    }
    if (INTEGRAL_TYPES.containsAll(classes)) {
      int widest = classes.stream().mapToInt(INTEGRAL_TYPES::indexOf).max().getAsInt();
      return ConversionResult.success(INTEGRAL_COLUMN_TYPES.get(widest));
    }
    if (classes.equals(ImmutableSet.of(Float.class))) {
      return ConversionResult.success(ArrowColumnType.FLOAT);
    }
    if (classes.stream().allMatch(c -> INTEGRAL_TYPES.contains(c) || FLOATING_TYPES.contains(c))) {
      return ConversionResult.success(ArrowColumnType.DOUBLE);
    }
    if (classes.size() == 1 && SCALAR_TYPES.containsKey(classes.iterator().next())) {
      return checkRange(name, SCALAR_TYPES.get(classes.iterator().next()), values);
    }
    if (numericLists && classes.equals(ImmutableSet.of(List.class)) && integralLists) {
      return ConversionResult.success(ArrowColumnType.LONG_LIST);
    }
    if (numericLists && classes.stream().allMatch(c -> c == List.class || c == double[].class)) {
      return ConversionResult.success(ArrowColumnType.DOUBLE_LIST);
    }

    String typeNames =
        classes.stream().map(Class::getSimpleName).collect(Collectors.joining(", ", "[", "]"));
    log.debug("Column {} holds values of types {} that Arrow cannot store", name, typeNames);
    return ConversionResult.failure(
        new ArrowConversionException(
            String.format(
                "Could not convert column %s to Arrow: values of types %s cannot be stored in a"
                    + " single Arrow column: %s",
                name, typeNames, truncatedRepr(values))));
  }

  private static ConversionResult<ArrowColumnType> checkRange(
      String name, ArrowColumnType type, Object[] values) {
    for (Object value : values) {
      if (value != null && !type.fits(value)) {
        log.debug("Value {} of column {} is outside the range of {}", value, name, type);
        return ConversionResult.failure(
            new ArrowConversionException(
                String.format(
                    "Could not convert column %s to Arrow: value %s is outside the range of"
                        + " Arrow type %s",
                    name, value, type.getArrowType())));
      }
    }
    return ConversionResult.success(type);
  }
}

/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.dataset.block.arrow;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.function.BiConsumer;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.BitVector;
import org.apache.arrow.vector.DateDayVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.Float4Vector;
import org.apache.arrow.vector.Float8Vector;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.SmallIntVector;
import org.apache.arrow.vector.TimeStampMilliVector;
import org.apache.arrow.vector.TinyIntVector;
import org.apache.arrow.vector.VarBinaryVector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.complex.ListVector;
import org.apache.arrow.vector.complex.impl.UnionListWriter;
import org.apache.arrow.vector.types.DateUnit;
import org.apache.arrow.vector.types.FloatingPointPrecision;
import org.apache.arrow.vector.types.TimeUnit;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.FieldType;

/**
 * Arrow column types a Java column can be converted to. Each constant creates and fills a nullable
 * vector from boxed values that {@link ArrowConversions} has already checked to fit the type.
 */
enum ArrowColumnType {
  NULL(ArrowType.Null.INSTANCE) {
    @Override
    void fill(FieldVector vector, Object[] values) {}
  },

  TINYINT(new ArrowType.Int(8, true)) {
    @Override
    void fill(FieldVector vector, Object[] values) {
      TinyIntVector typed = (TinyIntVector) vector;
      for (int i = 0; i < values.length; i++) {
        if (values[i] == null) {
          typed.setNull(i);
        } else {
          typed.setSafe(i, ((Number) values[i]).byteValue());
        }
      }
    }
  },

  SMALLINT(new ArrowType.Int(16, true)) {
    @Override
    void fill(FieldVector vector, Object[] values) {
      SmallIntVector typed = (SmallIntVector) vector;
      for (int i = 0; i < values.length; i++) {
        if (values[i] == null) {
          typed.setNull(i);
        } else {
          typed.setSafe(i, ((Number) values[i]).shortValue());
        }
      }
    }
  },

  INT(new ArrowType.Int(32, true)) {
    @Override
    void fill(FieldVector vector, Object[] values) {
      IntVector typed = (IntVector) vector;
      for (int i = 0; i < values.length; i++) {
        if (values[i] == null) {
          typed.setNull(i);
        } else {
          typed.setSafe(i, ((Number) values[i]).intValue());
        }
      }
    }
  },

  BIGINT(new ArrowType.Int(64, true)) {
    @Override
    void fill(FieldVector vector, Object[] values) {
      BigIntVector typed = (BigIntVector) vector;
      for (int i = 0; i < values.length; i++) {
        if (values[i] == null) {
          typed.setNull(i);
        } else {
          typed.setSafe(i, ((Number) values[i]).longValue());
        }
      }
    }
  },

  FLOAT(new ArrowType.FloatingPoint(FloatingPointPrecision.SINGLE)) {
    @Override
    void fill(FieldVector vector, Object[] values) {
      Float4Vector typed = (Float4Vector) vector;
      for (int i = 0; i < values.length; i++) {
        if (values[i] == null) {
          typed.setNull(i);
        } else {
          typed.setSafe(i, ((Number) values[i]).floatValue());
        }
      }
    }
  },

  DOUBLE(new ArrowType.FloatingPoint(FloatingPointPrecision.DOUBLE)) {
    @Override
    void fill(FieldVector vector, Object[] values) {
      Float8Vector typed = (Float8Vector) vector;
      for (int i = 0; i < values.length; i++) {
        if (values[i] == null) {
          typed.setNull(i);
        } else {
          typed.setSafe(i, ((Number) values[i]).doubleValue());
        }
      }
    }
  },

  BOOLEAN(ArrowType.Bool.INSTANCE) {
    @Override
    void fill(FieldVector vector, Object[] values) {
      BitVector typed = (BitVector) vector;
      for (int i = 0; i < values.length; i++) {
        if (values[i] == null) {
          typed.setNull(i);
        } else {
          typed.setSafe(i, (Boolean) values[i] ? 1 : 0);
        }
      }
    }
  },

  STRING(ArrowType.Utf8.INSTANCE) {
    @Override
    void fill(FieldVector vector, Object[] values) {
      VarCharVector typed = (VarCharVector) vector;
      for (int i = 0; i < values.length; i++) {
        if (values[i] == null) {
          typed.setNull(i);
        } else {
          typed.setSafe(i, ((String) values[i]).getBytes(StandardCharsets.UTF_8));
        }
      }
    }
  },

  BINARY(ArrowType.Binary.INSTANCE) {
    @Override
    void fill(FieldVector vector, Object[] values) {
      VarBinaryVector typed = (VarBinaryVector) vector;
      for (int i = 0; i < values.length; i++) {
        if (values[i] == null) {
          typed.setNull(i);
        } else {
          typed.setSafe(i, (byte[]) values[i]);
        }
      }
    }
  },

  DATE(new ArrowType.Date(DateUnit.DAY)) {
    @Override
    void fill(FieldVector vector, Object[] values) {
      DateDayVector typed = (DateDayVector) vector;
      for (int i = 0; i < values.length; i++) {
        if (values[i] == null) {
          typed.setNull(i);
        } else {
          typed.setSafe(i, Math.toIntExact(((LocalDate) values[i]).toEpochDay()));
        }
      }
    }
  },

  TIMESTAMP(new ArrowType.Timestamp(TimeUnit.MILLISECOND, null)) {
    @Override
    void fill(FieldVector vector, Object[] values) {
      TimeStampMilliVector typed = (TimeStampMilliVector) vector;
      for (int i = 0; i < values.length; i++) {
        if (values[i] == null) {
          typed.setNull(i);
        } else {
          typed.setSafe(
              i, ((LocalDateTime) values[i]).toInstant(ZoneOffset.UTC).toEpochMilli());
        }
      }
    }
  },

  /** Lists of integers, stored as lists of 64-bit integers. */
  LONG_LIST(ArrowType.List.INSTANCE) {
    @Override
    FieldVector createVector(String name, Object[] values, BufferAllocator allocator) {
      return writeLists(
          name,
          values,
          allocator,
          (writer, list) -> {
            for (Object element : (List<?>) list) {
              writer.bigInt().writeBigInt(((Number) element).longValue());
            }
          });
    }

    @Override
    void fill(FieldVector vector, Object[] values) {
      throw new UnsupportedOperationException("List vectors are written through createVector");
    }
  },

  /** Numeric lists, such as partial aggregation state, stored as lists of doubles. */
  DOUBLE_LIST(ArrowType.List.INSTANCE) {
    @Override
    FieldVector createVector(String name, Object[] values, BufferAllocator allocator) {
      return writeLists(
          name,
          values,
          allocator,
          (writer, list) -> {
            for (double element : doubles(list)) {
              writer.float8().writeFloat8(element);
            }
          });
    }

    @Override
    void fill(FieldVector vector, Object[] values) {
      throw new UnsupportedOperationException("List vectors are written through createVector");
    }
  };

  /** Largest epoch second whose millisecond value fits a long. */
  private static final long MAX_EPOCH_SECOND = Long.MAX_VALUE / 1000 - 1;

  private final ArrowType arrowType;

  ArrowColumnType(ArrowType arrowType) {
    this.arrowType = arrowType;
  }

  ArrowType getArrowType() {
    return arrowType;
  }

  /** Creates a vector named {@code name} holding the values. */
  FieldVector createVector(String name, Object[] values, BufferAllocator allocator) {
    FieldVector vector =
        new Field(name, FieldType.nullable(arrowType), null).createVector(allocator);
    vector.allocateNew();
    fill(vector, values);
    vector.setValueCount(values.length);
    return vector;
  }

  abstract void fill(FieldVector vector, Object[] values);

  /** Whether a non-null value of the type's Java class can be stored in the vector. */
  boolean fits(Object value) {
    return switch (this) {
      case DATE -> {
        long epochDay = ((LocalDate) value).toEpochDay();
        yield epochDay >= Integer.MIN_VALUE && epochDay <= Integer.MAX_VALUE;
      }
      case TIMESTAMP ->
          Math.abs(((LocalDateTime) value).toEpochSecond(ZoneOffset.UTC)) <= MAX_EPOCH_SECOND;
      default -> true;
    };
  }

  private static ListVector writeLists(
      String name,
      Object[] values,
      BufferAllocator allocator,
      BiConsumer<UnionListWriter, Object> elements) {
    ListVector vector = ListVector.empty(name, allocator);
    UnionListWriter writer = vector.getWriter();
    writer.allocate();
    for (int i = 0; i < values.length; i++) {
      if (values[i] == null) {
        continue;
      }
      writer.setPosition(i);
      writer.startList();
      elements.accept(writer, values[i]);
      writer.endList();
    }
    writer.setValueCount(values.length);
    vector.setValueCount(values.length);
    return vector;
  }

  static double[] doubles(Object list) {
    if (list instanceof double[] array) {
      return array;
    }
    List<?> elements = (List<?>) list;
    double[] result = new double[elements.size()];
    for (int i = 0; i < result.length; i++) {
      result[i] = ((Number) elements.get(i)).doubleValue();
    }
    return result;
  }
}

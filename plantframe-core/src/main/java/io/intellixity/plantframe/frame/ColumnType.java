package io.intellixity.plantframe.frame;

import io.intellixity.plantframe.error.SchemaException;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;

/** Semantic column types understood by every engine. */
public enum ColumnType {
  TIMESTAMP(Instant.class),
  DOUBLE(Double.class),
  LONG(Long.class),
  STRING(String.class),
  BOOLEAN(Boolean.class);

  private final Class<?> javaType;

  ColumnType(Class<?> javaType) {
    this.javaType = javaType;
  }

  public Class<?> javaType() {
    return javaType;
  }

  public boolean isNumeric() {
    return this == DOUBLE || this == LONG;
  }

  /** True when values of this type can be ordered (MIN/MAX, range conditions). */
  public boolean isComparable() {
    return this != BOOLEAN;
  }

  /**
   * Coerce a raw value into this type's canonical Java representation.\n
   *
   * {@code null} stays {@code null}; a NaN double is kept as-is (treated as missing by kernels).\n
   */
  public Object coerce(Object raw) {
    if (raw == null) return null;
    switch (this) {
      case TIMESTAMP:
        if (raw instanceof Instant) return raw;
        if (raw instanceof OffsetDateTime o) return o.toInstant();
        if (raw instanceof ZonedDateTime z) return z.toInstant();
        if (raw instanceof CharSequence cs) {
          try {
            return Instant.parse(cs);
          } catch (RuntimeException e) {
            throw new SchemaException("Cannot read '" + cs + "' as " + this, e);
          }
        }
        break;
      case DOUBLE:
        if (raw instanceof Double) return raw;
        if (raw instanceof Number n) return n.doubleValue();
        break;
      case LONG:
        if (raw instanceof Long) return raw;
        if (raw instanceof Integer || raw instanceof Short || raw instanceof Byte) return ((Number) raw).longValue();
        break;
      case STRING:
        if (raw instanceof String) return raw;
        if (raw instanceof CharSequence cs) return cs.toString();
        break;
      case BOOLEAN:
        if (raw instanceof Boolean) return raw;
        break;
    }
    throw new SchemaException("Value of type " + raw.getClass().getName() + " is not assignable to " + this);
  }

  /** Output type of arithmetic over this type (LONG widens to DOUBLE). */
  public ColumnType numericResult() {
    if (!isNumeric()) throw new SchemaException("Type " + this + " is not numeric");
    return DOUBLE;
  }
}

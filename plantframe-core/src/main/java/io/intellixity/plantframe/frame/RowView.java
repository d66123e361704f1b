package io.intellixity.plantframe.frame;

import java.time.Instant;

/** Read-only view of one row, handed to row closures ({@link RowFunction}, row conditions). */
public interface RowView {
  FrameSchema schema();

  Object get(String column);

  default boolean isMissing(String column) {
    return Values.isMissing(get(column));
  }

  /** Numeric value, or NaN when missing. */
  default double getDouble(String column) {
    Object v = get(column);
    if (v == null) return Double.NaN;
    if (v instanceof Number n) return n.doubleValue();
    throw new IllegalArgumentException("Column '" + column + "' is not numeric: " + v.getClass().getSimpleName());
  }

  default Instant getInstant(String column) {
    return (Instant) get(column);
  }

  default String getString(String column) {
    Object v = get(column);
    return v == null ? null : v.toString();
  }

  /** Boolean value; missing counts as false. */
  default boolean getBoolean(String column) {
    Object v = get(column);
    return v instanceof Boolean b && b;
  }
}

package io.intellixity.plantframe.query.aggregation;

import java.util.Objects;

/**
 * One output column of a resample or group aggregation.
 *
 * @param output output column name
 * @param function reducer
 * @param column input column ({@code null} only for {@link AggFunction#SIZE})
 */
public record Aggregation(String output, AggFunction function, String column) {
  public Aggregation {
    if (output == null || output.isBlank()) throw new IllegalArgumentException("output is required");
    Objects.requireNonNull(function, "function");
    if (function.requiresColumn() && (column == null || column.isBlank())) {
      throw new IllegalArgumentException(function + " requires an input column");
    }
  }

  public static Aggregation count(String column) { return new Aggregation(column + "_count", AggFunction.COUNT, column); }
  public static Aggregation size() { return new Aggregation("size", AggFunction.SIZE, null); }
  public static Aggregation sum(String column) { return new Aggregation(column, AggFunction.SUM, column); }
  public static Aggregation mean(String column) { return new Aggregation(column, AggFunction.MEAN, column); }
  public static Aggregation min(String column) { return new Aggregation(column + "_min", AggFunction.MIN, column); }
  public static Aggregation max(String column) { return new Aggregation(column + "_max", AggFunction.MAX, column); }
  public static Aggregation std(String column) { return new Aggregation(column + "_std", AggFunction.STD, column); }
  public static Aggregation nullFraction(String column) {
    return new Aggregation(column + "_nan_frac", AggFunction.NULL_FRACTION, column);
  }

  /** Same reducer, different output name. */
  public Aggregation as(String newOutput) {
    return new Aggregation(newOutput, function, column);
  }
}

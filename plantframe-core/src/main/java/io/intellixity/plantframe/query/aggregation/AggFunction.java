package io.intellixity.plantframe.query.aggregation;

import io.intellixity.plantframe.frame.ColumnType;

public enum AggFunction {
  /** Non-missing values. */
  COUNT,
  /** All rows, missing included. */
  SIZE,
  SUM,
  MEAN,
  MIN,
  MAX,
  /** Sample standard deviation (ddof = 1). */
  STD,
  /** Fraction of missing values in the bucket/group, 0.0 to 1.0. */
  NULL_FRACTION;

  public boolean requiresNumeric() {
    return this == SUM || this == MEAN || this == STD;
  }

  public boolean requiresColumn() {
    return this != SIZE;
  }

  /** Output type for an input column of the given type ({@code null} for SIZE). */
  public ColumnType outputType(ColumnType input) {
    switch (this) {
      case COUNT:
      case SIZE:
        return ColumnType.LONG;
      case MIN:
      case MAX:
        return input;
      default:
        return ColumnType.DOUBLE;
    }
  }
}

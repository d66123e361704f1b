package io.intellixity.plantframe.query;

public enum Operator {
  EQ,
  NE,
  GT,
  GE,
  LT,
  LE,

  IN,
  NIN,

  /** Inclusive on both bounds. */
  RANGE,
  /** SQL-style pattern: {@code %} any run, {@code _} one character. STRING columns only. */
  LIKE,

  /** Matches missing values (null, or NaN in DOUBLE columns); takes no operand. */
  IS_NULL;

  public boolean isOrdering() {
    return this == GT || this == GE || this == LT || this == LE || this == RANGE;
  }

  public boolean takesCollection() {
    return this == IN || this == NIN;
  }
}

package io.intellixity.plantframe.query;

import java.util.*;

public final class Condition implements FilterElement {
  private final String column;
  private final Operator operator;
  private final Object value;
  private final Object lower;
  private final Object upper;
  private final boolean not;

  public Condition(String column, Operator operator, Object value, Object lower, Object upper, boolean not) {
    this.column = Objects.requireNonNull(column, "column");
    this.operator = Objects.requireNonNull(operator, "operator");
    this.value = value;
    this.lower = lower;
    this.upper = upper;
    this.not = not;
  }

  public String column() { return column; }
  public Operator operator() { return operator; }
  public Object value() { return value; }
  public Object lower() { return lower; }
  public Object upper() { return upper; }
  public boolean not() { return not; }

  public Condition negate() {
    return new Condition(column, operator, value, lower, upper, !not);
  }

  /** Operand values as a collection (IN/NIN); a scalar is treated as a singleton. */
  public Collection<?> values() {
    if (value instanceof Collection<?> c) return c;
    if (value instanceof Object[] arr) return Arrays.asList(arr);
    return value == null ? List.of() : List.of(value);
  }

  @Override
  public <Q> Q accept(FilterVisitor<Q> visitor) { return visitor.visit(this); }

  public static Condition of(String column, Operator operator, Object value) {
    return new Condition(column, operator, value, null, null, false);
  }

  public static Condition range(String column, Object lower, Object upper) {
    return new Condition(column, Operator.RANGE, null, lower, upper, false);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Condition c)) return false;
    return not == c.not && column.equals(c.column) && operator == c.operator
        && Objects.equals(value, c.value) && Objects.equals(lower, c.lower) && Objects.equals(upper, c.upper);
  }

  @Override
  public int hashCode() {
    return Objects.hash(column, operator, value, lower, upper, not);
  }

  @Override
  public String toString() {
    String body = operator == Operator.RANGE ? "[" + lower + ", " + upper + "]" : String.valueOf(value);
    return (not ? "NOT " : "") + column + " " + operator + " " + body;
  }
}

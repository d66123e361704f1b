package io.intellixity.plantframe.query;

import io.intellixity.plantframe.frame.RowView;

import java.util.*;
import java.util.function.Predicate;

public final class Filters {
  private Filters() {}

  public static Condition eq(String column, Object value) { return Condition.of(column, Operator.EQ, value); }
  public static Condition ne(String column, Object value) { return Condition.of(column, Operator.NE, value); }
  public static Condition gt(String column, Object value) { return Condition.of(column, Operator.GT, value); }
  public static Condition ge(String column, Object value) { return Condition.of(column, Operator.GE, value); }
  public static Condition lt(String column, Object value) { return Condition.of(column, Operator.LT, value); }
  public static Condition le(String column, Object value) { return Condition.of(column, Operator.LE, value); }

  public static Condition in(String column, Collection<?> values) { return Condition.of(column, Operator.IN, List.copyOf(values)); }
  public static Condition nin(String column, Collection<?> values) { return Condition.of(column, Operator.NIN, List.copyOf(values)); }

  /** Inclusive range. */
  public static Condition range(String column, Object lower, Object upper) { return Condition.range(column, lower, upper); }

  public static Condition like(String column, String pattern) { return Condition.of(column, Operator.LIKE, pattern); }

  public static Condition isNull(String column) { return Condition.of(column, Operator.IS_NULL, null); }

  public static Condition notNull(String column) { return isNull(column).negate(); }

  public static LogicalGroup and(FilterElement... elements) {
    return new LogicalGroup(Clause.AND, List.of(elements));
  }

  public static LogicalGroup or(FilterElement... elements) {
    return new LogicalGroup(Clause.OR, List.of(elements));
  }

  public static NotElement not(FilterElement element) {
    return new NotElement(element);
  }

  public static RowCondition row(List<String> columns, Predicate<RowView> predicate) {
    return new RowCondition(columns, predicate, null);
  }

  public static RowCondition row(String description, List<String> columns, Predicate<RowView> predicate) {
    return new RowCondition(columns, predicate, description);
  }

  /** All column names referenced anywhere in the tree, in first-seen order. */
  public static Set<String> referencedColumns(FilterElement element) {
    Set<String> out = new LinkedHashSet<>();
    element.accept(new FilterVisitor<Void>() {
      @Override public Void visit(Condition c) { out.add(c.column()); return null; }
      @Override public Void visit(LogicalGroup g) { for (FilterElement e : g.elements()) e.accept(this); return null; }
      @Override public Void visit(NotElement n) { return n.element().accept(this); }
      @Override public Void visit(RowCondition r) { out.addAll(r.columns()); return null; }
    });
    return out;
  }
}

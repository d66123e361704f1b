package io.intellixity.plantframe.query;

import io.intellixity.plantframe.frame.RowView;

import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Closure predicate over named columns.\n
 *
 * The referenced columns are declared up front so they can be validated at call time; the predicate must be pure.
 * Row conditions cannot be written as filter JSON.\n
 */
public final class RowCondition implements FilterElement {
  private final List<String> columns;
  private final Predicate<RowView> predicate;
  private final String description;

  public RowCondition(List<String> columns, Predicate<RowView> predicate, String description) {
    this.columns = List.copyOf(Objects.requireNonNull(columns, "columns"));
    this.predicate = Objects.requireNonNull(predicate, "predicate");
    this.description = description == null ? "row-condition" + this.columns : description;
  }

  public List<String> columns() { return columns; }
  public Predicate<RowView> predicate() { return predicate; }
  public String description() { return description; }

  public boolean test(RowView row) {
    return predicate.test(row);
  }

  @Override
  public <Q> Q accept(FilterVisitor<Q> visitor) { return visitor.visit(this); }

  @Override
  public String toString() {
    return description;
  }
}

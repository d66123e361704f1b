package io.intellixity.plantframe.query;

import java.util.*;

public final class LogicalGroup implements FilterElement {
  private final Clause clause;
  private final List<FilterElement> elements;

  public LogicalGroup(Clause clause, List<FilterElement> elements) {
    this.clause = Objects.requireNonNull(clause, "clause");
    this.elements = List.copyOf(elements == null ? List.of() : elements);
  }

  public Clause clause() { return clause; }
  public List<FilterElement> elements() { return elements; }

  @Override
  public <Q> Q accept(FilterVisitor<Q> visitor) { return visitor.visit(this); }

  @Override
  public boolean equals(Object o) {
    return o instanceof LogicalGroup g && clause == g.clause && elements.equals(g.elements);
  }

  @Override
  public int hashCode() {
    return Objects.hash(clause, elements);
  }

  @Override
  public String toString() {
    return clause + elements.toString();
  }
}

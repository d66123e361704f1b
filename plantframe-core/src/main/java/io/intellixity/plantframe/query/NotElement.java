package io.intellixity.plantframe.query;

import java.util.Objects;

/** Unary NOT for a filter subtree (can wrap a {@link Condition} or a {@link LogicalGroup}). */
public final class NotElement implements FilterElement {
  private final FilterElement element;

  public NotElement(FilterElement element) {
    this.element = Objects.requireNonNull(element, "element");
  }

  public FilterElement element() { return element; }

  @Override
  public <Q> Q accept(FilterVisitor<Q> visitor) {
    return visitor.visit(this);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof NotElement n && element.equals(n.element);
  }

  @Override
  public int hashCode() {
    return element.hashCode() * 31 + 7;
  }

  @Override
  public String toString() {
    return "NOT(" + element + ")";
  }
}

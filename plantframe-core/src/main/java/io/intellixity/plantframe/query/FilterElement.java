package io.intellixity.plantframe.query;

/** Node of a row filter predicate. */
public interface FilterElement {
  <Q> Q accept(FilterVisitor<Q> visitor);
}

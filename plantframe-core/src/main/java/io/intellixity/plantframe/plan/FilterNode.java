package io.intellixity.plantframe.plan;

import io.intellixity.plantframe.frame.FrameSchema;
import io.intellixity.plantframe.query.FilterElement;

import java.util.List;
import java.util.Objects;

/** Row filter; {@code predicate} has its operands already coerced to the column types. */
public record FilterNode(PlanNode input, FilterElement predicate) implements PlanNode {
  public FilterNode {
    Objects.requireNonNull(input, "input");
    Objects.requireNonNull(predicate, "predicate");
  }

  @Override public FrameSchema schema() { return input.schema(); }
  @Override public List<PlanNode> inputs() { return List.of(input); }
  @Override public <R> R accept(PlanVisitor<R> visitor) { return visitor.visit(this); }
}

package io.intellixity.plantframe.plan;

import io.intellixity.plantframe.frame.FrameSchema;

import java.util.List;
import java.util.Objects;

public record SelectNode(PlanNode input, List<String> columns, FrameSchema schema) implements PlanNode {
  public SelectNode {
    Objects.requireNonNull(input, "input");
    columns = List.copyOf(columns);
    Objects.requireNonNull(schema, "schema");
  }

  @Override public List<PlanNode> inputs() { return List.of(input); }
  @Override public <R> R accept(PlanVisitor<R> visitor) { return visitor.visit(this); }
}

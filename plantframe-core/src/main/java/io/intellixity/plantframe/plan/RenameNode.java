package io.intellixity.plantframe.plan;

import io.intellixity.plantframe.frame.FrameSchema;

import java.util.List;
import java.util.Map;
import java.util.Objects;

public record RenameNode(PlanNode input, Map<String, String> mapping, FrameSchema schema) implements PlanNode {
  public RenameNode {
    Objects.requireNonNull(input, "input");
    mapping = Map.copyOf(mapping);
    Objects.requireNonNull(schema, "schema");
  }

  @Override public List<PlanNode> inputs() { return List.of(input); }
  @Override public <R> R accept(PlanVisitor<R> visitor) { return visitor.visit(this); }
}

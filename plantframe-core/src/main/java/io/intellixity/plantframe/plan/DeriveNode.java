package io.intellixity.plantframe.plan;

import io.intellixity.plantframe.frame.Column;
import io.intellixity.plantframe.frame.FrameSchema;
import io.intellixity.plantframe.frame.RowFunction;

import java.util.List;
import java.util.Objects;

/** Computed column, appended or replacing an existing column of the same name. */
public record DeriveNode(PlanNode input, Column column, RowFunction function, FrameSchema schema) implements PlanNode {
  public DeriveNode {
    Objects.requireNonNull(input, "input");
    Objects.requireNonNull(column, "column");
    Objects.requireNonNull(function, "function");
    Objects.requireNonNull(schema, "schema");
  }

  @Override public List<PlanNode> inputs() { return List.of(input); }
  @Override public <R> R accept(PlanVisitor<R> visitor) { return visitor.visit(this); }
}

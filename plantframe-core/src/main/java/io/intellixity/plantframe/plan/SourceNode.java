package io.intellixity.plantframe.plan;

import io.intellixity.plantframe.frame.DatasetRef;
import io.intellixity.plantframe.frame.FrameSchema;
import io.intellixity.plantframe.frame.MaterializedFrame;

import java.util.List;
import java.util.Objects;

/** Leaf: rows handed to the engine by a loader or by an eager evaluation. */
public record SourceNode(MaterializedFrame data, DatasetRef dataset) implements PlanNode {
  public SourceNode {
    Objects.requireNonNull(data, "data");
  }

  @Override public FrameSchema schema() { return data.schema(); }
  @Override public List<PlanNode> inputs() { return List.of(); }
  @Override public <R> R accept(PlanVisitor<R> visitor) { return visitor.visit(this); }
}

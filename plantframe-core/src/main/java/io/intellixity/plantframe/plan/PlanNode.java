package io.intellixity.plantframe.plan;

import io.intellixity.plantframe.frame.FrameSchema;

import java.util.List;

/**
 * Logical plan node. Nodes are immutable and carry their already-validated output schema.\n
 *
 * Eager engines evaluate a node as soon as it is built; lazy engines keep the tree and interpret it at materialize.\n
 */
public interface PlanNode {
  FrameSchema schema();

  List<PlanNode> inputs();

  <R> R accept(PlanVisitor<R> visitor);

  /** Short operator label for logs and diagnostics. */
  default String label() {
    return getClass().getSimpleName().replace("Node", "").toLowerCase();
  }
}

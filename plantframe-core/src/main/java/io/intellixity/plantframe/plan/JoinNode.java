package io.intellixity.plantframe.plan;

import io.intellixity.plantframe.frame.FrameSchema;

import java.util.List;
import java.util.Objects;

/**
 * Equi-join on same-named key columns.\n
 *
 * Output columns: left columns in order, then right non-key columns. Key columns of unmatched right rows are
 * taken from the right side.\n
 */
public record JoinNode(PlanNode left, PlanNode right, List<String> on, JoinType how, FrameSchema schema)
    implements PlanNode {
  public JoinNode {
    Objects.requireNonNull(left, "left");
    Objects.requireNonNull(right, "right");
    on = List.copyOf(on);
    Objects.requireNonNull(how, "how");
    Objects.requireNonNull(schema, "schema");
  }

  @Override public List<PlanNode> inputs() { return List.of(left, right); }
  @Override public <R> R accept(PlanVisitor<R> visitor) { return visitor.visit(this); }
}

package io.intellixity.plantframe.plan;

import io.intellixity.plantframe.frame.FrameSchema;
import io.intellixity.plantframe.query.aggregation.Aggregation;
import io.intellixity.plantframe.query.aggregation.GroupBy;

import java.util.List;
import java.util.Objects;

public record GroupAggregateNode(PlanNode input, GroupBy groupBy, List<Aggregation> aggregations, FrameSchema schema)
    implements PlanNode {
  public GroupAggregateNode {
    Objects.requireNonNull(input, "input");
    Objects.requireNonNull(groupBy, "groupBy");
    aggregations = List.copyOf(aggregations);
    Objects.requireNonNull(schema, "schema");
  }

  @Override public List<PlanNode> inputs() { return List.of(input); }
  @Override public <R> R accept(PlanVisitor<R> visitor) { return visitor.visit(this); }
}

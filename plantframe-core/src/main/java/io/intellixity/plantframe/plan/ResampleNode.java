package io.intellixity.plantframe.plan;

import io.intellixity.plantframe.frame.FrameSchema;
import io.intellixity.plantframe.query.aggregation.Aggregation;
import io.intellixity.plantframe.time.Frequency;

import java.time.ZoneId;
import java.util.List;
import java.util.Objects;

public record ResampleNode(PlanNode input,
                           String timeColumn,
                           Frequency frequency,
                           List<Aggregation> aggregations,
                           ZoneId zone,
                           FrameSchema schema) implements PlanNode {
  public ResampleNode {
    Objects.requireNonNull(input, "input");
    Objects.requireNonNull(timeColumn, "timeColumn");
    Objects.requireNonNull(frequency, "frequency");
    aggregations = List.copyOf(aggregations);
    Objects.requireNonNull(zone, "zone");
    Objects.requireNonNull(schema, "schema");
  }

  @Override public List<PlanNode> inputs() { return List.of(input); }
  @Override public <R> R accept(PlanVisitor<R> visitor) { return visitor.visit(this); }
}

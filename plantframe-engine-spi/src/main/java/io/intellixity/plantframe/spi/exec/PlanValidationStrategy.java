package io.intellixity.plantframe.spi.exec;

import io.intellixity.plantframe.frame.Column;
import io.intellixity.plantframe.frame.FrameSchema;
import io.intellixity.plantframe.plan.JoinType;
import io.intellixity.plantframe.query.FilterElement;
import io.intellixity.plantframe.query.aggregation.Aggregation;
import io.intellixity.plantframe.query.aggregation.GroupBy;

import java.util.List;
import java.util.Map;

/**
 * SPI hook to validate operations at call time and derive their output schema.
 * <p>
 * Engines call this before building a plan node, so schema problems surface synchronously from the operation that
 * caused them. Implementations throw {@link io.intellixity.plantframe.error.SchemaException}.
 */
public interface PlanValidationStrategy {
  FrameSchema validateSelect(FrameSchema input, List<String> columns);

  /** Returns the predicate with operands coerced to the column types. */
  FilterElement validateFilter(FrameSchema input, FilterElement predicate);

  FrameSchema validateDerive(FrameSchema input, Column column);

  FrameSchema validateRename(FrameSchema input, Map<String, String> mapping);

  FrameSchema validateResample(FrameSchema input, String timeColumn, List<Aggregation> aggregations);

  FrameSchema validateJoin(FrameSchema left, FrameSchema right, List<String> on, JoinType how);

  FrameSchema validateGroupAggregate(FrameSchema input, GroupBy groupBy, List<Aggregation> aggregations);
}

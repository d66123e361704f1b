package io.intellixity.plantframe.exec;

import io.intellixity.plantframe.frame.Column;
import io.intellixity.plantframe.frame.DatasetRef;
import io.intellixity.plantframe.frame.MaterializedFrame;
import io.intellixity.plantframe.frame.RowFunction;
import io.intellixity.plantframe.plan.JoinType;
import io.intellixity.plantframe.query.FilterElement;
import io.intellixity.plantframe.query.aggregation.Aggregation;
import io.intellixity.plantframe.query.aggregation.GroupBy;
import io.intellixity.plantframe.time.Frequency;

import java.time.ZoneId;
import java.util.List;
import java.util.Map;

/**
 * Uniform computational interface over one execution engine.\n
 *
 * All operations except {@link #materialize} validate their arguments synchronously (schema, ownership,
 * cancellation) and return a new immutable handle. Only {@code materialize} runs work and may fail with
 * out-of-resources, cancellation or engine execution errors.\n
 */
public interface BackendEngine extends AutoCloseable {
  EngineDescriptor descriptor();

  /** Zone used by {@link #resample(ComputationHandle, String, Frequency, List)}. */
  ZoneId defaultZone();

  /** Bring rows under this engine's control. */
  ComputationHandle source(MaterializedFrame data, DatasetRef dataset);

  ComputationHandle select(ComputationHandle input, List<String> columns);

  ComputationHandle filter(ComputationHandle input, FilterElement predicate);

  ComputationHandle derive(ComputationHandle input, Column column, RowFunction function);

  ComputationHandle rename(ComputationHandle input, Map<String, String> mapping);

  ComputationHandle resample(ComputationHandle input, String timeColumn, Frequency frequency,
                             List<Aggregation> aggregations, ZoneId zone);

  default ComputationHandle resample(ComputationHandle input, String timeColumn, Frequency frequency,
                                     List<Aggregation> aggregations) {
    return resample(input, timeColumn, frequency, aggregations, defaultZone());
  }

  ComputationHandle join(ComputationHandle left, ComputationHandle right, List<String> on, JoinType how);

  ComputationHandle groupAggregate(ComputationHandle input, GroupBy groupBy, List<Aggregation> aggregations);

  /** Deterministic snapshot; idempotent per handle (the second call returns the cached frame). */
  MaterializedFrame materialize(ComputationHandle handle);

  /** Fire-and-forget cancellation of the handle and any in-flight job producing it. */
  void cancel(ComputationHandle handle);

  EngineStats stats();

  /** Release workers and scheduler resources. Handles become unusable. */
  @Override
  void close();
}

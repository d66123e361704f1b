package io.intellixity.plantframe.exec;

import io.intellixity.plantframe.error.CancelledException;
import io.intellixity.plantframe.frame.*;
import io.intellixity.plantframe.plan.JoinType;
import io.intellixity.plantframe.plan.PlanNode;
import io.intellixity.plantframe.query.FilterElement;
import io.intellixity.plantframe.query.aggregation.Aggregation;
import io.intellixity.plantframe.query.aggregation.GroupBy;
import io.intellixity.plantframe.time.Frequency;

import java.time.ZoneId;
import java.util.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Engine-agnostic, immutable reference to a (possibly not yet computed) dataset.\n
 *
 * Handles are created only by engines. Every operation returns a new handle owned by the same engine; the
 * convenience methods here delegate to {@link #engine()}.\n
 */
public final class ComputationHandle {
  private static final AtomicLong SEQ = new AtomicLong();

  private final String id;
  private final BackendEngine engine;
  private final PlanNode plan;
  private final Partitioning partitioning;
  private final boolean ordered;
  private final List<DatasetRef> lineage;
  private final Object engineState;

  private final AtomicReference<MaterializedFrame> snapshot = new AtomicReference<>();
  private final AtomicBoolean cancelled = new AtomicBoolean();

  /**
   * @param engineState engine-private payload (e.g. eagerly computed rows); never inspected outside the engine
   */
  public ComputationHandle(BackendEngine engine,
                           PlanNode plan,
                           Partitioning partitioning,
                           boolean ordered,
                           List<DatasetRef> lineage,
                           Object engineState) {
    this.engine = Objects.requireNonNull(engine, "engine");
    this.plan = Objects.requireNonNull(plan, "plan");
    this.partitioning = Objects.requireNonNull(partitioning, "partitioning");
    this.ordered = ordered;
    this.lineage = List.copyOf(lineage == null ? List.of() : lineage);
    this.engineState = engineState;
    this.id = engine.descriptor().id() + "#h" + SEQ.incrementAndGet();
  }

  public String id() { return id; }
  public FrameSchema schema() { return plan.schema(); }
  public Partitioning partitioning() { return partitioning; }
  public boolean isOrdered() { return ordered; }
  public BackendEngine engine() { return engine; }
  public List<DatasetRef> lineage() { return lineage; }
  public PlanNode plan() { return plan; }
  public Object engineState() { return engineState; }

  public boolean isOwnedBy(BackendEngine e) {
    return engine == e;
  }

  public boolean isCancelled() {
    return cancelled.get();
  }

  /** Throws {@link CancelledException} if this handle has been cancelled. */
  public void ensureLive() {
    if (cancelled.get()) throw new CancelledException("Handle " + id + " was cancelled");
  }

  /** Engine-side: mark cancelled. Returns true on the first call. */
  public boolean markCancelled() {
    return cancelled.compareAndSet(false, true);
  }

  /** Engine-side: cached snapshot, or null before the first successful materialize. */
  public MaterializedFrame snapshotOrNull() {
    return snapshot.get();
  }

  /** Engine-side: memoize the first snapshot; returns the one that won. */
  public MaterializedFrame cacheSnapshot(MaterializedFrame frame) {
    Objects.requireNonNull(frame, "frame");
    return snapshot.compareAndSet(null, frame) ? frame : snapshot.get();
  }

  // --- convenience operations (delegate to the owning engine) ---

  public ComputationHandle select(String... columns) {
    return engine.select(this, List.of(columns));
  }

  public ComputationHandle select(List<String> columns) {
    return engine.select(this, columns);
  }

  public ComputationHandle filter(FilterElement predicate) {
    return engine.filter(this, predicate);
  }

  public ComputationHandle derive(String column, ColumnType type, RowFunction function) {
    return engine.derive(this, new Column(column, type), function);
  }

  public ComputationHandle rename(Map<String, String> mapping) {
    return engine.rename(this, mapping);
  }

  public ComputationHandle resample(String timeColumn, String frequency, Aggregation... aggregations) {
    return engine.resample(this, timeColumn, Frequency.parse(frequency), List.of(aggregations));
  }

  public ComputationHandle resample(String timeColumn, Frequency frequency, List<Aggregation> aggregations, ZoneId zone) {
    return engine.resample(this, timeColumn, frequency, aggregations, zone);
  }

  public ComputationHandle join(ComputationHandle other, List<String> on, JoinType how) {
    return engine.join(this, other, on, how);
  }

  public ComputationHandle groupAggregate(List<String> keys, Aggregation... aggregations) {
    return engine.groupAggregate(this, new GroupBy(keys), List.of(aggregations));
  }

  public MaterializedFrame materialize() {
    return engine.materialize(this);
  }

  public void cancel() {
    engine.cancel(this);
  }

  @Override
  public String toString() {
    return "ComputationHandle{" + id + ", schema=" + schema() + ", partitioning=" + partitioning
        + ", ordered=" + ordered + ", op=" + plan.label() + "}";
  }
}

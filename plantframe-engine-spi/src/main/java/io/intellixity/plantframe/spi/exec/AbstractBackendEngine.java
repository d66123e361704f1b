package io.intellixity.plantframe.spi.exec;

import io.intellixity.plantframe.error.*;
import io.intellixity.plantframe.exec.*;
import io.intellixity.plantframe.frame.*;
import io.intellixity.plantframe.plan.*;
import io.intellixity.plantframe.query.FilterElement;
import io.intellixity.plantframe.query.aggregation.Aggregation;
import io.intellixity.plantframe.query.aggregation.GroupBy;
import io.intellixity.plantframe.spi.kernel.CanonicalOrder;
import io.intellixity.plantframe.spi.kernel.RowSet;
import io.intellixity.plantframe.time.Frequency;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.ZoneId;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Template-method orchestrator for backend engines.\n
 *
 * Responsibilities:\n
 * - ownership, liveness and schema validation of every operation (synchronous)\n
 * - plan node construction and handle bookkeeping\n
 * - materialize: snapshot memoization (one job per handle, concurrent callers share it), job budget, memory\n
 *   budget, canonical ordering of plans without a defined row order, error wrapping, stats\n
 * - cancellation forwarding to in-flight jobs\n
 *
 * Engines plug in through the protected hooks.\n
 */
public abstract class AbstractBackendEngine implements BackendEngine {
  private static final Logger log = LoggerFactory.getLogger(AbstractBackendEngine.class);

  private final EngineDescriptor descriptor;
  private final ZoneId defaultZone;
  private final PlanValidationStrategy validation;
  private final Semaphore jobPermits;
  private final Map<String, JobControl> running = new ConcurrentHashMap<>();
  private final Map<String, CompletableFuture<MaterializedFrame>> inFlight = new ConcurrentHashMap<>();
  private final AtomicBoolean closed = new AtomicBoolean();
  private final AtomicLong jobSeq = new AtomicLong();

  private final AtomicLong jobsSubmitted = new AtomicLong();
  private final AtomicLong jobsSucceeded = new AtomicLong();
  private final AtomicLong jobsFailed = new AtomicLong();
  private final AtomicLong jobsCancelled = new AtomicLong();
  private final AtomicLong jobsRejected = new AtomicLong();
  private final AtomicLong rowsMaterialized = new AtomicLong();

  /**
   * DI-friendly constructor: callers may provide a stricter validation strategy.\n
   */
  protected AbstractBackendEngine(EngineSettings settings, ExecutionMode mode, PlanValidationStrategy validation) {
    Objects.requireNonNull(settings, "settings");
    this.descriptor = new EngineDescriptor(settings.engineId(), settings.variant(),
        Objects.requireNonNull(mode, "mode"), settings.limits());
    this.defaultZone = settings.zone();
    this.validation = (validation == null) ? new DefaultPlanValidationStrategy() : validation;
    this.jobPermits = new Semaphore(settings.limits().maxConcurrentJobs());
  }

  protected AbstractBackendEngine(EngineSettings settings, ExecutionMode mode) {
    this(settings, mode, null);
  }

  @Override
  public final EngineDescriptor descriptor() {
    return descriptor;
  }

  @Override
  public final ZoneId defaultZone() {
    return defaultZone;
  }

  protected final PlanValidationStrategy validation() {
    return validation;
  }

  // --- operations ---

  @Override
  public final ComputationHandle source(MaterializedFrame data, DatasetRef dataset) {
    checkOpen();
    Objects.requireNonNull(data, "data");
    SourceNode node = new SourceNode(data, dataset);
    return newHandle(node, List.of(), dataset == null ? List.of() : List.of(dataset));
  }

  @Override
  public final ComputationHandle select(ComputationHandle input, List<String> columns) {
    ComputationHandle in = checkInput(input);
    FrameSchema out = validation.validateSelect(in.schema(), columns);
    return derived(new SelectNode(in.plan(), columns, out), in);
  }

  @Override
  public final ComputationHandle filter(ComputationHandle input, FilterElement predicate) {
    ComputationHandle in = checkInput(input);
    FilterElement validated = validation.validateFilter(in.schema(), predicate);
    return derived(new FilterNode(in.plan(), validated), in);
  }

  @Override
  public final ComputationHandle derive(ComputationHandle input, Column column, RowFunction function) {
    ComputationHandle in = checkInput(input);
    Objects.requireNonNull(function, "function");
    FrameSchema out = validation.validateDerive(in.schema(), column);
    return derived(new DeriveNode(in.plan(), column, function, out), in);
  }

  @Override
  public final ComputationHandle rename(ComputationHandle input, Map<String, String> mapping) {
    ComputationHandle in = checkInput(input);
    FrameSchema out = validation.validateRename(in.schema(), mapping);
    return derived(new RenameNode(in.plan(), mapping, out), in);
  }

  @Override
  public final ComputationHandle resample(ComputationHandle input, String timeColumn, Frequency frequency,
                                          List<Aggregation> aggregations, ZoneId zone) {
    ComputationHandle in = checkInput(input);
    Objects.requireNonNull(frequency, "frequency");
    FrameSchema out = validation.validateResample(in.schema(), timeColumn, aggregations);
    ZoneId z = zone == null ? defaultZone : zone;
    return derived(new ResampleNode(in.plan(), timeColumn, frequency, aggregations, z, out), in);
  }

  @Override
  public final ComputationHandle join(ComputationHandle left, ComputationHandle right, List<String> on, JoinType how) {
    ComputationHandle l = checkInput(left);
    ComputationHandle r = checkInput(right);
    FrameSchema out = validation.validateJoin(l.schema(), r.schema(), on, how);
    JoinNode node = new JoinNode(l.plan(), r.plan(), on, how, out);
    return newHandle(node, List.of(l, r), lineage(l, r));
  }

  @Override
  public final ComputationHandle groupAggregate(ComputationHandle input, GroupBy groupBy, List<Aggregation> aggregations) {
    ComputationHandle in = checkInput(input);
    List<Aggregation> aggs = aggregations == null ? List.of() : aggregations;
    FrameSchema out = validation.validateGroupAggregate(in.schema(), groupBy, aggs);
    return derived(new GroupAggregateNode(in.plan(), groupBy, aggs, out), in);
  }

  @Override
  public final MaterializedFrame materialize(ComputationHandle handle) {
    ComputationHandle h = checkInput(handle);
    MaterializedFrame cached = h.snapshotOrNull();
    if (cached != null) return cached;

    CompletableFuture<MaterializedFrame> mine = new CompletableFuture<>();
    CompletableFuture<MaterializedFrame> current = inFlight.putIfAbsent(h.id(), mine);
    if (current != null) return awaitShared(h, current);
    try {
      // the previous job may have finished between the cache check and the claim
      MaterializedFrame frame = h.snapshotOrNull();
      if (frame == null) frame = runJob(h);
      mine.complete(frame);
      return frame;
    } catch (RuntimeException | Error e) {
      mine.completeExceptionally(e);
      throw e;
    } finally {
      inFlight.remove(h.id(), mine);
    }
  }

  /** Wait for the job another caller started on the same handle; its failure is rethrown as-is. */
  private MaterializedFrame awaitShared(ComputationHandle h, CompletableFuture<MaterializedFrame> job) {
    try {
      return job.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CancelledException("Interrupted while waiting for the materialize of " + h.id(), e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException re) throw re;
      if (cause instanceof Error err) throw err;
      throw new EngineExecutionException(descriptor.id(), "materialize of " + h.id() + " failed", cause);
    }
  }

  private MaterializedFrame runJob(ComputationHandle h) {
    if (!jobPermits.tryAcquire()) {
      jobsRejected.incrementAndGet();
      throw new OutOfResourcesException("Engine " + descriptor.id() + " already runs "
          + descriptor.limits().maxConcurrentJobs() + " jobs; materialize of " + h.id() + " rejected");
    }

    JobControl job = new JobControl(descriptor.id() + "-job-" + jobSeq.incrementAndGet(), h.id());
    running.put(h.id(), job);
    jobsSubmitted.incrementAndGet();
    long t0 = System.nanoTime();
    debugSubmit(h, job);
    try {
      // a cancel that raced the registration above
      if (h.isCancelled()) job.cancel();
      RowSet rows = execute(h, job);
      job.checkpoint();

      long cells = (long) rows.size() * h.schema().size();
      if (cells > descriptor.limits().memoryBudgetCells()) {
        throw new OutOfResourcesException("Result of " + h.id() + " has " + cells + " cells; engine "
            + descriptor.id() + " budget is " + descriptor.limits().memoryBudgetCells());
      }

      List<List<Object>> ordered = CanonicalOrder.isDefined(h.plan()) ? rows.rows() : CanonicalOrder.sort(rows.rows());
      MaterializedFrame frame = h.cacheSnapshot(MaterializedFrame.trusted(h.schema(), ordered));
      jobsSucceeded.incrementAndGet();
      rowsMaterialized.addAndGet(frame.rowCount());
      debugDone(h, job, "ok", frame.rowCount(), System.nanoTime() - t0);
      return frame;
    } catch (CancelledException e) {
      jobsCancelled.incrementAndGet();
      debugDone(h, job, "cancelled", -1, System.nanoTime() - t0);
      throw e;
    } catch (PlantframeException e) {
      jobsFailed.incrementAndGet();
      debugDone(h, job, e.kind().name().toLowerCase(), -1, System.nanoTime() - t0);
      throw e;
    } catch (RuntimeException e) {
      if (job.isCancelled()) {
        jobsCancelled.incrementAndGet();
        debugDone(h, job, "cancelled", -1, System.nanoTime() - t0);
        throw new CancelledException("Job " + job.jobId() + " for handle " + h.id() + " was cancelled", e);
      }
      jobsFailed.incrementAndGet();
      debugDone(h, job, "engine_execution", -1, System.nanoTime() - t0);
      throw new EngineExecutionException(descriptor.id(), "materialize of " + h.id() + " failed: " + e.getMessage(), e);
    } finally {
      running.remove(h.id(), job);
      jobPermits.release();
    }
  }

  @Override
  public final void cancel(ComputationHandle handle) {
    Objects.requireNonNull(handle, "handle");
    requireOwned(handle);
    if (!handle.markCancelled()) return;
    JobControl job = running.get(handle.id());
    if (job != null) job.cancel();
    onCancel(handle, job);
    if (log.isDebugEnabled()) {
      log.debug("plantframe.engine op=cancel engine={} handle={} inFlight={}", descriptor.id(), handle.id(), job != null);
    }
  }

  @Override
  public final EngineStats stats() {
    return new EngineStats(jobsSubmitted.get(), jobsSucceeded.get(), jobsFailed.get(), jobsCancelled.get(),
        jobsRejected.get(), rowsMaterialized.get());
  }

  @Override
  public final void close() {
    if (!closed.compareAndSet(false, true)) return;
    for (JobControl j : running.values()) j.cancel();
    onClose();
    log.debug("plantframe.engine op=close engine={} stats={}", descriptor.id(), stats());
  }

  public final boolean isClosed() {
    return closed.get();
  }

  // --- helpers ---

  private ComputationHandle derived(PlanNode node, ComputationHandle input) {
    return newHandle(node, List.of(input), input.lineage());
  }

  private ComputationHandle newHandle(PlanNode node, List<ComputationHandle> inputs, List<DatasetRef> lineage) {
    Object state = prepare(node, inputs);
    return new ComputationHandle(this, node, partitioningAfter(node, inputs), orderedAfter(node, inputs), lineage, state);
  }

  private static List<DatasetRef> lineage(ComputationHandle l, ComputationHandle r) {
    LinkedHashSet<DatasetRef> out = new LinkedHashSet<>(l.lineage());
    out.addAll(r.lineage());
    return new ArrayList<>(out);
  }

  private ComputationHandle checkInput(ComputationHandle h) {
    checkOpen();
    Objects.requireNonNull(h, "handle");
    requireOwned(h);
    h.ensureLive();
    return h;
  }

  private void requireOwned(ComputationHandle h) {
    if (!h.isOwnedBy(this)) {
      throw new BindingMismatchException("Handle " + h.id() + " belongs to engine " + h.engine().descriptor().id()
          + ", not to " + descriptor.id());
    }
  }

  private void checkOpen() {
    if (closed.get()) throw new IllegalStateException("Engine " + descriptor.id() + " is closed");
  }

  private void debugSubmit(ComputationHandle h, JobControl job) {
    if (!log.isDebugEnabled()) return;
    log.debug("plantframe.engine op=materialize engine={} variant={} job={} handle={} plan={} partitioning={} ordered={}",
        descriptor.id(), descriptor.variant(), job.jobId(), h.id(), h.plan().label(), h.partitioning(), h.isOrdered());
  }

  private void debugDone(ComputationHandle h, JobControl job, String outcome, long rows, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("plantframe.engine_done op=materialize engine={} job={} handle={} outcome={} rows={} durationMs={}",
        descriptor.id(), job.jobId(), h.id(), outcome, rows, durationNanos / 1_000_000.0);
  }

  // --- engine hooks ---

  /**
   * Called when a node is created. Eager engines compute and return the node's rows here; lazy engines return
   * null. Inputs are already validated.
   */
  protected abstract Object prepare(PlanNode node, List<ComputationHandle> inputs);

  protected abstract Partitioning partitioningAfter(PlanNode node, List<ComputationHandle> inputs);

  /**
   * Whether the node's partitions hold rows in logical order, as reported by {@link ComputationHandle#isOrdered()}.
   * Snapshots do not depend on it: their order follows {@link CanonicalOrder#isDefined(PlanNode)} on every engine.
   * Default rule: sources are ordered per
   * {@link #sourceOrdered()}, narrow operations inherit, resample and group aggregation produce sorted output, a
   * join keeps order only for INNER/LEFT over two ordered inputs.
   */
  protected boolean orderedAfter(PlanNode node, List<ComputationHandle> inputs) {
    if (node instanceof SourceNode) return sourceOrdered();
    if (node instanceof ResampleNode || node instanceof GroupAggregateNode) return true;
    if (node instanceof JoinNode j) {
      return inputs.get(0).isOrdered() && inputs.get(1).isOrdered()
          && (j.how() == JoinType.INNER || j.how() == JoinType.LEFT);
    }
    return inputs.get(0).isOrdered();
  }

  protected boolean sourceOrdered() {
    return true;
  }

  /** Compute the handle's rows. Runs with a job permit held; must honour {@link JobControl#checkpoint()}. */
  protected abstract RowSet execute(ComputationHandle handle, JobControl job);

  /** Cancellation hook; {@code job} is null when no materialize is in flight for the handle. */
  protected void onCancel(ComputationHandle handle, JobControl job) {}

  /** Release engine resources (pools, schedulers). */
  protected void onClose() {}
}

package io.intellixity.plantframe.engine.cluster;

import io.intellixity.plantframe.error.CancelledException;
import io.intellixity.plantframe.exec.ComputationHandle;
import io.intellixity.plantframe.exec.EngineSettings;
import io.intellixity.plantframe.exec.ExecutionMode;
import io.intellixity.plantframe.exec.Partitioning;
import io.intellixity.plantframe.plan.*;
import io.intellixity.plantframe.spi.exec.AbstractBackendEngine;
import io.intellixity.plantframe.spi.exec.JobControl;
import io.intellixity.plantframe.spi.exec.PlanValidationStrategy;
import io.intellixity.plantframe.spi.kernel.RowSet;
import io.intellixity.plantframe.spi.partition.PartitionedInterpreter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;

/**
 * Lazy engine submitting plans as jobs to a {@link ClusterScheduler}.\n
 *
 * Rows are spread round-robin over the executor nodes and wide operations hash-shuffle, so no partition holds
 * rows in order and handles report themselves unordered. Rows keep their logical positions and the gather merges
 * on them, so snapshots equal those of the other engines. With option {@code preserve-order=true} sources are
 * split contiguously and handles report their ordering.\n
 */
public final class ClusterBackendEngine extends AbstractBackendEngine {
  private static final Logger log = LoggerFactory.getLogger(ClusterBackendEngine.class);

  public static final String OPTION_PRESERVE_ORDER = "preserve-order";
  public static final String OPTION_PARTITIONS = "partitions";

  private final ClusterScheduler scheduler;
  private final boolean ownsScheduler;
  private final boolean preserveOrder;
  private final int partitions;
  private final PartitionedInterpreter interpreter;

  public ClusterBackendEngine(EngineSettings settings, ClusterScheduler scheduler, boolean ownsScheduler) {
    this(settings, scheduler, ownsScheduler, null);
  }

  public ClusterBackendEngine(EngineSettings settings, ClusterScheduler scheduler, boolean ownsScheduler,
                              PlanValidationStrategy validation) {
    super(settings, ExecutionMode.LAZY_DISTRIBUTED, validation);
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.ownsScheduler = ownsScheduler;
    this.preserveOrder = settings.booleanOption(OPTION_PRESERVE_ORDER, false);
    this.partitions = settings.intOption(OPTION_PARTITIONS, scheduler.executorCount());
    if (partitions < 1) throw new IllegalArgumentException("Option '" + OPTION_PARTITIONS + "' must be >= 1");
    this.interpreter = new PartitionedInterpreter(new ClusterTaskRunner(scheduler), partitions,
        preserveOrder ? PartitionedInterpreter.SourceSplit.CONTIGUOUS : PartitionedInterpreter.SourceSplit.ROUND_ROBIN,
        settings.limits().memoryBudgetCells());
    log.debug("plantframe.cluster op=start engine={} scheduler={} partitions={} preserveOrder={}",
        settings.engineId(), scheduler.name(), partitions, preserveOrder);
  }

  public boolean preservesOrder() {
    return preserveOrder;
  }

  @Override
  protected Object prepare(PlanNode node, List<ComputationHandle> inputs) {
    return null;
  }

  @Override
  protected boolean sourceOrdered() {
    return preserveOrder;
  }

  @Override
  protected boolean orderedAfter(PlanNode node, List<ComputationHandle> inputs) {
    return preserveOrder && super.orderedAfter(node, inputs);
  }

  @Override
  protected Partitioning partitioningAfter(PlanNode node, List<ComputationHandle> inputs) {
    if (node instanceof SourceNode) {
      return new Partitioning(preserveOrder ? Partitioning.Scheme.CONTIGUOUS : Partitioning.Scheme.ROUND_ROBIN, partitions);
    }
    if (node instanceof ResampleNode || node instanceof GroupAggregateNode || node instanceof JoinNode) {
      return new Partitioning(Partitioning.Scheme.HASH, partitions);
    }
    return inputs.get(0).partitioning();
  }

  @Override
  protected RowSet execute(ComputationHandle handle, JobControl job) {
    ClusterJob<RowSet> submitted = scheduler.submit(job.jobId(), () -> interpreter.execute(handle.plan(), job));
    job.onCancel(submitted::cancel);
    try {
      return submitted.await();
    } catch (CancellationException e) {
      throw new CancelledException("Cluster job " + submitted.id() + " was cancelled", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      job.cancel();
      throw new CancelledException("Interrupted while waiting for cluster job " + submitted.id(), e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException re) throw re;
      if (cause instanceof Error err) throw err;
      throw new IllegalStateException("Cluster job " + submitted.id() + " failed", cause);
    }
  }

  @Override
  protected void onClose() {
    if (ownsScheduler) scheduler.close();
  }
}

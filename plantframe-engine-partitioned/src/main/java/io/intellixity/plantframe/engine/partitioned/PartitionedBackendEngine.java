package io.intellixity.plantframe.engine.partitioned;

import io.intellixity.plantframe.exec.ComputationHandle;
import io.intellixity.plantframe.exec.EngineSettings;
import io.intellixity.plantframe.exec.ExecutionMode;
import io.intellixity.plantframe.exec.Partitioning;
import io.intellixity.plantframe.plan.*;
import io.intellixity.plantframe.spi.exec.AbstractBackendEngine;
import io.intellixity.plantframe.spi.exec.JobControl;
import io.intellixity.plantframe.spi.exec.PlanValidationStrategy;
import io.intellixity.plantframe.spi.kernel.RowSet;
import io.intellixity.plantframe.spi.partition.ExecutorTaskRunner;
import io.intellixity.plantframe.spi.partition.PartitionedInterpreter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lazy engine running plans on a fixed worker pool of one process.\n
 *
 * Sources are cut into contiguous partitions (option {@code partitions}, default: one per worker). Operations only
 * extend the plan; {@code materialize} executes it stage by stage on the pool.\n
 */
public final class PartitionedBackendEngine extends AbstractBackendEngine {
  private static final Logger log = LoggerFactory.getLogger(PartitionedBackendEngine.class);

  public static final String OPTION_PARTITIONS = "partitions";

  private final ExecutorService workers;
  private final PartitionedInterpreter interpreter;
  private final int partitions;

  public PartitionedBackendEngine(EngineSettings settings) {
    this(settings, null);
  }

  public PartitionedBackendEngine(EngineSettings settings, PlanValidationStrategy validation) {
    super(settings, ExecutionMode.LAZY_PARTITIONED, validation);
    int poolSize = settings.limits().workers();
    this.partitions = settings.intOption(OPTION_PARTITIONS, poolSize);
    if (partitions < 1) throw new IllegalArgumentException("Option '" + OPTION_PARTITIONS + "' must be >= 1");
    this.workers = Executors.newFixedThreadPool(poolSize, workerThreads(settings.engineId()));
    this.interpreter = new PartitionedInterpreter(new ExecutorTaskRunner(workers), partitions,
        PartitionedInterpreter.SourceSplit.CONTIGUOUS, settings.limits().memoryBudgetCells());
    log.debug("plantframe.partitioned op=start engine={} workers={} partitions={}", settings.engineId(), poolSize, partitions);
  }

  @Override
  protected Object prepare(PlanNode node, List<ComputationHandle> inputs) {
    return null;
  }

  @Override
  protected Partitioning partitioningAfter(PlanNode node, List<ComputationHandle> inputs) {
    if (node instanceof SourceNode || node instanceof ResampleNode || node instanceof GroupAggregateNode
        || node instanceof JoinNode) {
      return new Partitioning(Partitioning.Scheme.CONTIGUOUS, partitions);
    }
    return inputs.get(0).partitioning();
  }

  @Override
  protected RowSet execute(ComputationHandle handle, JobControl job) {
    return interpreter.execute(handle.plan(), job);
  }

  @Override
  protected void onClose() {
    workers.shutdownNow();
    try {
      if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
        log.warn("plantframe.partitioned op=close engine={} workers did not terminate in 5s", descriptor().id());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private static ThreadFactory workerThreads(String engineId) {
    AtomicInteger n = new AtomicInteger();
    return r -> {
      Thread t = new Thread(r, "plantframe-" + engineId + "-worker-" + n.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }
}

package io.intellixity.plantframe.engine.local;

import io.intellixity.plantframe.exec.ComputationHandle;
import io.intellixity.plantframe.exec.EngineSettings;
import io.intellixity.plantframe.exec.ExecutionMode;
import io.intellixity.plantframe.exec.Partitioning;
import io.intellixity.plantframe.plan.PlanNode;
import io.intellixity.plantframe.spi.exec.AbstractBackendEngine;
import io.intellixity.plantframe.spi.exec.JobControl;
import io.intellixity.plantframe.spi.exec.PlanValidationStrategy;
import io.intellixity.plantframe.spi.kernel.NodeEvaluator;
import io.intellixity.plantframe.spi.kernel.RowSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Eager, single-threaded engine.\n
 *
 * Each operation is evaluated on the calling thread as soon as it is issued; the rows travel inside the handle.
 * A failure while evaluating is kept on the handle and raised by {@code materialize}, like on the lazy engines.
 * Output is always ordered and held in a single partition.\n
 */
public final class LocalBackendEngine extends AbstractBackendEngine {
  private static final Logger log = LoggerFactory.getLogger(LocalBackendEngine.class);

  /** Evaluation failure carried by a handle instead of rows. */
  private record EagerFailure(RuntimeException cause) {}

  public LocalBackendEngine(EngineSettings settings) {
    this(settings, null);
  }

  public LocalBackendEngine(EngineSettings settings, PlanValidationStrategy validation) {
    super(settings, ExecutionMode.EAGER_LOCAL, validation);
  }

  @Override
  protected Object prepare(PlanNode node, List<ComputationHandle> inputs) {
    List<RowSet> computed = new ArrayList<>(inputs.size());
    for (ComputationHandle h : inputs) {
      Object state = h.engineState();
      if (state instanceof EagerFailure f) return f;
      computed.add((RowSet) state);
    }
    long t0 = System.nanoTime();
    try {
      RowSet out = NodeEvaluator.evaluate(node, computed, descriptor().limits().memoryBudgetCells());
      if (log.isTraceEnabled()) {
        log.trace("plantframe.local op={} engine={} rows={} durationMs={}",
            node.label(), descriptor().id(), out.size(), (System.nanoTime() - t0) / 1_000_000.0);
      }
      return out;
    } catch (RuntimeException e) {
      log.debug("plantframe.local op={} engine={} deferred failure: {}", node.label(), descriptor().id(), e.toString());
      return new EagerFailure(e);
    }
  }

  @Override
  protected Partitioning partitioningAfter(PlanNode node, List<ComputationHandle> inputs) {
    return Partitioning.single();
  }

  @Override
  protected boolean orderedAfter(PlanNode node, List<ComputationHandle> inputs) {
    return true;
  }

  @Override
  protected RowSet execute(ComputationHandle handle, JobControl job) {
    Object state = handle.engineState();
    if (state instanceof EagerFailure f) throw f.cause();
    return (RowSet) state;
  }
}

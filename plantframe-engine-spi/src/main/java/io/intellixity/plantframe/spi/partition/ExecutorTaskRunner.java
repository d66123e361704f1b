package io.intellixity.plantframe.spi.partition;

import io.intellixity.plantframe.spi.exec.JobControl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.*;

/** {@link TaskRunner} over an {@link ExecutorService}; cancellation interrupts the stage's in-flight tasks. */
public final class ExecutorTaskRunner implements TaskRunner {
  private static final Logger log = LoggerFactory.getLogger(ExecutorTaskRunner.class);

  private final ExecutorService executor;

  public ExecutorTaskRunner(ExecutorService executor) {
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  @Override
  public <T> List<T> runAll(String stage, List<Callable<T>> tasks, JobControl job) {
    job.checkpoint();
    long t0 = System.nanoTime();
    List<Future<T>> futures = new ArrayList<>(tasks.size());
    try {
      for (Callable<T> t : tasks) futures.add(executor.submit(t));
    } catch (RejectedExecutionException e) {
      StageFutures.cancelAll(futures);
      throw new IllegalStateException("Worker pool rejected stage '" + stage + "' of job " + job.jobId(), e);
    }
    List<T> out = StageFutures.awaitAll(stage, futures, job);
    if (log.isTraceEnabled()) {
      log.trace("plantframe.stage job={} stage={} tasks={} durationMs={}",
          job.jobId(), stage, tasks.size(), (System.nanoTime() - t0) / 1_000_000.0);
    }
    return out;
  }
}

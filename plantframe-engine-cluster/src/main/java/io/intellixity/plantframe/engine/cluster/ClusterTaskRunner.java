package io.intellixity.plantframe.engine.cluster;

import io.intellixity.plantframe.spi.exec.JobControl;
import io.intellixity.plantframe.spi.partition.StageFutures;
import io.intellixity.plantframe.spi.partition.TaskRunner;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;

/** Runs stages on the scheduler's executor nodes. */
final class ClusterTaskRunner implements TaskRunner {
  private final ClusterScheduler scheduler;

  ClusterTaskRunner(ClusterScheduler scheduler) {
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
  }

  @Override
  public <T> List<T> runAll(String stage, List<Callable<T>> tasks, JobControl job) {
    job.checkpoint();
    return StageFutures.awaitAll(stage, scheduler.launch(job.jobId(), stage, tasks), job);
  }
}

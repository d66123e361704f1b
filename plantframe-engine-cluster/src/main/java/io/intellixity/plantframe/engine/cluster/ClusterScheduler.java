package io.intellixity.plantframe.engine.cluster;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.Future;

/**
 * Cluster-side collaborator of the distributed engine.\n
 *
 * A job is a driver callable that runs somewhere in the cluster and launches stages of tasks on executor nodes.
 * The engine only submits jobs, waits for them and cancels them.\n
 */
public interface ClusterScheduler extends AutoCloseable {
  String name();

  /** Executor nodes available for tasks; the engine's default partition count. */
  int executorCount();

  <T> ClusterJob<T> submit(String jobId, Callable<T> driver);

  /** Launch one stage of a running job; one future per task, in task order. */
  <T> List<Future<T>> launch(String jobId, String stage, List<Callable<T>> tasks);

  @Override
  void close();
}

package io.intellixity.plantframe.engine.cluster;

import java.util.concurrent.ExecutionException;

/** Handle on a submitted cluster job. */
public interface ClusterJob<T> {
  String id();

  /** Block until the job completes, fails or is cancelled. */
  T await() throws InterruptedException, ExecutionException;

  void cancel();

  boolean isDone();
}

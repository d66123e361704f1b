package io.intellixity.plantframe.spi.partition;

import io.intellixity.plantframe.error.CancelledException;
import io.intellixity.plantframe.spi.exec.JobControl;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/** Waits for the futures of one stage; shared by the worker-pool and cluster task runners. */
public final class StageFutures {
  private StageFutures() {}

  /**
   * Results in future order. On the first failure the remaining futures are cancelled and the cause is rethrown
   * (unchecked causes as-is); cancellation and interruption surface as {@link CancelledException}. The stage's
   * cancel hook is only registered with {@code job} while it waits.
   */
  public static <T> List<T> awaitAll(String stage, List<? extends Future<T>> futures, JobControl job) {
    Runnable hook = () -> cancelAll(futures);
    job.onCancel(hook);
    List<T> out = new ArrayList<>(futures.size());
    try {
      for (Future<T> f : futures) out.add(f.get());
    } catch (CancellationException e) {
      cancelAll(futures);
      throw new CancelledException("Stage '" + stage + "' of job " + job.jobId() + " was cancelled", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      cancelAll(futures);
      throw new CancelledException("Interrupted while waiting for stage '" + stage + "' of job " + job.jobId(), e);
    } catch (ExecutionException e) {
      cancelAll(futures);
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException re) throw re;
      if (cause instanceof Error err) throw err;
      throw new IllegalStateException("Stage '" + stage + "' of job " + job.jobId() + " failed", cause);
    } finally {
      job.removeOnCancel(hook);
    }
    return out;
  }

  public static void cancelAll(List<? extends Future<?>> futures) {
    for (Future<?> f : futures) f.cancel(true);
  }
}

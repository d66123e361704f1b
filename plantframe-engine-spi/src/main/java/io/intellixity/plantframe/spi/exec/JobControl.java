package io.intellixity.plantframe.spi.exec;

import io.intellixity.plantframe.error.CancelledException;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation token of one materialize job.\n
 *
 * Executors call {@link #checkpoint()} between stages and tasks; cancel hooks let them interrupt in-flight work.\n
 */
public final class JobControl {
  private final String jobId;
  private final String handleId;
  private final AtomicBoolean cancelled = new AtomicBoolean();
  private final List<Runnable> cancelHooks = new CopyOnWriteArrayList<>();

  public JobControl(String jobId, String handleId) {
    this.jobId = Objects.requireNonNull(jobId, "jobId");
    this.handleId = Objects.requireNonNull(handleId, "handleId");
  }

  public String jobId() { return jobId; }
  public String handleId() { return handleId; }

  public boolean isCancelled() {
    return cancelled.get();
  }

  public void checkpoint() {
    if (cancelled.get()) throw new CancelledException("Job " + jobId + " for handle " + handleId + " was cancelled");
  }

  /** Register a hook run once on cancellation; runs immediately if already cancelled. */
  public void onCancel(Runnable hook) {
    Objects.requireNonNull(hook, "hook");
    cancelHooks.add(hook);
    if (cancelled.get()) hook.run();
  }

  /** Drop a hook once the work it would interrupt has finished. */
  public void removeOnCancel(Runnable hook) {
    cancelHooks.remove(hook);
  }

  public void cancel() {
    if (!cancelled.compareAndSet(false, true)) return;
    for (Runnable r : cancelHooks) r.run();
  }
}

package io.intellixity.plantframe.spi.partition;

import io.intellixity.plantframe.spi.exec.JobControl;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/** Runs a stage's tasks one after another on the calling thread. */
public final class SequentialTaskRunner implements TaskRunner {
  @Override
  public <T> List<T> runAll(String stage, List<Callable<T>> tasks, JobControl job) {
    List<T> out = new ArrayList<>(tasks.size());
    for (Callable<T> t : tasks) {
      job.checkpoint();
      try {
        out.add(t.call());
      } catch (RuntimeException e) {
        throw e;
      } catch (Exception e) {
        throw new IllegalStateException("Stage '" + stage + "' of job " + job.jobId() + " failed", e);
      }
    }
    return out;
  }
}

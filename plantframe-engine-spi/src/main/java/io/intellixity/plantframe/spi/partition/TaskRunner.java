package io.intellixity.plantframe.spi.partition;

import io.intellixity.plantframe.spi.exec.JobControl;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * Runs the tasks of one stage (one task per partition) and blocks until all complete.\n
 *
 * Results are returned in task order. The first task failure is rethrown unwrapped when it is unchecked; a
 * cancelled job raises {@link io.intellixity.plantframe.error.CancelledException}.\n
 */
public interface TaskRunner {
  <T> List<T> runAll(String stage, List<Callable<T>> tasks, JobControl job);
}

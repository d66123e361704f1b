package io.intellixity.plantframe.exec;

/**
 * Resource budget of one engine instance.
 *
 * @param workers worker threads (partitioned) or executor nodes (cluster); also the default partition count
 * @param maxConcurrentJobs materializations allowed in flight at once
 * @param memoryBudgetCells largest result (rows x columns) a single materialize may return
 */
public record ResourceLimits(int workers, int maxConcurrentJobs, long memoryBudgetCells) {
  public static final long UNBOUNDED_CELLS = Long.MAX_VALUE;

  public ResourceLimits {
    if (workers < 1) throw new IllegalArgumentException("workers must be >= 1");
    if (maxConcurrentJobs < 1) throw new IllegalArgumentException("maxConcurrentJobs must be >= 1");
    if (memoryBudgetCells < 1) throw new IllegalArgumentException("memoryBudgetCells must be >= 1");
  }

  public static ResourceLimits defaults() {
    return new ResourceLimits(Math.max(1, Runtime.getRuntime().availableProcessors()), 4, UNBOUNDED_CELLS);
  }

  public static ResourceLimits singleThreaded() {
    return new ResourceLimits(1, 1, UNBOUNDED_CELLS);
  }

  public ResourceLimits withWorkers(int n) { return new ResourceLimits(n, maxConcurrentJobs, memoryBudgetCells); }
  public ResourceLimits withMaxConcurrentJobs(int n) { return new ResourceLimits(workers, n, memoryBudgetCells); }
  public ResourceLimits withMemoryBudgetCells(long n) { return new ResourceLimits(workers, maxConcurrentJobs, n); }
}

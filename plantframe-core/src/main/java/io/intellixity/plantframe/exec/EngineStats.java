package io.intellixity.plantframe.exec;

/** Counters of one engine instance; a snapshot, not a live view. */
public record EngineStats(long jobsSubmitted,
                          long jobsSucceeded,
                          long jobsFailed,
                          long jobsCancelled,
                          long jobsRejected,
                          long rowsMaterialized) {
  public static EngineStats empty() {
    return new EngineStats(0, 0, 0, 0, 0, 0);
  }

  /** Difference to an earlier snapshot, used to attribute work to a single run. */
  public EngineStats since(EngineStats earlier) {
    return new EngineStats(
        jobsSubmitted - earlier.jobsSubmitted,
        jobsSucceeded - earlier.jobsSucceeded,
        jobsFailed - earlier.jobsFailed,
        jobsCancelled - earlier.jobsCancelled,
        jobsRejected - earlier.jobsRejected,
        rowsMaterialized - earlier.rowsMaterialized);
  }
}

package io.intellixity.plantframe.analysis.run;

/**
 * Work attributed to one run.
 *
 * @param engineJobs materializations submitted to the engine while the run was active
 * @param rowsMaterialized rows returned by those materializations
 */
public record ResourceUsage(long wallClockMillis, long engineJobs, long rowsMaterialized) {
}

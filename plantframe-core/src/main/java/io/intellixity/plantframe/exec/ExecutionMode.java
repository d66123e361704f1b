package io.intellixity.plantframe.exec;

public enum ExecutionMode {
  /** Every operation is evaluated immediately on the calling thread. */
  EAGER_LOCAL,
  /** Operations build a plan; materialize runs it on a worker pool of one process. */
  LAZY_PARTITIONED,
  /** Operations build a plan; materialize submits it as a job to a cluster scheduler. */
  LAZY_DISTRIBUTED
}

package io.intellixity.plantframe.exec;

import java.util.Objects;

/** How a handle's rows are spread over workers. Opaque to analysis code; engines use it for planning and logs. */
public record Partitioning(Scheme scheme, int count) {
  public enum Scheme {
    SINGLE,
    /** Consecutive row ranges, partition order equals row order. */
    CONTIGUOUS,
    ROUND_ROBIN,
    /** Rows placed by key hash after a shuffle. */
    HASH
  }

  public Partitioning {
    Objects.requireNonNull(scheme, "scheme");
    if (count < 1) throw new IllegalArgumentException("count must be >= 1");
  }

  public static Partitioning single() {
    return new Partitioning(Scheme.SINGLE, 1);
  }

  @Override
  public String toString() {
    return scheme.name().toLowerCase() + "/" + count;
  }
}

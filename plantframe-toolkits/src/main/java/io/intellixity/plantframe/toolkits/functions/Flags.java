package io.intellixity.plantframe.toolkits.functions;

/** Row-level flag rules. A missing value is never flagged. */
public final class Flags {
  private Flags() {}

  public static boolean outsideRange(double value, double below, double above) {
    return value < below || value > above;
  }

  /** Flags {@code value} outside {@code [valueMin, valueMax]} while {@code window} lies in {@code [windowStart, windowEnd]}. */
  public static boolean windowRange(double window, double windowStart, double windowEnd,
                                    double value, double valueMin, double valueMax) {
    return window >= windowStart && window <= windowEnd && outsideRange(value, valueMin, valueMax);
  }
}

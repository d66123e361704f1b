package io.intellixity.plantframe.frame;

/**
 * Pure function computing one value from a row (used by {@code derive}).\n
 *
 * Implementations must not depend on row order, engine, or mutable state, so any engine may evaluate them on
 * any partition.\n
 */
@FunctionalInterface
public interface RowFunction {
  Object apply(RowView row);
}

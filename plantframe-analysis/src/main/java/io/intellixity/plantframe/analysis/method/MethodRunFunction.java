package io.intellixity.plantframe.analysis.method;

import io.intellixity.plantframe.exec.ComputationHandle;

/**
 * Analysis logic of a method.\n
 *
 * Receives the bound handles and resolved configuration through the context and returns the result handle. It
 * must only raise plantframe error kinds; anything else is reported as an engine execution failure.\n
 */
@FunctionalInterface
public interface MethodRunFunction {
  ComputationHandle run(MethodRunContext ctx);
}

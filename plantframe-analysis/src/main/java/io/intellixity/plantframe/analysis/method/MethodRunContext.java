package io.intellixity.plantframe.analysis.method;

import io.intellixity.plantframe.analysis.config.ResolvedConfig;
import io.intellixity.plantframe.exec.BackendEngine;
import io.intellixity.plantframe.exec.ComputationHandle;
import io.intellixity.plantframe.frame.MaterializedFrame;
import io.intellixity.plantframe.toolkit.ToolkitParams;

import java.util.function.Supplier;

/** What a {@link MethodRunFunction} sees of its run. */
public interface MethodRunContext {
  MethodDefinition method();

  String runId();

  BackendEngine engine();

  ResolvedConfig config();

  boolean hasRole(String role);

  /** Handle bound to {@code role}; NotFoundException for an unbound optional role. */
  ComputationHandle handle(String role);

  /**
   * Apply a toolkit the method declared, by name, and record a diagnostic for it. Cancellation is checked
   * before the toolkit runs.
   */
  ComputationHandle applyToolkit(String toolkit, ComputationHandle input, ToolkitParams params);

  default ComputationHandle applyToolkit(String toolkit, ComputationHandle input) {
    return applyToolkit(toolkit, input, ToolkitParams.empty());
  }

  /** Run a named step; the step name is reported if it fails. Cancellation is checked before the step. */
  <T> T step(String name, Supplier<T> body);

  /** Materialize an intermediate handle; a cancel of the run during the call is forwarded to the engine. */
  MaterializedFrame materialize(ComputationHandle handle);

  void warn(String message);
}

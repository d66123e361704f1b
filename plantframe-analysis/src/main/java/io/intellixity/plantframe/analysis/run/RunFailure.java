package io.intellixity.plantframe.analysis.run;

import io.intellixity.plantframe.error.ErrorKind;

import java.util.Objects;

/**
 * Why a run failed.
 *
 * @param step name of the step that raised the error ({@code validate}, a toolkit step, a method step,
 *             {@code materialize})
 * @param kind error category of {@code cause}
 * @param cause the original error, rethrown by {@link ExecutionContext#run()}
 */
public record RunFailure(String step, ErrorKind kind, Throwable cause) {
  public RunFailure {
    Objects.requireNonNull(step, "step");
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(cause, "cause");
  }
}

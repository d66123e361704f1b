package io.intellixity.plantframe.analysis.run;

/** Lifecycle of an {@link ExecutionContext}. Transitions only move forward. */
public enum RunState {
  CREATED,
  VALIDATED,
  RUNNING,
  SUCCEEDED,
  FAILED;

  public boolean isTerminal() {
    return this == SUCCEEDED || this == FAILED;
  }
}

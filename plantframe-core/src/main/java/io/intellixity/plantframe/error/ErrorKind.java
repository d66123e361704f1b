package io.intellixity.plantframe.error;

/** Closed set of failure kinds surfaced by engines, toolkits and execution contexts. */
public enum ErrorKind {
  SCHEMA,
  BINDING_MISMATCH,
  CONFIG_VALIDATION,
  DUPLICATE_NAME,
  NOT_FOUND,
  OUT_OF_RESOURCES,
  CANCELLED,
  ENGINE_EXECUTION;

  /** Validation kinds are raised synchronously by the call that caused them. */
  public boolean isValidation() {
    return switch (this) {
      case SCHEMA, BINDING_MISMATCH, CONFIG_VALIDATION, DUPLICATE_NAME, NOT_FOUND -> true;
      case OUT_OF_RESOURCES, CANCELLED, ENGINE_EXECUTION -> false;
    };
  }
}

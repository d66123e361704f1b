package io.intellixity.plantframe.error;

/** Raised when a method configuration has unknown keys, missing required keys, or bad types/ranges. */
public final class ConfigValidationException extends PlantframeException {
  public ConfigValidationException(String message) {
    super(ErrorKind.CONFIG_VALIDATION, message);
  }

  public ConfigValidationException(String message, Throwable cause) {
    super(ErrorKind.CONFIG_VALIDATION, message, cause);
  }
}

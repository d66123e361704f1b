package io.intellixity.plantframe.error;

/** Raised when handles owned by different engine instances are combined. */
public final class BindingMismatchException extends PlantframeException {
  public BindingMismatchException(String message) {
    super(ErrorKind.BINDING_MISMATCH, message);
  }

  public BindingMismatchException(String message, Throwable cause) {
    super(ErrorKind.BINDING_MISMATCH, message, cause);
  }
}

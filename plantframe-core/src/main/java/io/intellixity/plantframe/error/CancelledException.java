package io.intellixity.plantframe.error;

/** Raised when work is attempted on a cancelled handle or execution context. */
public final class CancelledException extends PlantframeException {
  public CancelledException(String message) {
    super(ErrorKind.CANCELLED, message);
  }

  public CancelledException(String message, Throwable cause) {
    super(ErrorKind.CANCELLED, message, cause);
  }
}

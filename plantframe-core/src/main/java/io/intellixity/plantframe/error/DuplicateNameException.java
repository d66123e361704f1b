package io.intellixity.plantframe.error;

/** Raised when a name+version is registered twice. */
public final class DuplicateNameException extends PlantframeException {
  public DuplicateNameException(String message) {
    super(ErrorKind.DUPLICATE_NAME, message);
  }

  public DuplicateNameException(String message, Throwable cause) {
    super(ErrorKind.DUPLICATE_NAME, message, cause);
  }
}

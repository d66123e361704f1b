package io.intellixity.plantframe.error;

/** Raised when a registry lookup misses. */
public final class NotFoundException extends PlantframeException {
  public NotFoundException(String message) {
    super(ErrorKind.NOT_FOUND, message);
  }

  public NotFoundException(String message, Throwable cause) {
    super(ErrorKind.NOT_FOUND, message, cause);
  }
}

package io.intellixity.plantframe.error;

/** Raised at materialize time when an engine budget (concurrent jobs, memory cells) would be exceeded. */
public final class OutOfResourcesException extends PlantframeException {
  public OutOfResourcesException(String message) {
    super(ErrorKind.OUT_OF_RESOURCES, message);
  }

  public OutOfResourcesException(String message, Throwable cause) {
    super(ErrorKind.OUT_OF_RESOURCES, message, cause);
  }
}

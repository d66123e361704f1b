package io.intellixity.plantframe.error;

import java.util.Objects;

/**
 * Base type of every declared plantframe failure.\n
 *
 * {@link #kind()} identifies the failure class for run bookkeeping.\n
 */
public abstract class PlantframeException extends RuntimeException {
  private final ErrorKind kind;

  protected PlantframeException(ErrorKind kind, String message) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  protected PlantframeException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public final ErrorKind kind() {
    return kind;
  }
}

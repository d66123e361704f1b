package io.intellixity.plantframe.error;

/** Raised when a column, role or result does not match the expected schema. */
public final class SchemaException extends PlantframeException {
  public SchemaException(String message) {
    super(ErrorKind.SCHEMA, message);
  }

  public SchemaException(String message, Throwable cause) {
    super(ErrorKind.SCHEMA, message, cause);
  }
}

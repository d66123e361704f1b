package io.intellixity.plantframe.error;

/**
 * Opaque wrapper for lower-level execution failures of a specific backend.\n
 *
 * The backend's original exception is always kept as the cause.\n
 */
public final class EngineExecutionException extends PlantframeException {
  private final String engineId;

  public EngineExecutionException(String engineId, String message, Throwable cause) {
    super(ErrorKind.ENGINE_EXECUTION, "[" + engineId + "] " + message, cause);
    this.engineId = engineId;
  }

  public String engineId() {
    return engineId;
  }
}

package io.intellixity.plantframe.exec;

/**
 * SPI for engine variants, registered in {@code META-INF/plantframe.factories} under this interface's name.
 */
public interface BackendEngineProvider {
  /** Variant id this provider answers to ({@code local}, {@code partitioned}, {@code cluster}, ...). */
  String variant();

  BackendEngine create(EngineSettings settings);
}

package io.intellixity.plantframe.engine.partitioned;

import io.intellixity.plantframe.exec.BackendEngine;
import io.intellixity.plantframe.exec.BackendEngineProvider;
import io.intellixity.plantframe.exec.EngineSettings;

public final class PartitionedEngineProvider implements BackendEngineProvider {
  public static final String VARIANT = "partitioned";

  @Override
  public String variant() {
    return VARIANT;
  }

  @Override
  public BackendEngine create(EngineSettings settings) {
    return new PartitionedBackendEngine(settings);
  }
}

package io.intellixity.plantframe.engine.local;

import io.intellixity.plantframe.exec.BackendEngine;
import io.intellixity.plantframe.exec.BackendEngineProvider;
import io.intellixity.plantframe.exec.EngineSettings;

public final class LocalEngineProvider implements BackendEngineProvider {
  public static final String VARIANT = "local";

  @Override
  public String variant() {
    return VARIANT;
  }

  @Override
  public BackendEngine create(EngineSettings settings) {
    return new LocalBackendEngine(settings);
  }
}

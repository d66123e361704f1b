package io.intellixity.plantframe.engine.cluster;

import io.intellixity.plantframe.exec.BackendEngine;
import io.intellixity.plantframe.exec.BackendEngineProvider;
import io.intellixity.plantframe.exec.EngineSettings;

/** Builds cluster engines backed by an {@link InProcessClusterScheduler} sized from the resource limits. */
public final class ClusterEngineProvider implements BackendEngineProvider {
  public static final String VARIANT = "cluster";

  @Override
  public String variant() {
    return VARIANT;
  }

  @Override
  public BackendEngine create(EngineSettings settings) {
    InProcessClusterScheduler scheduler = new InProcessClusterScheduler(settings.engineId(),
        settings.limits().workers(), settings.limits().maxConcurrentJobs());
    return new ClusterBackendEngine(settings, scheduler, true);
  }
}

package io.intellixity.plantframe.exec;

import io.intellixity.plantframe.error.NotFoundException;
import io.intellixity.plantframe.util.PlantframeFactoriesLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/** Resolves engine variants through the providers discovered on the classpath. */
public final class BackendEngines {
  private static final Logger log = LoggerFactory.getLogger(BackendEngines.class);

  private BackendEngines() {}

  public static BackendEngine create(EngineSettings settings) {
    return create(settings, PlantframeFactoriesLoader.load(BackendEngineProvider.class));
  }

  public static BackendEngine create(EngineSettings settings, List<BackendEngineProvider> providers) {
    Objects.requireNonNull(settings, "settings");
    for (BackendEngineProvider p : providers) {
      if (p.variant().equalsIgnoreCase(settings.variant())) {
        BackendEngine engine = p.create(settings);
        if (engine == null) throw new IllegalStateException("BackendEngineProvider returned null for " + settings.variant());
        log.debug("plantframe.engine op=create variant={} provider={} engineId={}",
            settings.variant(), p.getClass().getName(), engine.descriptor().id());
        return engine;
      }
    }
    throw new NotFoundException("No engine provider for variant '" + settings.variant() + "'; available: "
        + variants(providers));
  }

  public static Set<String> availableVariants() {
    return variants(PlantframeFactoriesLoader.load(BackendEngineProvider.class));
  }

  private static Set<String> variants(List<BackendEngineProvider> providers) {
    Set<String> out = new TreeSet<>();
    for (BackendEngineProvider p : providers) out.add(p.variant());
    return out;
  }
}

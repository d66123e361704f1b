package io.intellixity.plantframe.toolkit;

import io.intellixity.plantframe.error.DuplicateNameException;
import io.intellixity.plantframe.error.NotFoundException;
import io.intellixity.plantframe.util.PlantframeFactoriesLoader;
import io.intellixity.plantframe.util.Versions;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/** Thread-safe catalog of toolkits keyed by name and version. */
public final class ToolkitCatalog {
  private final Map<ToolkitId, Toolkit> toolkits = new ConcurrentHashMap<>();

  /** Catalog filled by every {@link ToolkitContributor} on the classpath. */
  public static ToolkitCatalog discover() {
    ToolkitCatalog catalog = new ToolkitCatalog();
    for (ToolkitContributor c : PlantframeFactoriesLoader.load(ToolkitContributor.class)) {
      c.contribute(catalog);
    }
    return catalog;
  }

  public ToolkitCatalog register(Toolkit toolkit) {
    Objects.requireNonNull(toolkit, "toolkit");
    if (toolkits.putIfAbsent(toolkit.id(), toolkit) != null) {
      throw new DuplicateNameException("Toolkit already registered: " + toolkit.id());
    }
    return this;
  }

  public Toolkit lookup(String name, String version) {
    return lookup(new ToolkitId(name, version));
  }

  public Toolkit lookup(ToolkitId id) {
    Toolkit t = toolkits.get(id);
    if (t == null) throw new NotFoundException("Unknown toolkit: " + id);
    return t;
  }

  /** Highest registered version of {@code name}. */
  public Toolkit latest(String name) {
    Toolkit best = null;
    for (Toolkit t : toolkits.values()) {
      if (!t.id().name().equals(name)) continue;
      if (best == null || Versions.compare(t.id().version(), best.id().version()) > 0) best = t;
    }
    if (best == null) throw new NotFoundException("Unknown toolkit: " + name);
    return best;
  }

  public boolean contains(ToolkitId id) {
    return toolkits.containsKey(id);
  }

  public Collection<Toolkit> all() {
    List<Toolkit> out = new ArrayList<>(toolkits.values());
    out.sort(Comparator.comparing((Toolkit t) -> t.id().name()).thenComparing(t -> t.id().version(), Versions.ORDER));
    return out;
  }
}

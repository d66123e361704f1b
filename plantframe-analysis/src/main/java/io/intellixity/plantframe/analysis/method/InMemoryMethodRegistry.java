package io.intellixity.plantframe.analysis.method;

import io.intellixity.plantframe.error.DuplicateNameException;
import io.intellixity.plantframe.error.NotFoundException;
import io.intellixity.plantframe.util.PlantframeFactoriesLoader;
import io.intellixity.plantframe.util.Versions;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Simple in-memory {@link ListableMethodRegistry}.\n
 *
 * Thread-safe; registration is first-wins per name and version.\n
 */
public final class InMemoryMethodRegistry implements ListableMethodRegistry {
  private final Map<MethodId, MethodDefinition> methods = new ConcurrentHashMap<>();

  public InMemoryMethodRegistry() {}

  public InMemoryMethodRegistry(List<MethodDefinition> defs) {
    for (MethodDefinition d : defs) register(d);
  }

  /** Registry filled by every {@link MethodContributor} on the classpath. */
  public static InMemoryMethodRegistry discover() {
    InMemoryMethodRegistry r = new InMemoryMethodRegistry();
    for (MethodContributor c : PlantframeFactoriesLoader.load(MethodContributor.class)) c.contribute(r);
    return r;
  }

  @Override
  public InMemoryMethodRegistry register(MethodDefinition method) {
    Objects.requireNonNull(method, "method");
    if (methods.putIfAbsent(method.id(), method) != null) {
      throw new DuplicateNameException("Method already registered: " + method.id());
    }
    return this;
  }

  @Override
  public MethodDefinition lookup(String name, String version) {
    MethodDefinition d = methods.get(new MethodId(name, version));
    if (d == null) throw new NotFoundException("Unknown method: " + name + ":" + version);
    return d;
  }

  @Override
  public MethodDefinition latest(String name) {
    MethodDefinition best = null;
    for (MethodDefinition d : methods.values()) {
      if (!d.name().equals(name)) continue;
      if (best == null || Versions.compare(d.version(), best.version()) > 0) best = d;
    }
    if (best == null) throw new NotFoundException("Unknown method: " + name);
    return best;
  }

  @Override
  public Collection<MethodDefinition> all() {
    List<MethodDefinition> out = new ArrayList<>(methods.values());
    out.sort(Comparator.comparing(MethodDefinition::name).thenComparing(MethodDefinition::version, Versions.ORDER));
    return out;
  }

  @Override
  public boolean contains(MethodId id) {
    return methods.containsKey(id);
  }
}

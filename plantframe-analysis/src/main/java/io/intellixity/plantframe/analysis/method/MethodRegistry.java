package io.intellixity.plantframe.analysis.method;

public interface MethodRegistry {
  /** @throws io.intellixity.plantframe.error.DuplicateNameException if name and version are taken */
  MethodRegistry register(MethodDefinition method);

  /** @throws io.intellixity.plantframe.error.NotFoundException if absent */
  MethodDefinition lookup(String name, String version);

  default MethodDefinition lookup(MethodId id) {
    return lookup(id.name(), id.version());
  }

  /** Highest registered version of {@code name}. */
  MethodDefinition latest(String name);
}

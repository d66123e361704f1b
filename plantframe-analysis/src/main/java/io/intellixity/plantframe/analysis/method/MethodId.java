package io.intellixity.plantframe.analysis.method;

import java.util.Objects;

public record MethodId(String name, String version) {
  public MethodId {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(version, "version");
    if (name.isBlank()) throw new IllegalArgumentException("method name is blank");
    if (version.isBlank()) throw new IllegalArgumentException("method version is blank");
  }

  @Override
  public String toString() {
    return name + ":" + version;
  }
}

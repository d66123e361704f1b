package io.intellixity.plantframe.toolkit;

public record ToolkitId(String name, String version) {
  public ToolkitId {
    if (name == null || name.isBlank()) throw new IllegalArgumentException("name is required");
    if (version == null || version.isBlank()) throw new IllegalArgumentException("version is required");
  }

  public static ToolkitId of(String name, String version) {
    return new ToolkitId(name, version);
  }

  @Override
  public String toString() {
    return name + ":" + version;
  }
}

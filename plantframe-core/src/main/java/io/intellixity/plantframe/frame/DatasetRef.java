package io.intellixity.plantframe.frame;

/**
 * Identity of a loaded dataset (name + data version), recorded in run provenance.
 *
 * @param name logical dataset name (e.g. "plant-a/scada")
 * @param version data version as reported by the loader
 */
public record DatasetRef(String name, String version) {
  public DatasetRef {
    if (name == null || name.isBlank()) throw new IllegalArgumentException("name is required");
    if (version == null || version.isBlank()) version = "unversioned";
  }

  public static DatasetRef of(String name) {
    return new DatasetRef(name, null);
  }

  public static DatasetRef of(String name, String version) {
    return new DatasetRef(name, version);
  }

  @Override
  public String toString() {
    return name + "@" + version;
  }
}

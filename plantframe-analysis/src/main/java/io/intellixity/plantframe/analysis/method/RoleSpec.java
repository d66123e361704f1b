package io.intellixity.plantframe.analysis.method;

import io.intellixity.plantframe.frame.SchemaContract;

import java.util.Objects;

/** Input dataset role of a method, e.g. {@code meter} or {@code reanalysis}. */
public record RoleSpec(String name, SchemaContract contract, boolean required, String description) {
  public RoleSpec {
    Objects.requireNonNull(name, "name");
    if (name.isBlank()) throw new IllegalArgumentException("role name is blank");
    contract = contract == null ? SchemaContract.none() : contract;
    description = description == null ? "" : description;
  }

  public static RoleSpec required(String name, SchemaContract contract) {
    return new RoleSpec(name, contract, true, "");
  }

  public static RoleSpec optional(String name, SchemaContract contract) {
    return new RoleSpec(name, contract, false, "");
  }
}

package io.intellixity.plantframe.frame;

import java.util.Objects;

public record Column(String name, ColumnType type) {
  public Column {
    if (name == null || name.isBlank()) throw new IllegalArgumentException("name is required");
    Objects.requireNonNull(type, "type");
  }

  public static Column of(String name, ColumnType type) {
    return new Column(name, type);
  }

  public Column renamed(String newName) {
    return new Column(newName, type);
  }
}

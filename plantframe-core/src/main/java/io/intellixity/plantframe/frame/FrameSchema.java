package io.intellixity.plantframe.frame;

import io.intellixity.plantframe.error.SchemaException;

import java.util.*;

/** Ordered, duplicate-free logical schema of a frame. */
public final class FrameSchema {
  private final List<Column> columns;
  private final Map<String, Integer> index;

  public FrameSchema(List<Column> columns) {
    Objects.requireNonNull(columns, "columns");
    Map<String, Integer> idx = new LinkedHashMap<>();
    for (int i = 0; i < columns.size(); i++) {
      Column c = Objects.requireNonNull(columns.get(i), "column");
      if (idx.put(c.name(), i) != null) throw new SchemaException("Duplicate column '" + c.name() + "'");
    }
    this.columns = List.copyOf(columns);
    this.index = Collections.unmodifiableMap(idx);
  }

  public static FrameSchema of(Column... columns) {
    return new FrameSchema(List.of(columns));
  }

  public static Builder builder() {
    return new Builder();
  }

  public List<Column> columns() { return columns; }
  public int size() { return columns.size(); }

  public List<String> names() {
    List<String> out = new ArrayList<>(columns.size());
    for (Column c : columns) out.add(c.name());
    return out;
  }

  public boolean has(String name) {
    return index.containsKey(name);
  }

  /** Index of the column, or -1. */
  public int indexOf(String name) {
    Integer i = index.get(name);
    return i == null ? -1 : i;
  }

  /** Index of the column; throws {@link SchemaException} if absent. */
  public int require(String name) {
    Integer i = index.get(name);
    if (i == null) throw new SchemaException("Unknown column '" + name + "'; available: " + names());
    return i;
  }

  public Column column(String name) {
    return columns.get(require(name));
  }

  public ColumnType typeOf(String name) {
    return column(name).type();
  }

  public FrameSchema select(List<String> names) {
    List<Column> out = new ArrayList<>(names.size());
    for (String n : names) out.add(column(n));
    return new FrameSchema(out);
  }

  /** Append the column, or replace the column with the same name in place. */
  public FrameSchema with(Column column) {
    List<Column> out = new ArrayList<>(columns);
    int i = indexOf(column.name());
    if (i >= 0) out.set(i, column);
    else out.add(column);
    return new FrameSchema(out);
  }

  public FrameSchema rename(Map<String, String> renames) {
    for (String from : renames.keySet()) require(from);
    List<Column> out = new ArrayList<>(columns.size());
    for (Column c : columns) {
      String to = renames.get(c.name());
      out.add(to == null ? c : c.renamed(to));
    }
    return new FrameSchema(out);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof FrameSchema other)) return false;
    return columns.equals(other.columns);
  }

  @Override
  public int hashCode() {
    return columns.hashCode();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("[");
    for (int i = 0; i < columns.size(); i++) {
      if (i > 0) sb.append(", ");
      sb.append(columns.get(i).name()).append(':').append(columns.get(i).type());
    }
    return sb.append(']').toString();
  }

  public static final class Builder {
    private final List<Column> columns = new ArrayList<>();

    private Builder() {}

    public Builder column(String name, ColumnType type) {
      columns.add(new Column(name, type));
      return this;
    }

    public Builder timestamp(String name) { return column(name, ColumnType.TIMESTAMP); }
    public Builder doubles(String name) { return column(name, ColumnType.DOUBLE); }
    public Builder longs(String name) { return column(name, ColumnType.LONG); }
    public Builder strings(String name) { return column(name, ColumnType.STRING); }
    public Builder booleans(String name) { return column(name, ColumnType.BOOLEAN); }

    public FrameSchema build() {
      return new FrameSchema(columns);
    }
  }
}

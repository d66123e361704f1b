package io.intellixity.plantframe.frame;

import io.intellixity.plantframe.error.SchemaException;

import java.util.*;

/**
 * Minimal schema a frame must satisfy: named columns with expected types.\n
 *
 * Extra columns are allowed. A DOUBLE requirement also accepts a LONG column.\n
 */
public final class SchemaContract {
  private static final SchemaContract NONE = new SchemaContract(Map.of());

  private final Map<String, ColumnType> required;

  private SchemaContract(Map<String, ColumnType> required) {
    this.required = Collections.unmodifiableMap(new LinkedHashMap<>(required));
  }

  public static SchemaContract none() {
    return NONE;
  }

  public static SchemaContract of(Map<String, ColumnType> required) {
    Objects.requireNonNull(required, "required");
    return new SchemaContract(required);
  }

  public static Builder builder() {
    return new Builder();
  }

  public Map<String, ColumnType> required() {
    return required;
  }

  public boolean isSatisfiedBy(FrameSchema schema) {
    return violations(schema).isEmpty();
  }

  public List<String> violations(FrameSchema schema) {
    List<String> out = new ArrayList<>();
    for (Map.Entry<String, ColumnType> e : required.entrySet()) {
      int idx = schema.indexOf(e.getKey());
      if (idx < 0) {
        out.add("missing column '" + e.getKey() + "'");
        continue;
      }
      ColumnType actual = schema.columns().get(idx).type();
      if (!accepts(e.getValue(), actual)) {
        out.add("column '" + e.getKey() + "' is " + actual + ", expected " + e.getValue());
      }
    }
    return out;
  }

  /** @param subject what is being checked, used in the message (e.g. "role 'meter'") */
  public void check(FrameSchema schema, String subject) {
    List<String> v = violations(schema);
    if (!v.isEmpty()) throw new SchemaException(subject + " does not satisfy its schema contract: " + String.join("; ", v));
  }

  public SchemaContract and(SchemaContract other) {
    Map<String, ColumnType> m = new LinkedHashMap<>(required);
    m.putAll(other.required);
    return new SchemaContract(m);
  }

  private static boolean accepts(ColumnType expected, ColumnType actual) {
    return expected == actual || (expected == ColumnType.DOUBLE && actual == ColumnType.LONG);
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof SchemaContract other && required.equals(other.required);
  }

  @Override
  public int hashCode() {
    return required.hashCode();
  }

  @Override
  public String toString() {
    return "SchemaContract" + required;
  }

  public static final class Builder {
    private final Map<String, ColumnType> required = new LinkedHashMap<>();

    private Builder() {}

    public Builder require(String column, ColumnType type) {
      if (column == null || column.isBlank()) throw new IllegalArgumentException("column is required");
      required.put(column, Objects.requireNonNull(type, "type"));
      return this;
    }

    public SchemaContract build() {
      return new SchemaContract(required);
    }
  }
}

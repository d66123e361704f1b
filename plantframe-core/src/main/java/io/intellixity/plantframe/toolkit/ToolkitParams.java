package io.intellixity.plantframe.toolkit;

import java.util.*;

/** Immutable, loosely typed toolkit parameters with typed accessors. */
public final class ToolkitParams {
  private static final ToolkitParams EMPTY = new ToolkitParams(Map.of());

  private final Map<String, Object> values;

  private ToolkitParams(Map<String, Object> values) {
    this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  public static ToolkitParams empty() {
    return EMPTY;
  }

  public static ToolkitParams of(Map<String, ?> values) {
    return new ToolkitParams(new LinkedHashMap<>(Objects.requireNonNull(values, "values")));
  }

  public static ToolkitParams of(String k1, Object v1) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put(k1, v1);
    return new ToolkitParams(m);
  }

  public static ToolkitParams of(String k1, Object v1, String k2, Object v2) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put(k1, v1);
    m.put(k2, v2);
    return new ToolkitParams(m);
  }

  public Map<String, Object> asMap() {
    return values;
  }

  public boolean has(String name) {
    return values.get(name) != null;
  }

  public ToolkitParams with(String name, Object value) {
    Map<String, Object> m = new LinkedHashMap<>(values);
    m.put(name, value);
    return new ToolkitParams(m);
  }

  /** Entries of {@code overrides} win over this instance's entries. */
  public ToolkitParams merge(ToolkitParams overrides) {
    Map<String, Object> m = new LinkedHashMap<>(values);
    for (Map.Entry<String, Object> e : overrides.values.entrySet()) {
      if (e.getValue() != null) m.put(e.getKey(), e.getValue());
    }
    return new ToolkitParams(m);
  }

  public Object get(String name) {
    return values.get(name);
  }

  public String getString(String name, String def) {
    Object v = values.get(name);
    return v == null ? def : v.toString();
  }

  public String requireString(String name) {
    return require(name).toString();
  }

  public double getDouble(String name, double def) {
    Object v = values.get(name);
    return v == null ? def : toDouble(name, v);
  }

  public double requireDouble(String name) {
    return toDouble(name, require(name));
  }

  public int getInt(String name, int def) {
    Object v = values.get(name);
    if (v == null) return def;
    if (v instanceof Number n) return n.intValue();
    try {
      return Integer.parseInt(v.toString().trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Toolkit parameter '" + name + "' must be an integer: " + v, e);
    }
  }

  public boolean getBoolean(String name, boolean def) {
    Object v = values.get(name);
    if (v == null) return def;
    if (v instanceof Boolean b) return b;
    return Boolean.parseBoolean(v.toString().trim());
  }

  private Object require(String name) {
    Object v = values.get(name);
    if (v == null) throw new IllegalArgumentException("Missing toolkit parameter '" + name + "'");
    return v;
  }

  private static double toDouble(String name, Object v) {
    if (v instanceof Number n) return n.doubleValue();
    try {
      return Double.parseDouble(v.toString().trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Toolkit parameter '" + name + "' must be numeric: " + v, e);
    }
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof ToolkitParams p && values.equals(p.values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return values.toString();
  }
}

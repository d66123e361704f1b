package io.intellixity.plantframe.analysis.config;

import io.intellixity.plantframe.toolkit.ToolkitParams;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Validated configuration values with schema defaults applied. Absent optional keys have no entry. */
public final class ResolvedConfig {
  private final Map<String, Object> values;

  ResolvedConfig(Map<String, Object> values) {
    this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  public Map<String, Object> asMap() {
    return values;
  }

  public boolean has(String key) {
    return values.containsKey(key);
  }

  public Object get(String key) {
    return values.get(key);
  }

  public double getDouble(String key) {
    return ((Number) require(key)).doubleValue();
  }

  public long getLong(String key) {
    return ((Number) require(key)).longValue();
  }

  public String getString(String key) {
    return (String) require(key);
  }

  public boolean getBoolean(String key) {
    return (Boolean) require(key);
  }

  public Instant getInstant(String key) {
    return (Instant) require(key);
  }

  public ToolkitParams toToolkitParams() {
    return ToolkitParams.of(values);
  }

  private Object require(String key) {
    Object v = values.get(key);
    if (v == null) throw new IllegalArgumentException("Configuration has no value for '" + key + "'");
    return v;
  }

  @Override
  public String toString() {
    return values.toString();
  }
}

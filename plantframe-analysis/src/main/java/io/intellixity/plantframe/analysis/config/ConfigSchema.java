package io.intellixity.plantframe.analysis.config;

import io.intellixity.plantframe.error.ConfigValidationException;

import java.util.*;

/**
 * Configuration schema of a method.\n
 *
 * {@link #resolve(Map)} rejects unknown keys, missing required keys, and values of the wrong type or outside
 * their range / allowed set. All violations are reported together in one {@link ConfigValidationException}.\n
 */
public final class ConfigSchema {
  private static final ConfigSchema EMPTY = new ConfigSchema(List.of());

  private final Map<String, ParameterSpec> specs;

  private ConfigSchema(List<ParameterSpec> specs) {
    Map<String, ParameterSpec> m = new LinkedHashMap<>();
    for (ParameterSpec s : specs) {
      if (m.putIfAbsent(s.name(), s) != null) throw new IllegalArgumentException("Duplicate parameter '" + s.name() + "'");
    }
    this.specs = Collections.unmodifiableMap(m);
  }

  public static ConfigSchema empty() {
    return EMPTY;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Collection<ParameterSpec> specs() {
    return specs.values();
  }

  public ParameterSpec spec(String name) {
    return specs.get(name);
  }

  public ResolvedConfig resolve(Map<String, ?> supplied) {
    Map<String, ?> in = supplied == null ? Map.of() : supplied;
    List<String> violations = new ArrayList<>();

    List<String> unknown = new ArrayList<>();
    for (String k : in.keySet()) if (!specs.containsKey(k)) unknown.add(k);
    if (!unknown.isEmpty()) {
      Collections.sort(unknown);
      violations.add("unrecognised keys " + unknown + "; recognised: " + specs.keySet());
    }

    Map<String, Object> resolved = new LinkedHashMap<>();
    Object[] out = new Object[1];
    for (ParameterSpec s : specs.values()) {
      Object raw = in.get(s.name());
      if (raw == null) {
        if (s.defaultValue() != null) {
          resolved.put(s.name(), s.defaultValue());
        } else if (s.required()) {
          violations.add("missing required key '" + s.name() + "'");
        }
        continue;
      }
      String problem = s.check(raw, out);
      if (problem != null) violations.add(problem);
      else resolved.put(s.name(), out[0]);
    }

    if (!violations.isEmpty()) {
      throw new ConfigValidationException("Invalid configuration: " + String.join("; ", violations));
    }
    return new ResolvedConfig(resolved);
  }

  @Override
  public String toString() {
    return "ConfigSchema" + specs.values();
  }

  public static final class Builder {
    private final List<ParameterSpec> specs = new ArrayList<>();

    public Builder param(ParameterSpec spec) {
      specs.add(Objects.requireNonNull(spec, "spec"));
      return this;
    }

    public Builder doubleParam(String name, double defaultValue, double min, double max) {
      return param(ParameterSpec.builder(name, ParameterType.DOUBLE).defaultValue(defaultValue).range(min, max).build());
    }

    public Builder stringParam(String name, String defaultValue, String... allowed) {
      ParameterSpec.Builder b = ParameterSpec.builder(name, ParameterType.STRING).defaultValue(defaultValue);
      if (allowed.length > 0) b.allowed((Object[]) allowed);
      return param(b.build());
    }

    public ConfigSchema build() {
      return new ConfigSchema(specs);
    }
  }
}

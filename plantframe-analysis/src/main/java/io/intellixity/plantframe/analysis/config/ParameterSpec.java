package io.intellixity.plantframe.analysis.config;

import java.util.*;

/**
 * One recognised configuration parameter: type, default, and validity constraints (inclusive numeric range or
 * allowed set).\n
 */
public final class ParameterSpec {
  private final String name;
  private final ParameterType type;
  private final Object defaultValue;
  private final boolean required;
  private final Double min;
  private final Double max;
  private final Set<Object> allowed;
  private final String description;

  private ParameterSpec(Builder b) {
    this.name = b.name;
    this.type = b.type;
    this.required = b.required;
    this.min = b.min;
    this.max = b.max;
    this.allowed = b.allowed == null ? null : Collections.unmodifiableSet(new LinkedHashSet<>(b.allowed));
    this.description = b.description;
    if (b.defaultValue != null) {
      Object d = type.coerce(b.defaultValue);
      if (d == null) throw new IllegalArgumentException("Default of '" + name + "' is not a " + type + ": " + b.defaultValue);
      this.defaultValue = d;
    } else {
      this.defaultValue = null;
    }
  }

  public static Builder builder(String name, ParameterType type) {
    return new Builder(name, type);
  }

  public String name() { return name; }
  public ParameterType type() { return type; }
  public Object defaultValue() { return defaultValue; }
  public boolean required() { return required; }
  public Double min() { return min; }
  public Double max() { return max; }
  public Set<Object> allowed() { return allowed; }
  public String description() { return description; }

  /** Violation message for {@code raw}, or null if it is valid. The coerced value goes to {@code out[0]}. */
  String check(Object raw, Object[] out) {
    Object v = type.coerce(raw);
    if (v == null) return "'" + name + "' must be " + type + ", got " + describe(raw);
    if (v instanceof Number n) {
      double d = n.doubleValue();
      if (Double.isNaN(d)) return "'" + name + "' must not be NaN";
      if (min != null && d < min) return "'" + name + "' = " + v + " is below the minimum " + min;
      if (max != null && d > max) return "'" + name + "' = " + v + " is above the maximum " + max;
    }
    if (allowed != null && !allowed.contains(v)) return "'" + name + "' = " + v + " is not one of " + allowed;
    out[0] = v;
    return null;
  }

  private static String describe(Object v) {
    return v == null ? "null" : v + " (" + v.getClass().getSimpleName() + ")";
  }

  @Override
  public String toString() {
    return name + ":" + type + (required ? "!" : "") + (defaultValue == null ? "" : "=" + defaultValue);
  }

  public static final class Builder {
    private final String name;
    private final ParameterType type;
    private Object defaultValue;
    private boolean required;
    private Double min;
    private Double max;
    private Set<Object> allowed;
    private String description = "";

    private Builder(String name, ParameterType type) {
      if (name == null || name.isBlank()) throw new IllegalArgumentException("parameter name is blank");
      this.name = name;
      this.type = Objects.requireNonNull(type, "type");
    }

    public Builder defaultValue(Object v) {
      this.defaultValue = v;
      return this;
    }

    /** No default; the key must be supplied. */
    public Builder required() {
      this.required = true;
      return this;
    }

    public Builder min(double v) {
      this.min = v;
      return this;
    }

    public Builder max(double v) {
      this.max = v;
      return this;
    }

    public Builder range(double lo, double hi) {
      if (lo > hi) throw new IllegalArgumentException("Empty range for '" + name + "': [" + lo + ", " + hi + "]");
      return min(lo).max(hi);
    }

    public Builder allowed(Object... values) {
      Set<Object> s = new LinkedHashSet<>();
      for (Object v : values) {
        Object c = type.coerce(v);
        if (c == null) throw new IllegalArgumentException("Allowed value of '" + name + "' is not a " + type + ": " + v);
        s.add(c);
      }
      this.allowed = s;
      return this;
    }

    public Builder description(String d) {
      this.description = d == null ? "" : d;
      return this;
    }

    public ParameterSpec build() {
      if (required && defaultValue != null) {
        throw new IllegalArgumentException("Parameter '" + name + "' is required and has a default");
      }
      return new ParameterSpec(this);
    }
  }
}

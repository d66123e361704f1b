package io.intellixity.plantframe.analysis.config;

import java.time.Instant;
import java.time.format.DateTimeParseException;

/** Types a method configuration parameter can take. Coercion returns null when the value does not fit. */
public enum ParameterType {
  DOUBLE {
    @Override
    Object coerce(Object v) {
      if (v instanceof Number n) return n.doubleValue();
      if (v instanceof CharSequence s) {
        try {
          return Double.parseDouble(s.toString().trim());
        } catch (NumberFormatException e) {
          return null;
        }
      }
      return null;
    }
  },
  INTEGER {
    @Override
    Object coerce(Object v) {
      if (v instanceof Long || v instanceof Integer || v instanceof Short || v instanceof Byte) {
        return ((Number) v).longValue();
      }
      if (v instanceof Double d && d == Math.rint(d) && !d.isInfinite()) return d.longValue();
      if (v instanceof CharSequence s) {
        try {
          return Long.parseLong(s.toString().trim());
        } catch (NumberFormatException e) {
          return null;
        }
      }
      return null;
    }
  },
  STRING {
    @Override
    Object coerce(Object v) {
      return v instanceof CharSequence s ? s.toString() : null;
    }
  },
  BOOLEAN {
    @Override
    Object coerce(Object v) {
      if (v instanceof Boolean b) return b;
      if (v instanceof CharSequence s) {
        String t = s.toString().trim();
        if (t.equalsIgnoreCase("true")) return Boolean.TRUE;
        if (t.equalsIgnoreCase("false")) return Boolean.FALSE;
      }
      return null;
    }
  },
  /** An instant, given as such or as ISO-8601 text ({@code 2019-01-01T00:00:00Z}). */
  INSTANT {
    @Override
    Object coerce(Object v) {
      if (v instanceof Instant i) return i;
      if (v instanceof CharSequence s) {
        try {
          return Instant.parse(s.toString().trim());
        } catch (DateTimeParseException e) {
          return null;
        }
      }
      return null;
    }
  };

  abstract Object coerce(Object v);
}

package io.intellixity.plantframe.frame;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/** Missing-value and ordering rules shared by every engine. */
public final class Values {
  private Values() {}

  /** Total order over cell values: null, then NaN, then natural order. */
  public static final Comparator<Object> NATURAL = Values::compare;

  /** Lexicographic order over whole rows, used for canonical ordering. */
  public static final Comparator<List<Object>> ROWS = Values::compareRows;

  public static boolean isMissing(Object v) {
    if (v == null) return true;
    if (v instanceof Double d) return d.isNaN();
    if (v instanceof Float f) return f.isNaN();
    return false;
  }

  public static int compare(Object a, Object b) {
    if (a == null || b == null) return a == null ? (b == null ? 0 : -1) : 1;
    boolean ma = isMissing(a);
    boolean mb = isMissing(b);
    if (ma || mb) return ma == mb ? 0 : (ma ? -1 : 1);
    if (a instanceof Number na && b instanceof Number nb) {
      if (isIntegral(na) && isIntegral(nb)) return Long.compare(na.longValue(), nb.longValue());
      return Double.compare(na.doubleValue(), nb.doubleValue());
    }
    if (a instanceof Instant ia && b instanceof Instant ib) return ia.compareTo(ib);
    if (a instanceof String sa && b instanceof String sb) return sa.compareTo(sb);
    if (a instanceof Boolean ba && b instanceof Boolean bb) return Boolean.compare(ba, bb);
    throw new IllegalArgumentException(
        "Values are not comparable: " + a.getClass().getSimpleName() + " vs " + b.getClass().getSimpleName());
  }

  public static int compareRows(List<Object> a, List<Object> b) {
    int n = Math.min(a.size(), b.size());
    for (int i = 0; i < n; i++) {
      int c = compare(a.get(i), b.get(i));
      if (c != 0) return c;
    }
    return Integer.compare(a.size(), b.size());
  }

  /** Equality used by filters and joins; missing never equals anything. */
  public static boolean sameValue(Object a, Object b) {
    if (isMissing(a) || isMissing(b)) return false;
    if (a instanceof Number && b instanceof Number) return compare(a, b) == 0;
    return a.equals(b);
  }

  /** Key normalization so LONG 1 and DOUBLE 1.0 hash alike in joins and groupings. */
  public static Object normalizeKey(Object v) {
    if (isMissing(v)) return null;
    if (v instanceof Number n && !isIntegral(n)) {
      double d = n.doubleValue();
      if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 9.007199254740992E15) return (long) d;
      return d == 0.0 ? 0.0 : d;
    }
    if (v instanceof Number n) return n.longValue();
    return v;
  }

  private static boolean isIntegral(Number n) {
    return n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte;
  }
}

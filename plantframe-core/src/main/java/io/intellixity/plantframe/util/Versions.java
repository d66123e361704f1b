package io.intellixity.plantframe.util;

import java.util.Comparator;

/** Dotted version comparison ("1.10" > "1.9"); non-numeric segments compare as text. */
public final class Versions {
  private Versions() {}

  public static final Comparator<String> ORDER = Versions::compare;

  public static int compare(String a, String b) {
    String[] pa = a.split("\\.");
    String[] pb = b.split("\\.");
    int n = Math.max(pa.length, pb.length);
    for (int i = 0; i < n; i++) {
      String sa = i < pa.length ? pa[i] : "0";
      String sb = i < pb.length ? pb[i] : "0";
      int c = compareSegment(sa, sb);
      if (c != 0) return c;
    }
    return 0;
  }

  private static int compareSegment(String a, String b) {
    boolean na = isDigits(a);
    boolean nb = isDigits(b);
    if (na && nb) {
      int c = Integer.compare(a.length(), b.length());
      return c != 0 ? c : a.compareTo(b);
    }
    if (na != nb) return na ? 1 : -1;
    return a.compareTo(b);
  }

  private static boolean isDigits(String s) {
    if (s.isEmpty()) return false;
    for (int i = 0; i < s.length(); i++) {
      if (!Character.isDigit(s.charAt(i))) return false;
    }
    return true;
  }
}

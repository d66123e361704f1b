package io.intellixity.plantframe.spi.partition;

import java.util.ArrayList;
import java.util.List;

/** Splitting and gathering of row partitions. */
public final class Partitions {
  private Partitions() {}

  /** Consecutive ranges of near-equal size; concatenating them restores the input order. */
  public static List<List<List<Object>>> contiguous(List<List<Object>> rows, int count) {
    List<List<List<Object>>> out = new ArrayList<>(count);
    int n = rows.size();
    int base = n / count;
    int extra = n % count;
    int from = 0;
    for (int i = 0; i < count; i++) {
      int len = base + (i < extra ? 1 : 0);
      out.add(new ArrayList<>(rows.subList(from, from + len)));
      from += len;
    }
    return out;
  }

  /** Row i goes to partition i mod count, at index i / count. */
  public static List<List<List<Object>>> roundRobin(List<List<Object>> rows, int count) {
    List<List<List<Object>>> out = new ArrayList<>(count);
    for (int i = 0; i < count; i++) out.add(new ArrayList<>(rows.size() / count + 1));
    for (int i = 0; i < rows.size(); i++) out.get(i % count).add(rows.get(i));
    return out;
  }

  /** Shuffle target of a key. */
  public static int target(Object key, int count) {
    return Math.floorMod(key == null ? 0 : key.hashCode(), count);
  }
}

package io.intellixity.plantframe.spi.kernel;

import io.intellixity.plantframe.frame.FrameSchema;
import io.intellixity.plantframe.frame.Values;
import io.intellixity.plantframe.plan.GroupAggregateNode;
import io.intellixity.plantframe.query.aggregation.Aggregation;

import java.util.*;

/**
 * Keyed aggregation; output rows are sorted by key tuple (missing keys first).\n
 *
 * A missing key value forms its own group. A global aggregation (no keys) always yields exactly one row.\n
 */
public final class GroupKernel {
  private GroupKernel() {}

  public static final Comparator<List<Object>> KEY_ORDER = Values.ROWS;

  public static int[] keyIndexes(FrameSchema input, GroupAggregateNode node) {
    List<String> keys = node.groupBy().keys();
    int[] out = new int[keys.size()];
    for (int i = 0; i < out.length; i++) out[i] = input.require(keys.get(i));
    return out;
  }

  /** Normalized key tuple so that, e.g., NaN and null or 1 and 1.0 fall into the same group. */
  public static List<Object> keyOf(List<Object> row, int[] keyIdx) {
    Object[] k = new Object[keyIdx.length];
    for (int i = 0; i < k.length; i++) k[i] = Values.normalizeKey(row.get(keyIdx[i]));
    return Arrays.asList(k);
  }

  public static SortedMap<List<Object>, List<List<Object>>> groups(List<List<Object>> rows, int[] keyIdx) {
    SortedMap<List<Object>, List<List<Object>>> out = new TreeMap<>(KEY_ORDER);
    for (List<Object> r : rows) out.computeIfAbsent(keyOf(r, keyIdx), k -> new ArrayList<>()).add(r);
    return out;
  }

  /** Output row for one group: the representative key values followed by the reductions. */
  public static List<Object> reduceGroup(List<Object> key, List<List<Object>> rows, GroupAggregateNode node,
                                         int[] keyIdx, int[] inputIdx) {
    List<Aggregation> aggs = node.aggregations();
    Object[] o = new Object[keyIdx.length + aggs.size()];
    for (int i = 0; i < keyIdx.length; i++) {
      o[i] = rows.isEmpty() ? key.get(i) : representative(key.get(i), rows.get(0).get(keyIdx[i]));
    }
    for (int i = 0; i < aggs.size(); i++) o[keyIdx.length + i] = Aggregators.reduce(aggs.get(i), rows, inputIdx[i]);
    return Arrays.asList(o);
  }

  // Missing keys come out as null; -0.0 and 0.0 share a group and come out as 0.0.
  private static Object representative(Object normalized, Object raw) {
    if (normalized == null) return null;
    if (raw instanceof Double d && d == 0.0) return 0.0;
    return raw;
  }

  /** Single-partition group aggregation. */
  public static List<List<Object>> run(List<List<Object>> rows, FrameSchema input, GroupAggregateNode node) {
    int[] keyIdx = keyIndexes(input, node);
    int[] inputIdx = Aggregators.inputIndexes(node.aggregations(), input);
    List<List<Object>> out = new ArrayList<>();
    if (node.groupBy().isGlobal()) {
      out.add(reduceGroup(List.of(), rows, node, keyIdx, inputIdx));
      return out;
    }
    for (Map.Entry<List<Object>, List<List<Object>>> e : groups(rows, keyIdx).entrySet()) {
      out.add(reduceGroup(e.getKey(), e.getValue(), node, keyIdx, inputIdx));
    }
    return out;
  }
}

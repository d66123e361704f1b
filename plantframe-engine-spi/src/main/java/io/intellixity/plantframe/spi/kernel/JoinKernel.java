package io.intellixity.plantframe.spi.kernel;

import io.intellixity.plantframe.frame.FrameSchema;
import io.intellixity.plantframe.frame.Values;
import io.intellixity.plantframe.plan.JoinNode;

import java.util.*;

/**
 * Hash equi-join.\n
 *
 * Output order: matched and left-only rows follow the left input order (matches of one left row follow the right
 * input order), then right-only rows in right input order. Rows with any missing key never match.\n
 */
public final class JoinKernel {
  private JoinKernel() {}

  /** A joined row tagged with the input positions it came from, so partitioned joins can restore the order. */
  public record Tagged(long leftSeq, long rightSeq, List<Object> row) {
    public static final Comparator<Tagged> ORDER =
        Comparator.comparingLong(Tagged::leftSeq).thenComparingLong(Tagged::rightSeq);
  }

  /** Positional description of the output layout. */
  public static final class Layout {
    final int[] leftKeys;
    final int[] rightKeys;
    final int[] rightKeyOut;
    final int[] rightCarried;
    final int leftWidth;
    final int outWidth;

    public Layout(FrameSchema left, FrameSchema right, JoinNode node) {
      List<String> on = node.on();
      leftKeys = new int[on.size()];
      rightKeys = new int[on.size()];
      rightKeyOut = new int[on.size()];
      for (int i = 0; i < on.size(); i++) {
        leftKeys[i] = left.require(on.get(i));
        rightKeys[i] = right.require(on.get(i));
        rightKeyOut[i] = leftKeys[i];
      }
      Set<String> keys = new HashSet<>(on);
      List<Integer> carried = new ArrayList<>();
      for (int i = 0; i < right.size(); i++) {
        if (!keys.contains(right.columns().get(i).name())) carried.add(i);
      }
      rightCarried = carried.stream().mapToInt(Integer::intValue).toArray();
      leftWidth = left.size();
      outWidth = leftWidth + rightCarried.length;
    }

    public List<Object> leftKey(List<Object> row) {
      return key(row, leftKeys);
    }

    public List<Object> rightKey(List<Object> row) {
      return key(row, rightKeys);
    }

    /** Normalized key, or null if any key value is missing. */
    private static List<Object> key(List<Object> row, int[] idx) {
      Object[] k = new Object[idx.length];
      for (int i = 0; i < idx.length; i++) {
        Object v = Values.normalizeKey(row.get(idx[i]));
        if (v == null) return null;
        k[i] = v;
      }
      return Arrays.asList(k);
    }

    List<Object> combine(List<Object> l, List<Object> r) {
      Object[] o = new Object[outWidth];
      if (l != null) {
        for (int i = 0; i < leftWidth; i++) o[i] = l.get(i);
      } else {
        for (int i = 0; i < rightKeys.length; i++) o[rightKeyOut[i]] = r.get(rightKeys[i]);
      }
      if (r != null) {
        for (int i = 0; i < rightCarried.length; i++) o[leftWidth + i] = r.get(rightCarried[i]);
      }
      return Arrays.asList(o);
    }
  }

  /**
   * Join two slices whose rows carry global sequence numbers. Unmatched right rows get
   * {@code leftSeq = Long.MAX_VALUE} so they sort after every left-driven row.
   */
  public static List<Tagged> joinTagged(List<Map.Entry<Long, List<Object>>> left,
                                        List<Map.Entry<Long, List<Object>>> right,
                                        JoinNode node,
                                        Layout layout) {
    Map<List<Object>, List<Map.Entry<Long, List<Object>>>> index = new HashMap<>();
    for (Map.Entry<Long, List<Object>> r : right) {
      List<Object> k = layout.rightKey(r.getValue());
      if (k != null) index.computeIfAbsent(k, x -> new ArrayList<>()).add(r);
    }
    for (List<Map.Entry<Long, List<Object>>> bucket : index.values()) bucket.sort(Map.Entry.comparingByKey());

    Set<Long> matchedRight = new HashSet<>();
    List<Tagged> out = new ArrayList<>();
    for (Map.Entry<Long, List<Object>> l : left) {
      List<Object> k = layout.leftKey(l.getValue());
      List<Map.Entry<Long, List<Object>>> matches = k == null ? null : index.get(k);
      if (matches == null || matches.isEmpty()) {
        if (node.how().keepsUnmatchedLeft()) out.add(new Tagged(l.getKey(), -1L, layout.combine(l.getValue(), null)));
        continue;
      }
      for (Map.Entry<Long, List<Object>> r : matches) {
        matchedRight.add(r.getKey());
        out.add(new Tagged(l.getKey(), r.getKey(), layout.combine(l.getValue(), r.getValue())));
      }
    }
    if (node.how().keepsUnmatchedRight()) {
      for (Map.Entry<Long, List<Object>> r : right) {
        if (!matchedRight.contains(r.getKey())) {
          out.add(new Tagged(Long.MAX_VALUE, r.getKey(), layout.combine(null, r.getValue())));
        }
      }
    }
    return out;
  }

  public static List<Map.Entry<Long, List<Object>>> sequence(List<List<Object>> rows, long offset) {
    List<Map.Entry<Long, List<Object>>> out = new ArrayList<>(rows.size());
    for (int i = 0; i < rows.size(); i++) out.add(Map.entry(offset + i, rows.get(i)));
    return out;
  }

  public static List<List<Object>> untag(List<Tagged> tagged) {
    List<Tagged> sorted = new ArrayList<>(tagged);
    sorted.sort(Tagged.ORDER);
    List<List<Object>> out = new ArrayList<>(sorted.size());
    for (Tagged t : sorted) out.add(t.row());
    return out;
  }

  /** Single-partition join. */
  public static List<List<Object>> run(List<List<Object>> left, FrameSchema leftSchema,
                                       List<List<Object>> right, FrameSchema rightSchema,
                                       JoinNode node) {
    Layout layout = new Layout(leftSchema, rightSchema, node);
    return untag(joinTagged(sequence(left, 0), sequence(right, 0), node, layout));
  }
}

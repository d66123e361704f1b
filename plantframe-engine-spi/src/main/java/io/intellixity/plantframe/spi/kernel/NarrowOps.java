package io.intellixity.plantframe.spi.kernel;

import io.intellixity.plantframe.frame.ColumnType;
import io.intellixity.plantframe.frame.FrameSchema;
import io.intellixity.plantframe.plan.DeriveNode;
import io.intellixity.plantframe.plan.FilterNode;
import io.intellixity.plantframe.plan.SelectNode;

import java.util.*;
import java.util.function.Predicate;

/** Row-local operations; each works on any slice of rows and preserves row order. */
public final class NarrowOps {
  private NarrowOps() {}

  public static List<List<Object>> select(List<List<Object>> rows, FrameSchema input, SelectNode node) {
    int[] idx = new int[node.columns().size()];
    for (int i = 0; i < idx.length; i++) idx[i] = input.require(node.columns().get(i));
    List<List<Object>> out = new ArrayList<>(rows.size());
    for (List<Object> r : rows) {
      Object[] o = new Object[idx.length];
      for (int i = 0; i < idx.length; i++) o[i] = r.get(idx[i]);
      out.add(Arrays.asList(o));
    }
    return out;
  }

  public static List<List<Object>> filter(List<List<Object>> rows, FrameSchema input, FilterNode node) {
    int[] keep = matching(rows, input, node);
    List<List<Object>> out = new ArrayList<>(keep.length);
    for (int i : keep) out.add(rows.get(i));
    return out;
  }

  /** Positions of the rows that pass the filter, ascending. */
  public static int[] matching(List<List<Object>> rows, FrameSchema input, FilterNode node) {
    Predicate<List<Object>> p = RowPredicates.compile(node.predicate(), input);
    int[] keep = new int[rows.size()];
    int n = 0;
    for (int i = 0; i < rows.size(); i++) {
      if (p.test(rows.get(i))) keep[n++] = i;
    }
    return Arrays.copyOf(keep, n);
  }

  /**
   * Appends the computed column, or replaces it in place. Results are coerced to the declared type; a
   * non-finite double result is stored as NaN (missing).
   */
  public static List<List<Object>> derive(List<List<Object>> rows, FrameSchema input, DeriveNode node) {
    ListRowView view = new ListRowView(input);
    int replace = input.indexOf(node.column().name());
    ColumnType type = node.column().type();
    List<List<Object>> out = new ArrayList<>(rows.size());
    for (List<Object> r : rows) {
      Object v = type.coerce(node.function().apply(view.at(r)));
      if (v instanceof Double d && d.isInfinite()) v = Double.NaN;
      Object[] o;
      if (replace >= 0) {
        o = r.toArray();
        o[replace] = v;
      } else {
        o = Arrays.copyOf(r.toArray(), r.size() + 1);
        o[r.size()] = v;
      }
      out.add(Arrays.asList(o));
    }
    return out;
  }

  /** Rename changes only the schema. */
  public static List<List<Object>> rename(List<List<Object>> rows) {
    return rows;
  }
}

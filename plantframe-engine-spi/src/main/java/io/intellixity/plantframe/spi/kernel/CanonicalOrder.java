package io.intellixity.plantframe.spi.kernel;

import io.intellixity.plantframe.frame.Values;
import io.intellixity.plantframe.plan.*;

import java.util.ArrayList;
import java.util.List;

/** Lexicographic sort over all columns, missing values first; the snapshot order of unordered handles. */
public final class CanonicalOrder {
  private CanonicalOrder() {}

  /**
   * Whether the plan's output has a row order of its own: sources keep their input order, narrow operations
   * inherit it, resample and group aggregation sort by key, and a join keeps the left-driven order only when it is
   * INNER or LEFT over two inputs with a defined order. Other outputs are sorted canonically.
   */
  public static boolean isDefined(PlanNode node) {
    if (node instanceof SourceNode) return true;
    if (node instanceof ResampleNode || node instanceof GroupAggregateNode) return true;
    if (node instanceof JoinNode j) {
      return (j.how() == JoinType.INNER || j.how() == JoinType.LEFT) && isDefined(j.left()) && isDefined(j.right());
    }
    return isDefined(node.inputs().get(0));
  }

  public static List<List<Object>> sort(List<List<Object>> rows) {
    List<List<Object>> out = new ArrayList<>(rows);
    out.sort(Values.ROWS);
    return out;
  }
}

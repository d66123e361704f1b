package io.intellixity.plantframe.spi.kernel;

import io.intellixity.plantframe.frame.FrameSchema;
import io.intellixity.plantframe.frame.Values;
import io.intellixity.plantframe.query.aggregation.Aggregation;

import java.util.*;

/**
 * Reducers for resample and group aggregation.\n
 *
 * Non-missing values are sorted before reduction, so the result depends only on the multiset of values in the
 * bucket, never on row order or partitioning.\n
 */
public final class Aggregators {
  private Aggregators() {}

  /**
   * @param rows rows of one bucket / group (possibly empty)
   * @param columnIndex input column index, -1 for SIZE
   */
  public static Object reduce(Aggregation agg, List<List<Object>> rows, int columnIndex) {
    switch (agg.function()) {
      case SIZE:
        return (long) rows.size();
      case COUNT:
        return (long) present(rows, columnIndex).size();
      case NULL_FRACTION: {
        if (rows.isEmpty()) return null;
        int n = present(rows, columnIndex).size();
        return (rows.size() - n) / (double) rows.size();
      }
      case SUM:
        return sum(sortedDoubles(rows, columnIndex));
      case MEAN: {
        double[] xs = sortedDoubles(rows, columnIndex);
        return xs.length == 0 ? null : sum(xs) / xs.length;
      }
      case STD: {
        double[] xs = sortedDoubles(rows, columnIndex);
        if (xs.length < 2) return null;
        double mean = sum(xs) / xs.length;
        double[] sq = new double[xs.length];
        for (int i = 0; i < xs.length; i++) {
          double d = xs[i] - mean;
          sq[i] = d * d;
        }
        Arrays.sort(sq);
        return Math.sqrt(sum(sq) / (xs.length - 1));
      }
      case MIN: {
        List<Object> vs = present(rows, columnIndex);
        return vs.isEmpty() ? null : Collections.min(vs, Values.NATURAL);
      }
      case MAX: {
        List<Object> vs = present(rows, columnIndex);
        return vs.isEmpty() ? null : Collections.max(vs, Values.NATURAL);
      }
      default:
        throw new IllegalArgumentException("Unsupported aggregation " + agg.function());
    }
  }

  /** Column indexes of each aggregation's input (-1 for SIZE). */
  public static int[] inputIndexes(List<Aggregation> aggs, FrameSchema schema) {
    int[] out = new int[aggs.size()];
    for (int i = 0; i < out.length; i++) {
      Aggregation a = aggs.get(i);
      out[i] = a.function().requiresColumn() ? schema.require(a.column()) : -1;
    }
    return out;
  }

  private static List<Object> present(List<List<Object>> rows, int idx) {
    List<Object> out = new ArrayList<>(rows.size());
    for (List<Object> r : rows) {
      Object v = r.get(idx);
      if (!Values.isMissing(v)) out.add(v);
    }
    return out;
  }

  private static double[] sortedDoubles(List<List<Object>> rows, int idx) {
    List<Object> vs = present(rows, idx);
    double[] out = new double[vs.size()];
    for (int i = 0; i < out.length; i++) out[i] = ((Number) vs.get(i)).doubleValue();
    Arrays.sort(out);
    return out;
  }

  private static double sum(double[] xs) {
    double s = 0.0;
    for (double x : xs) s += x;
    return s;
  }
}

package io.intellixity.plantframe.spi.kernel;

import io.intellixity.plantframe.error.OutOfResourcesException;
import io.intellixity.plantframe.frame.FrameSchema;
import io.intellixity.plantframe.plan.ResampleNode;
import io.intellixity.plantframe.query.aggregation.Aggregation;

import java.time.Instant;
import java.util.*;

/**
 * Time-bucketed aggregation.\n
 *
 * Split in phases so partitioned engines can key rows in parallel, shuffle buckets, reduce per bucket and fill gaps
 * once on the gathered, sorted result. Rows with a missing timestamp are dropped.\n
 */
public final class ResampleKernel {
  private ResampleKernel() {}

  /** Bucket start of a row, or null when the timestamp is missing. */
  public static Instant bucketOf(List<Object> row, int timeIndex, ResampleNode node) {
    Object t = row.get(timeIndex);
    if (t == null) return null;
    return node.frequency().bucketStart((Instant) t, node.zone());
  }

  /** Group rows by bucket (insertion order within a bucket is kept, it does not affect results). */
  public static SortedMap<Instant, List<List<Object>>> bucketize(List<List<Object>> rows, FrameSchema input, ResampleNode node) {
    int timeIdx = input.require(node.timeColumn());
    SortedMap<Instant, List<List<Object>>> out = new TreeMap<>();
    for (List<Object> r : rows) {
      Instant b = bucketOf(r, timeIdx, node);
      if (b == null) continue;
      out.computeIfAbsent(b, k -> new ArrayList<>()).add(r);
    }
    return out;
  }

  public static List<Object> reduceBucket(Instant bucket, List<List<Object>> rows, ResampleNode node, int[] inputIdx) {
    List<Aggregation> aggs = node.aggregations();
    Object[] o = new Object[aggs.size() + 1];
    o[0] = bucket;
    for (int i = 0; i < aggs.size(); i++) o[i + 1] = Aggregators.reduce(aggs.get(i), rows, inputIdx[i]);
    return Arrays.asList(o);
  }

  /**
   * Emit every bucket from the first to the last reduced one, in order. Missing buckets get the empty-bucket
   * reduction (COUNT/SIZE 0, SUM 0.0, others null).\n
   *
   * @param maxRows bucket count above which the fill is abandoned with {@link OutOfResourcesException}
   */
  public static List<List<Object>> fillGaps(SortedMap<Instant, List<Object>> reduced, ResampleNode node, int[] inputIdx,
                                            long maxRows) {
    List<List<Object>> out = new ArrayList<>();
    if (reduced.isEmpty()) return out;
    Instant last = reduced.lastKey();
    for (Instant b = reduced.firstKey(); !b.isAfter(last); b = node.frequency().next(b, node.zone())) {
      if (out.size() >= maxRows) {
        throw new OutOfResourcesException("Resample to " + node.frequency() + " between " + reduced.firstKey()
            + " and " + last + " needs more than " + maxRows + " buckets");
      }
      List<Object> row = reduced.get(b);
      out.add(row != null ? row : reduceBucket(b, List.of(), node, inputIdx));
    }
    return out;
  }

  /** Single-partition resample. */
  public static List<List<Object>> run(List<List<Object>> rows, FrameSchema input, ResampleNode node, long maxRows) {
    int[] idx = Aggregators.inputIndexes(node.aggregations(), input);
    SortedMap<Instant, List<Object>> reduced = new TreeMap<>();
    for (Map.Entry<Instant, List<List<Object>>> e : bucketize(rows, input, node).entrySet()) {
      reduced.put(e.getKey(), reduceBucket(e.getKey(), e.getValue(), node, idx));
    }
    return fillGaps(reduced, node, idx, maxRows);
  }
}

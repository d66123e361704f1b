package io.intellixity.plantframe.spi.partition;

import io.intellixity.plantframe.frame.FrameSchema;
import io.intellixity.plantframe.plan.*;
import io.intellixity.plantframe.spi.exec.JobControl;
import io.intellixity.plantframe.spi.kernel.*;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.Callable;

/**
 * Interprets a logical plan over partitioned rows.\n
 *
 * Every partition carries the logical position of each of its rows (its index in the input for sources, its
 * index in the gathered output for wide operations). Narrow operations run one task per partition and keep the
 * positions; the gather merges partitions by position, so the result is in the same order as single-partition
 * evaluation whatever the source split. Resample and group aggregation key rows in parallel, hash-shuffle them so
 * that every bucket or group lands in exactly one partition, reduce there, and gather sorted by key. Joins shuffle
 * both sides by key and order the output by the left then right positions. Reductions see the complete bucket, so
 * results are bit-identical to single-partition evaluation.\n
 */
public final class PartitionedInterpreter {
  public enum SourceSplit {
    CONTIGUOUS,
    ROUND_ROBIN
  }

  /** Rows of one partition with their logical positions, ascending. */
  private record Part(List<List<Object>> rows, long[] seq) {
    int size() {
      return rows.size();
    }
  }

  private final TaskRunner runner;
  private final int partitions;
  private final SourceSplit split;
  private final long memoryBudgetCells;

  public PartitionedInterpreter(TaskRunner runner, int partitions, SourceSplit split) {
    this(runner, partitions, split, Long.MAX_VALUE);
  }

  /** @param memoryBudgetCells cells a generated result (resample gap filling) may reach before it is abandoned */
  public PartitionedInterpreter(TaskRunner runner, int partitions, SourceSplit split, long memoryBudgetCells) {
    this.runner = Objects.requireNonNull(runner, "runner");
    if (partitions < 1) throw new IllegalArgumentException("partitions must be >= 1");
    this.partitions = partitions;
    this.split = Objects.requireNonNull(split, "split");
    this.memoryBudgetCells = memoryBudgetCells;
  }

  public int partitions() {
    return partitions;
  }

  /** Execute and gather the result partitions in logical row order. */
  public RowSet execute(PlanNode plan, JobControl job) {
    List<Part> parts = eval(plan, job);
    job.checkpoint();
    return new RowSet(plan.schema(), gather(parts));
  }

  private List<Part> eval(PlanNode node, JobControl job) {
    job.checkpoint();
    if (node instanceof SourceNode s) {
      return split(s.data().rows());
    }
    if (node instanceof SelectNode n) {
      FrameSchema in = n.input().schema();
      return mapPartitions("select", eval(n.input(), job), p -> new Part(NarrowOps.select(p.rows(), in, n), p.seq()), job);
    }
    if (node instanceof FilterNode n) {
      FrameSchema in = n.input().schema();
      return mapPartitions("filter", eval(n.input(), job), p -> {
        int[] keep = NarrowOps.matching(p.rows(), in, n);
        List<List<Object>> rows = new ArrayList<>(keep.length);
        long[] seq = new long[keep.length];
        for (int i = 0; i < keep.length; i++) {
          rows.add(p.rows().get(keep[i]));
          seq[i] = p.seq()[keep[i]];
        }
        return new Part(rows, seq);
      }, job);
    }
    if (node instanceof DeriveNode n) {
      FrameSchema in = n.input().schema();
      return mapPartitions("derive", eval(n.input(), job), p -> new Part(NarrowOps.derive(p.rows(), in, n), p.seq()), job);
    }
    if (node instanceof RenameNode n) {
      return eval(n.input(), job);
    }
    if (node instanceof ResampleNode n) {
      return resample(n, eval(n.input(), job), job);
    }
    if (node instanceof GroupAggregateNode n) {
      return group(n, eval(n.input(), job), job);
    }
    if (node instanceof JoinNode n) {
      return join(n, eval(n.left(), job), eval(n.right(), job), job);
    }
    throw new IllegalArgumentException("Unsupported plan node: " + node.getClass().getName());
  }

  private interface PartitionFn {
    Part apply(Part part);
  }

  private List<Part> mapPartitions(String stage, List<Part> parts, PartitionFn fn, JobControl job) {
    List<Callable<Part>> tasks = new ArrayList<>(parts.size());
    for (Part p : parts) {
      tasks.add(() -> {
        job.checkpoint();
        return fn.apply(p);
      });
    }
    return runner.runAll(stage, tasks, job);
  }

  // --- split and gather ---

  private List<Part> split(List<List<Object>> rows) {
    List<List<List<Object>>> sliced = split == SourceSplit.CONTIGUOUS
        ? Partitions.contiguous(rows, partitions)
        : Partitions.roundRobin(rows, partitions);
    List<Part> out = new ArrayList<>(partitions);
    long offset = 0;
    for (int p = 0; p < sliced.size(); p++) {
      List<List<Object>> slice = sliced.get(p);
      long[] seq = new long[slice.size()];
      for (int i = 0; i < seq.length; i++) {
        seq[i] = split == SourceSplit.CONTIGUOUS ? offset + i : p + (long) i * partitions;
      }
      offset += slice.size();
      out.add(new Part(slice, seq));
    }
    return out;
  }

  /** Output of a wide operation, already in order: contiguous slices numbered by output position. */
  private List<Part> ordered(List<List<Object>> rows) {
    List<Part> out = new ArrayList<>(partitions);
    long offset = 0;
    for (List<List<Object>> slice : Partitions.contiguous(rows, partitions)) {
      long[] seq = new long[slice.size()];
      for (int i = 0; i < seq.length; i++) seq[i] = offset + i;
      offset += slice.size();
      out.add(new Part(slice, seq));
    }
    return out;
  }

  /** K-way merge of the partitions by logical position. */
  private static List<List<Object>> gather(List<Part> parts) {
    int n = 0;
    for (Part p : parts) n += p.size();
    List<List<Object>> out = new ArrayList<>(n);
    int[] cursor = new int[parts.size()];
    for (int k = 0; k < n; k++) {
      int best = -1;
      for (int p = 0; p < parts.size(); p++) {
        if (cursor[p] < parts.get(p).size()
            && (best < 0 || parts.get(p).seq()[cursor[p]] < parts.get(best).seq()[cursor[best]])) {
          best = p;
        }
      }
      out.add(parts.get(best).rows().get(cursor[best]++));
    }
    return out;
  }

  private static List<List<Object>> rowsOf(List<Part> parts) {
    List<List<Object>> out = new ArrayList<>();
    for (Part p : parts) out.addAll(p.rows());
    return out;
  }

  // --- resample ---

  private List<Part> resample(ResampleNode n, List<Part> parts, JobControl job) {
    FrameSchema in = n.input().schema();
    int[] idx = Aggregators.inputIndexes(n.aggregations(), in);

    // map: bucket rows locally, route each bucket to its shuffle target
    List<Callable<List<Map<Instant, List<List<Object>>>>>> keyTasks = new ArrayList<>();
    for (Part p : parts) {
      keyTasks.add(() -> {
        job.checkpoint();
        List<Map<Instant, List<List<Object>>>> routed = emptyRoutes();
        for (Map.Entry<Instant, List<List<Object>>> e : ResampleKernel.bucketize(p.rows(), in, n).entrySet()) {
          routed.get(Partitions.target(e.getKey(), partitions)).put(e.getKey(), e.getValue());
        }
        return routed;
      });
    }
    List<List<Map<Instant, List<List<Object>>>>> mapped = runner.runAll("resample-shuffle", keyTasks, job);

    // reduce: each target owns complete buckets
    List<Callable<SortedMap<Instant, List<Object>>>> reduceTasks = new ArrayList<>();
    for (int t = 0; t < partitions; t++) {
      Map<Instant, List<List<Object>>> merged = mergeRoutes(mapped, t);
      reduceTasks.add(() -> {
        job.checkpoint();
        SortedMap<Instant, List<Object>> out = new TreeMap<>();
        for (Map.Entry<Instant, List<List<Object>>> e : merged.entrySet()) {
          out.put(e.getKey(), ResampleKernel.reduceBucket(e.getKey(), e.getValue(), n, idx));
        }
        return out;
      });
    }
    SortedMap<Instant, List<Object>> all = new TreeMap<>();
    for (SortedMap<Instant, List<Object>> m : runner.runAll("resample-reduce", reduceTasks, job)) all.putAll(m);
    job.checkpoint();
    return ordered(ResampleKernel.fillGaps(all, n, idx, NodeEvaluator.rowBudget(n, memoryBudgetCells)));
  }

  // --- group aggregate ---

  private List<Part> group(GroupAggregateNode n, List<Part> parts, JobControl job) {
    FrameSchema in = n.input().schema();
    int[] keyIdx = GroupKernel.keyIndexes(in, n);
    int[] idx = Aggregators.inputIndexes(n.aggregations(), in);

    if (n.groupBy().isGlobal()) {
      List<List<Object>> all = rowsOf(parts);
      Callable<List<Object>> reduceAll = () -> GroupKernel.reduceGroup(List.of(), all, n, keyIdx, idx);
      return ordered(runner.runAll("group-global", List.of(reduceAll), job));
    }

    List<Callable<List<Map<List<Object>, List<List<Object>>>>>> keyTasks = new ArrayList<>();
    for (Part p : parts) {
      keyTasks.add(() -> {
        job.checkpoint();
        List<Map<List<Object>, List<List<Object>>>> routed = emptyRoutes();
        for (Map.Entry<List<Object>, List<List<Object>>> e : GroupKernel.groups(p.rows(), keyIdx).entrySet()) {
          routed.get(Partitions.target(e.getKey(), partitions)).put(e.getKey(), e.getValue());
        }
        return routed;
      });
    }
    List<List<Map<List<Object>, List<List<Object>>>>> mapped = runner.runAll("group-shuffle", keyTasks, job);

    List<Callable<List<Map.Entry<List<Object>, List<Object>>>>> reduceTasks = new ArrayList<>();
    for (int t = 0; t < partitions; t++) {
      Map<List<Object>, List<List<Object>>> merged = mergeRoutes(mapped, t);
      reduceTasks.add(() -> {
        job.checkpoint();
        List<Map.Entry<List<Object>, List<Object>>> out = new ArrayList<>();
        for (Map.Entry<List<Object>, List<List<Object>>> e : merged.entrySet()) {
          out.add(Map.entry(e.getKey(), GroupKernel.reduceGroup(e.getKey(), e.getValue(), n, keyIdx, idx)));
        }
        return out;
      });
    }
    SortedMap<List<Object>, List<Object>> all = new TreeMap<>(GroupKernel.KEY_ORDER);
    for (List<Map.Entry<List<Object>, List<Object>>> part : runner.runAll("group-reduce", reduceTasks, job)) {
      for (Map.Entry<List<Object>, List<Object>> e : part) all.put(e.getKey(), e.getValue());
    }
    job.checkpoint();
    return ordered(new ArrayList<>(all.values()));
  }

  // --- join ---

  private List<Part> join(JoinNode n, List<Part> leftParts, List<Part> rightParts, JobControl job) {
    JoinKernel.Layout layout = new JoinKernel.Layout(n.left().schema(), n.right().schema(), n);
    List<List<Map.Entry<Long, List<Object>>>> leftRouted = routeForJoin("join-shuffle-left", leftParts, layout, true, job);
    List<List<Map.Entry<Long, List<Object>>>> rightRouted = routeForJoin("join-shuffle-right", rightParts, layout, false, job);

    List<Callable<List<JoinKernel.Tagged>>> matchTasks = new ArrayList<>();
    for (int t = 0; t < partitions; t++) {
      List<Map.Entry<Long, List<Object>>> l = leftRouted.get(t);
      List<Map.Entry<Long, List<Object>>> r = rightRouted.get(t);
      matchTasks.add(() -> {
        job.checkpoint();
        return JoinKernel.joinTagged(l, r, n, layout);
      });
    }
    List<JoinKernel.Tagged> tagged = new ArrayList<>();
    for (List<JoinKernel.Tagged> part : runner.runAll("join-match", matchTasks, job)) tagged.addAll(part);
    job.checkpoint();
    return ordered(JoinKernel.untag(tagged));
  }

  /** Route rows, tagged with their logical position, by key hash; rows with a missing key go by position. */
  private List<List<Map.Entry<Long, List<Object>>>> routeForJoin(String stage, List<Part> parts,
                                                                JoinKernel.Layout layout, boolean left,
                                                                JobControl job) {
    List<Callable<List<List<Map.Entry<Long, List<Object>>>>>> tasks = new ArrayList<>();
    for (Part p : parts) {
      tasks.add(() -> {
        job.checkpoint();
        List<List<Map.Entry<Long, List<Object>>>> routed = new ArrayList<>(partitions);
        for (int i = 0; i < partitions; i++) routed.add(new ArrayList<>());
        for (int i = 0; i < p.size(); i++) {
          long seq = p.seq()[i];
          List<Object> row = p.rows().get(i);
          List<Object> key = left ? layout.leftKey(row) : layout.rightKey(row);
          int t = key == null ? (int) Math.floorMod(seq, (long) partitions) : Partitions.target(key, partitions);
          routed.get(t).add(Map.entry(seq, row));
        }
        return routed;
      });
    }
    List<List<List<Map.Entry<Long, List<Object>>>>> mapped = runner.runAll(stage, tasks, job);
    List<List<Map.Entry<Long, List<Object>>>> out = new ArrayList<>(partitions);
    for (int t = 0; t < partitions; t++) {
      List<Map.Entry<Long, List<Object>>> merged = new ArrayList<>();
      for (List<List<Map.Entry<Long, List<Object>>>> m : mapped) merged.addAll(m.get(t));
      out.add(merged);
    }
    return out;
  }

  // --- shuffle helpers ---

  private <K> List<Map<K, List<List<Object>>>> emptyRoutes() {
    List<Map<K, List<List<Object>>>> out = new ArrayList<>(partitions);
    for (int i = 0; i < partitions; i++) out.add(new HashMap<>());
    return out;
  }

  private static <K> Map<K, List<List<Object>>> mergeRoutes(List<List<Map<K, List<List<Object>>>>> mapped, int target) {
    Map<K, List<List<Object>>> merged = new HashMap<>();
    for (List<Map<K, List<List<Object>>>> fromSource : mapped) {
      for (Map.Entry<K, List<List<Object>>> e : fromSource.get(target).entrySet()) {
        merged.computeIfAbsent(e.getKey(), k -> new ArrayList<>()).addAll(e.getValue());
      }
    }
    return merged;
  }
}

package io.intellixity.plantframe.engine.partitioned;

import io.intellixity.plantframe.engine.local.LocalBackendEngine;
import io.intellixity.plantframe.error.CancelledException;
import io.intellixity.plantframe.error.OutOfResourcesException;
import io.intellixity.plantframe.exec.*;
import io.intellixity.plantframe.frame.ColumnType;
import io.intellixity.plantframe.frame.DatasetRef;
import io.intellixity.plantframe.frame.FrameSchema;
import io.intellixity.plantframe.frame.MaterializedFrame;
import io.intellixity.plantframe.plan.JoinType;
import io.intellixity.plantframe.query.Filters;
import io.intellixity.plantframe.query.aggregation.Aggregation;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.*;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

final class PartitionedBackendEngineTest {
  private static final FrameSchema SCADA = FrameSchema.builder()
      .timestamp("time").strings("asset_id").doubles("power_kw").doubles("wind_ms").build();
  private static final Instant T0 = Instant.parse("2019-07-01T00:00:00Z");

  private static List<List<Object>> scadaRows() {
    Random rnd = new Random(42);
    List<List<Object>> rows = new ArrayList<>();
    for (int i = 0; i < 3000; i++) {
      double wind = rnd.nextDouble() * 20;
      double power = rnd.nextInt(50) == 0 ? Double.NaN : Math.min(2000, wind * wind * 8);
      rows.add(List.of(T0.plusSeconds(600L * (i / 3)), "WTG0" + (i % 3), power, wind));
    }
    return rows;
  }

  private static MaterializedFrame scada() {
    return MaterializedFrame.of(SCADA, scadaRows());
  }

  private static PartitionedBackendEngine engine(int workers) {
    return new PartitionedBackendEngine(EngineSettings.of("partitioned", ResourceLimits.defaults().withWorkers(workers)));
  }

  private static MaterializedFrame run(BackendEngine e, Function<BackendEngine, ComputationHandle> plan) {
    try (e) {
      return plan.apply(e).materialize();
    }
  }

  @Test
  void resultsMatchTheLocalEngine() {
    Function<BackendEngine, ComputationHandle> plan = e -> {
      ComputationHandle src = e.source(scada(), DatasetRef.of("scada"));
      ComputationHandle hourly = src
          .filter(Filters.and(Filters.notNull("power_kw"), Filters.gt("wind_ms", 3.0)))
          .derive("energy_kwh", ColumnType.DOUBLE, r -> r.getDouble("power_kw") / 6.0)
          .resample("time", "1H", Aggregation.sum("energy_kwh"), Aggregation.mean("wind_ms"), Aggregation.size());
      ComputationHandle perAsset = src.groupAggregate(List.of("asset_id"), Aggregation.std("power_kw"), Aggregation.count("power_kw"))
          .rename(Map.of("asset_id", "asset"));
      return hourly.select("time", "energy_kwh").join(
          src.resample("time", "1H", Aggregation.max("power_kw")), List.of("time"), JoinType.LEFT)
          .join(perAsset.select("asset").derive("time", ColumnType.TIMESTAMP, r -> T0), List.of("time"), JoinType.OUTER);
    };
    MaterializedFrame expected = run(new LocalBackendEngine(EngineSettings.of("local")), plan);
    for (int workers : new int[]{1, 2, 5}) {
      assertEquals(expected, run(engine(workers), plan), "workers=" + workers);
    }
  }

  @Test
  void resampleIsIndependentOfInputOrder() {
    List<List<Object>> shuffled = new ArrayList<>(scadaRows());
    Collections.shuffle(shuffled, new Random(7));
    Function<MaterializedFrame, Function<BackendEngine, ComputationHandle>> plan = data -> e ->
        e.source(data, DatasetRef.of("scada")).resample("time", "1H",
            Aggregation.mean("power_kw"), Aggregation.std("wind_ms"), Aggregation.nullFraction("power_kw"));
    MaterializedFrame ordered = run(engine(4), plan.apply(scada()));
    MaterializedFrame unordered = run(engine(4), plan.apply(MaterializedFrame.of(SCADA, shuffled)));
    assertEquals(ordered, unordered);
  }

  @Test
  void operationsAreLazyUntilMaterialize() {
    try (PartitionedBackendEngine e = engine(2)) {
      ComputationHandle h = e.source(scada(), DatasetRef.of("scada"))
          .derive("boom", ColumnType.DOUBLE, r -> { throw new IllegalStateException("not yet"); });
      assertEquals(ExecutionMode.LAZY_PARTITIONED, e.descriptor().mode());
      assertEquals(0, e.stats().jobsSubmitted());
      assertNotNull(h.schema().column("boom"));
    }
  }

  @Test
  void materializingTwiceRunsOneJob() {
    try (PartitionedBackendEngine e = engine(3)) {
      ComputationHandle h = e.source(scada(), DatasetRef.of("scada")).select("time", "power_kw");
      assertSame(h.materialize(), h.materialize());
      assertEquals(1, e.stats().jobsSubmitted());
      assertEquals(Partitioning.Scheme.CONTIGUOUS, h.partitioning().scheme());
    }
  }

  @Test
  void cancelStopsAnInFlightJob() throws Exception {
    CountDownLatch started = new CountDownLatch(1);
    try (PartitionedBackendEngine e = engine(2)) {
      ComputationHandle slow = e.source(scada(), DatasetRef.of("scada")).derive("slow", ColumnType.DOUBLE, r -> {
        started.countDown();
        try {
          Thread.sleep(50);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          throw new IllegalStateException("interrupted", ie);
        }
        return 1.0;
      });
      ExecutorService caller = Executors.newSingleThreadExecutor();
      try {
        Future<MaterializedFrame> f = caller.submit(slow::materialize);
        assertTrue(started.await(10, TimeUnit.SECONDS));
        slow.cancel();
        ExecutionException ex = assertThrows(ExecutionException.class, () -> f.get(30, TimeUnit.SECONDS));
        assertInstanceOf(CancelledException.class, ex.getCause());
        assertEquals(1, e.stats().jobsCancelled());
      } finally {
        caller.shutdownNow();
      }
    }
  }

  @Test
  void concurrentJobLimitRejectsExcessMaterialize() throws Exception {
    CountDownLatch started = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    EngineSettings s = EngineSettings.of("partitioned", ResourceLimits.defaults().withWorkers(2).withMaxConcurrentJobs(1));
    try (PartitionedBackendEngine e = new PartitionedBackendEngine(s)) {
      ComputationHandle blocking = e.source(scada(), DatasetRef.of("scada")).derive("b", ColumnType.DOUBLE, r -> {
        started.countDown();
        try {
          release.await(30, TimeUnit.SECONDS);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
        }
        return 0.0;
      });
      ExecutorService caller = Executors.newSingleThreadExecutor();
      try {
        Future<MaterializedFrame> first = caller.submit(blocking::materialize);
        assertTrue(started.await(10, TimeUnit.SECONDS));
        ComputationHandle other = e.source(scada(), DatasetRef.of("scada"));
        assertThrows(OutOfResourcesException.class, other::materialize);
        assertEquals(1, e.stats().jobsRejected());
        release.countDown();
        assertEquals(3000, first.get(30, TimeUnit.SECONDS).rowCount());
      } finally {
        release.countDown();
        caller.shutdownNow();
      }
    }
  }

  @Test
  void providerRegistersVariant() {
    try (BackendEngine e = BackendEngines.create(EngineSettings.of(PartitionedEngineProvider.VARIANT).withOption("partitions", "6"))) {
      assertEquals(ExecutionMode.LAZY_PARTITIONED, e.descriptor().mode());
      ComputationHandle h = e.source(scada(), DatasetRef.of("scada"));
      assertEquals(6, h.partitioning().count());
    }
  }
}

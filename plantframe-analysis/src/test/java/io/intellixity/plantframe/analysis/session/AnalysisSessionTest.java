package io.intellixity.plantframe.analysis.session;

import io.intellixity.plantframe.analysis.io.InMemoryDatasetLoader;
import io.intellixity.plantframe.analysis.method.InMemoryMethodRegistry;
import io.intellixity.plantframe.analysis.method.MethodDefinition;
import io.intellixity.plantframe.analysis.run.Result;
import io.intellixity.plantframe.engine.partitioned.PartitionedBackendEngine;
import io.intellixity.plantframe.error.NotFoundException;
import io.intellixity.plantframe.exec.ComputationHandle;
import io.intellixity.plantframe.exec.ExecutionMode;
import io.intellixity.plantframe.exec.ResourceLimits;
import io.intellixity.plantframe.frame.ColumnType;
import io.intellixity.plantframe.frame.DatasetRef;
import io.intellixity.plantframe.frame.FrameSchema;
import io.intellixity.plantframe.frame.MaterializedFrame;
import io.intellixity.plantframe.frame.SchemaContract;
import io.intellixity.plantframe.query.aggregation.Aggregation;
import io.intellixity.plantframe.toolkit.ToolkitCatalog;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class AnalysisSessionTest {
  private static final FrameSchema SCADA = FrameSchema.builder().timestamp("time").doubles("power_kw").build();
  private static final Instant T0 = Instant.parse("2020-01-01T00:00:00Z");

  /** 10,000 one-minute rows; power equals the row index. */
  private static MaterializedFrame scada() {
    List<List<Object>> rows = new ArrayList<>();
    for (int i = 0; i < 10_000; i++) rows.add(List.of(T0.plusSeconds(60L * i), (double) i));
    return MaterializedFrame.of(SCADA, rows);
  }

  private static MethodDefinition hourlyMean() {
    return MethodDefinition.builder("hourly-power", "1.0")
        .role("scada", SchemaContract.builder().require("time", ColumnType.TIMESTAMP).require("power_kw", ColumnType.DOUBLE).build())
        .result(SchemaContract.builder().require("power_kw", ColumnType.DOUBLE).build())
        .run(ctx -> ctx.handle("scada").resample("time", "1H", Aggregation.mean("power_kw")))
        .build();
  }

  private static Result runOn(SessionConfig config) {
    InMemoryDatasetLoader data = new InMemoryDatasetLoader().register("plant-a/scada", "2020-01", scada());
    try (AnalysisSession s = AnalysisSession.open(config, new ToolkitCatalog(), new InMemoryMethodRegistry(List.of(hourlyMean())))) {
      ComputationHandle h = s.load(data, "plant-a/scada", SchemaContract.none());
      return s.run("hourly-power", "1.0", Map.of("scada", h), Map.of());
    }
  }

  @Test
  void hourlyMeansAreIdenticalOnLocalAndPartitionedSessions() {
    Result local = runOn(SessionConfig.local());
    Result partitioned = runOn(SessionConfig.of("partitioned", ResourceLimits.defaults().withWorkers(4))
        .withOption(PartitionedBackendEngine.OPTION_PARTITIONS, "7"));

    assertEquals(167, local.payload().rowCount());
    assertEquals(29.5, local.payload().doubleValue(0, "power_kw"), 1e-12);
    assertEquals(9979.5, local.payload().doubleValue(166, "power_kw"), 1e-12);
    assertEquals(local.payload(), partitioned.payload());

    assertEquals(ExecutionMode.EAGER_LOCAL, local.provenance().engine().mode());
    assertEquals("partitioned", partitioned.provenance().engine().variant());
    assertEquals("2020-01", partitioned.provenance().datasets().get("scada").get(0).version());
  }

  @Test
  void unknownMethodOrVariantIsNotFound() {
    assertThrows(NotFoundException.class, () -> AnalysisSession.open(SessionConfig.of("gpu")));
    try (AnalysisSession s = AnalysisSession.open(SessionConfig.local(), new ToolkitCatalog(), new InMemoryMethodRegistry())) {
      assertThrows(NotFoundException.class, () -> s.newContext("hourly-power", "1.0", Map.of(), Map.of()));
    }
  }

  @Test
  void closingTheSessionClosesTheEngine() {
    AnalysisSession s = AnalysisSession.open(SessionConfig.local(), new ToolkitCatalog(), new InMemoryMethodRegistry());
    ComputationHandle h = s.source(scada(), DatasetRef.of("scada"));
    s.close();
    assertThrows(IllegalStateException.class, h::materialize);
  }
}

package io.intellixity.plantframe.analysis.io;

import io.intellixity.plantframe.engine.local.LocalBackendEngine;
import io.intellixity.plantframe.error.DuplicateNameException;
import io.intellixity.plantframe.error.NotFoundException;
import io.intellixity.plantframe.error.SchemaException;
import io.intellixity.plantframe.exec.BackendEngine;
import io.intellixity.plantframe.exec.ComputationHandle;
import io.intellixity.plantframe.exec.EngineSettings;
import io.intellixity.plantframe.frame.*;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class InMemoryDatasetLoaderTest {
  private static final MaterializedFrame METER = MaterializedFrame.builder(
          FrameSchema.builder().timestamp("time").longs("energy_kwh").build())
      .row(Instant.parse("2020-01-01T00:00:00Z"), 10L)
      .build();

  @Test
  void loadsUnderTheEngineWithLineage() {
    InMemoryDatasetLoader loader = new InMemoryDatasetLoader().register("meter", "v3", METER);
    try (BackendEngine e = new LocalBackendEngine(EngineSettings.of("local"))) {
      // a DOUBLE requirement accepts LONG data
      ComputationHandle h = loader.load("meter", e,
          SchemaContract.builder().require("energy_kwh", ColumnType.DOUBLE).build());
      assertTrue(h.isOwnedBy(e));
      assertEquals(List.of(new DatasetRef("meter", "v3")), h.lineage());
      assertEquals(METER, h.materialize());
    }
  }

  @Test
  void mismatchingDataIsRejected() {
    InMemoryDatasetLoader loader = new InMemoryDatasetLoader().register("meter", METER);
    try (BackendEngine e = new LocalBackendEngine(EngineSettings.of("local"))) {
      SchemaException ex = assertThrows(SchemaException.class, () -> loader.load("meter", e,
          SchemaContract.builder().require("availability_kwh", ColumnType.DOUBLE).build()));
      assertTrue(ex.getMessage().contains("availability_kwh"), ex.getMessage());
      assertThrows(NotFoundException.class, () -> loader.load("curtailment", e));
    }
    assertThrows(DuplicateNameException.class, () -> loader.register("meter", METER));
  }
}

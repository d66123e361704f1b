package io.intellixity.plantframe.methods;

import io.intellixity.plantframe.analysis.io.InMemoryDatasetLoader;
import io.intellixity.plantframe.analysis.run.ExecutionContext;
import io.intellixity.plantframe.analysis.run.Result;
import io.intellixity.plantframe.analysis.run.RunState;
import io.intellixity.plantframe.analysis.session.AnalysisSession;
import io.intellixity.plantframe.analysis.session.SessionConfig;
import io.intellixity.plantframe.error.ConfigValidationException;
import io.intellixity.plantframe.exec.ComputationHandle;
import io.intellixity.plantframe.exec.ResourceLimits;
import io.intellixity.plantframe.frame.FrameSchema;
import io.intellixity.plantframe.frame.MaterializedFrame;
import io.intellixity.plantframe.toolkits.functions.MetData;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class WindClimatologyTest {
  private static final FrameSchema REANALYSIS = FrameSchema.builder()
      .timestamp("time").doubles("ws_ms").doubles("temperature_k").doubles("pressure_pa").build();
  private static final double T = 288.15;
  private static final double P = 101_325.0;

  /** Daily samples for 2018 and 2019; wind speed is the month number, plus one in 2019. */
  private static MaterializedFrame reanalysis() {
    MaterializedFrame.Builder b = MaterializedFrame.builder(REANALYSIS);
    for (LocalDate d = LocalDate.of(2018, 1, 1); d.getYear() < 2020; d = d.plusDays(1)) {
      double ws = d.getMonthValue() + (d.getYear() == 2019 ? 1 : 0);
      b.row(d.atStartOfDay(ZoneOffset.UTC).toInstant(), ws, T, P);
    }
    return b.build();
  }

  private static Result run(SessionConfig session, Map<String, ?> config) {
    InMemoryDatasetLoader data = new InMemoryDatasetLoader().register("era5/site-a", "2020-06", reanalysis());
    try (AnalysisSession s = AnalysisSession.open(session)) {
      ComputationHandle h = s.load(data, "era5/site-a", WindClimatology.definition().roles().get("reanalysis").contract());
      return s.run(WindClimatology.NAME, WindClimatology.VERSION, Map.of(WindClimatology.ROLE_REANALYSIS, h), config);
    }
  }

  private static double factor() {
    return MetData.densityCorrectedWindSpeed(1.0, MetData.airDensity(T, P), MetData.RHO_STANDARD);
  }

  @Test
  void monthlyMeanSpreadAndCount() {
    MaterializedFrame t = run(SessionConfig.local(), Map.of()).payload();
    double f = factor();

    assertEquals(12, t.rowCount());
    for (int i = 0; i < 12; i++) {
      long month = i + 1;
      assertEquals(month, t.value(i, "month"));
      assertEquals((month + 0.5) * f, t.doubleValue(i, "ws_mean"), 1e-9);
      assertEquals(f / Math.sqrt(2), t.doubleValue(i, "ws_std"), 1e-9);
      assertEquals(2L, t.value(i, "n_months"));
    }
  }

  @Test
  void periodOfRecordLimitsTheMonths() {
    Result r = run(SessionConfig.local(), Map.of("start", "2019-01-01T00:00:00Z"));
    MaterializedFrame t = r.payload();
    assertEquals(12, t.rowCount());
    assertEquals(1L, t.value(0, "n_months"));
    assertNull(t.value(0, "ws_std"));
    assertEquals(2.0 * factor(), t.doubleValue(0, "ws_mean"), 1e-9);
    assertEquals(Instant.parse("2019-01-01T00:00:00Z"), r.provenance().parameters().get("start"));
  }

  @Test
  void referenceDensityScalesTheResult() {
    double rho = MetData.airDensity(T, P);
    MaterializedFrame t = run(SessionConfig.local(), Map.of("rho_ref", rho)).payload();
    // at the reference density the correction is the identity
    assertEquals(1.5, t.doubleValue(0, "ws_mean"), 1e-9);
  }

  @Test
  void partitionedEngineAgrees() {
    MaterializedFrame local = run(SessionConfig.local(), Map.of()).payload();
    MaterializedFrame partitioned = run(SessionConfig.of("partitioned", ResourceLimits.defaults().withWorkers(4)), Map.of()).payload();
    assertEquals(local, partitioned);
  }

  @Test
  void malformedRecordBoundIsAConfigError() {
    InMemoryDatasetLoader data = new InMemoryDatasetLoader().register("era5/site-a", "2020-06", reanalysis());
    try (AnalysisSession s = AnalysisSession.open(SessionConfig.local())) {
      ComputationHandle h = s.load(data, "era5/site-a", WindClimatology.definition().roles().get("reanalysis").contract());
      ExecutionContext ctx = s.newContext(WindClimatology.NAME, WindClimatology.VERSION,
          Map.of(WindClimatology.ROLE_REANALYSIS, h), Map.of("end", "last year"));
      ConfigValidationException e = assertThrows(ConfigValidationException.class, ctx::run);
      assertTrue(e.getMessage().contains("'end' must be INSTANT"), e.getMessage());
      assertEquals(RunState.FAILED, ctx.state());
      assertEquals(ExecutionContext.STEP_VALIDATE, ctx.failure().orElseThrow().step());
      assertEquals(0, s.engine().stats().jobsSubmitted());
    }
    assertThrows(ConfigValidationException.class, () -> run(SessionConfig.local(), Map.of("rho_ref", 0.0)));
  }
}

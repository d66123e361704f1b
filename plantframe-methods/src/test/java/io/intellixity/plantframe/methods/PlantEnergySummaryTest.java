package io.intellixity.plantframe.methods;

import io.intellixity.plantframe.analysis.run.ExecutionContext;
import io.intellixity.plantframe.analysis.run.Result;
import io.intellixity.plantframe.analysis.run.RunState;
import io.intellixity.plantframe.analysis.session.AnalysisSession;
import io.intellixity.plantframe.analysis.session.SessionConfig;
import io.intellixity.plantframe.error.ConfigValidationException;
import io.intellixity.plantframe.error.SchemaException;
import io.intellixity.plantframe.exec.ComputationHandle;
import io.intellixity.plantframe.exec.ResourceLimits;
import io.intellixity.plantframe.frame.DatasetRef;
import io.intellixity.plantframe.frame.FrameSchema;
import io.intellixity.plantframe.frame.MaterializedFrame;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class PlantEnergySummaryTest {
  private static final FrameSchema METER = FrameSchema.builder().timestamp("time").doubles("energy_kwh").build();
  private static final FrameSchema CURTAILMENT = FrameSchema.builder()
      .timestamp("time").doubles("availability_kwh").doubles("curtailment_kwh").build();
  private static final Instant T0 = Instant.parse("2020-01-31T00:00:00Z");

  /** Jan 31 and Feb 1 at 10 minutes, 1000 kWh per sample, the first sample missing. */
  private static MaterializedFrame meter() {
    MaterializedFrame.Builder b = MaterializedFrame.builder(METER);
    for (int i = 0; i < 288; i++) b.row(T0.plusSeconds(600L * i), i == 0 ? Double.NaN : 1000.0);
    return b.build();
  }

  private static MaterializedFrame curtailment(int samples) {
    MaterializedFrame.Builder b = MaterializedFrame.builder(CURTAILMENT);
    for (int i = 0; i < samples; i++) b.row(T0.plusSeconds(600L * i), 10.0, 5.0);
    return b.build();
  }

  private static Result run(SessionConfig session, int curtailmentSamples, Map<String, ?> config) {
    try (AnalysisSession s = AnalysisSession.open(session)) {
      Map<String, ComputationHandle> roles = Map.of(
          PlantEnergySummary.ROLE_METER, s.source(meter(), new DatasetRef("plant-a/meter", "v1")),
          PlantEnergySummary.ROLE_CURTAILMENT, s.source(curtailment(curtailmentSamples), DatasetRef.of("plant-a/curtailment")));
      return s.run(PlantEnergySummary.NAME, PlantEnergySummary.VERSION, roles, config);
    }
  }

  @Test
  void dailyTableWithLossesAndGrossEnergy() {
    Result r = run(SessionConfig.local(), 288, Map.of("frequency", "D"));
    MaterializedFrame t = r.payload();

    assertEquals(PlantEnergySummary.OUTPUT_COLUMNS, t.schema().names());
    assertEquals(2, t.rowCount());
    assertEquals(T0, t.value(0, "time"));
    assertEquals(0.143, t.doubleValue(0, "energy_gwh"), 1e-12);
    assertEquals(0.144, t.doubleValue(1, "energy_gwh"), 1e-12);
    assertEquals(1.0 / 144, t.doubleValue(0, "energy_nan_perc"), 1e-12);
    assertEquals(0.00144, t.doubleValue(1, "availability_gwh"), 1e-12);
    assertEquals(0.00072, t.doubleValue(1, "curtailment_gwh"), 1e-12);
    assertEquals(0.14616, t.doubleValue(1, "gross_energy_gwh"), 1e-12);
    assertEquals(0.00144 / 0.14616, t.doubleValue(1, "availability_pct"), 1e-12);
    assertEquals(Boolean.FALSE, t.value(0, "nan_flag"));
    assertEquals(Boolean.FALSE, t.value(1, "energy_range_flag"));
    assertTrue(r.warnings().isEmpty());

    assertEquals(List.of("meter-energy", "loss-estimates", "gross-energy"),
        r.diagnostics().stream().map(d -> d.toolkit().name()).toList());
    assertEquals("v1", r.provenance().datasets().get("meter").get(0).version());
    assertEquals(0.01, r.provenance().parameters().get("uncertainty_nan_energy"));
  }

  @Test
  void monthlyIsTheDefaultPeriod() {
    MaterializedFrame t = run(SessionConfig.local(), 288, Map.of()).payload();
    assertEquals(2, t.rowCount());
    assertEquals(Instant.parse("2020-01-01T00:00:00Z"), t.value(0, "time"));
    assertEquals(Instant.parse("2020-02-01T00:00:00Z"), t.value(1, "time"));
  }

  @Test
  void nanFlagUsesTheThresholdAndWarns() {
    Result r = run(SessionConfig.local(), 288, Map.of("frequency", "D", "uncertainty_nan_energy", 0.005));
    assertEquals(Boolean.TRUE, r.payload().value(0, "nan_flag"));
    assertEquals(Boolean.FALSE, r.payload().value(1, "nan_flag"));
    assertEquals(1, r.warnings().size());
    assertTrue(r.warnings().get(0).startsWith("1 periods"), r.warnings().get(0));
    // the flag count is a second engine job
    assertEquals(2, r.usage().engineJobs());
  }

  @Test
  void periodsWithoutLossDataAreFlagged() {
    MaterializedFrame t = run(SessionConfig.local(), 144, Map.of("frequency", "D")).payload();
    assertEquals(2, t.rowCount());
    assertNull(t.value(1, "avail_nan_perc"));
    assertTrue(Double.isNaN(t.doubleValue(1, "gross_energy_gwh")));
    assertEquals(Boolean.FALSE, t.value(0, "nan_flag"));
    assertEquals(Boolean.TRUE, t.value(1, "nan_flag"));
  }

  @Test
  void energyAboveCapacityTimesHoursIsFlagged() {
    // 5.97 MW * 24 h = 0.14328 GWh: Jan 31 (0.143) fits, Feb 1 (0.144) does not
    MaterializedFrame t = run(SessionConfig.local(), 288, Map.of("frequency", "D", "capacity", 5.97)).payload();
    assertEquals(Boolean.FALSE, t.value(0, "energy_range_flag"));
    assertEquals(Boolean.TRUE, t.value(1, "energy_range_flag"));

    // a month of 744 hours easily holds the January energy
    MaterializedFrame monthly = run(SessionConfig.local(), 288, Map.of("capacity", 5.97)).payload();
    assertEquals(Boolean.FALSE, monthly.value(0, "energy_range_flag"));
  }

  @Test
  void resultIsTheSameOnEveryEngine() {
    Map<String, Object> config = new HashMap<>(Map.of("frequency", "D", "capacity", 5.97));
    MaterializedFrame local = run(SessionConfig.local(), 200, config).payload();
    MaterializedFrame partitioned = run(SessionConfig.of("partitioned", ResourceLimits.defaults().withWorkers(3)), 200, config).payload();
    MaterializedFrame cluster = run(SessionConfig.of("cluster", ResourceLimits.defaults().withWorkers(2)), 200, config).payload();
    assertEquals(local, partitioned);
    assertEquals(local, cluster);
  }

  @Test
  void missingMeterRoleFailsValidation() {
    try (AnalysisSession s = AnalysisSession.open(SessionConfig.local())) {
      ExecutionContext ctx = s.newContext(PlantEnergySummary.NAME, PlantEnergySummary.VERSION,
          Map.of(PlantEnergySummary.ROLE_CURTAILMENT, s.source(curtailment(10), DatasetRef.of("curtailment"))), Map.of());
      SchemaException e = assertThrows(SchemaException.class, ctx::run);
      assertTrue(e.getMessage().contains("meter"), e.getMessage());
      assertEquals(RunState.FAILED, ctx.state());
      assertTrue(ctx.diagnostics().isEmpty());
      assertEquals(0, s.engine().stats().jobsSubmitted());
    }
  }

  @Test
  void frequencyOutsideTheAllowedSetIsRejected() {
    assertThrows(ConfigValidationException.class, () -> run(SessionConfig.local(), 288, Map.of("frequency", "W")));
    assertThrows(ConfigValidationException.class, () -> run(SessionConfig.local(), 288, Map.of("capacity", -1)));
  }
}

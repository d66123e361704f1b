package io.intellixity.plantframe.analysis.run;

import io.intellixity.plantframe.analysis.config.ConfigSchema;
import io.intellixity.plantframe.analysis.config.ParameterSpec;
import io.intellixity.plantframe.analysis.config.ParameterType;
import io.intellixity.plantframe.analysis.method.MethodDefinition;
import io.intellixity.plantframe.analysis.method.MethodRunFunction;
import io.intellixity.plantframe.frame.ColumnType;
import io.intellixity.plantframe.frame.FrameSchema;
import io.intellixity.plantframe.frame.MaterializedFrame;
import io.intellixity.plantframe.frame.SchemaContract;
import io.intellixity.plantframe.query.aggregation.Aggregation;
import io.intellixity.plantframe.toolkit.PipelineToolkit;
import io.intellixity.plantframe.toolkit.Toolkit;
import io.intellixity.plantframe.toolkit.ToolkitCatalog;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/** Meter frame, a daily-sum toolkit and a method built on it, shared by the run tests. */
final class DailyEnergyFixture {
  static final Instant T0 = Instant.parse("2021-03-01T00:00:00Z");
  static final FrameSchema METER = FrameSchema.builder().timestamp("time").doubles("energy_kwh").build();
  static final SchemaContract METER_CONTRACT = SchemaContract.builder()
      .require("time", ColumnType.TIMESTAMP).require("energy_kwh", ColumnType.DOUBLE).build();

  private DailyEnergyFixture() {}

  /** Two days of hourly rows, 1 kWh each. */
  static MaterializedFrame meter() {
    List<List<Object>> rows = new ArrayList<>();
    for (int i = 0; i < 48; i++) rows.add(List.of(T0.plusSeconds(3600L * i), 1.0));
    return MaterializedFrame.of(METER, rows);
  }

  static Toolkit dailySum() {
    return PipelineToolkit.builder("daily-sum", "1.0")
        .requires(METER_CONTRACT)
        .produces("time", "energy_kwh")
        .step("resample", (h, p) -> h.resample("time", "D", Aggregation.sum("energy_kwh")))
        .build();
  }

  static ToolkitCatalog catalog() {
    return new ToolkitCatalog().register(dailySum());
  }

  static ConfigSchema config() {
    return ConfigSchema.builder()
        .param(ParameterSpec.builder("scale", ParameterType.DOUBLE).defaultValue(1.0).range(0, 1000).build())
        .build();
  }

  static MethodDefinition.Builder method(MethodRunFunction fn) {
    return MethodDefinition.builder("daily-energy", "1.0")
        .role("meter", METER_CONTRACT)
        .toolkit("daily-sum", "1.0")
        .config(config())
        .result(SchemaContract.builder().require("time", ColumnType.TIMESTAMP).require("scaled", ColumnType.DOUBLE).build())
        .run(fn);
  }

  static MethodDefinition method() {
    return method(ctx -> {
      double scale = ctx.config().getDouble("scale");
      return ctx.applyToolkit("daily-sum", ctx.handle("meter"))
          .derive("scaled", ColumnType.DOUBLE, r -> r.getDouble("energy_kwh") * scale);
    }).build();
  }
}

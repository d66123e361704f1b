package io.intellixity.plantframe.methods;

import io.intellixity.plantframe.analysis.config.ConfigSchema;
import io.intellixity.plantframe.analysis.config.ParameterSpec;
import io.intellixity.plantframe.analysis.config.ParameterType;
import io.intellixity.plantframe.analysis.method.MethodDefinition;
import io.intellixity.plantframe.analysis.method.MethodRunContext;
import io.intellixity.plantframe.exec.ComputationHandle;
import io.intellixity.plantframe.frame.ColumnType;
import io.intellixity.plantframe.frame.SchemaContract;
import io.intellixity.plantframe.query.Filters;
import io.intellixity.plantframe.query.aggregation.Aggregation;
import io.intellixity.plantframe.toolkit.ToolkitParams;
import io.intellixity.plantframe.toolkits.BuiltinToolkits;
import io.intellixity.plantframe.toolkits.MetToolkits;

import java.time.ZoneId;
import java.util.List;

/**
 * Long-term monthly wind climatology from reanalysis data: density-corrected wind speed, averaged per calendar
 * month of the record, then mean / sample std / count of those monthly means per month of year.\n
 */
public final class WindClimatology {
  public static final String NAME = "long-term-wind-climatology";
  public static final String VERSION = "1.0";

  public static final String ROLE_REANALYSIS = "reanalysis";

  public static final String PARAM_RHO_REF = MetToolkits.PARAM_RHO_REF;
  /** Optional bounds of the record, start inclusive, end exclusive. */
  public static final String PARAM_START = "start";
  public static final String PARAM_END = "end";

  private WindClimatology() {}

  public static MethodDefinition definition() {
    return MethodDefinition.builder(NAME, VERSION)
        .description("Monthly mean, spread and sample count of density-corrected reanalysis wind speed")
        .role(ROLE_REANALYSIS, SchemaContract.builder()
            .require("time", ColumnType.TIMESTAMP)
            .require("ws_ms", ColumnType.DOUBLE)
            .require("temperature_k", ColumnType.DOUBLE)
            .require("pressure_pa", ColumnType.DOUBLE)
            .build())
        .toolkit(MetToolkits.DENSITY_CORRECTED_WIND_SPEED, BuiltinToolkits.VERSION)
        .config(ConfigSchema.builder()
            .param(ParameterSpec.builder(PARAM_RHO_REF, ParameterType.DOUBLE).defaultValue(1.225).min(0.1).max(2.0)
                .description("Reference air density in kg/m3").build())
            .param(ParameterSpec.builder(PARAM_START, ParameterType.INSTANT)
                .description("First instant of the record").build())
            .param(ParameterSpec.builder(PARAM_END, ParameterType.INSTANT)
                .description("End of the record, exclusive").build())
            .build())
        .result(SchemaContract.builder()
            .require("month", ColumnType.LONG)
            .require("ws_mean", ColumnType.DOUBLE)
            .require("ws_std", ColumnType.DOUBLE)
            .require("n_months", ColumnType.LONG)
            .build())
        .run(WindClimatology::run)
        .build();
  }

  static ComputationHandle run(MethodRunContext ctx) {
    ZoneId zone = ctx.engine().defaultZone();
    ComputationHandle record = ctx.step("period-of-record", () -> {
      ComputationHandle h = ctx.handle(ROLE_REANALYSIS);
      if (ctx.config().has(PARAM_START)) h = h.filter(Filters.ge("time", ctx.config().getInstant(PARAM_START)));
      if (ctx.config().has(PARAM_END)) h = h.filter(Filters.lt("time", ctx.config().getInstant(PARAM_END)));
      return h;
    });

    ComputationHandle corrected = ctx.applyToolkit(MetToolkits.DENSITY_CORRECTED_WIND_SPEED, record,
        ToolkitParams.of(PARAM_RHO_REF, ctx.config().getDouble(PARAM_RHO_REF)));

    ComputationHandle monthly = ctx.step("monthly-means", () -> corrected
        .resample("time", "MS", Aggregation.mean("ws_dens_corr")));

    return ctx.step("climatology", () -> monthly
        .derive("month", ColumnType.LONG, r -> (long) r.getInstant("time").atZone(zone).getMonthValue())
        .groupAggregate(List.of("month"),
            Aggregation.mean("ws_dens_corr").as("ws_mean"),
            Aggregation.std("ws_dens_corr").as("ws_std"),
            Aggregation.count("ws_dens_corr").as("n_months")));
  }
}

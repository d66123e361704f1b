package io.intellixity.plantframe.methods;

import io.intellixity.plantframe.analysis.config.ConfigSchema;
import io.intellixity.plantframe.analysis.config.ParameterSpec;
import io.intellixity.plantframe.analysis.config.ParameterType;
import io.intellixity.plantframe.analysis.method.MethodDefinition;
import io.intellixity.plantframe.analysis.method.MethodRunContext;
import io.intellixity.plantframe.exec.ComputationHandle;
import io.intellixity.plantframe.frame.ColumnType;
import io.intellixity.plantframe.frame.MaterializedFrame;
import io.intellixity.plantframe.frame.RowView;
import io.intellixity.plantframe.frame.SchemaContract;
import io.intellixity.plantframe.plan.JoinType;
import io.intellixity.plantframe.query.Filters;
import io.intellixity.plantframe.query.aggregation.Aggregation;
import io.intellixity.plantframe.time.Frequency;
import io.intellixity.plantframe.toolkit.ToolkitParams;
import io.intellixity.plantframe.toolkits.BuiltinToolkits;
import io.intellixity.plantframe.toolkits.EnergyToolkits;
import io.intellixity.plantframe.toolkits.functions.Flags;

import java.time.ZoneId;
import java.util.List;

/**
 * Monthly or daily energy table of a plant: net energy from the revenue meter, availability and curtailment
 * losses, gross energy and loss percentages.\n
 *
 * Two quality flags are added per period:\n
 * <ul>
 *   <li>{@code nan_flag}: any of the meter, availability or curtailment missing fractions is above
 *       {@code uncertainty_nan_energy}. A period without loss data counts as fully missing.</li>
 *   <li>{@code energy_range_flag}: net energy outside {@code [0, capacity * period hours]}; with no
 *       {@code capacity} only negative energy is flagged.</li>
 * </ul>
 */
public final class PlantEnergySummary {
  public static final String NAME = "plant-energy-summary";
  public static final String VERSION = "1.0";

  public static final String ROLE_METER = "meter";
  public static final String ROLE_CURTAILMENT = "curtailment";

  public static final String PARAM_FREQUENCY = "frequency";
  public static final String PARAM_UNCERTAINTY_NAN_ENERGY = "uncertainty_nan_energy";
  /** Nameplate capacity in MW. */
  public static final String PARAM_CAPACITY = "capacity";

  public static final List<String> OUTPUT_COLUMNS = List.of(
      "time", "energy_gwh", "availability_gwh", "curtailment_gwh", "gross_energy_gwh",
      "availability_pct", "curtailment_pct", "energy_nan_perc", "avail_nan_perc", "curt_nan_perc",
      "nan_flag", "energy_range_flag");

  private PlantEnergySummary() {}

  public static MethodDefinition definition() {
    return MethodDefinition.builder(NAME, VERSION)
        .description("Net, loss and gross energy per period with data quality flags")
        .role(ROLE_METER, SchemaContract.builder()
            .require("time", ColumnType.TIMESTAMP)
            .require("energy_kwh", ColumnType.DOUBLE)
            .build())
        .role(ROLE_CURTAILMENT, SchemaContract.builder()
            .require("time", ColumnType.TIMESTAMP)
            .require("availability_kwh", ColumnType.DOUBLE)
            .require("curtailment_kwh", ColumnType.DOUBLE)
            .build())
        .toolkit(EnergyToolkits.METER_ENERGY, BuiltinToolkits.VERSION)
        .toolkit(EnergyToolkits.LOSS_ESTIMATES, BuiltinToolkits.VERSION)
        .toolkit(EnergyToolkits.GROSS_ENERGY, BuiltinToolkits.VERSION)
        .config(ConfigSchema.builder()
            .stringParam(PARAM_FREQUENCY, "MS", "MS", "D")
            .doubleParam(PARAM_UNCERTAINTY_NAN_ENERGY, 0.01, 0.0, 1.0)
            .param(ParameterSpec.builder(PARAM_CAPACITY, ParameterType.DOUBLE)
                .min(0)
                .description("Nameplate capacity in MW")
                .build())
            .build())
        .result(SchemaContract.builder()
            .require("time", ColumnType.TIMESTAMP)
            .require("energy_gwh", ColumnType.DOUBLE)
            .require("gross_energy_gwh", ColumnType.DOUBLE)
            .require("nan_flag", ColumnType.BOOLEAN)
            .require("energy_range_flag", ColumnType.BOOLEAN)
            .build())
        .run(PlantEnergySummary::run)
        .build();
  }

  static ComputationHandle run(MethodRunContext ctx) {
    String frequency = ctx.config().getString(PARAM_FREQUENCY);
    double nanThreshold = ctx.config().getDouble(PARAM_UNCERTAINTY_NAN_ENERGY);
    double capacityMw = ctx.config().has(PARAM_CAPACITY) ? ctx.config().getDouble(PARAM_CAPACITY) : Double.POSITIVE_INFINITY;
    Frequency period = Frequency.parse(frequency);
    ZoneId zone = ctx.engine().defaultZone();
    ToolkitParams periodParams = ToolkitParams.of("frequency", frequency);

    ComputationHandle energy = ctx.applyToolkit(EnergyToolkits.METER_ENERGY, ctx.handle(ROLE_METER), periodParams);
    ComputationHandle losses = ctx.applyToolkit(EnergyToolkits.LOSS_ESTIMATES, ctx.handle(ROLE_CURTAILMENT), periodParams);
    ComputationHandle joined = ctx.step("join-losses", () -> energy.join(losses, List.of("time"), JoinType.LEFT));
    ComputationHandle gross = ctx.applyToolkit(EnergyToolkits.GROSS_ENERGY, joined);

    ComputationHandle flagged = ctx.step("flags", () -> gross
        .derive("nan_flag", ColumnType.BOOLEAN, r -> nanFlag(r, nanThreshold))
        .derive("energy_range_flag", ColumnType.BOOLEAN, r -> {
          double maxGwh = capacityMw * period.periodHours(r.getInstant("time"), zone) / 1000.0;
          return Flags.outsideRange(r.getDouble("energy_gwh"), 0.0, maxGwh);
        })
        .select(OUTPUT_COLUMNS));

    MaterializedFrame counts = ctx.materialize(ctx.step("count-flags", () -> flagged
        .filter(Filters.eq("nan_flag", true))
        .groupAggregate(List.of("nan_flag"), Aggregation.size())));
    if (!counts.isEmpty()) {
      ctx.warn(counts.value(0, "size") + " periods have more than " + nanThreshold
          + " of their meter or loss data missing");
    }
    return flagged;
  }

  /** Missing fractions are null for periods without data; those count as fully missing. */
  static boolean nanFlag(RowView r, double threshold) {
    return fraction(r, "energy_nan_perc") > threshold
        || fraction(r, "avail_nan_perc") > threshold
        || fraction(r, "curt_nan_perc") > threshold;
  }

  private static double fraction(RowView r, String column) {
    return r.isMissing(column) ? 1.0 : r.getDouble(column);
  }
}

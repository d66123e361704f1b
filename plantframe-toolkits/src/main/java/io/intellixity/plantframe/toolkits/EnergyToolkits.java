package io.intellixity.plantframe.toolkits;

import io.intellixity.plantframe.frame.ColumnType;
import io.intellixity.plantframe.frame.SchemaContract;
import io.intellixity.plantframe.query.aggregation.Aggregation;
import io.intellixity.plantframe.toolkit.PipelineToolkit;
import io.intellixity.plantframe.toolkit.Toolkit;
import io.intellixity.plantframe.toolkit.ToolkitParams;
import io.intellixity.plantframe.toolkits.functions.UnitConversions;

/**
 * Energy bookkeeping toolkits: revenue meter aggregation, loss aggregation, gross energy and power-to-energy
 * conversion.\n
 *
 * Aggregating toolkits take {@code frequency} (default {@code MS}) and an optional {@code zone}; missing
 * fractions are reported per period so callers can flag incomplete periods.\n
 */
public final class EnergyToolkits {
  public static final String METER_ENERGY = "meter-energy";
  public static final String LOSS_ESTIMATES = "loss-estimates";
  public static final String GROSS_ENERGY = "gross-energy";
  public static final String POWER_TO_ENERGY = "power-to-energy";

  public static final String PARAM_INTERVAL_MINUTES = "interval_minutes";

  private EnergyToolkits() {}

  public static Toolkit meterEnergy() {
    return PipelineToolkit.builder(METER_ENERGY, BuiltinToolkits.VERSION)
        .description("Revenue meter energy per period in GWh with the fraction of missing samples")
        .requires(SchemaContract.builder()
            .require(Steps.TIME, ColumnType.TIMESTAMP)
            .require("energy_kwh", ColumnType.DOUBLE)
            .build())
        .produces(Steps.TIME, "energy_gwh", "energy_nan_perc")
        .defaults(ToolkitParams.of(Steps.PARAM_FREQUENCY, "MS"))
        .step("resample", (h, p) -> Steps.resample(h, p,
            Aggregation.sum("energy_kwh"),
            Aggregation.nullFraction("energy_kwh").as("energy_nan_perc")))
        .step("to-gwh", (h, p) -> h.derive("energy_gwh", ColumnType.DOUBLE,
            r -> UnitConversions.kwhToGwh(r.getDouble("energy_kwh"))))
        .step("select", (h, p) -> h.select(Steps.TIME, "energy_gwh", "energy_nan_perc"))
        .build();
  }

  public static Toolkit lossEstimates() {
    return PipelineToolkit.builder(LOSS_ESTIMATES, BuiltinToolkits.VERSION)
        .description("Availability and curtailment losses per period in GWh with missing fractions")
        .requires(SchemaContract.builder()
            .require(Steps.TIME, ColumnType.TIMESTAMP)
            .require("availability_kwh", ColumnType.DOUBLE)
            .require("curtailment_kwh", ColumnType.DOUBLE)
            .build())
        .produces(Steps.TIME, "availability_gwh", "curtailment_gwh", "avail_nan_perc", "curt_nan_perc")
        .defaults(ToolkitParams.of(Steps.PARAM_FREQUENCY, "MS"))
        .step("resample", (h, p) -> Steps.resample(h, p,
            Aggregation.sum("availability_kwh"),
            Aggregation.sum("curtailment_kwh"),
            Aggregation.nullFraction("availability_kwh").as("avail_nan_perc"),
            Aggregation.nullFraction("curtailment_kwh").as("curt_nan_perc")))
        .step("to-gwh", (h, p) -> h
            .derive("availability_gwh", ColumnType.DOUBLE, r -> UnitConversions.kwhToGwh(r.getDouble("availability_kwh")))
            .derive("curtailment_gwh", ColumnType.DOUBLE, r -> UnitConversions.kwhToGwh(r.getDouble("curtailment_kwh"))))
        .step("select", (h, p) -> h.select(Steps.TIME, "availability_gwh", "curtailment_gwh", "avail_nan_perc", "curt_nan_perc"))
        .build();
  }

  public static Toolkit grossEnergy() {
    return PipelineToolkit.builder(GROSS_ENERGY, BuiltinToolkits.VERSION)
        .description("Gross energy and loss percentages from net energy and losses")
        .requires(SchemaContract.builder()
            .require("energy_gwh", ColumnType.DOUBLE)
            .require("availability_gwh", ColumnType.DOUBLE)
            .require("curtailment_gwh", ColumnType.DOUBLE)
            .build())
        .produces("gross_energy_gwh", "availability_pct", "curtailment_pct")
        .step("gross", (h, p) -> h.derive("gross_energy_gwh", ColumnType.DOUBLE,
            r -> UnitConversions.grossEnergy(r.getDouble("energy_gwh"), r.getDouble("availability_gwh"),
                r.getDouble("curtailment_gwh"))))
        .step("loss-fractions", (h, p) -> h
            .derive("availability_pct", ColumnType.DOUBLE,
                r -> UnitConversions.lossFraction(r.getDouble("availability_gwh"), r.getDouble("gross_energy_gwh")))
            .derive("curtailment_pct", ColumnType.DOUBLE,
                r -> UnitConversions.lossFraction(r.getDouble("curtailment_gwh"), r.getDouble("gross_energy_gwh"))))
        .build();
  }

  public static Toolkit powerToEnergy() {
    return PipelineToolkit.builder(POWER_TO_ENERGY, BuiltinToolkits.VERSION)
        .description("Energy per sample from average power and the sampling interval")
        .requires(SchemaContract.builder().require("power_kw", ColumnType.DOUBLE).build())
        .produces("energy_kwh")
        .defaults(ToolkitParams.of(PARAM_INTERVAL_MINUTES, 10))
        .step("convert", (h, p) -> {
          double minutes = p.requireDouble(PARAM_INTERVAL_MINUTES);
          if (!(minutes > 0)) throw new IllegalArgumentException(PARAM_INTERVAL_MINUTES + " must be > 0: " + minutes);
          return h.derive("energy_kwh", ColumnType.DOUBLE,
              r -> UnitConversions.powerToEnergy(r.getDouble("power_kw"), minutes));
        })
        .build();
  }
}

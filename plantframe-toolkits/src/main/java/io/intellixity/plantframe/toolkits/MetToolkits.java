package io.intellixity.plantframe.toolkits;

import io.intellixity.plantframe.frame.ColumnType;
import io.intellixity.plantframe.frame.SchemaContract;
import io.intellixity.plantframe.toolkit.PipelineToolkit;
import io.intellixity.plantframe.toolkit.Toolkit;
import io.intellixity.plantframe.toolkit.ToolkitParams;
import io.intellixity.plantframe.toolkits.functions.MetData;

public final class MetToolkits {
  public static final String AIR_DENSITY = "air-density";
  public static final String DENSITY_CORRECTED_WIND_SPEED = "density-corrected-wind-speed";

  public static final String PARAM_RHO_REF = "rho_ref";

  private MetToolkits() {}

  /** {@code rho_kgm3} from {@code temperature_k} and {@code pressure_pa}. */
  public static Toolkit airDensity() {
    return PipelineToolkit.builder(AIR_DENSITY, BuiltinToolkits.VERSION)
        .description("Dry air density from temperature and surface pressure")
        .requires(SchemaContract.builder()
            .require("temperature_k", ColumnType.DOUBLE)
            .require("pressure_pa", ColumnType.DOUBLE)
            .build())
        .produces("rho_kgm3")
        .step("density", (h, p) -> h.derive("rho_kgm3", ColumnType.DOUBLE,
            r -> MetData.airDensity(r.getDouble("temperature_k"), r.getDouble("pressure_pa"))))
        .build();
  }

  /** Composes {@link #airDensity()}, then normalises {@code ws_ms} to the reference density {@code rho_ref}. */
  public static Toolkit densityCorrectedWindSpeed(Toolkit airDensity) {
    return PipelineToolkit.builder(DENSITY_CORRECTED_WIND_SPEED, BuiltinToolkits.VERSION)
        .description("Wind speed corrected to a reference air density")
        .requires(SchemaContract.builder()
            .require("ws_ms", ColumnType.DOUBLE)
            .require("temperature_k", ColumnType.DOUBLE)
            .require("pressure_pa", ColumnType.DOUBLE)
            .build())
        .produces("rho_kgm3", "ws_dens_corr")
        .defaults(ToolkitParams.of(PARAM_RHO_REF, MetData.RHO_STANDARD))
        .then(airDensity)
        .step("correct", (h, p) -> {
          double rhoRef = p.requireDouble(PARAM_RHO_REF);
          if (!(rhoRef > 0)) throw new IllegalArgumentException(PARAM_RHO_REF + " must be > 0: " + rhoRef);
          return h.derive("ws_dens_corr", ColumnType.DOUBLE,
              r -> MetData.densityCorrectedWindSpeed(r.getDouble("ws_ms"), r.getDouble("rho_kgm3"), rhoRef));
        })
        .build();
  }
}

package io.intellixity.plantframe.toolkits;

import io.intellixity.plantframe.frame.ColumnType;
import io.intellixity.plantframe.frame.SchemaContract;
import io.intellixity.plantframe.toolkit.PipelineToolkit;
import io.intellixity.plantframe.toolkit.Toolkit;
import io.intellixity.plantframe.toolkits.functions.PowerCurves;

public final class PowerCurveToolkits {
  public static final String LOGISTIC5 = "power-curve-logistic5";

  private PowerCurveToolkits() {}

  /**
   * Predicted power {@code power_curve_kw} from {@code ws_ms}.\n
   * Parameters {@code a, b, c, d, g} are required; {@code lower} and {@code upper} cap the curve when given.
   */
  public static Toolkit logistic5() {
    return PipelineToolkit.builder(LOGISTIC5, BuiltinToolkits.VERSION)
        .description("Five-parameter logistic power curve, optionally capped")
        .requires(SchemaContract.builder().require("ws_ms", ColumnType.DOUBLE).build())
        .produces("power_curve_kw")
        .step("predict", (h, p) -> {
          double a = p.requireDouble("a");
          double b = p.requireDouble("b");
          double c = p.requireDouble("c");
          double d = p.requireDouble("d");
          double g = p.requireDouble("g");
          double lower = p.getDouble("lower", Double.NaN);
          double upper = p.getDouble("upper", Double.NaN);
          return h.derive("power_curve_kw", ColumnType.DOUBLE,
              r -> PowerCurves.logistic5Capped(r.getDouble("ws_ms"), a, b, c, d, g, lower, upper));
        })
        .build();
  }
}

package io.intellixity.plantframe.toolkits;

import io.intellixity.plantframe.toolkit.Toolkit;
import io.intellixity.plantframe.toolkit.ToolkitCatalog;
import io.intellixity.plantframe.toolkit.ToolkitContributor;

/** Contributes the built-in toolkits; listed in {@code META-INF/plantframe.factories}. */
public final class BuiltinToolkits implements ToolkitContributor {
  public static final String VERSION = "1.0";

  @Override
  public void contribute(ToolkitCatalog catalog) {
    registerAll(catalog);
  }

  public static ToolkitCatalog registerAll(ToolkitCatalog catalog) {
    Toolkit airDensity = MetToolkits.airDensity();
    return catalog
        .register(EnergyToolkits.meterEnergy())
        .register(EnergyToolkits.lossEstimates())
        .register(EnergyToolkits.grossEnergy())
        .register(EnergyToolkits.powerToEnergy())
        .register(QualityToolkits.rangeFlag())
        .register(QualityToolkits.windowRangeFlag())
        .register(QualityToolkits.flagFilter())
        .register(airDensity)
        .register(MetToolkits.densityCorrectedWindSpeed(airDensity))
        .register(PowerCurveToolkits.logistic5());
  }
}

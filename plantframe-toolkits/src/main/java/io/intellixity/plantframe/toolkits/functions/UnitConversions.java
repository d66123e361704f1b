package io.intellixity.plantframe.toolkits.functions;

public final class UnitConversions {
  public static final double KWH_PER_GWH = 1e6;

  private UnitConversions() {}

  /** Energy over one sample of {@code intervalMinutes} at constant power. */
  public static double powerToEnergy(double powerKw, double intervalMinutes) {
    return powerKw * intervalMinutes / 60.0;
  }

  public static double kwhToGwh(double kwh) {
    return kwh / KWH_PER_GWH;
  }

  /** Gross energy from net (metered) energy plus availability and curtailment losses, all in the same unit. */
  public static double grossEnergy(double net, double availability, double curtailment) {
    return net + availability + curtailment;
  }

  /** {@code loss / gross}; NaN when gross is zero or missing. */
  public static double lossFraction(double loss, double gross) {
    if (gross == 0.0 || Double.isNaN(gross)) return Double.NaN;
    return loss / gross;
  }
}

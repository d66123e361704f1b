package io.intellixity.plantframe.toolkits.functions;

/** Meteorological helpers. */
public final class MetData {
  /** Specific gas constant of dry air, J/(kg K). */
  public static final double R_DRY_AIR = 287.05;
  /** Standard sea-level air density, kg/m^3. */
  public static final double RHO_STANDARD = 1.225;

  private MetData() {}

  /** Dry-air density in kg/m^3 from temperature (K) and pressure (Pa). */
  public static double airDensity(double temperatureK, double pressurePa) {
    if (temperatureK <= 0.0) return Double.NaN;
    return pressurePa / (R_DRY_AIR * temperatureK);
  }

  /** Wind speed normalised to {@code rhoRef}: {@code ws * (rho / rhoRef)^(1/3)}. */
  public static double densityCorrectedWindSpeed(double windSpeed, double rho, double rhoRef) {
    return windSpeed * Math.cbrt(rho / rhoRef);
  }
}

package io.intellixity.plantframe.toolkits.functions;

/**
 * Parametric power curve forms.\n
 *
 * {@code logistic5} is the five-parameter logistic
 * {@code d + (a - d) / (1 + (x / c)^b)^g}: {@code a} is the value as {@code x -> 0} for {@code b > 0},
 * {@code d} the value as {@code x -> 0} for {@code b < 0}.\n
 */
public final class PowerCurves {
  private PowerCurves() {}

  public static double logistic5(double x, double a, double b, double c, double d, double g) {
    if (Double.isNaN(x)) return Double.NaN;
    if (x == 0.0) return b > 0 ? a : d;
    return d + (a - d) / Math.pow(1.0 + Math.pow(x / c, b), g);
  }

  /** {@link #logistic5} clipped to {@code [lower, upper]}; a NaN bound leaves that side open. */
  public static double logistic5Capped(double x, double a, double b, double c, double d, double g,
                                       double lower, double upper) {
    double y = logistic5(x, a, b, c, d, g);
    if (Double.isNaN(y)) return y;
    if (!Double.isNaN(lower) && y < lower) y = lower;
    if (!Double.isNaN(upper) && y > upper) y = upper;
    return y;
  }
}

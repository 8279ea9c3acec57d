package perf.foresight.core.stat;

/**
 * Ordinary least squares fit {@code y = intercept + slope·x}.
 *
 * <p>A fit over a regressor with zero variance is {@code degenerate}: slope 0, intercept mean(y),
 * r² 0. Callers decide whether that is an error.
 *
 * @param pValue two-sided p-value of the slope (normal approximation of the t statistic)
 */
public record LinearFit(
    double intercept, double slope, double rSquared, double pValue, int n, boolean degenerate) {

  /** Fits against the sample index 0..n-1. */
  public static LinearFit overIndex(double[] y) {
    double[] x = new double[y.length];
    for (int i = 0; i < x.length; i++) {
      x[i] = i;
    }
    return of(x, y);
  }

  public static LinearFit of(double[] x, double[] y) {
    if (x.length != y.length || x.length == 0) {
      throw new IllegalArgumentException("x and y must be non-empty and of equal length");
    }
    int n = x.length;
    double meanX = Statistics.mean(x);
    double meanY = Statistics.mean(y);

    double sxx = 0;
    double sxy = 0;
    double syy = 0;
    for (int i = 0; i < n; i++) {
      double dx = x[i] - meanX;
      double dy = y[i] - meanY;
      sxx += dx * dx;
      sxy += dx * dy;
      syy += dy * dy;
    }

    if (sxx == 0) {
      return new LinearFit(meanY, 0.0, 0.0, 1.0, n, true);
    }

    double slope = sxy / sxx;
    double intercept = meanY - slope * meanX;

    double sse = 0;
    for (int i = 0; i < n; i++) {
      double residual = y[i] - (intercept + slope * x[i]);
      sse += residual * residual;
    }
    double rSquared = syy == 0 ? 0.0 : Math.max(0.0, Math.min(1.0, 1.0 - sse / syy));
    return new LinearFit(intercept, slope, rSquared, slopePValue(slope, sse, sxx, n), n, false);
  }

  public double valueAt(double x) {
    return intercept + slope * x;
  }

  private static double slopePValue(double slope, double sse, double sxx, int n) {
    if (n <= 2) {
      return 1.0;
    }
    double standardError = Math.sqrt(sse / (n - 2) / sxx);
    if (standardError == 0) {
      return slope == 0 ? 1.0 : 0.0;
    }
    return Statistics.twoSidedPValue(slope / standardError);
  }
}

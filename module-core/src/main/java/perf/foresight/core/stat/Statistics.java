package perf.foresight.core.stat;

import java.util.Arrays;

/**
 * Descriptive statistics over {@code double[]} samples.
 *
 * <p>Standard deviation is the population form (divide by n). Every method except {@link
 * #mape(double[], double[])} requires a non-empty array.
 */
public final class Statistics {

  private Statistics() {}

  public static double mean(double[] values) {
    requireNonEmpty(values);
    double sum = 0;
    for (double v : values) {
      sum += v;
    }
    return sum / values.length;
  }

  public static double variance(double[] values) {
    double mean = mean(values);
    double sum = 0;
    for (double v : values) {
      double d = v - mean;
      sum += d * d;
    }
    return sum / values.length;
  }

  public static double stdDev(double[] values) {
    return Math.sqrt(variance(values));
  }

  /** stdDev / mean, or NaN when the mean is zero. */
  public static double coefficientOfVariation(double[] values) {
    double mean = mean(values);
    if (mean == 0) {
      return Double.NaN;
    }
    return stdDev(values) / Math.abs(mean);
  }

  public static double min(double[] values) {
    requireNonEmpty(values);
    double min = values[0];
    for (double v : values) {
      min = Math.min(min, v);
    }
    return min;
  }

  public static double max(double[] values) {
    requireNonEmpty(values);
    double max = values[0];
    for (double v : values) {
      max = Math.max(max, v);
    }
    return max;
  }

  /**
   * Nearest-rank percentile: {@code rank = ⌈p/100 · n⌉} clamped to [1, n].
   *
   * <p>{@code percentile(v, 0)} is the minimum and {@code percentile(v, 100)} the maximum.
   */
  public static double percentile(double[] values, double p) {
    requireNonEmpty(values);
    if (p < 0 || p > 100 || Double.isNaN(p)) {
      throw new IllegalArgumentException("percentile must be in [0,100]: " + p);
    }
    double[] sorted = values.clone();
    Arrays.sort(sorted);
    int rank = (int) Math.ceil(p / 100.0 * sorted.length);
    rank = Math.max(1, Math.min(sorted.length, rank));
    return sorted[rank - 1];
  }

  /**
   * Mean absolute percentage error as a fraction, skipping points whose actual value is zero.
   *
   * @return NaN when no point can be scored
   */
  public static double mape(double[] actual, double[] fitted) {
    if (actual.length != fitted.length) {
      throw new IllegalArgumentException("length mismatch");
    }
    double sum = 0;
    int counted = 0;
    for (int i = 0; i < actual.length; i++) {
      if (actual[i] == 0) {
        continue;
      }
      sum += Math.abs((actual[i] - fitted[i]) / actual[i]);
      counted++;
    }
    return counted == 0 ? Double.NaN : sum / counted;
  }

  /** {@code 1 − MAPE} clamped to [0,1]; 0 when nothing can be scored. */
  public static double accuracy(double[] actual, double[] fitted) {
    double mape = mape(actual, fitted);
    if (Double.isNaN(mape)) {
      return 0.0;
    }
    return Math.max(0.0, Math.min(1.0, 1.0 - mape));
  }

  /** Standard normal CDF (Abramowitz-Stegun 7.1.26, |error| < 1.5e-7). */
  public static double normalCdf(double z) {
    double x = Math.abs(z) / Math.sqrt(2.0);
    double t = 1.0 / (1.0 + 0.3275911 * x);
    double poly =
        t
            * (0.254829592
                + t * (-0.284496736 + t * (1.421413741 + t * (-1.453152027 + t * 1.061405429))));
    double erf = 1.0 - poly * Math.exp(-x * x);
    return z >= 0 ? 0.5 * (1.0 + erf) : 0.5 * (1.0 - erf);
  }

  public static double twoSidedPValue(double z) {
    if (Double.isInfinite(z)) {
      return 0.0;
    }
    return Math.max(0.0, Math.min(1.0, 2.0 * (1.0 - normalCdf(Math.abs(z)))));
  }

  private static void requireNonEmpty(double[] values) {
    if (values == null || values.length == 0) {
      throw new IllegalArgumentException("values must not be empty");
    }
  }
}

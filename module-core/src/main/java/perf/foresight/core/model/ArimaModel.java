package perf.foresight.core.model;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import perf.foresight.core.domain.model.MetricType;
import perf.foresight.core.domain.model.ModelType;
import perf.foresight.core.domain.model.PerformanceDataPoint;
import perf.foresight.core.stat.Statistics;

/**
 * Simplified AR(1)+MA(1) on mean-centred values.
 *
 * <p>The coefficients are fixed heuristics ({@code φ = 0.5}, {@code θ = 0.3}); training only
 * estimates the mean and replays the recursion to obtain the last state. No likelihood fitting
 * is done.
 *
 * <pre>
 * x̂(t) = φ · x(t−1) + θ · e(t−1),   e(t) = x(t) − x̂(t)
 * </pre>
 */
public class ArimaModel extends AbstractPredictionModel {

  public static final int MIN_POINTS = 20;
  public static final double PHI = 0.5;
  public static final double THETA = 0.3;

  private volatile double mean;
  private volatile double lastCentered;
  private volatile double lastError;
  private volatile double lastValue;

  public ArimaModel(MetricType metric, Duration samplingInterval, Clock clock) {
    super(metric, samplingInterval, clock);
  }

  @Override
  public ModelType type() {
    return ModelType.ARIMA;
  }

  @Override
  public int minimumPoints() {
    return MIN_POINTS;
  }

  @Override
  protected double[] fit(double[] values, List<PerformanceDataPoint> history) {
    double mu = Statistics.mean(values);
    double[] fitted = new double[values.length];
    fitted[0] = values[0];

    double previousCentered = values[0] - mu;
    double previousError = 0.0;
    for (int i = 1; i < values.length; i++) {
      double centered = values[i] - mu;
      double estimate = PHI * previousCentered + THETA * previousError;
      fitted[i] = estimate + mu;
      previousError = centered - estimate;
      previousCentered = centered;
    }

    this.mean = mu;
    this.lastCentered = previousCentered;
    this.lastError = previousError;
    this.lastValue = values[values.length - 1];
    return fitted;
  }

  @Override
  protected double extrapolate(Map<String, Double> features, double steps) {
    int iterations = (int) Math.ceil(steps);
    if (iterations == 0) {
      return lastValue;
    }
    // future shocks are zero after the first step
    double estimate = PHI * lastCentered + THETA * lastError;
    for (int i = 1; i < iterations; i++) {
      estimate = PHI * estimate;
    }
    return mean + estimate;
  }
}

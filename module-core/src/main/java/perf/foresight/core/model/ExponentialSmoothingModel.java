package perf.foresight.core.model;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import perf.foresight.core.domain.model.MetricType;
import perf.foresight.core.domain.model.ModelType;
import perf.foresight.core.domain.model.PerformanceDataPoint;

/**
 * Double exponential smoothing (level + trend) with a fixed factor.
 *
 * <p>Level is seeded from the first point, trend from {@code (y2 − y0) / 2}; both are smoothed
 * with {@link #ALPHA}. Accuracy is scored on one-step-ahead forecasts.
 */
public class ExponentialSmoothingModel extends AbstractPredictionModel {

  public static final int MIN_POINTS = 5;
  public static final double ALPHA = 0.3;

  private volatile double level;
  private volatile double trend;

  public ExponentialSmoothingModel(MetricType metric, Duration samplingInterval, Clock clock) {
    super(metric, samplingInterval, clock);
  }

  @Override
  public ModelType type() {
    return ModelType.EXPONENTIAL;
  }

  @Override
  public int minimumPoints() {
    return MIN_POINTS;
  }

  @Override
  protected double[] fit(double[] values, List<PerformanceDataPoint> history) {
    double currentLevel = values[0];
    double currentTrend = (values[2] - values[0]) / 2.0;

    double[] fitted = new double[values.length];
    fitted[0] = values[0];
    for (int i = 1; i < values.length; i++) {
      fitted[i] = currentLevel + currentTrend;
      double nextLevel = ALPHA * values[i] + (1 - ALPHA) * (currentLevel + currentTrend);
      currentTrend = ALPHA * (nextLevel - currentLevel) + (1 - ALPHA) * currentTrend;
      currentLevel = nextLevel;
    }
    this.level = currentLevel;
    this.trend = currentTrend;
    return fitted;
  }

  @Override
  protected double extrapolate(Map<String, Double> features, double steps) {
    return level + trend * steps;
  }
}

package perf.foresight.core.detector;

import java.time.Clock;
import java.util.List;
import perf.foresight.core.config.AnalyticsConfig;
import perf.foresight.core.domain.model.DetectorType;
import perf.foresight.core.domain.model.MetricType;
import perf.foresight.core.domain.model.PerformanceBaseline;
import perf.foresight.core.domain.model.PerformanceDataPoint;
import perf.foresight.core.domain.model.RegressionResult;
import perf.foresight.core.domain.model.RegressionThreshold;
import perf.foresight.core.domain.model.RegressionType;
import perf.foresight.core.domain.model.TrendAnalysis;
import perf.foresight.core.domain.model.TrendDirection;

/**
 * Slope of the current window.
 *
 * <p>The projected change is the drift of the fitted line across the window relative to the
 * baseline mean: {@code slope · (n − 1) / baselineMean × 100}. A flag needs an unfavourable
 * direction, a fit with r² at least {@code trendMinRSquared}, and a projected change strictly
 * above the threshold.
 */
public class TrendRegressionDetector extends AbstractRegressionDetector {

  public static final int MIN_POINTS = 20;
  public static final double CONFIDENCE = 0.8;

  public TrendRegressionDetector(AnalyticsConfig config, Clock clock) {
    super(config, clock);
  }

  @Override
  public DetectorType type() {
    return DetectorType.TREND;
  }

  @Override
  public double confidence() {
    return CONFIDENCE;
  }

  @Override
  public int minimumPoints() {
    return MIN_POINTS;
  }

  @Override
  protected RegressionResult doDetect(
      PerformanceBaseline baseline, List<PerformanceDataPoint> window, double[] values) {
    MetricType metric = baseline.metric();
    RegressionThreshold threshold = threshold(metric);
    TrendAnalysis trend = analyzeTrend(values, baseline.mean());

    double projected =
        baseline.mean() == 0
            ? 0.0
            : trend.slope() * (values.length - 1) / Math.abs(baseline.mean()) * 100.0;
    boolean fitted = trend.rSquared() >= config.getTrendMinRSquared();

    RegressionResult.RegressionResultBuilder builder =
        resultBuilder(baseline, window, mean(values))
            .changePercent(projected)
            .trend(trend)
            .pValue(trend.pValue())
            .significant(trend.pValue() < config.getSignificanceLevel());

    if (trend.direction() == TrendDirection.STABLE || !fitted) {
      return builder.build();
    }
    if (trend.direction() == unfavourableDirection(metric)) {
      if (Math.abs(projected) > threshold.degradationPercent()) {
        builder
            .type(RegressionType.DEGRADATION)
            .severity(severity(projected, threshold.degradationPercent()));
      }
    } else if (Math.abs(projected) > threshold.improvementPercent()) {
      builder
          .type(RegressionType.IMPROVEMENT)
          .severity(severity(projected, threshold.improvementPercent()));
    }
    return builder.build();
  }
}

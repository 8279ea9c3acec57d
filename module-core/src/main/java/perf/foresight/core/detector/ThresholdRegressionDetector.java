package perf.foresight.core.detector;

import java.time.Clock;
import java.util.List;
import perf.foresight.core.config.AnalyticsConfig;
import perf.foresight.core.domain.model.DetectorType;
import perf.foresight.core.domain.model.MetricType;
import perf.foresight.core.domain.model.PerformanceBaseline;
import perf.foresight.core.domain.model.PerformanceDataPoint;
import perf.foresight.core.domain.model.RegressionResult;
import perf.foresight.core.domain.model.RegressionType;
import perf.foresight.core.domain.model.Severity;

/**
 * Sustained excursions above the baseline's p99/p95.
 *
 * <p>Only meaningful for metrics where higher is worse; a lower-is-worse metric never sits
 * "above" a bad percentile.
 */
public class ThresholdRegressionDetector extends AbstractRegressionDetector {

  public static final int MIN_POINTS = 5;
  public static final double CONFIDENCE = 0.9;

  public ThresholdRegressionDetector(AnalyticsConfig config, Clock clock) {
    super(config, clock);
  }

  @Override
  public DetectorType type() {
    return DetectorType.THRESHOLD;
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
  public boolean isApplicable(MetricType metric) {
    return metric.isHigherIsWorse();
  }

  @Override
  protected RegressionResult doDetect(
      PerformanceBaseline baseline, List<PerformanceDataPoint> window, double[] values) {
    double currentMean = mean(values);
    double change = changePercent(baseline.mean(), currentMean);
    double sustain = config.getThresholdSustainRatio();
    RegressionResult.RegressionResultBuilder builder = resultBuilder(baseline, window, currentMean);

    if (ratioAbove(values, baseline.p99()) >= sustain) {
      return builder.type(RegressionType.DEGRADATION).severity(Severity.HIGH).build();
    }
    if (ratioAbove(values, baseline.p95()) >= sustain) {
      double threshold = threshold(baseline.metric()).degradationPercent();
      return builder.type(RegressionType.DEGRADATION).severity(severity(change, threshold)).build();
    }
    if (currentMean < baseline.mean() - 2 * baseline.stdDev()) {
      double threshold = threshold(baseline.metric()).improvementPercent();
      return builder.type(RegressionType.IMPROVEMENT).severity(severity(change, threshold)).build();
    }
    return builder.build();
  }

  private static double ratioAbove(double[] values, double bound) {
    int above = 0;
    for (double v : values) {
      if (v > bound) {
        above++;
      }
    }
    return (double) above / values.length;
  }
}

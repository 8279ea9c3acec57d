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
import perf.foresight.core.stat.Statistics;

/**
 * Mean comparison against the baseline.
 *
 * <p>Flags a degradation iff the unfavourable change strictly exceeds the metric's degradation
 * threshold; the exact boundary does not flag. The z-test p-value ({@code σ_baseline / √n}) is
 * attached as a significance hint and does not gate the verdict.
 */
public class StatisticalRegressionDetector extends AbstractRegressionDetector {

  public static final int MIN_POINTS = 10;

  public StatisticalRegressionDetector(AnalyticsConfig config, Clock clock) {
    super(config, clock);
  }

  @Override
  public DetectorType type() {
    return DetectorType.STATISTICAL;
  }

  @Override
  public double confidence() {
    return config.getConfidenceLevel();
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
    double currentMean = mean(values);
    double change = changePercent(baseline.mean(), currentMean);
    double unfavourable = unfavourableChange(metric, change);
    double pValue = pValue(baseline, currentMean, values.length);

    RegressionResult.RegressionResultBuilder builder =
        resultBuilder(baseline, window, currentMean)
            .pValue(pValue)
            .significant(pValue < config.getSignificanceLevel())
            .trend(analyzeTrend(values, baseline.mean()));

    if (unfavourable > threshold.degradationPercent()) {
      builder
          .type(RegressionType.DEGRADATION)
          .severity(severity(change, threshold.degradationPercent()));
    } else if (-unfavourable > threshold.improvementPercent()) {
      builder
          .type(RegressionType.IMPROVEMENT)
          .severity(severity(change, threshold.improvementPercent()));
    }
    return builder.build();
  }

  private static double pValue(PerformanceBaseline baseline, double currentMean, int n) {
    double difference = currentMean - baseline.mean();
    if (baseline.stdDev() == 0) {
      return difference == 0 ? 1.0 : 0.0;
    }
    double z = difference / (baseline.stdDev() / Math.sqrt(n));
    return Statistics.twoSidedPValue(z);
  }
}

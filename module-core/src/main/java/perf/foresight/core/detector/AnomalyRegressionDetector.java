package perf.foresight.core.detector;

import java.time.Clock;
import java.util.List;
import perf.foresight.core.config.AnalyticsConfig;
import perf.foresight.core.domain.model.DetectorType;
import perf.foresight.core.domain.model.OutlierAnalysis;
import perf.foresight.core.domain.model.PerformanceBaseline;
import perf.foresight.core.domain.model.PerformanceDataPoint;
import perf.foresight.core.domain.model.RegressionResult;
import perf.foresight.core.domain.model.RegressionType;
import perf.foresight.core.domain.model.Severity;

/**
 * z-score outliers of the current window against the baseline.
 *
 * <p>A point is an outlier when it lies strictly outside {@code [μ − k·σ, μ + k·σ]}, where μ
 * and σ are the baseline mean and standard deviation. A baseline with σ = 0 has no usable
 * spread and yields no outliers. The window is classified {@code ANOMALY} once the outlier
 * ratio exceeds {@code anomalyRatio}; the outlier analysis is attached either way.
 */
public class AnomalyRegressionDetector extends AbstractRegressionDetector {

  public static final int MIN_POINTS = 10;
  public static final double CONFIDENCE = 0.7;
  public static final String METHOD = "z-score";

  public AnomalyRegressionDetector(AnalyticsConfig config, Clock clock) {
    super(config, clock);
  }

  @Override
  public DetectorType type() {
    return DetectorType.ANOMALY;
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
    OutlierAnalysis outliers = findOutliers(values, baseline, config.getAnomalyK());
    RegressionResult.RegressionResultBuilder builder =
        resultBuilder(baseline, window, mean(values)).outliers(outliers);

    if (outliers.outlierRatio() > config.getAnomalyRatio()) {
      double allowed = config.getAnomalyRatio() * values.length;
      builder
          .type(RegressionType.ANOMALY)
          .severity(Severity.fromRatio(outliers.outlierCount() / allowed));
    }
    return builder.build();
  }

  static OutlierAnalysis findOutliers(double[] values, PerformanceBaseline baseline, double k) {
    double stdDev = baseline.stdDev();
    int count = 0;
    if (stdDev > 0) {
      double lower = baseline.mean() - k * stdDev;
      double upper = baseline.mean() + k * stdDev;
      for (double v : values) {
        if (v < lower || v > upper) {
          count++;
        }
      }
    }
    double ratio = (double) count / values.length;
    return new OutlierAnalysis(count, ratio, ratio * 100.0, k, METHOD);
  }
}

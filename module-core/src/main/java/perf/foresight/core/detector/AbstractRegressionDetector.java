package perf.foresight.core.detector;

import java.time.Clock;
import java.util.List;
import java.util.UUID;
import perf.foresight.core.config.AnalyticsConfig;
import perf.foresight.core.domain.model.ChangeDirection;
import perf.foresight.core.domain.model.MetricType;
import perf.foresight.core.domain.model.PerformanceBaseline;
import perf.foresight.core.domain.model.PerformanceDataPoint;
import perf.foresight.core.domain.model.RegressionResult;
import perf.foresight.core.domain.model.RegressionThreshold;
import perf.foresight.core.domain.model.RegressionType;
import perf.foresight.core.domain.model.Severity;
import perf.foresight.core.domain.model.TrendAnalysis;
import perf.foresight.core.domain.model.TrendDirection;
import perf.foresight.core.stat.LinearFit;
import perf.foresight.core.stat.Statistics;
import perf.foresight.error.exception.InactiveBaselineException;
import perf.foresight.error.exception.InsufficientDataException;

/**
 * Template for detectors: precondition checks, value extraction and the result skeleton.
 *
 * <p>Changes are read through the metric polarity. {@link #unfavourableChange(MetricType,
 * double)} is positive when the metric moved the wrong way (up for response time, down for
 * throughput).
 */
public abstract class AbstractRegressionDetector implements RegressionDetector {

  protected final AnalyticsConfig config;
  protected final Clock clock;

  protected AbstractRegressionDetector(AnalyticsConfig config, Clock clock) {
    this.config = config;
    this.clock = clock;
  }

  @Override
  public String name() {
    return type().getDetectorName();
  }

  @Override
  public boolean isApplicable(MetricType metric) {
    return true;
  }

  @Override
  public final RegressionResult detect(
      PerformanceBaseline baseline, List<PerformanceDataPoint> window) {
    if (!baseline.active()) {
      throw new InactiveBaselineException(baseline.metric().getKey());
    }
    if (window.size() < minimumPoints()) {
      throw new InsufficientDataException(
          name() + ":" + baseline.metric().getKey(), minimumPoints(), window.size());
    }
    double[] values = new double[window.size()];
    for (int i = 0; i < values.length; i++) {
      values[i] = window.get(i).value(baseline.metric());
    }
    return doDetect(baseline, window, values);
  }

  protected abstract RegressionResult doDetect(
      PerformanceBaseline baseline, List<PerformanceDataPoint> window, double[] values);

  /** Result pre-filled with identity, windows and the mean comparison. */
  protected RegressionResult.RegressionResultBuilder resultBuilder(
      PerformanceBaseline baseline, List<PerformanceDataPoint> window, double currentMean) {
    double change = changePercent(baseline.mean(), currentMean);
    return RegressionResult.builder()
        .id(UUID.randomUUID().toString())
        .metric(baseline.metric())
        .detector(name())
        .type(RegressionType.NONE)
        .severity(Severity.LOW)
        .baselineMean(baseline.mean())
        .currentMean(currentMean)
        .changePercent(change)
        .direction(ChangeDirection.of(change))
        .pValue(1.0)
        .confidence(confidence())
        .significant(false)
        .baselineId(baseline.id())
        .baselineWindowStart(baseline.windowStart())
        .baselineWindowEnd(baseline.windowEnd())
        .currentWindowStart(window.get(0).timestamp())
        .currentWindowEnd(window.get(window.size() - 1).timestamp())
        .detectedAt(clock.instant());
  }

  protected RegressionThreshold threshold(MetricType metric) {
    return config.thresholdFor(metric);
  }

  /** {@code (current − baseline) / baseline × 100}; 0 when the baseline mean is 0. */
  protected static double changePercent(double baselineMean, double currentMean) {
    if (baselineMean == 0) {
      return 0.0;
    }
    return (currentMean - baselineMean) / Math.abs(baselineMean) * 100.0;
  }

  protected static double unfavourableChange(MetricType metric, double changePercent) {
    return metric.isHigherIsWorse() ? changePercent : -changePercent;
  }

  protected static Severity severity(double changePercent, double thresholdPercent) {
    return Severity.fromRatio(Math.abs(changePercent) / thresholdPercent);
  }

  /** OLS trend of the window against the sample index. */
  protected TrendAnalysis analyzeTrend(double[] values, double baselineMean) {
    LinearFit fit = LinearFit.overIndex(values);
    TrendDirection direction;
    if (Math.abs(fit.slope()) <= config.getTrendEpsilon() * Math.abs(baselineMean)) {
      direction = TrendDirection.STABLE;
    } else {
      direction = fit.slope() > 0 ? TrendDirection.INCREASING : TrendDirection.DECREASING;
    }
    return new TrendAnalysis(direction, fit.rSquared(), fit.slope(), fit.rSquared(), fit.pValue());
  }

  protected static TrendDirection unfavourableDirection(MetricType metric) {
    return metric.isHigherIsWorse() ? TrendDirection.INCREASING : TrendDirection.DECREASING;
  }

  protected static double mean(double[] values) {
    return Statistics.mean(values);
  }
}

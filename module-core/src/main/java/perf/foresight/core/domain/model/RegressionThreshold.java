package perf.foresight.core.domain.model;

import perf.foresight.error.exception.InvalidConfigurationException;

/**
 * Per-metric change thresholds, in percent of the baseline mean.
 *
 * @param degradationPercent unfavourable change that must be strictly exceeded to flag
 * @param improvementPercent favourable change that must be strictly exceeded to report
 */
public record RegressionThreshold(
    MetricType metric, double degradationPercent, double improvementPercent) {

  public RegressionThreshold {
    if (metric == null) {
      throw new InvalidConfigurationException("threshold metric is required");
    }
    if (!(degradationPercent > 0) || !(improvementPercent > 0)) {
      throw new InvalidConfigurationException(
          String.format(
              "thresholds for %s must be positive (degradation=%s, improvement=%s)",
              metric.getKey(), degradationPercent, improvementPercent));
    }
  }
}

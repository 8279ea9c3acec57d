package perf.foresight.core.domain.model;

import java.time.Instant;
import lombok.Builder;

/**
 * Verdict of one detector for one metric.
 *
 * <p>{@code trend} and {@code outliers} are null when the detector does not produce them.
 */
@Builder(toBuilder = true)
public record RegressionResult(
    String id,
    MetricType metric,
    String detector,
    RegressionType type,
    Severity severity,
    double baselineMean,
    double currentMean,
    double changePercent,
    ChangeDirection direction,
    double pValue,
    double confidence,
    boolean significant,
    String baselineId,
    Instant baselineWindowStart,
    Instant baselineWindowEnd,
    Instant currentWindowStart,
    Instant currentWindowEnd,
    TrendAnalysis trend,
    OutlierAnalysis outliers,
    Instant detectedAt) {

  public boolean isFlagged() {
    return type != RegressionType.NONE;
  }
}

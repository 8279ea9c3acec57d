package perf.foresight.core.domain.model;

import java.time.Instant;
import lombok.Builder;

/**
 * Statistical summary of a metric over a sample window.
 *
 * <p>Immutable; a refresh publishes a new instance instead of mutating this one.
 */
@Builder(toBuilder = true)
public record PerformanceBaseline(
    String id,
    MetricType metric,
    double mean,
    double stdDev,
    double min,
    double max,
    int sampleSize,
    double p95,
    double p99,
    Instant windowStart,
    Instant windowEnd,
    Instant createdAt,
    boolean active) {

  public PerformanceBaseline deactivated() {
    return toBuilder().active(false).build();
  }
}

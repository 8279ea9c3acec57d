package perf.foresight.core.domain.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import lombok.Builder;

/**
 * One collected observation with its derived features.
 *
 * <p>Immutable: features are attached when the point is built, so any reader that can see the
 * point also sees its features.
 */
@Builder(toBuilder = true)
public record PerformanceDataPoint(
    Instant timestamp,
    double responseTimeMs,
    double successRate,
    double throughput,
    double errorRate,
    double cpuUsage,
    double memoryUsage,
    double diskUsage,
    double networkIo,
    double activeUsers,
    double dataVolume,
    Map<String, Double> features) {

  public PerformanceDataPoint {
    Objects.requireNonNull(timestamp, "timestamp");
    features = features == null ? Map.of() : Map.copyOf(features);
  }

  public static PerformanceDataPoint of(
      PerformanceMetrics metrics, Instant timestamp, Map<String, Double> features) {
    return PerformanceDataPoint.builder()
        .timestamp(timestamp)
        .responseTimeMs(metrics.averageResponseTime().toNanos() / 1_000_000.0)
        .successRate(metrics.successRate())
        .throughput(metrics.requestsPerSecond())
        .errorRate(metrics.errorRate())
        .cpuUsage(metrics.cpuUsage())
        .memoryUsage(metrics.memoryUsage())
        .diskUsage(metrics.diskUsage())
        .networkIo(metrics.networkIo())
        .activeUsers(metrics.activeUsers())
        .dataVolume(metrics.dataProcessingVolume())
        .features(features)
        .build();
  }

  public double value(MetricType metric) {
    return metric.valueOf(this);
  }

  public OptionalDouble feature(String name) {
    Double value = features.get(name);
    return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
  }
}

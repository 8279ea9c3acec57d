package perf.foresight.core.fixture;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import perf.foresight.core.domain.model.MetricType;
import perf.foresight.core.domain.model.PerformanceBaseline;
import perf.foresight.core.domain.model.PerformanceDataPoint;
import perf.foresight.core.domain.model.PerformanceMetrics;

/** Builders for data points, series and baselines used across the core tests. */
public final class TestDataPoints {

  /** Monday 2024-01-15 06:00 UTC. */
  public static final Instant START = Instant.parse("2024-01-15T06:00:00Z");

  public static final Duration STEP = Duration.ofSeconds(30);

  private TestDataPoints() {}

  /** Points {@link #STEP} apart starting at {@link #START}, with {@code metric} set. */
  public static List<PerformanceDataPoint> series(MetricType metric, double... values) {
    List<PerformanceDataPoint> points = new ArrayList<>(values.length);
    for (int i = 0; i < values.length; i++) {
      points.add(point(START.plus(STEP.multipliedBy(i)), metric, values[i]));
    }
    return points;
  }

  /** {@code a + b·i} for i in [0, n). */
  public static List<PerformanceDataPoint> linear(MetricType metric, int n, double a, double b) {
    double[] values = new double[n];
    for (int i = 0; i < n; i++) {
      values[i] = a + b * i;
    }
    return series(metric, values);
  }

  public static List<PerformanceDataPoint> constant(MetricType metric, int n, double value) {
    return linear(metric, n, value, 0.0);
  }

  public static PerformanceDataPoint point(Instant timestamp, MetricType metric, double value) {
    return point(timestamp, metric, value, Map.of());
  }

  public static PerformanceDataPoint point(
      Instant timestamp, MetricType metric, double value, Map<String, Double> features) {
    PerformanceDataPoint.PerformanceDataPointBuilder builder =
        PerformanceDataPoint.builder().timestamp(timestamp).features(features);
    switch (metric) {
      case RESPONSE_TIME -> builder.responseTimeMs(value);
      case SUCCESS_RATE -> builder.successRate(value);
      case THROUGHPUT -> builder.throughput(value);
      case ERROR_RATE -> builder.errorRate(value);
      case CPU_USAGE -> builder.cpuUsage(value);
      case MEMORY_USAGE -> builder.memoryUsage(value);
      case DISK_USAGE -> builder.diskUsage(value);
      case NETWORK_IO -> builder.networkIo(value);
      case ACTIVE_USERS -> builder.activeUsers(value);
      case DATA_VOLUME -> builder.dataVolume(value);
    }
    return builder.build();
  }

  public static PerformanceMetrics metrics(double responseTimeMs) {
    return PerformanceMetrics.builder()
        .averageResponseTime(Duration.ofNanos(Math.round(responseTimeMs * 1_000_000)))
        .successRate(0.99)
        .requestsPerSecond(100)
        .errorRate(0.01)
        .cpuUsage(40)
        .memoryUsage(60)
        .diskUsage(50)
        .networkIo(1_000)
        .activeUsers(50)
        .dataProcessingVolume(5_000)
        .build();
  }

  public static PerformanceBaseline baseline(
      MetricType metric, double mean, double stdDev, double p95, double p99) {
    return PerformanceBaseline.builder()
        .id("baseline-" + metric.getKey())
        .metric(metric)
        .mean(mean)
        .stdDev(stdDev)
        .min(mean - stdDev)
        .max(p99)
        .sampleSize(100)
        .p95(p95)
        .p99(p99)
        .windowStart(START.minus(Duration.ofDays(1)))
        .windowEnd(START)
        .createdAt(START)
        .active(true)
        .build();
  }

  public static PerformanceBaseline baseline(MetricType metric, double mean, double stdDev) {
    return baseline(metric, mean, stdDev, mean + 2 * stdDev, mean + 3 * stdDev);
  }
}

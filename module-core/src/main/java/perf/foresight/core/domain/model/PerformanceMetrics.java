package perf.foresight.core.domain.model;

import java.time.Duration;
import java.time.Instant;
import lombok.Builder;

/** Raw snapshot supplied by a {@link perf.foresight.core.port.out.PerformanceMonitor}. */
@Builder
public record PerformanceMetrics(
    Duration averageResponseTime,
    double successRate,
    double requestsPerSecond,
    double errorRate,
    double cpuUsage,
    double memoryUsage,
    double diskUsage,
    double networkIo,
    long activeUsers,
    double dataProcessingVolume,
    Instant collectedAt) {

  public PerformanceMetrics {
    if (averageResponseTime == null) {
      averageResponseTime = Duration.ZERO;
    }
  }
}

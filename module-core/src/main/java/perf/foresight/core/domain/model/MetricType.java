package perf.foresight.core.domain.model;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import perf.foresight.error.exception.InvalidConfigurationException;

/**
 * Closed set of monitored metrics.
 *
 * <p>Each constant carries its wire key, unit, the valid value domain used for clamping
 * predictions, and its polarity: for {@code higherIsWorse} metrics an increase is unfavourable,
 * for the others a decrease is.
 */
@Getter
@RequiredArgsConstructor
public enum MetricType {
  RESPONSE_TIME("response_time", "ms", 0.0, Double.POSITIVE_INFINITY, true, true),
  SUCCESS_RATE("success_rate", "ratio", 0.0, 1.0, false, true),
  THROUGHPUT("throughput", "req/s", 0.0, Double.POSITIVE_INFINITY, false, true),
  ERROR_RATE("error_rate", "ratio", 0.0, 1.0, true, true),
  CPU_USAGE("cpu_usage", "percent", 0.0, 100.0, true, true),
  MEMORY_USAGE("memory_usage", "percent", 0.0, 100.0, true, true),
  DISK_USAGE("disk_usage", "percent", 0.0, 100.0, true, false),
  NETWORK_IO("network_io", "bytes/s", 0.0, Double.POSITIVE_INFINITY, true, false),
  ACTIVE_USERS("active_users", "users", 0.0, Double.POSITIVE_INFINITY, false, false),
  DATA_VOLUME("data_volume", "bytes", 0.0, Double.POSITIVE_INFINITY, false, false);

  private final String key;
  private final String unit;
  private final double minValue;
  private final double maxValue;
  private final boolean higherIsWorse;

  /** Whether moving-average, trend and volatility features are derived for this metric. */
  private final boolean featured;

  public double clamp(double value) {
    if (Double.isNaN(value)) {
      return minValue;
    }
    return Math.max(minValue, Math.min(maxValue, value));
  }

  public boolean isRate() {
    return maxValue == 1.0;
  }

  /** Reads this metric's value from a data point. */
  public double valueOf(PerformanceDataPoint point) {
    return switch (this) {
      case RESPONSE_TIME -> point.responseTimeMs();
      case SUCCESS_RATE -> point.successRate();
      case THROUGHPUT -> point.throughput();
      case ERROR_RATE -> point.errorRate();
      case CPU_USAGE -> point.cpuUsage();
      case MEMORY_USAGE -> point.memoryUsage();
      case DISK_USAGE -> point.diskUsage();
      case NETWORK_IO -> point.networkIo();
      case ACTIVE_USERS -> point.activeUsers();
      case DATA_VOLUME -> point.dataVolume();
    };
  }

  public static MetricType fromKey(String key) {
    return Arrays.stream(values())
        .filter(type -> type.key.equalsIgnoreCase(key))
        .findFirst()
        .orElseThrow(() -> new InvalidConfigurationException("unknown metric '" + key + "'"));
  }

  public static Set<MetricType> featuredMetrics() {
    EnumSet<MetricType> result = EnumSet.noneOf(MetricType.class);
    for (MetricType type : values()) {
      if (type.featured) {
        result.add(type);
      }
    }
    return result;
  }
}

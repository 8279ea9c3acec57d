package perf.foresight.core.config;

import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.Builder;
import lombok.Getter;
import perf.foresight.core.domain.model.DetectorType;
import perf.foresight.core.domain.model.MetricType;
import perf.foresight.core.domain.model.ModelType;
import perf.foresight.core.domain.model.RegressionThreshold;
import perf.foresight.error.exception.InvalidConfigurationException;

/**
 * Engine configuration.
 *
 * <p>Defaults match the production profile: 30s collection, 30 day / 10,000 point retention,
 * 5 minute predictions and a daily retrain. Call {@link #validate()} before handing an instance
 * to the engine; the engine constructor does it as well.
 */
@Getter
@Builder(toBuilder = true)
public class AnalyticsConfig {

  // === Collection ===
  @Builder.Default private final Duration collectionInterval = Duration.ofSeconds(30);

  /** Cadence used to turn a horizon into model steps; null means the collection interval. */
  private final Duration samplingInterval;

  @Builder.Default private final Duration retentionPeriod = Duration.ofDays(30);
  @Builder.Default private final int maxDataPoints = 10_000;

  // === Prediction ===
  @Builder.Default private final Duration predictionInterval = Duration.ofMinutes(5);

  @Builder.Default
  private final List<Duration> predictionHorizons =
      List.of(Duration.ofMinutes(15), Duration.ofHours(1), Duration.ofHours(4));

  @Builder.Default
  private final Set<MetricType> predictedMetrics =
      EnumSet.of(
          MetricType.RESPONSE_TIME,
          MetricType.ERROR_RATE,
          MetricType.THROUGHPUT,
          MetricType.CPU_USAGE,
          MetricType.MEMORY_USAGE);

  @Builder.Default private final Set<ModelType> enabledModels = EnumSet.allOf(ModelType.class);
  @Builder.Default private final boolean autoRetrain = true;
  @Builder.Default private final Duration retrainInterval = Duration.ofHours(24);
  @Builder.Default private final int minRetrainPoints = 50;

  // === Detection ===
  @Builder.Default private final Duration detectionInterval = Duration.ofMinutes(1);
  @Builder.Default private final Duration detectionWindow = Duration.ofHours(1);

  @Builder.Default
  private final Set<DetectorType> enabledDetectors = EnumSet.allOf(DetectorType.class);

  @Builder.Default
  private final Set<MetricType> monitoredMetrics =
      EnumSet.of(
          MetricType.RESPONSE_TIME,
          MetricType.ERROR_RATE,
          MetricType.THROUGHPUT,
          MetricType.CPU_USAGE,
          MetricType.MEMORY_USAGE);

  // === Baseline ===
  @Builder.Default private final Duration baselineWindow = Duration.ofDays(7);
  @Builder.Default private final int minBaselineSamples = 30;
  @Builder.Default private final Duration baselineRefreshInterval = Duration.ofHours(6);

  // === Statistics ===
  @Builder.Default private final double confidenceLevel = 0.95;
  @Builder.Default private final double significanceLevel = 0.05;
  @Builder.Default private final double anomalyK = 3.0;
  @Builder.Default private final double anomalyRatio = 0.2;
  @Builder.Default private final double thresholdSustainRatio = 0.5;
  @Builder.Default private final double trendEpsilon = 0.001;
  @Builder.Default private final double trendMinRSquared = 0.5;

  @Builder.Default
  private final Map<MetricType, RegressionThreshold> thresholds = defaultThresholds();

  // === Predictive alerts ===
  @Builder.Default private final boolean predictiveAlertsEnabled = true;
  @Builder.Default private final Map<MetricType, Double> alertThresholds = defaultAlertThresholds();

  // === Misc ===
  @Builder.Default private final int historyLimit = 1_000;
  @Builder.Default private final ZoneId zoneId = ZoneOffset.UTC;
  @Builder.Default private final int businessHourStart = 9;
  @Builder.Default private final int businessHourEnd = 17;

  public static AnalyticsConfig defaults() {
    return AnalyticsConfig.builder().build();
  }

  public Duration getSamplingInterval() {
    return samplingInterval != null ? samplingInterval : collectionInterval;
  }

  public RegressionThreshold thresholdFor(MetricType metric) {
    RegressionThreshold threshold = thresholds.get(metric);
    if (threshold == null) {
      throw new InvalidConfigurationException("no regression threshold for " + metric.getKey());
    }
    return threshold;
  }

  public boolean isBusinessHour(int hourOfDay) {
    return hourOfDay >= businessHourStart && hourOfDay <= businessHourEnd;
  }

  /**
   * Fails fast on a configuration the engine cannot run with.
   *
   * @return this, for chaining
   * @throws InvalidConfigurationException on the first violated constraint
   */
  public AnalyticsConfig validate() {
    requirePositive("collectionInterval", collectionInterval);
    requirePositive("samplingInterval", getSamplingInterval());
    requirePositive("retentionPeriod", retentionPeriod);
    requirePositive("predictionInterval", predictionInterval);
    requirePositive("retrainInterval", retrainInterval);
    requirePositive("detectionInterval", detectionInterval);
    requirePositive("detectionWindow", detectionWindow);
    requirePositive("baselineWindow", baselineWindow);
    requirePositive("baselineRefreshInterval", baselineRefreshInterval);

    require(maxDataPoints > 0, "maxDataPoints must be positive");
    require(minRetrainPoints > 0, "minRetrainPoints must be positive");
    require(minBaselineSamples > 0, "minBaselineSamples must be positive");
    require(historyLimit > 0, "historyLimit must be positive");

    require(predictionHorizons != null && !predictionHorizons.isEmpty(), "no prediction horizons");
    predictionHorizons.forEach(horizon -> requirePositive("predictionHorizon", horizon));
    require(enabledModels != null && !enabledModels.isEmpty(), "no model types enabled");
    require(enabledDetectors != null, "enabledDetectors is required");
    require(predictedMetrics != null && monitoredMetrics != null, "metric sets are required");

    requireUnitInterval("confidenceLevel", confidenceLevel);
    requireUnitInterval("significanceLevel", significanceLevel);
    requireUnitInterval("thresholdSustainRatio", thresholdSustainRatio);
    requireUnitInterval("anomalyRatio", anomalyRatio);
    require(trendMinRSquared >= 0 && trendMinRSquared <= 1, "trendMinRSquared must be in [0,1]");
    require(anomalyK > 0, "anomalyK must be positive");
    require(trendEpsilon >= 0, "trendEpsilon must not be negative");

    for (MetricType metric : monitoredMetrics) {
      require(
          thresholds.containsKey(metric), "missing regression threshold for " + metric.getKey());
    }
    alertThresholds.forEach(
        (metric, value) ->
            require(
                value != null && value > 0,
                "alert threshold for " + metric.getKey() + " must be positive"));

    require(zoneId != null, "zoneId is required");
    require(
        businessHourStart >= 0 && businessHourEnd <= 23 && businessHourStart <= businessHourEnd,
        "business hours must satisfy 0 <= start <= end <= 23");
    return this;
  }

  private static void requirePositive(String name, Duration value) {
    require(
        value != null && !value.isNegative() && !value.isZero(), name + " must be positive");
  }

  private static void requireUnitInterval(String name, double value) {
    require(value > 0 && value <= 1, name + " must be in (0,1]");
  }

  private static void require(boolean condition, String detail) {
    if (!condition) {
      throw new InvalidConfigurationException(detail);
    }
  }

  private static Map<MetricType, RegressionThreshold> defaultThresholds() {
    Map<MetricType, RegressionThreshold> map = new EnumMap<>(MetricType.class);
    put(map, MetricType.RESPONSE_TIME, 20, 10);
    put(map, MetricType.SUCCESS_RATE, 5, 2);
    put(map, MetricType.THROUGHPUT, 15, 10);
    put(map, MetricType.ERROR_RATE, 50, 25);
    put(map, MetricType.CPU_USAGE, 25, 15);
    put(map, MetricType.MEMORY_USAGE, 20, 10);
    put(map, MetricType.DISK_USAGE, 20, 10);
    put(map, MetricType.NETWORK_IO, 30, 15);
    put(map, MetricType.ACTIVE_USERS, 30, 15);
    put(map, MetricType.DATA_VOLUME, 30, 15);
    return Map.copyOf(map);
  }

  private static void put(
      Map<MetricType, RegressionThreshold> map, MetricType metric, double deg, double imp) {
    map.put(metric, new RegressionThreshold(metric, deg, imp));
  }

  private static Map<MetricType, Double> defaultAlertThresholds() {
    return Map.of(
        MetricType.RESPONSE_TIME, 1000.0,
        MetricType.ERROR_RATE, 0.05,
        MetricType.SUCCESS_RATE, 0.95,
        MetricType.CPU_USAGE, 80.0,
        MetricType.MEMORY_USAGE, 90.0);
  }
}

package perf.foresight.config;

import java.time.Duration;
import java.time.ZoneId;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import perf.foresight.core.config.AnalyticsConfig;
import perf.foresight.core.domain.model.DetectorType;
import perf.foresight.core.domain.model.MetricType;
import perf.foresight.core.domain.model.ModelType;
import perf.foresight.core.domain.model.RegressionThreshold;

/**
 * Analytics engine properties.
 *
 * <h2>Settings</h2>
 *
 * <pre>{@code
 * analytics:
 *   enabled: true
 *   collection-interval: 30s
 *   prediction-horizons: 15m,1h,4h
 *   monitored-metrics: response_time,error_rate,throughput,cpu_usage,memory_usage
 *   thresholds:
 *     response-time: { degradation-percent: 15, improvement-percent: 10 }
 *   alert-thresholds:
 *     response-time: 800
 * }</pre>
 *
 * <p>Metric, model and detector names use their keys ({@code response_time}, {@code arima},
 * {@code anomaly}). Map keys lose their underscores in binding, so metric keys are matched
 * ignoring separators. Regression and alert thresholds are merged over the engine defaults. Range
 * checks happen in {@link AnalyticsConfig#validate()} when the engine is built.
 */
@ConfigurationProperties(prefix = "analytics")
public record AnalyticsProperties(
    @DefaultValue("true") boolean enabled,
    @DefaultValue("30s") Duration collectionInterval,
    Duration samplingInterval,
    @DefaultValue("30d") Duration retentionPeriod,
    @DefaultValue("10000") int maxDataPoints,
    @DefaultValue("5m") Duration predictionInterval,
    @DefaultValue({"15m", "1h", "4h"}) List<Duration> predictionHorizons,
    @DefaultValue({"response_time", "error_rate", "throughput", "cpu_usage", "memory_usage"})
        List<String> predictedMetrics,
    @DefaultValue({"response_time", "error_rate", "throughput", "cpu_usage", "memory_usage"})
        List<String> monitoredMetrics,
    @DefaultValue({"linear", "exponential", "arima", "ensemble"}) List<String> enabledModels,
    @DefaultValue({"statistical", "trend", "threshold", "anomaly"}) List<String> enabledDetectors,
    @DefaultValue("true") boolean autoRetrain,
    @DefaultValue("24h") Duration retrainInterval,
    @DefaultValue("50") int minRetrainPoints,
    @DefaultValue("1m") Duration detectionInterval,
    @DefaultValue("1h") Duration detectionWindow,
    @DefaultValue("7d") Duration baselineWindow,
    @DefaultValue("30") int minBaselineSamples,
    @DefaultValue("6h") Duration baselineRefreshInterval,
    @DefaultValue("0.95") double confidenceLevel,
    @DefaultValue("0.05") double significanceLevel,
    @DefaultValue("3.0") double anomalyK,
    @DefaultValue("0.2") double anomalyRatio,
    @DefaultValue("0.5") double thresholdSustainRatio,
    @DefaultValue("true") boolean predictiveAlertsEnabled,
    @DefaultValue("1000") int historyLimit,
    @DefaultValue("UTC") ZoneId zoneId,
    Map<String, Threshold> thresholds,
    Map<String, Double> alertThresholds) {

  /** Regression thresholds of one metric, in percent. */
  public record Threshold(double degradationPercent, double improvementPercent) {}

  public AnalyticsConfig toConfig() {
    AnalyticsConfig defaults = AnalyticsConfig.defaults();
    return defaults.toBuilder()
        .collectionInterval(collectionInterval)
        .samplingInterval(samplingInterval)
        .retentionPeriod(retentionPeriod)
        .maxDataPoints(maxDataPoints)
        .predictionInterval(predictionInterval)
        .predictionHorizons(List.copyOf(predictionHorizons))
        .predictedMetrics(metrics(predictedMetrics))
        .monitoredMetrics(metrics(monitoredMetrics))
        .enabledModels(names(enabledModels, ModelType.class, ModelType::fromName))
        .enabledDetectors(names(enabledDetectors, DetectorType.class, DetectorType::fromName))
        .autoRetrain(autoRetrain)
        .retrainInterval(retrainInterval)
        .minRetrainPoints(minRetrainPoints)
        .detectionInterval(detectionInterval)
        .detectionWindow(detectionWindow)
        .baselineWindow(baselineWindow)
        .minBaselineSamples(minBaselineSamples)
        .baselineRefreshInterval(baselineRefreshInterval)
        .confidenceLevel(confidenceLevel)
        .significanceLevel(significanceLevel)
        .anomalyK(anomalyK)
        .anomalyRatio(anomalyRatio)
        .thresholdSustainRatio(thresholdSustainRatio)
        .predictiveAlertsEnabled(predictiveAlertsEnabled)
        .historyLimit(historyLimit)
        .zoneId(zoneId)
        .thresholds(mergedThresholds(defaults))
        .alertThresholds(mergedAlertThresholds(defaults))
        .build();
  }

  private Map<MetricType, RegressionThreshold> mergedThresholds(AnalyticsConfig defaults) {
    Map<MetricType, RegressionThreshold> merged = new EnumMap<>(MetricType.class);
    merged.putAll(defaults.getThresholds());
    if (thresholds != null) {
      thresholds.forEach(
          (key, value) -> {
            MetricType metric = metric(key);
            merged.put(
                metric,
                new RegressionThreshold(
                    metric, value.degradationPercent(), value.improvementPercent()));
          });
    }
    return merged;
  }

  private Map<MetricType, Double> mergedAlertThresholds(AnalyticsConfig defaults) {
    Map<MetricType, Double> merged = new EnumMap<>(MetricType.class);
    merged.putAll(defaults.getAlertThresholds());
    if (alertThresholds != null) {
      alertThresholds.forEach((key, value) -> merged.put(metric(key), value));
    }
    return merged;
  }

  private static Set<MetricType> metrics(List<String> keys) {
    return names(keys, MetricType.class, AnalyticsProperties::metric);
  }

  static MetricType metric(String key) {
    String normalized = normalize(key);
    for (MetricType metric : MetricType.values()) {
      if (normalize(metric.getKey()).equals(normalized)) {
        return metric;
      }
    }
    return MetricType.fromKey(key);
  }

  private static String normalize(String key) {
    return key.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
  }

  private static <E extends Enum<E>> Set<E> names(
      List<String> names, Class<E> type, Function<String, E> parser) {
    Set<E> parsed = EnumSet.noneOf(type);
    names.forEach(name -> parsed.add(parser.apply(name.trim())));
    return parsed;
  }
}

package perf.foresight.core.prediction;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import perf.foresight.core.config.AnalyticsConfig;
import perf.foresight.core.domain.model.MetricType;
import perf.foresight.core.domain.model.PerformanceDataPoint;
import perf.foresight.core.domain.model.PredictionFactor;
import perf.foresight.core.domain.model.PredictionResult;
import perf.foresight.core.domain.model.TrendClassification;
import perf.foresight.core.model.PredictionModel;
import perf.foresight.core.model.PredictionModel.Forecast;

/**
 * Turns a raw forecast into a {@link PredictionResult}.
 *
 * <ul>
 *   <li>trend: more than ±10% away from the current value, read through the metric polarity
 *   <li>seasonality: the latest point falls inside business hours
 *   <li>factors: rising trend, CPU, volatility, error rate and memory pressure
 *   <li>bounds: {@code value ± 1.96·σ}
 * </ul>
 */
public class PredictionEnhancer {

  static final double TREND_CHANGE_PERCENT = 10.0;
  static final double Z_95 = 1.96;

  private final AnalyticsConfig config;

  public PredictionEnhancer(AnalyticsConfig config) {
    this.config = config;
  }

  public PredictionResult enhance(
      MetricType metric,
      PerformanceDataPoint latest,
      PredictionModel model,
      Forecast forecast,
      Duration horizon,
      Instant now) {
    double current = latest.value(metric);
    double predicted = forecast.value();
    double change = current == 0 ? 0.0 : (predicted - current) / Math.abs(current) * 100.0;
    double sigma = sigma(metric, latest, predicted);

    return PredictionResult.builder()
        .id(UUID.randomUUID().toString())
        .metric(metric)
        .currentValue(current)
        .predictedValue(predicted)
        .confidence(forecast.confidence())
        .horizon(horizon)
        .modelUsed(model.name())
        .timestamp(now)
        .lowerBound(metric.clamp(predicted - Z_95 * sigma))
        .upperBound(metric.clamp(predicted + Z_95 * sigma))
        .standardDeviation(sigma)
        .trend(classify(metric, change))
        .trendStrength(trendStrength(change))
        .seasonal(config.isBusinessHour(latest.timestamp().atZone(config.getZoneId()).getHour()))
        .factors(factors(metric, latest))
        .modelAccuracy(model.accuracy())
        .modelLastTraining(model.lastTraining().orElse(null))
        .build();
  }

  static TrendClassification classify(MetricType metric, double changePercent) {
    if (Math.abs(changePercent) <= TREND_CHANGE_PERCENT) {
      return TrendClassification.STABLE;
    }
    boolean rising = changePercent > 0;
    return rising == metric.isHigherIsWorse()
        ? TrendClassification.DEGRADING
        : TrendClassification.IMPROVING;
  }

  static double trendStrength(double changePercent) {
    if (Math.abs(changePercent) <= TREND_CHANGE_PERCENT) {
      return 0.1;
    }
    return Math.min(Math.abs(changePercent) / 50.0, 1.0);
  }

  private static double sigma(MetricType metric, PerformanceDataPoint latest, double predicted) {
    return latest
        .feature(metric.getKey() + "_volatility")
        .orElse(metric.isRate() ? 0.05 : Math.abs(predicted) * 0.1);
  }

  private static List<PredictionFactor> factors(MetricType metric, PerformanceDataPoint latest) {
    List<PredictionFactor> factors = new ArrayList<>();

    double trend = latest.feature(metric.getKey() + "_trend").orElse(0.0);
    if (trend > 0) {
      double strength = latest.feature(metric.getKey() + "_trend_strength").orElse(0.0);
      double impact = metric.isHigherIsWorse() ? strength : -strength;
      factors.add(
          new PredictionFactor(
              "rising_trend", impact, 0.8, metric.getKey() + " is trending upward"));
    }
    if (latest.cpuUsage() > 80) {
      factors.add(new PredictionFactor("high_cpu", 0.7, 0.9, "CPU usage above 80%"));
    }
    double volatility = latest.feature(metric.getKey() + "_volatility").orElse(0.0);
    if (volatility > 100) {
      factors.add(
          new PredictionFactor("high_volatility", 0.5, 0.7, metric.getKey() + " is volatile"));
    }
    if (latest.errorRate() > 0.05) {
      factors.add(new PredictionFactor("high_error_rate", 0.8, 0.85, "error rate above 5%"));
    }
    if (latest.memoryUsage() > 90) {
      factors.add(new PredictionFactor("high_memory", 0.6, 0.85, "memory usage above 90%"));
    }
    return factors;
  }
}

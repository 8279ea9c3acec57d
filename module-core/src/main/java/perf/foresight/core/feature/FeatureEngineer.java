package perf.foresight.core.feature;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import perf.foresight.core.domain.model.MetricType;
import perf.foresight.core.domain.model.PerformanceDataPoint;
import perf.foresight.core.domain.model.PerformanceMetrics;
import perf.foresight.core.stat.LinearFit;
import perf.foresight.core.stat.Statistics;

/**
 * Derives model features for a new observation.
 *
 * <p>Every window includes the new point itself. A feature whose input is missing (empty
 * window, too few points, zero denominator) is omitted instead of defaulted to zero.
 *
 * <pre>
 * &lt;metric&gt;_ma_5min, &lt;metric&gt;_ma_1hour        moving averages
 * &lt;metric&gt;_trend, &lt;metric&gt;_trend_strength    OLS over the last 10 points
 * &lt;metric&gt;_volatility, &lt;metric&gt;_cv          over the last 20 points
 * hour_of_day, hour_sin, hour_cos, day_of_week, day_sin, day_cos
 * cpu_memory_ratio, error_success_ratio, throughput_per_user, data_per_request
 * </pre>
 */
public class FeatureEngineer {

  public static final Duration SHORT_WINDOW = Duration.ofMinutes(5);
  public static final Duration LONG_WINDOW = Duration.ofHours(1);
  public static final int TREND_POINTS = 10;
  public static final int VOLATILITY_POINTS = 20;

  public static final String HOUR_SIN = "hour_sin";
  public static final String HOUR_COS = "hour_cos";

  private final ZoneId zoneId;

  public FeatureEngineer(ZoneId zoneId) {
    this.zoneId = zoneId;
  }

  /** Longest time lookback any feature needs. */
  public Duration requiredLookback() {
    return LONG_WINDOW;
  }

  /** Number of previous points the count-based features need besides the new one. */
  public int requiredHistoryCount() {
    return VOLATILITY_POINTS - 1;
  }

  /**
   * @param history previous points in timestamp order; only the tail is read
   * @param snapshot the new observation
   * @param timestamp the new observation's timestamp
   */
  public Map<String, Double> computeFeatures(
      List<PerformanceDataPoint> history, PerformanceMetrics snapshot, Instant timestamp) {
    PerformanceDataPoint current = PerformanceDataPoint.of(snapshot, timestamp, Map.of());
    List<PerformanceDataPoint> sequence = new ArrayList<>(history.size() + 1);
    sequence.addAll(history);
    sequence.add(current);

    Map<String, Double> features = new LinkedHashMap<>();
    for (MetricType metric : MetricType.featuredMetrics()) {
      addMovingAverage(features, sequence, metric, "_ma_5min", timestamp.minus(SHORT_WINDOW));
      addMovingAverage(features, sequence, metric, "_ma_1hour", timestamp.minus(LONG_WINDOW));
      addTrend(features, sequence, metric);
      addVolatility(features, sequence, metric);
    }
    features.putAll(seasonalFeatures(timestamp));
    addRatios(features, current);
    return features;
  }

  /** Seasonality encoding of an instant in the configured zone. */
  public Map<String, Double> seasonalFeatures(Instant instant) {
    ZonedDateTime time = instant.atZone(zoneId);
    int hour = time.getHour();
    int day = dayIndex(time.getDayOfWeek());

    Map<String, Double> features = new LinkedHashMap<>();
    features.put("hour_of_day", (double) hour);
    features.put(HOUR_SIN, Math.sin(2 * Math.PI * hour / 24.0));
    features.put(HOUR_COS, Math.cos(2 * Math.PI * hour / 24.0));
    features.put("day_of_week", (double) day);
    features.put("day_sin", Math.sin(2 * Math.PI * day / 7.0));
    features.put("day_cos", Math.cos(2 * Math.PI * day / 7.0));
    return features;
  }

  public int hourOfDay(Instant instant) {
    return instant.atZone(zoneId).getHour();
  }

  // Sunday = 0
  private static int dayIndex(DayOfWeek dayOfWeek) {
    return dayOfWeek.getValue() % 7;
  }

  private static void addMovingAverage(
      Map<String, Double> features,
      List<PerformanceDataPoint> sequence,
      MetricType metric,
      String suffix,
      Instant cutoff) {
    double sum = 0;
    int count = 0;
    for (int i = sequence.size() - 1; i >= 0; i--) {
      PerformanceDataPoint point = sequence.get(i);
      if (point.timestamp().isBefore(cutoff)) {
        break;
      }
      sum += point.value(metric);
      count++;
    }
    if (count > 0) {
      features.put(metric.getKey() + suffix, sum / count);
    }
  }

  private static void addTrend(
      Map<String, Double> features, List<PerformanceDataPoint> sequence, MetricType metric) {
    if (sequence.size() < TREND_POINTS) {
      return;
    }
    double[] values = tail(sequence, metric, TREND_POINTS);
    double slope = LinearFit.overIndex(values).slope();
    double mean = Statistics.mean(values);

    double strength;
    if (mean == 0) {
      strength = slope == 0 ? 0.0 : 1.0;
    } else {
      strength = Math.min(1.0, Math.abs(slope) / Math.abs(mean));
    }
    features.put(metric.getKey() + "_trend", slope);
    features.put(metric.getKey() + "_trend_strength", strength);
  }

  private static void addVolatility(
      Map<String, Double> features, List<PerformanceDataPoint> sequence, MetricType metric) {
    if (sequence.size() < VOLATILITY_POINTS) {
      return;
    }
    double[] values = tail(sequence, metric, VOLATILITY_POINTS);
    features.put(metric.getKey() + "_volatility", Statistics.stdDev(values));
    double cv = Statistics.coefficientOfVariation(values);
    if (!Double.isNaN(cv)) {
      features.put(metric.getKey() + "_cv", cv);
    }
  }

  private static void addRatios(Map<String, Double> features, PerformanceDataPoint current) {
    putRatio(features, "cpu_memory_ratio", current.cpuUsage(), current.memoryUsage());
    putRatio(features, "error_success_ratio", current.errorRate(), current.successRate());
    putRatio(features, "throughput_per_user", current.throughput(), current.activeUsers());
    putRatio(features, "data_per_request", current.dataVolume(), current.throughput());
  }

  private static void putRatio(
      Map<String, Double> features, String name, double numerator, double denominator) {
    if (denominator != 0) {
      features.put(name, numerator / denominator);
    }
  }

  private static double[] tail(List<PerformanceDataPoint> sequence, MetricType metric, int count) {
    double[] values = new double[count];
    int offset = sequence.size() - count;
    for (int i = 0; i < count; i++) {
      values[i] = sequence.get(offset + i).value(metric);
    }
    return values;
  }
}

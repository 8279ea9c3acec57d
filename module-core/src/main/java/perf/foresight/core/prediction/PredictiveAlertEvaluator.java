package perf.foresight.core.prediction;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import perf.foresight.core.config.AnalyticsConfig;
import perf.foresight.core.domain.model.MetricType;
import perf.foresight.core.domain.model.PredictionAlert;
import perf.foresight.core.domain.model.PredictionAlertType;
import perf.foresight.core.domain.model.PredictionResult;
import perf.foresight.core.domain.model.Severity;
import perf.foresight.core.domain.model.TrendClassification;

/** Raises early warnings from predictions of metrics that have an alert threshold. */
public class PredictiveAlertEvaluator {

  static final double TREND_ALERT_STRENGTH = 0.7;

  private final AnalyticsConfig config;

  public PredictiveAlertEvaluator(AnalyticsConfig config) {
    this.config = config;
  }

  public List<PredictionAlert> evaluate(PredictionResult prediction) {
    if (!config.isPredictiveAlertsEnabled()) {
      return List.of();
    }
    Double threshold = config.getAlertThresholds().get(prediction.metric());
    if (threshold == null) {
      return List.of();
    }

    List<PredictionAlert> alerts = new ArrayList<>(2);
    MetricType metric = prediction.metric();
    double predicted = prediction.predictedValue();
    if (breaches(metric, predicted, threshold)) {
      Severity severity = overshoot(predicted, threshold);
      alerts.add(
          alert(prediction, PredictionAlertType.THRESHOLD_BREACH, severity, threshold)
              .message(
                  String.format(
                      "%s predicted to reach %.4f (threshold %.4f) within %s",
                      metric.getKey(), predicted, threshold, prediction.horizon()))
              .build());
    }
    if (prediction.trend() == TrendClassification.DEGRADING
        && prediction.trendStrength() > TREND_ALERT_STRENGTH) {
      Severity severity = prediction.trendStrength() >= 0.9 ? Severity.HIGH : Severity.MEDIUM;
      alerts.add(
          alert(prediction, PredictionAlertType.TREND_CHANGE, severity, threshold)
              .message(
                  String.format(
                      "%s is degrading (strength %.2f) within %s",
                      metric.getKey(), prediction.trendStrength(), prediction.horizon()))
              .build());
    }
    return alerts;
  }

  private static boolean breaches(MetricType metric, double predicted, double threshold) {
    return metric.isHigherIsWorse() ? predicted > threshold : predicted < threshold;
  }

  static Severity overshoot(double predicted, double threshold) {
    double ratio = Math.abs(predicted - threshold) / threshold;
    if (ratio >= 0.5) {
      return Severity.CRITICAL;
    }
    if (ratio >= 0.25) {
      return Severity.HIGH;
    }
    if (ratio >= 0.1) {
      return Severity.MEDIUM;
    }
    return Severity.LOW;
  }

  private static PredictionAlert.PredictionAlertBuilder alert(
      PredictionResult prediction, PredictionAlertType type, Severity severity, double threshold) {
    return PredictionAlert.builder()
        .id(UUID.randomUUID().toString())
        .metric(prediction.metric())
        .type(type)
        .severity(severity)
        .predictedValue(prediction.predictedValue())
        .threshold(threshold)
        .horizon(prediction.horizon())
        .confidence(prediction.confidence())
        .timestamp(prediction.timestamp());
  }
}

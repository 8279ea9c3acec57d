package perf.foresight.alert;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import perf.foresight.core.domain.model.PredictionAlert;
import perf.foresight.core.domain.model.PredictionResult;
import perf.foresight.core.domain.model.RegressionEvent;
import perf.foresight.core.domain.model.RegressionResult;
import perf.foresight.core.port.out.AnalyticsResultSink;

/**
 * Logs engine output and counts it.
 *
 * <h3>Meters</h3>
 *
 * <pre>
 * analytics.predictions          counter  metric, model
 * analytics.prediction.alerts    counter  metric, type, severity
 * analytics.regressions          counter  metric, detector, type
 * analytics.regression.events    counter  metric, type
 * </pre>
 */
@Slf4j
@RequiredArgsConstructor
public class MeteredAnalyticsResultSink implements AnalyticsResultSink {

  private final MeterRegistry registry;

  @Override
  public void onPrediction(PredictionResult prediction) {
    log.debug(
        "[AnalyticsSink] Prediction {} in {}: {} → {} ({}, confidence={})",
        prediction.metric().getKey(),
        prediction.horizon(),
        prediction.currentValue(),
        prediction.predictedValue(),
        prediction.trend(),
        prediction.confidence());
    Counter.builder("analytics.predictions")
        .tag("metric", prediction.metric().getKey())
        .tag("model", prediction.modelUsed())
        .register(registry)
        .increment();
  }

  @Override
  public void onPredictiveAlert(PredictionAlert alert) {
    log.warn("[AnalyticsSink] {} [{}] {}", alert.type(), alert.severity(), alert.message());
    Counter.builder("analytics.prediction.alerts")
        .tag("metric", alert.metric().getKey())
        .tag("type", alert.type().name())
        .tag("severity", alert.severity().name())
        .register(registry)
        .increment();
  }

  @Override
  public void onRegression(RegressionResult regression) {
    log.warn(
        "[AnalyticsSink] Regression {} by {}: {} {} (baseline={}, current={})",
        regression.metric().getKey(),
        regression.detector(),
        regression.type(),
        regression.severity(),
        regression.baselineMean(),
        regression.currentMean());
    Counter.builder("analytics.regressions")
        .tag("metric", regression.metric().getKey())
        .tag("detector", regression.detector())
        .tag("type", regression.type().name())
        .register(registry)
        .increment();
  }

  @Override
  public void onRegressionEvent(RegressionEvent event) {
    log.info(
        "[AnalyticsSink] Regression {} for {} by {}",
        event.type(),
        event.metric().getKey(),
        event.detector());
    Counter.builder("analytics.regression.events")
        .tag("metric", event.metric().getKey())
        .tag("type", event.type().name())
        .register(registry)
        .increment();
  }
}

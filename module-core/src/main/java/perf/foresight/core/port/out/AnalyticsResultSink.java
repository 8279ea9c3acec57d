package perf.foresight.core.port.out;

import perf.foresight.core.domain.model.PredictionAlert;
import perf.foresight.core.domain.model.PredictionResult;
import perf.foresight.core.domain.model.RegressionEvent;
import perf.foresight.core.domain.model.RegressionResult;

/**
 * Consumer of analytics output (alerting/notification side).
 *
 * <p>Implementations are called from the engine's scheduler threads and must not block.
 */
public interface AnalyticsResultSink {

  void onPrediction(PredictionResult prediction);

  void onPredictiveAlert(PredictionAlert alert);

  void onRegression(RegressionResult result);

  void onRegressionEvent(RegressionEvent event);
}

package perf.foresight.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import perf.foresight.core.domain.model.MetricType;
import perf.foresight.core.domain.model.ModelType;
import perf.foresight.core.domain.model.PerformanceDataPoint;

/**
 * Forecasting model bound to one metric.
 *
 * <p>Models are trained in batch, once per instance; retraining creates a new instance. A
 * trained instance is read-only and may be shared between threads after publication.
 */
public interface PredictionModel {

  String name();

  ModelType type();

  MetricType metric();

  /** Smallest history {@link #train(List)} accepts. */
  int minimumPoints();

  /**
   * @throws perf.foresight.error.exception.InsufficientDataException below {@link
   *     #minimumPoints()}
   * @throws perf.foresight.error.exception.ModelTrainingException on numerical degeneracy
   */
  void train(List<PerformanceDataPoint> history);

  /**
   * @param features feature map of the target instant (seasonal terms) or the latest point
   * @throws perf.foresight.error.exception.ModelNotTrainedException before a successful train
   */
  Forecast forecast(Map<String, Double> features, Duration horizon);

  default double predict(Map<String, Double> features, Duration horizon) {
    return forecast(features, horizon).value();
  }

  /** {@code 1 − MAPE} of the in-sample fit, in [0,1]. */
  double accuracy();

  Optional<Instant> lastTraining();

  boolean isTrained();

  /** Predicted value and the model's confidence in it. */
  record Forecast(double value, double confidence) {}
}

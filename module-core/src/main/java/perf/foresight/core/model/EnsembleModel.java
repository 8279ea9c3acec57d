package perf.foresight.core.model;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import perf.foresight.core.domain.model.MetricType;
import perf.foresight.core.domain.model.ModelType;
import perf.foresight.core.domain.model.PerformanceDataPoint;
import perf.foresight.core.stat.Statistics;
import perf.foresight.error.exception.InsufficientDataException;
import perf.foresight.error.exception.ModelNotTrainedException;

/**
 * Accuracy-weighted combination of the linear, exponential and ARIMA models.
 *
 * <ul>
 *   <li>every sub-model with enough history is trained; the others are left out
 *   <li>weight = standalone accuracy / Σ accuracy (equal weights when Σ is 0)
 *   <li>confidence = {@code 1 − CV} of the sub-predictions, floored at 0, capped at {@link
 *       #MAX_CONFIDENCE}
 * </ul>
 */
public class EnsembleModel implements PredictionModel {

  public static final double MAX_CONFIDENCE = 0.95;

  private final MetricType metric;
  private final Clock clock;
  private final List<PredictionModel> candidates;

  private volatile List<PredictionModel> members = List.of();
  private volatile Map<ModelType, Double> weights = Map.of();
  private volatile double accuracy;
  private volatile Instant lastTraining;

  public EnsembleModel(MetricType metric, Duration samplingInterval, Clock clock) {
    this(
        metric,
        clock,
        List.of(
            new LinearPredictionModel(metric, samplingInterval, clock),
            new ExponentialSmoothingModel(metric, samplingInterval, clock),
            new ArimaModel(metric, samplingInterval, clock)));
  }

  EnsembleModel(MetricType metric, Clock clock, List<PredictionModel> candidates) {
    this.metric = metric;
    this.clock = clock;
    this.candidates = List.copyOf(candidates);
  }

  @Override
  public String name() {
    return ModelType.ENSEMBLE.getModelName() + ":" + metric.getKey();
  }

  @Override
  public ModelType type() {
    return ModelType.ENSEMBLE;
  }

  @Override
  public MetricType metric() {
    return metric;
  }

  @Override
  public int minimumPoints() {
    return candidates.stream().mapToInt(PredictionModel::minimumPoints).min().orElse(0);
  }

  @Override
  public void train(List<PerformanceDataPoint> history) {
    List<PredictionModel> trained = new ArrayList<>();
    for (PredictionModel candidate : candidates) {
      if (history.size() >= candidate.minimumPoints()) {
        candidate.train(history);
        trained.add(candidate);
      }
    }
    if (trained.isEmpty()) {
      throw new InsufficientDataException(name(), minimumPoints(), history.size());
    }

    Map<ModelType, Double> computed = computeWeights(trained);
    double weightedAccuracy = 0;
    for (PredictionModel model : trained) {
      weightedAccuracy += computed.get(model.type()) * model.accuracy();
    }

    this.weights = Collections.unmodifiableMap(computed);
    this.accuracy = weightedAccuracy;
    this.lastTraining = clock.instant();
    this.members = List.copyOf(trained);
  }

  @Override
  public Forecast forecast(Map<String, Double> features, Duration horizon) {
    List<PredictionModel> current = members;
    if (current.isEmpty()) {
      throw new ModelNotTrainedException(name());
    }
    Map<ModelType, Double> currentWeights = weights;

    double[] predictions = new double[current.size()];
    double combined = 0;
    for (int i = 0; i < predictions.length; i++) {
      PredictionModel model = current.get(i);
      predictions[i] = model.predict(features, horizon);
      combined += currentWeights.get(model.type()) * predictions[i];
    }
    return new Forecast(metric.clamp(combined), confidence(predictions));
  }

  /** Normalized weights of the trained sub-models; empty before training. */
  public Map<ModelType, Double> weights() {
    return weights;
  }

  @Override
  public double accuracy() {
    return accuracy;
  }

  @Override
  public Optional<Instant> lastTraining() {
    return Optional.ofNullable(lastTraining);
  }

  @Override
  public boolean isTrained() {
    return !members.isEmpty();
  }

  static Map<ModelType, Double> computeWeights(List<PredictionModel> models) {
    double total = models.stream().mapToDouble(PredictionModel::accuracy).sum();
    Map<ModelType, Double> result = new EnumMap<>(ModelType.class);
    for (PredictionModel model : models) {
      double weight = total > 0 ? model.accuracy() / total : 1.0 / models.size();
      result.put(model.type(), weight);
    }
    return result;
  }

  private static double confidence(double[] predictions) {
    double stdDev = Statistics.stdDev(predictions);
    if (stdDev == 0) {
      return MAX_CONFIDENCE;
    }
    double cv = Statistics.coefficientOfVariation(predictions);
    if (Double.isNaN(cv)) {
      return 0.0;
    }
    return Math.min(MAX_CONFIDENCE, Math.max(0.0, 1.0 - cv));
  }
}

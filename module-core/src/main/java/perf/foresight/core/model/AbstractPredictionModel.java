package perf.foresight.core.model;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import perf.foresight.core.domain.model.MetricType;
import perf.foresight.core.domain.model.PerformanceDataPoint;
import perf.foresight.core.stat.Statistics;
import perf.foresight.error.exception.InsufficientDataException;
import perf.foresight.error.exception.ModelNotTrainedException;

/**
 * Template for single-series models.
 *
 * <p>Handles the shared preconditions (minimum history, trained state), the horizon to step
 * conversion through the sampling interval, and clamping to the metric's domain. Subclasses fit
 * in {@link #fit(double[], List)} and extrapolate in {@link #extrapolate(Map, double)}.
 */
public abstract class AbstractPredictionModel implements PredictionModel {

  protected final MetricType metric;
  private final Duration samplingInterval;
  private final Clock clock;

  private volatile boolean trained;
  private volatile double accuracy;
  private volatile Instant lastTraining;

  protected AbstractPredictionModel(MetricType metric, Duration samplingInterval, Clock clock) {
    this.metric = Objects.requireNonNull(metric, "metric");
    if (samplingInterval == null || samplingInterval.isZero() || samplingInterval.isNegative()) {
      throw new IllegalArgumentException("samplingInterval must be positive");
    }
    this.samplingInterval = samplingInterval;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public String name() {
    return type().getModelName() + ":" + metric.getKey();
  }

  @Override
  public MetricType metric() {
    return metric;
  }

  @Override
  public final void train(List<PerformanceDataPoint> history) {
    if (history.size() < minimumPoints()) {
      throw new InsufficientDataException(name(), minimumPoints(), history.size());
    }
    double[] values = new double[history.size()];
    for (int i = 0; i < values.length; i++) {
      values[i] = history.get(i).value(metric);
    }
    double[] fitted = fit(values, history);
    this.accuracy = Statistics.accuracy(values, fitted);
    this.lastTraining = clock.instant();
    this.trained = true;
  }

  @Override
  public Forecast forecast(Map<String, Double> features, Duration horizon) {
    if (!trained) {
      throw new ModelNotTrainedException(name());
    }
    double value = metric.clamp(extrapolate(features, steps(horizon)));
    return new Forecast(value, accuracy);
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
    return trained;
  }

  /** {@code horizon / samplingInterval}; fractional steps are kept. */
  protected double steps(Duration horizon) {
    if (horizon.isNegative()) {
      throw new IllegalArgumentException("horizon must not be negative: " + horizon);
    }
    return (double) horizon.toNanos() / samplingInterval.toNanos();
  }

  /**
   * Fits the model.
   *
   * @param values the metric's values, oldest first
   * @param history the points the values came from (for auxiliary features)
   * @return in-sample fitted or one-step-ahead values, aligned with {@code values}
   */
  protected abstract double[] fit(double[] values, List<PerformanceDataPoint> history);

  /** Unclamped prediction {@code steps} samples past the last training point. */
  protected abstract double extrapolate(Map<String, Double> features, double steps);
}

package perf.foresight.core.model;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import perf.foresight.core.domain.model.MetricType;
import perf.foresight.core.domain.model.ModelType;
import perf.foresight.error.exception.InvalidConfigurationException;

/** Name → factory table of the available model types, built at construction. */
public class ModelRegistry {

  private final Map<ModelType, ModelFactory> factories;

  public ModelRegistry(Duration samplingInterval, Clock clock) {
    Map<ModelType, ModelFactory> map = new EnumMap<>(ModelType.class);
    map.put(ModelType.LINEAR, metric -> new LinearPredictionModel(metric, samplingInterval, clock));
    map.put(
        ModelType.EXPONENTIAL,
        metric -> new ExponentialSmoothingModel(metric, samplingInterval, clock));
    map.put(ModelType.ARIMA, metric -> new ArimaModel(metric, samplingInterval, clock));
    map.put(ModelType.ENSEMBLE, metric -> new EnsembleModel(metric, samplingInterval, clock));
    this.factories = Map.copyOf(map);
  }

  public PredictionModel create(String name, MetricType metric) {
    return create(ModelType.fromName(name), metric);
  }

  public PredictionModel create(ModelType type, MetricType metric) {
    ModelFactory factory = factories.get(type);
    if (factory == null) {
      throw new InvalidConfigurationException("no factory for model type " + type);
    }
    return factory.create(metric);
  }

  public Set<ModelType> types() {
    return factories.keySet();
  }
}

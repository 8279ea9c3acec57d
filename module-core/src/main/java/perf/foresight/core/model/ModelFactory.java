package perf.foresight.core.model;

import perf.foresight.core.domain.model.MetricType;

/** Creates an untrained model instance for a metric. */
@FunctionalInterface
public interface ModelFactory {

  PredictionModel create(MetricType metric);
}

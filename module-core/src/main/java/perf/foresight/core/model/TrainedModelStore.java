package perf.foresight.core.model;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import perf.foresight.core.domain.model.MetricType;

/**
 * Published models per metric.
 *
 * <p>A retrain replaces a metric's whole model set at once; readers see either the old or the
 * new set.
 */
public class TrainedModelStore {

  private final Map<MetricType, List<PredictionModel>> models = new EnumMap<>(MetricType.class);
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

  public void publish(MetricType metric, List<PredictionModel> trained) {
    List<PredictionModel> copy = List.copyOf(trained);
    lock.writeLock().lock();
    try {
      if (copy.isEmpty()) {
        models.remove(metric);
      } else {
        models.put(metric, copy);
      }
    } finally {
      lock.writeLock().unlock();
    }
  }

  /** Trained model with the highest accuracy. */
  public Optional<PredictionModel> best(MetricType metric) {
    return models(metric).stream()
        .filter(PredictionModel::isTrained)
        .max(Comparator.comparingDouble(PredictionModel::accuracy));
  }

  public List<PredictionModel> models(MetricType metric) {
    lock.readLock().lock();
    try {
      return models.getOrDefault(metric, List.of());
    } finally {
      lock.readLock().unlock();
    }
  }

  public boolean hasModels(MetricType metric) {
    return !models(metric).isEmpty();
  }

  /** Model name → accuracy for every published model. */
  public Map<String, Double> accuracies() {
    lock.readLock().lock();
    try {
      Map<String, Double> result = new TreeMap<>();
      models.values().forEach(list -> list.forEach(m -> result.put(m.name(), m.accuracy())));
      return result;
    } finally {
      lock.readLock().unlock();
    }
  }
}

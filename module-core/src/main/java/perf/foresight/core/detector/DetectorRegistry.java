package perf.foresight.core.detector;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import perf.foresight.core.config.AnalyticsConfig;
import perf.foresight.core.domain.model.DetectorType;
import perf.foresight.core.domain.model.MetricType;
import perf.foresight.error.exception.InvalidConfigurationException;

/** Name → detector table, built at construction from the configuration. */
public class DetectorRegistry {

  private final Map<DetectorType, RegressionDetector> detectors;

  public DetectorRegistry(AnalyticsConfig config, Clock clock) {
    Map<DetectorType, RegressionDetector> map = new EnumMap<>(DetectorType.class);
    register(map, new StatisticalRegressionDetector(config, clock));
    register(map, new TrendRegressionDetector(config, clock));
    register(map, new ThresholdRegressionDetector(config, clock));
    register(map, new AnomalyRegressionDetector(config, clock));
    this.detectors = Map.copyOf(map);
  }

  public RegressionDetector get(String name) {
    return get(DetectorType.fromName(name));
  }

  public RegressionDetector get(DetectorType type) {
    RegressionDetector detector = detectors.get(type);
    if (detector == null) {
      throw new InvalidConfigurationException("no detector registered for " + type);
    }
    return detector;
  }

  /** Enabled detectors that apply to {@code metric}, in {@link DetectorType} order. */
  public List<RegressionDetector> applicable(MetricType metric, Collection<DetectorType> enabled) {
    List<RegressionDetector> result = new ArrayList<>();
    for (DetectorType type : DetectorType.values()) {
      if (enabled.contains(type) && get(type).isApplicable(metric)) {
        result.add(get(type));
      }
    }
    return result;
  }

  private static void register(
      Map<DetectorType, RegressionDetector> map, RegressionDetector detector) {
    map.put(detector.type(), detector);
  }
}

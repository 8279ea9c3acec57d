package perf.foresight.core.baseline;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import perf.foresight.core.domain.model.MetricType;
import perf.foresight.core.domain.model.PerformanceBaseline;
import perf.foresight.core.domain.model.PerformanceDataPoint;
import perf.foresight.core.stat.Statistics;
import perf.foresight.error.exception.InsufficientDataException;

/**
 * Computes and holds the active baseline of each metric.
 *
 * <h3>Publication</h3>
 *
 * <ul>
 *   <li>baselines are immutable; a refresh swaps the map entry under the write lock
 *   <li>a refresh with too few points leaves the previous baseline authoritative
 *   <li>statistics are computed outside the lock
 * </ul>
 */
@Slf4j
public class BaselineManager {

  private final int minSampleSize;
  private final Clock clock;

  private final Map<MetricType, PerformanceBaseline> baselines = new EnumMap<>(MetricType.class);
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

  public BaselineManager(int minSampleSize, Clock clock) {
    if (minSampleSize <= 0) {
      throw new IllegalArgumentException("minSampleSize must be positive");
    }
    this.minSampleSize = minSampleSize;
    this.clock = clock;
  }

  /**
   * Summarizes {@code points} (oldest first) without storing the result.
   *
   * @throws InsufficientDataException when fewer than the minimum sample size
   */
  public PerformanceBaseline calculateBaseline(
      MetricType metric, List<PerformanceDataPoint> points) {
    if (points.size() < minSampleSize) {
      throw new InsufficientDataException(
          "baseline:" + metric.getKey(), minSampleSize, points.size());
    }
    double[] values = new double[points.size()];
    for (int i = 0; i < values.length; i++) {
      values[i] = points.get(i).value(metric);
    }

    return PerformanceBaseline.builder()
        .id(UUID.randomUUID().toString())
        .metric(metric)
        .mean(Statistics.mean(values))
        .stdDev(Statistics.stdDev(values))
        .min(Statistics.min(values))
        .max(Statistics.max(values))
        .sampleSize(values.length)
        .p95(Statistics.percentile(values, 95))
        .p99(Statistics.percentile(values, 99))
        .windowStart(points.get(0).timestamp())
        .windowEnd(points.get(points.size() - 1).timestamp())
        .createdAt(clock.instant())
        .active(true)
        .build();
  }

  /**
   * Recomputes and publishes the baseline; a no-op below the minimum sample size.
   *
   * @return the newly published baseline, or empty when the previous one was kept
   */
  public Optional<PerformanceBaseline> refreshBaseline(
      MetricType metric, List<PerformanceDataPoint> points) {
    if (points.size() < minSampleSize) {
      log.debug(
          "[BaselineManager] Refresh skipped for {}: {} of {} points",
          metric.getKey(),
          points.size(),
          minSampleSize);
      return Optional.empty();
    }
    PerformanceBaseline baseline = calculateBaseline(metric, points);
    put(baseline);
    log.info(
        "[BaselineManager] Baseline refreshed: {} mean={} stdDev={} n={}",
        metric.getKey(),
        baseline.mean(),
        baseline.stdDev(),
        baseline.sampleSize());
    return Optional.of(baseline);
  }

  /** Stored baseline, creating it from {@code points} on first demand. */
  public Optional<PerformanceBaseline> getOrCreate(
      MetricType metric, Supplier<List<PerformanceDataPoint>> points) {
    Optional<PerformanceBaseline> existing = getBaseline(metric);
    if (existing.isPresent()) {
      return existing;
    }
    return refreshBaseline(metric, points.get());
  }

  private void put(PerformanceBaseline baseline) {
    lock.writeLock().lock();
    try {
      baselines.put(baseline.metric(), baseline);
    } finally {
      lock.writeLock().unlock();
    }
  }

  /** Marks the stored baseline inactive; detection against it is then refused. */
  public Optional<PerformanceBaseline> deactivate(MetricType metric) {
    lock.writeLock().lock();
    try {
      PerformanceBaseline current = baselines.get(metric);
      if (current == null) {
        return Optional.empty();
      }
      PerformanceBaseline deactivated = current.deactivated();
      baselines.put(metric, deactivated);
      return Optional.of(deactivated);
    } finally {
      lock.writeLock().unlock();
    }
  }

  public Optional<PerformanceBaseline> getBaseline(MetricType metric) {
    lock.readLock().lock();
    try {
      return Optional.ofNullable(baselines.get(metric));
    } finally {
      lock.readLock().unlock();
    }
  }

  public Map<MetricType, PerformanceBaseline> getBaselines() {
    lock.readLock().lock();
    try {
      return baselines.isEmpty() ? Map.of() : Map.copyOf(baselines);
    } finally {
      lock.readLock().unlock();
    }
  }

  public int size() {
    lock.readLock().lock();
    try {
      return baselines.size();
    } finally {
      lock.readLock().unlock();
    }
  }
}

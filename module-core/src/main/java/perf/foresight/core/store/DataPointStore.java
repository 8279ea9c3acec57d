package perf.foresight.core.store;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import lombok.extern.slf4j.Slf4j;
import perf.foresight.core.domain.model.PerformanceDataPoint;
import perf.foresight.core.domain.model.PerformanceMetrics;
import perf.foresight.core.feature.FeatureEngineer;

/**
 * Bounded, time-ordered buffer of data points.
 *
 * <h3>Retention</h3>
 *
 * <ul>
 *   <li>count cap: the oldest point is dropped once {@code maxPoints} is exceeded
 *   <li>time cutoff: points older than {@code now - retention} are dropped on every append
 * </ul>
 *
 * <p>One writer, many readers. The write lock covers feature computation, the append and
 * eviction, so a reader never observes a point without its features.
 */
@Slf4j
public class DataPointStore {

  private final int maxPoints;
  private final Duration retention;
  private final Clock clock;

  private final ArrayDeque<PerformanceDataPoint> points = new ArrayDeque<>();
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

  public DataPointStore(int maxPoints, Duration retention, Clock clock) {
    if (maxPoints <= 0) {
      throw new IllegalArgumentException("maxPoints must be positive");
    }
    this.maxPoints = maxPoints;
    this.retention = retention;
    this.clock = clock;
  }

  /**
   * Appends a fully built point.
   *
   * @throws IllegalArgumentException if the point is older than the latest stored point
   */
  public void append(PerformanceDataPoint point) {
    lock.writeLock().lock();
    try {
      appendLocked(point);
    } finally {
      lock.writeLock().unlock();
    }
  }

  /** Computes the features of a new observation and appends it in one critical section. */
  public PerformanceDataPoint record(
      PerformanceMetrics snapshot, Instant timestamp, FeatureEngineer featureEngineer) {
    lock.writeLock().lock();
    try {
      List<PerformanceDataPoint> history =
          tailLocked(
              featureEngineer.requiredHistoryCount(),
              timestamp.minus(featureEngineer.requiredLookback()));
      Map<String, Double> features = featureEngineer.computeFeatures(history, snapshot, timestamp);
      PerformanceDataPoint point = PerformanceDataPoint.of(snapshot, timestamp, features);
      appendLocked(point);
      return point;
    } finally {
      lock.writeLock().unlock();
    }
  }

  /** Points strictly newer than {@code now - duration}, oldest first. */
  public List<PerformanceDataPoint> window(Duration duration) {
    Instant cutoff = clock.instant().minus(duration);
    lock.readLock().lock();
    try {
      List<PerformanceDataPoint> result = new ArrayList<>();
      Iterator<PerformanceDataPoint> it = points.descendingIterator();
      while (it.hasNext()) {
        PerformanceDataPoint point = it.next();
        if (!point.timestamp().isAfter(cutoff)) {
          break;
        }
        result.add(point);
      }
      Collections.reverse(result);
      return result;
    } finally {
      lock.readLock().unlock();
    }
  }

  public List<PerformanceDataPoint> snapshot() {
    lock.readLock().lock();
    try {
      return List.copyOf(points);
    } finally {
      lock.readLock().unlock();
    }
  }

  public Optional<PerformanceDataPoint> latest() {
    lock.readLock().lock();
    try {
      return Optional.ofNullable(points.peekLast());
    } finally {
      lock.readLock().unlock();
    }
  }

  public int size() {
    lock.readLock().lock();
    try {
      return points.size();
    } finally {
      lock.readLock().unlock();
    }
  }

  private void appendLocked(PerformanceDataPoint point) {
    PerformanceDataPoint last = points.peekLast();
    if (last != null && point.timestamp().isBefore(last.timestamp())) {
      throw new IllegalArgumentException(
          "out-of-order data point: " + point.timestamp() + " < " + last.timestamp());
    }
    points.addLast(point);
    evictLocked();
  }

  private void evictLocked() {
    int evicted = 0;
    while (points.size() > maxPoints) {
      points.pollFirst();
      evicted++;
    }
    Instant cutoff = clock.instant().minus(retention);
    while (!points.isEmpty() && points.peekFirst().timestamp().isBefore(cutoff)) {
      points.pollFirst();
      evicted++;
    }
    if (evicted > 0) {
      log.debug("[DataPointStore] Evicted {} points (size={})", evicted, points.size());
    }
  }

  // Most recent points needed for feature computation, oldest first.
  private List<PerformanceDataPoint> tailLocked(int minCount, Instant since) {
    List<PerformanceDataPoint> result = new ArrayList<>();
    Iterator<PerformanceDataPoint> it = points.descendingIterator();
    while (it.hasNext()) {
      PerformanceDataPoint point = it.next();
      if (result.size() >= minCount && point.timestamp().isBefore(since)) {
        break;
      }
      result.add(point);
    }
    Collections.reverse(result);
    return result;
  }
}

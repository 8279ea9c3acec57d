package perf.foresight.core.port.out;

import perf.foresight.core.domain.model.PerformanceMetrics;

/**
 * Source of raw performance snapshots.
 *
 * <p>Returning null means no snapshot is available this tick; the collector skips it.
 */
public interface PerformanceMonitor {

  PerformanceMetrics currentMetrics();
}

package perf.foresight.core.detector;

import java.util.List;
import perf.foresight.core.domain.model.DetectorType;
import perf.foresight.core.domain.model.MetricType;
import perf.foresight.core.domain.model.PerformanceBaseline;
import perf.foresight.core.domain.model.PerformanceDataPoint;
import perf.foresight.core.domain.model.RegressionResult;

/**
 * Compares a current window against a baseline.
 *
 * <p>Detectors are stateless and thread-safe. Several detectors run per metric and every
 * result is surfaced; none overrides another.
 */
public interface RegressionDetector {

  String name();

  DetectorType type();

  /** Fixed confidence reported on every result. */
  double confidence();

  int minimumPoints();

  boolean isApplicable(MetricType metric);

  /**
   * @param window current points, oldest first
   * @throws perf.foresight.error.exception.InactiveBaselineException if the baseline is inactive
   * @throws perf.foresight.error.exception.InsufficientDataException if the window is below
   *     {@link #minimumPoints()}
   */
  RegressionResult detect(PerformanceBaseline baseline, List<PerformanceDataPoint> window);
}

package perf.foresight.core.detector;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import perf.foresight.core.config.AnalyticsConfig;
import perf.foresight.core.domain.model.MetricType;
import perf.foresight.core.domain.model.PerformanceBaseline;
import perf.foresight.core.domain.model.RegressionResult;
import perf.foresight.core.domain.model.RegressionType;
import perf.foresight.core.domain.model.Severity;
import perf.foresight.core.fixture.MutableClock;
import perf.foresight.core.fixture.TestDataPoints;
import perf.foresight.error.exception.InsufficientDataException;

@Tag("unit")
@DisplayName("ThresholdRegressionDetector unit tests")
class ThresholdRegressionDetectorTest {

  private final ThresholdRegressionDetector detector =
      new ThresholdRegressionDetector(
          AnalyticsConfig.defaults(), new MutableClock(TestDataPoints.START));

  // mean 200, σ 20, p95 300, p99 400
  private final PerformanceBaseline baseline =
      TestDataPoints.baseline(MetricType.RESPONSE_TIME, 200, 20, 300, 400);

  @Test
  @DisplayName("applies only to metrics where higher is worse")
  void applicability() {
    assertThat(detector.isApplicable(MetricType.RESPONSE_TIME)).isTrue();
    assertThat(detector.isApplicable(MetricType.ERROR_RATE)).isTrue();
    assertThat(detector.isApplicable(MetricType.THROUGHPUT)).isFalse();
    assertThat(detector.isApplicable(MetricType.SUCCESS_RATE)).isFalse();
  }

  @Test
  @DisplayName("sustained above p99 is a high severity degradation")
  void above_p99() {
    RegressionResult result =
        detector.detect(baseline, TestDataPoints.constant(MetricType.RESPONSE_TIME, 10, 450));

    assertThat(result.type()).isEqualTo(RegressionType.DEGRADATION);
    assertThat(result.severity()).isEqualTo(Severity.HIGH);
  }

  @Test
  @DisplayName("sustained above p95 is graded by the change")
  void above_p95() {
    // +75% against a 20% threshold
    RegressionResult result =
        detector.detect(baseline, TestDataPoints.constant(MetricType.RESPONSE_TIME, 10, 350));

    assertThat(result.type()).isEqualTo(RegressionType.DEGRADATION);
    assertThat(result.severity()).isEqualTo(Severity.CRITICAL);
  }

  @Test
  @DisplayName("short spikes below the sustain ratio do not flag")
  void short_spike() {
    double[] values = {200, 200, 200, 200, 200, 200, 200, 200, 450, 450};

    RegressionResult result =
        detector.detect(baseline, TestDataPoints.series(MetricType.RESPONSE_TIME, values));

    assertThat(result.type()).isEqualTo(RegressionType.NONE);
  }

  @Test
  @DisplayName("mean below mean − 2σ is an improvement")
  void improvement() {
    RegressionResult result =
        detector.detect(baseline, TestDataPoints.constant(MetricType.RESPONSE_TIME, 5, 150));

    assertThat(result.type()).isEqualTo(RegressionType.IMPROVEMENT);
  }

  @Test
  @DisplayName("needs 5 points")
  void insufficient_window() {
    assertThatThrownBy(
            () ->
                detector.detect(
                    baseline, TestDataPoints.constant(MetricType.RESPONSE_TIME, 4, 450)))
        .isInstanceOf(InsufficientDataException.class);
  }
}

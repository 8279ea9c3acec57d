package perf.foresight.core.detector;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.Arrays;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import perf.foresight.core.config.AnalyticsConfig;
import perf.foresight.core.domain.model.MetricType;
import perf.foresight.core.domain.model.OutlierAnalysis;
import perf.foresight.core.domain.model.PerformanceBaseline;
import perf.foresight.core.domain.model.RegressionResult;
import perf.foresight.core.domain.model.RegressionType;
import perf.foresight.core.domain.model.Severity;
import perf.foresight.core.fixture.MutableClock;
import perf.foresight.core.fixture.TestDataPoints;

@Tag("unit")
@DisplayName("AnomalyRegressionDetector unit tests")
class AnomalyRegressionDetectorTest {

  private final MutableClock clock = new MutableClock(TestDataPoints.START);
  private final PerformanceBaseline baseline =
      TestDataPoints.baseline(MetricType.RESPONSE_TIME, 100, 10);

  private AnomalyRegressionDetector detector(double k) {
    return new AnomalyRegressionDetector(AnalyticsConfig.builder().anomalyK(k).build(), clock);
  }

  @Test
  @DisplayName("outliers within the allowed ratio are reported but not classified")
  void few_outliers() {
    // baseline 100 ± 10; k = 2 → [80, 120]
    double[] values = new double[20];
    Arrays.fill(values, 100);
    values[18] = 1000;
    values[19] = 1000;

    RegressionResult result =
        detector(2).detect(baseline, TestDataPoints.series(MetricType.RESPONSE_TIME, values));

    OutlierAnalysis outliers = result.outliers();
    assertThat(outliers.outlierCount()).isEqualTo(2);
    assertThat(outliers.outlierRatio()).isCloseTo(0.1, within(1e-12));
    assertThat(outliers.outlierPercent()).isCloseTo(10.0, within(1e-9));
    assertThat(outliers.threshold()).isEqualTo(2.0);
    assertThat(result.type()).isEqualTo(RegressionType.NONE);
  }

  @Test
  @DisplayName("a point exactly on the bound is not an outlier")
  void bound_is_inclusive() {
    // k = 3 → [70, 130]
    double[] values = new double[20];
    Arrays.fill(values, 100);
    values[18] = 130;
    values[19] = 70;

    RegressionResult result =
        detector(3).detect(baseline, TestDataPoints.series(MetricType.RESPONSE_TIME, values));

    assertThat(result.outliers().outlierCount()).isZero();
  }

  @Test
  @DisplayName("outlier ratio above the anomaly ratio is classified ANOMALY")
  void anomaly() {
    // k = 1 → [90, 110]
    double[] values = {100, 100, 100, 100, 100, 100, 100, 200, 200, 200};

    RegressionResult result =
        detector(1).detect(baseline, TestDataPoints.series(MetricType.RESPONSE_TIME, values));

    assertThat(result.outliers().outlierCount()).isEqualTo(3);
    assertThat(result.type()).isEqualTo(RegressionType.ANOMALY);
    assertThat(result.severity()).isEqualTo(Severity.MEDIUM);
    assertThat(result.confidence()).isEqualTo(0.7);
  }

  @Test
  @DisplayName("a tight window shifted away from the baseline is all outliers")
  void shifted_window() {
    // window σ is 1, baseline 100 ± 10; k = 3 → [70, 130]
    double[] values = new double[20];
    for (int i = 0; i < values.length; i++) {
      values[i] = i % 2 == 0 ? 499 : 501;
    }

    RegressionResult result =
        detector(3).detect(baseline, TestDataPoints.series(MetricType.RESPONSE_TIME, values));

    assertThat(result.outliers().outlierCount()).isEqualTo(20);
    assertThat(result.outliers().outlierRatio()).isEqualTo(1.0);
    assertThat(result.type()).isEqualTo(RegressionType.ANOMALY);
    assertThat(result.severity()).isEqualTo(Severity.CRITICAL);
  }

  @Test
  @DisplayName("a baseline without spread reports no outliers")
  void zero_spread_baseline() {
    double[] values = new double[20];
    Arrays.fill(values, 500);

    RegressionResult result =
        detector(3)
            .detect(
                TestDataPoints.baseline(MetricType.RESPONSE_TIME, 100, 0),
                TestDataPoints.series(MetricType.RESPONSE_TIME, values));

    assertThat(result.outliers().outlierCount()).isZero();
    assertThat(result.type()).isEqualTo(RegressionType.NONE);
  }
}

package perf.foresight.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.BDDMockito.then;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;

import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import perf.foresight.core.config.AnalyticsConfig;
import perf.foresight.core.domain.model.DetectorType;
import perf.foresight.core.domain.model.MetricType;
import perf.foresight.core.domain.model.PerformanceBaseline;
import perf.foresight.core.domain.model.PredictionResult;
import perf.foresight.core.domain.model.RegressionEvent;
import perf.foresight.core.domain.model.RegressionEventType;
import perf.foresight.core.domain.model.RegressionResult;
import perf.foresight.core.domain.model.RegressionType;
import perf.foresight.core.domain.model.TrendDirection;
import perf.foresight.core.fixture.FakePerformanceMonitor;
import perf.foresight.core.fixture.MutableClock;
import perf.foresight.core.fixture.TestDataPoints;
import perf.foresight.core.port.out.AnalyticsResultSink;
import perf.foresight.global.executor.DefaultLogicExecutor;

@Tag("unit")
@DisplayName("PerformanceAnalyticsEngine tests")
class PerformanceAnalyticsEngineTest {

  private MutableClock clock;
  private FakePerformanceMonitor monitor;
  private AnalyticsResultSink sink;
  private PerformanceAnalyticsEngine engine;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(TestDataPoints.START);
    monitor = new FakePerformanceMonitor();
    sink = mock(AnalyticsResultSink.class);
    engine = engine(EnumSet.of(MetricType.RESPONSE_TIME));
  }

  @AfterEach
  void tearDown() {
    engine.stop();
  }

  @Nested
  @DisplayName("collection")
  class Collection {

    @Test
    @DisplayName("stores each snapshot with its features at the clock time")
    void stores_snapshot_with_features() {
      collect(25, 220);

      assertThat(engine.getDataPointCount()).isEqualTo(25);
      assertThat(engine.getHistoricalData())
          .last()
          .satisfies(
              point -> {
                assertThat(point.timestamp()).isEqualTo(clock.instant());
                assertThat(point.responseTimeMs()).isEqualTo(220.0);
                assertThat(point.features()).containsKey("response_time_ma_5min");
              });
      assertThat(engine.getHistoricalData(Duration.ofMinutes(5))).hasSize(10);
    }

    @Test
    @DisplayName("a missing snapshot is skipped")
    void missing_snapshot() {
      monitor.setAvailable(false);

      assertThat(engine.collectOnce()).isEmpty();
      assertThat(engine.getDataPointCount()).isZero();
    }

    @Test
    @DisplayName("a snapshot older than the latest point is rejected")
    void out_of_order() {
      collect(1, 220);
      monitor.setCollectedAt(TestDataPoints.START.minus(Duration.ofHours(1)));

      assertThatThrownBy(engine::collectOnce)
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessageContaining("out-of-order");
      assertThat(engine.getDataPointCount()).isEqualTo(1);
    }
  }

  @Nested
  @DisplayName("prediction")
  class Prediction {

    @Test
    @DisplayName("flat history predicts the flat value with every model published")
    void flat_history() {
      collect(60, 220);

      List<PredictionResult> results = engine.predictOnce();

      assertThat(results).hasSize(1);
      PredictionResult result = results.get(0);
      assertThat(result.metric()).isEqualTo(MetricType.RESPONSE_TIME);
      assertThat(result.horizon()).isEqualTo(Duration.ofMinutes(5));
      assertThat(result.predictedValue()).isCloseTo(220.0, within(1e-6));
      assertThat(result.currentValue()).isEqualTo(220.0);
      assertThat(engine.getPredictionAccuracy())
          .containsOnlyKeys(
              "linear:response_time",
              "exponential:response_time",
              "arima:response_time",
              "ensemble:response_time");
      assertThat(engine.getRecentPredictions()).containsExactly(result);
      then(sink).should().onPrediction(result);
      then(sink).should(never()).onPredictiveAlert(any());
    }

    @Test
    @DisplayName("too little history yields no predictions")
    void insufficient_history() {
      collect(5, 220);

      assertThat(engine.predictOnce()).isEmpty();
      assertThat(engine.getPredictionAccuracy()).isEmpty();
      then(sink).should(never()).onPrediction(any());
    }

    @Test
    @DisplayName("on-demand training waits for the retrain minimum")
    void on_demand_training_needs_retrain_minimum() {
      // 15 points trains linear and exponential models on their own, the retrain minimum is 20
      collect(15, 220);

      assertThat(engine.predictOnce()).isEmpty();
      assertThat(engine.getPredictionAccuracy()).isEmpty();

      collect(5, 220);

      assertThat(engine.predictOnce()).hasSize(1);
      assertThat(engine.getPredictionAccuracy()).isNotEmpty();
    }

    @Test
    @DisplayName("a failing metric does not block the others")
    void failure_isolation() {
      engine = engine(EnumSet.of(MetricType.RESPONSE_TIME, MetricType.ERROR_RATE));
      willThrow(new IllegalStateException("sink down"))
          .given(sink)
          .onPrediction(argThat(r -> r != null && r.metric() == MetricType.RESPONSE_TIME));
      collect(60, 220);

      List<PredictionResult> results = engine.predictOnce();

      assertThat(results)
          .extracting(PredictionResult::metric)
          .containsExactly(MetricType.ERROR_RATE);
    }

    @Test
    @DisplayName("retraining needs the configured minimum of points")
    void retrain() {
      collect(10, 220);
      assertThat(engine.retrainModels()).isZero();

      collect(20, 220);
      assertThat(engine.retrainModels()).isEqualTo(4);
    }
  }

  @Nested
  @DisplayName("regression detection")
  class Detection {

    @Test
    @DisplayName("a ramp opens regressions that resolve once the metric recovers")
    void detect_and_resolve() {
      // Given
      collect(60, 220);
      assertThat(engine.refreshBaselines()).isEqualTo(1);
      PerformanceBaseline baseline = engine.getBaseline(MetricType.RESPONSE_TIME).orElseThrow();
      assertThat(baseline.mean()).isEqualTo(220.0);

      for (int i = 0; i < 50; i++) {
        collect(1, 200 + 5 * i);
      }

      // When
      List<RegressionResult> ramp = engine.detectOnce();

      // Then
      assertThat(ramp).hasSize(4);
      RegressionResult trend = result(ramp, DetectorType.TREND);
      assertThat(trend.trend().direction()).isEqualTo(TrendDirection.INCREASING);
      assertThat(trend.type()).isEqualTo(RegressionType.DEGRADATION);
      assertThat(result(ramp, DetectorType.STATISTICAL).type())
          .isEqualTo(RegressionType.DEGRADATION);
      assertThat(result(ramp, DetectorType.THRESHOLD).type())
          .isEqualTo(RegressionType.DEGRADATION);
      assertThat(result(ramp, DetectorType.ANOMALY).type()).isEqualTo(RegressionType.NONE);
      assertThat(events(RegressionEventType.DETECTED)).hasSize(3);
      then(sink).should(times(3)).onRegression(any());

      // a second pass over the same ramp does not duplicate events
      engine.detectOnce();
      assertThat(events(RegressionEventType.DETECTED)).hasSize(3);

      collect(60, 220);
      List<RegressionResult> recovered = engine.detectOnce();

      assertThat(recovered).extracting(RegressionResult::type).containsOnly(RegressionType.NONE);
      assertThat(events(RegressionEventType.RESOLVED))
          .extracting(RegressionEvent::detector)
          .containsExactlyInAnyOrder("statistical", "trend", "threshold");
      assertThat(engine.getRecentDetections()).hasSize(12);
    }

    @Test
    @DisplayName("an event can be acknowledged")
    void acknowledge() {
      collect(60, 220);
      engine.refreshBaselines();
      for (int i = 0; i < 50; i++) {
        collect(1, 200 + 5 * i);
      }
      engine.detectOnce();
      RegressionEvent detected = events(RegressionEventType.DETECTED).get(0);

      RegressionEvent acknowledged =
          engine.acknowledge(detected.id(), "oncall", "rollback scheduled").orElseThrow();

      assertThat(acknowledged.type()).isEqualTo(RegressionEventType.ACKNOWLEDGED);
      assertThat(acknowledged.relatedResultId()).isEqualTo(detected.relatedResultId());
      assertThat(acknowledged.actor()).isEqualTo("oncall");
      assertThat(engine.getRegressionHistory()).last().isEqualTo(acknowledged);
      then(sink).should().onRegressionEvent(acknowledged);
      assertThat(engine.acknowledge("missing", "oncall", null)).isEmpty();
    }

    @Test
    @DisplayName("without enough history there is no baseline and no detection")
    void no_baseline() {
      collect(5, 220);

      assertThat(engine.detectOnce()).isEmpty();
      assertThat(engine.getBaselineCount()).isZero();
      assertThat(engine.refreshBaselines()).isZero();
    }

    @Test
    @DisplayName("a deactivated baseline suspends detection")
    void deactivated_baseline() {
      collect(60, 220);
      engine.refreshBaselines();

      assertThat(engine.deactivateBaseline(MetricType.RESPONSE_TIME))
          .hasValueSatisfying(b -> assertThat(b.active()).isFalse());
      assertThat(engine.detectOnce()).isEmpty();

      assertThat(engine.updateBaseline(MetricType.RESPONSE_TIME))
          .hasValueSatisfying(b -> assertThat(b.active()).isTrue());
      assertThat(engine.detectOnce()).hasSize(4);
    }
  }

  @Nested
  @DisplayName("lifecycle")
  class Lifecycle {

    @Test
    @DisplayName("start collects on schedule and stop is idempotent")
    void start_stop() {
      engine =
          new PerformanceAnalyticsEngine(
              config(EnumSet.of(MetricType.RESPONSE_TIME)).toBuilder()
                  .collectionInterval(Duration.ofMillis(20))
                  .build(),
              monitor,
              sink,
              new DefaultLogicExecutor(),
              clock);

      engine.start();
      engine.start();

      assertThat(engine.isRunning()).isTrue();
      await()
          .atMost(Duration.ofSeconds(5))
          .untilAsserted(() -> assertThat(engine.getDataPointCount()).isPositive());

      engine.stop();
      engine.stop();

      assertThat(engine.isRunning()).isFalse();
    }
  }

  private PerformanceAnalyticsEngine engine(Set<MetricType> metrics) {
    return new PerformanceAnalyticsEngine(
        config(metrics), monitor, sink, new DefaultLogicExecutor(), clock);
  }

  private static AnalyticsConfig config(Set<MetricType> metrics) {
    return AnalyticsConfig.builder()
        .minBaselineSamples(10)
        .minRetrainPoints(20)
        .predictedMetrics(metrics)
        .monitoredMetrics(metrics)
        .predictionHorizons(List.of(Duration.ofMinutes(5)))
        .detectionWindow(Duration.ofMinutes(25))
        .baselineWindow(Duration.ofDays(1))
        .build();
  }

  private void collect(int count, double responseTimeMs) {
    monitor.setResponseTimeMs(responseTimeMs);
    for (int i = 0; i < count; i++) {
      clock.advance(TestDataPoints.STEP);
      engine.collectOnce();
    }
  }

  private List<RegressionEvent> events(RegressionEventType type) {
    return engine.getRegressionHistory().stream().filter(e -> e.type() == type).toList();
  }

  private static RegressionResult result(List<RegressionResult> results, DetectorType detector) {
    return results.stream()
        .filter(r -> r.detector().equals(detector.getDetectorName()))
        .findFirst()
        .orElseThrow();
  }
}

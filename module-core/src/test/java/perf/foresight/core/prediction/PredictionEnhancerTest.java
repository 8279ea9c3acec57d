package perf.foresight.core.prediction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.BDDMockito.given;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import perf.foresight.core.config.AnalyticsConfig;
import perf.foresight.core.domain.model.MetricType;
import perf.foresight.core.domain.model.PerformanceDataPoint;
import perf.foresight.core.domain.model.PredictionFactor;
import perf.foresight.core.domain.model.PredictionResult;
import perf.foresight.core.domain.model.TrendClassification;
import perf.foresight.core.fixture.TestDataPoints;
import perf.foresight.core.model.PredictionModel;
import perf.foresight.core.model.PredictionModel.Forecast;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
@DisplayName("PredictionEnhancer unit tests")
class PredictionEnhancerTest {

  private static final Instant TEN_AM = Instant.parse("2024-01-15T10:00:00Z");
  private static final Instant EIGHT_PM = Instant.parse("2024-01-15T20:00:00Z");

  @Mock private PredictionModel model;

  private final PredictionEnhancer enhancer = new PredictionEnhancer(AnalyticsConfig.defaults());

  @Nested
  @DisplayName("trend classification")
  class Classification {

    @ParameterizedTest
    @CsvSource({
      "RESPONSE_TIME, 15, DEGRADING",
      "RESPONSE_TIME, -15, IMPROVING",
      "THROUGHPUT, 15, IMPROVING",
      "THROUGHPUT, -15, DEGRADING",
      "RESPONSE_TIME, 10, STABLE"
    })
    @DisplayName("more than ±10% change is read through the metric polarity")
    void polarity(MetricType metric, double changePercent, TrendClassification expected) {
      assertThat(PredictionEnhancer.classify(metric, changePercent)).isEqualTo(expected);
    }

    @Test
    @DisplayName("strength is |change| / 50 capped at 1, 0.1 when stable")
    void strength() {
      assertThat(PredictionEnhancer.trendStrength(25)).isEqualTo(0.5);
      assertThat(PredictionEnhancer.trendStrength(-80)).isEqualTo(1.0);
      assertThat(PredictionEnhancer.trendStrength(5)).isEqualTo(0.1);
    }
  }

  @Test
  @DisplayName("bounds use the volatility feature, seasonality uses business hours")
  void bounds_and_seasonality() {
    stubModel();
    PerformanceDataPoint latest =
        TestDataPoints.point(
            TEN_AM, MetricType.RESPONSE_TIME, 200, Map.of("response_time_volatility", 10.0));

    PredictionResult result =
        enhancer.enhance(
            MetricType.RESPONSE_TIME,
            latest,
            model,
            new Forecast(260, 0.8),
            Duration.ofHours(1),
            TEN_AM);

    assertThat(result.currentValue()).isEqualTo(200.0);
    assertThat(result.predictedValue()).isEqualTo(260.0);
    assertThat(result.lowerBound()).isCloseTo(240.4, within(1e-9));
    assertThat(result.upperBound()).isCloseTo(279.6, within(1e-9));
    assertThat(result.trend()).isEqualTo(TrendClassification.DEGRADING);
    assertThat(result.trendStrength()).isCloseTo(0.6, within(1e-9));
    assertThat(result.seasonal()).isTrue();
    assertThat(result.modelUsed()).isEqualTo("linear:response_time");
    assertThat(result.modelAccuracy()).isEqualTo(0.9);
    assertThat(result.modelLastTraining()).isEqualTo(TestDataPoints.START);
  }

  @Test
  @DisplayName("rates fall back to σ = 0.05 and bounds are clamped")
  void rate_bounds() {
    stubModel();
    PerformanceDataPoint latest = TestDataPoints.point(EIGHT_PM, MetricType.ERROR_RATE, 0.02);

    PredictionResult result =
        enhancer.enhance(
            MetricType.ERROR_RATE, latest, model, new Forecast(0.03, 0.7), Duration.ZERO, EIGHT_PM);

    assertThat(result.standardDeviation()).isEqualTo(0.05);
    assertThat(result.lowerBound()).isZero();
    assertThat(result.seasonal()).isFalse();
  }

  @Test
  @DisplayName("contributing factors reflect resource pressure and trend")
  void factors() {
    stubModel();
    PerformanceDataPoint latest =
        PerformanceDataPoint.builder()
            .timestamp(TEN_AM)
            .responseTimeMs(300)
            .cpuUsage(85)
            .memoryUsage(95)
            .errorRate(0.08)
            .features(
                Map.of(
                    "response_time_trend", 2.0,
                    "response_time_trend_strength", 0.4,
                    "response_time_volatility", 150.0))
            .build();

    PredictionResult result =
        enhancer.enhance(
            MetricType.RESPONSE_TIME,
            latest,
            model,
            new Forecast(310, 0.8),
            Duration.ofMinutes(15),
            TEN_AM);

    assertThat(result.factors())
        .extracting(PredictionFactor::name)
        .containsExactly(
            "rising_trend", "high_cpu", "high_volatility", "high_error_rate", "high_memory");
    assertThat(result.factors().get(0).impact()).isEqualTo(0.4);
  }

  private void stubModel() {
    given(model.name()).willReturn("linear:response_time");
    given(model.accuracy()).willReturn(0.9);
    given(model.lastTraining()).willReturn(Optional.of(TestDataPoints.START));
  }
}

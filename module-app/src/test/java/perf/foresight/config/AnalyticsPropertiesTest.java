package perf.foresight.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;
import perf.foresight.core.config.AnalyticsConfig;
import perf.foresight.core.domain.model.DetectorType;
import perf.foresight.core.domain.model.MetricType;
import perf.foresight.core.domain.model.ModelType;
import perf.foresight.error.exception.InvalidConfigurationException;

@DisplayName("AnalyticsProperties binding tests")
class AnalyticsPropertiesTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner().withUserConfiguration(PropertiesConfig.class);

  @Test
  @DisplayName("defaults match the engine defaults")
  void defaults() {
    contextRunner.run(
        context -> {
          AnalyticsConfig config = context.getBean(AnalyticsProperties.class).toConfig();
          AnalyticsConfig defaults = AnalyticsConfig.defaults();

          assertThat(config.getCollectionInterval()).isEqualTo(defaults.getCollectionInterval());
          assertThat(config.getSamplingInterval()).isEqualTo(Duration.ofSeconds(30));
          assertThat(config.getPredictionHorizons())
              .containsExactly(Duration.ofMinutes(15), Duration.ofHours(1), Duration.ofHours(4));
          assertThat(config.getMonitoredMetrics()).isEqualTo(defaults.getMonitoredMetrics());
          assertThat(config.getEnabledModels()).containsExactlyInAnyOrder(ModelType.values());
          assertThat(config.getThresholds()).isEqualTo(defaults.getThresholds());
          assertThat(config.validate()).isSameAs(config);
        });
  }

  @Test
  @DisplayName("overrides are bound and thresholds merged over the defaults")
  void overrides() {
    contextRunner
        .withPropertyValues(
            "analytics.collection-interval=10s",
            "analytics.prediction-horizons=5m",
            "analytics.monitored-metrics=response_time,cpu_usage",
            "analytics.enabled-detectors=statistical,anomaly",
            "analytics.anomaly-k=2.5",
            "analytics.thresholds.response-time.degradation-percent=15",
            "analytics.thresholds.response-time.improvement-percent=5",
            "analytics.alert-thresholds.cpu-usage=70")
        .run(
            context -> {
              AnalyticsConfig config = context.getBean(AnalyticsProperties.class).toConfig();

              assertThat(config.getCollectionInterval()).isEqualTo(Duration.ofSeconds(10));
              assertThat(config.getPredictionHorizons()).containsExactly(Duration.ofMinutes(5));
              assertThat(config.getMonitoredMetrics())
                  .containsExactlyInAnyOrder(MetricType.RESPONSE_TIME, MetricType.CPU_USAGE);
              assertThat(config.getEnabledDetectors())
                  .containsExactlyInAnyOrder(DetectorType.STATISTICAL, DetectorType.ANOMALY);
              assertThat(config.getAnomalyK()).isEqualTo(2.5);
              assertThat(config.thresholdFor(MetricType.RESPONSE_TIME).degradationPercent())
                  .isEqualTo(15.0);
              assertThat(config.thresholdFor(MetricType.CPU_USAGE).degradationPercent())
                  .isEqualTo(25.0);
              assertThat(config.getAlertThresholds())
                  .containsEntry(MetricType.CPU_USAGE, 70.0)
                  .containsEntry(MetricType.RESPONSE_TIME, 1000.0);
            });
  }

  @Test
  @DisplayName("unknown names are rejected as configuration errors")
  void unknown_names() {
    contextRunner
        .withPropertyValues("analytics.enabled-models=linear,prophet")
        .run(
            context ->
                assertThatThrownBy(() -> context.getBean(AnalyticsProperties.class).toConfig())
                    .isInstanceOf(InvalidConfigurationException.class)
                    .hasMessageContaining("prophet"));
  }

  @Test
  @DisplayName("metric keys match regardless of separators")
  void lenient_metric_keys() {
    assertThat(AnalyticsProperties.metric("response-time")).isEqualTo(MetricType.RESPONSE_TIME);
    assertThat(AnalyticsProperties.metric("memoryusage")).isEqualTo(MetricType.MEMORY_USAGE);
    assertThatThrownBy(() -> AnalyticsProperties.metric("latency"))
        .isInstanceOf(InvalidConfigurationException.class);
  }

  @Configuration(proxyBeanMethods = false)
  @EnableConfigurationProperties(AnalyticsProperties.class)
  static class PropertiesConfig {}
}

package perf.foresight.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import perf.foresight.alert.MeteredAnalyticsResultSink;
import perf.foresight.core.engine.PerformanceAnalyticsEngine;
import perf.foresight.core.port.out.AnalyticsResultSink;
import perf.foresight.core.port.out.PerformanceMonitor;
import perf.foresight.global.executor.DefaultLogicExecutor;
import perf.foresight.global.executor.LogicExecutor;
import perf.foresight.global.executor.strategy.ExceptionTranslator;
import perf.foresight.lifecycle.AnalyticsEngineLifecycle;
import perf.foresight.monitor.MicrometerPerformanceMonitor;

/**
 * Wires the analytics engine.
 *
 * <p>Monitor, sink and clock back off when the application defines its own. An invalid {@code
 * analytics.*} configuration fails engine creation and with it the context.
 *
 * <pre>
 * analytics.task.failures   counter  component, operation
 * analytics.datapoints      gauge
 * analytics.baselines       gauge
 * </pre>
 */
@Configuration(proxyBeanMethods = false)
@EnableConfigurationProperties(AnalyticsProperties.class)
@ConditionalOnProperty(prefix = "analytics", name = "enabled", matchIfMissing = true)
public class AnalyticsEngineConfig {

  @Bean
  @ConditionalOnMissingBean
  public Clock analyticsClock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnMissingBean
  public LogicExecutor logicExecutor(MeterRegistry meterRegistry) {
    return new DefaultLogicExecutor(
        ExceptionTranslator.defaultTranslator(),
        context ->
            Counter.builder("analytics.task.failures")
                .tag("component", context.component())
                .tag("operation", context.operation())
                .register(meterRegistry)
                .increment());
  }

  @Bean
  @ConditionalOnMissingBean
  public PerformanceMonitor performanceMonitor(MeterRegistry meterRegistry, Clock clock) {
    return new MicrometerPerformanceMonitor(meterRegistry, clock);
  }

  @Bean
  @ConditionalOnMissingBean
  public AnalyticsResultSink analyticsResultSink(MeterRegistry meterRegistry) {
    return new MeteredAnalyticsResultSink(meterRegistry);
  }

  @Bean
  public PerformanceAnalyticsEngine performanceAnalyticsEngine(
      AnalyticsProperties properties,
      PerformanceMonitor monitor,
      AnalyticsResultSink sink,
      LogicExecutor logicExecutor,
      Clock clock,
      MeterRegistry meterRegistry) {
    PerformanceAnalyticsEngine engine =
        new PerformanceAnalyticsEngine(properties.toConfig(), monitor, sink, logicExecutor, clock);
    Gauge.builder("analytics.datapoints", engine, PerformanceAnalyticsEngine::getDataPointCount)
        .description("Data points held by the analytics engine")
        .register(meterRegistry);
    Gauge.builder("analytics.baselines", engine, PerformanceAnalyticsEngine::getBaselineCount)
        .description("Active and inactive baselines")
        .register(meterRegistry);
    return engine;
  }

  @Bean
  public AnalyticsEngineLifecycle analyticsEngineLifecycle(PerformanceAnalyticsEngine engine) {
    return new AnalyticsEngineLifecycle(engine);
  }
}

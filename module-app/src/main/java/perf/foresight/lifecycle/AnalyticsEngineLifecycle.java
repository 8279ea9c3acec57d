package perf.foresight.lifecycle;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import perf.foresight.core.engine.PerformanceAnalyticsEngine;

/**
 * Starts the engine's scheduler with the application context and stops it before the context
 * closes.
 *
 * <p>Phase {@code Integer.MAX_VALUE - 1000}: started late and stopped early, so the meters and
 * the monitor the tasks read are still available while the last cycle drains.
 */
@Slf4j
@RequiredArgsConstructor
public class AnalyticsEngineLifecycle implements SmartLifecycle {

  static final int PHASE = Integer.MAX_VALUE - 1000;

  private final PerformanceAnalyticsEngine engine;

  @Override
  public void start() {
    engine.start();
  }

  @Override
  public void stop() {
    log.info("[AnalyticsEngineLifecycle] Stopping analytics engine");
    engine.stop();
  }

  @Override
  public boolean isRunning() {
    return engine.isRunning();
  }

  @Override
  public int getPhase() {
    return PHASE;
  }
}

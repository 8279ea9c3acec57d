package perf.foresight.monitor;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import perf.foresight.core.domain.model.PerformanceMetrics;
import perf.foresight.core.port.out.PerformanceMonitor;

/**
 * Reads a snapshot from the application's own Micrometer registry.
 *
 * <h3>Sources</h3>
 *
 * <pre>
 * response time / throughput / error rate   http.server.requests (delta since the previous read)
 * cpu                                       system.cpu.usage (0..1 → percent)
 * memory                                    jvm.memory.used / jvm.memory.max (area=heap)
 * disk                                      disk.free / disk.total
 * active users                              tomcat.sessions.active.current
 * </pre>
 *
 * <p>Request meters are cumulative, so the first read only records a starting point and returns
 * {@code null}; the engine skips that cycle. Missing meters read as zero.
 */
@Slf4j
public class MicrometerPerformanceMonitor implements PerformanceMonitor {

  static final String HTTP_REQUESTS = "http.server.requests";
  private static final String SERVER_ERROR = "SERVER_ERROR";

  private final MeterRegistry registry;
  private final Clock clock;

  private Totals previous;

  public MicrometerPerformanceMonitor(MeterRegistry registry, Clock clock) {
    this.registry = registry;
    this.clock = clock;
  }

  @Override
  public synchronized PerformanceMetrics currentMetrics() {
    Totals current = readTotals(clock.instant());
    Totals last = previous;
    previous = current;
    if (last == null) {
      log.debug("[MicrometerMonitor] First read, recording request totals");
      return null;
    }
    double seconds = Duration.between(last.at(), current.at()).toMillis() / 1000.0;
    if (seconds <= 0) {
      return null;
    }

    long requests = current.count() - last.count();
    double errorRate = requests > 0 ? (double) (current.errors() - last.errors()) / requests : 0.0;
    double averageMs = requests > 0 ? (current.totalMs() - last.totalMs()) / requests : 0.0;

    return PerformanceMetrics.builder()
        .averageResponseTime(Duration.ofNanos(Math.round(averageMs * 1_000_000)))
        .successRate(1.0 - errorRate)
        .requestsPerSecond(requests / seconds)
        .errorRate(errorRate)
        .cpuUsage(gauge("system.cpu.usage") * 100.0)
        .memoryUsage(heapUsagePercent())
        .diskUsage(diskUsagePercent())
        .activeUsers(Math.round(gauge("tomcat.sessions.active.current")))
        .dataProcessingVolume(requests)
        .collectedAt(current.at())
        .build();
  }

  private Totals readTotals(Instant at) {
    Collection<Timer> timers = registry.find(HTTP_REQUESTS).timers();
    long count = 0;
    long errors = 0;
    double totalMs = 0;
    for (Timer timer : timers) {
      count += timer.count();
      totalMs += timer.totalTime(TimeUnit.MILLISECONDS);
      if (SERVER_ERROR.equals(timer.getId().getTag("outcome"))) {
        errors += timer.count();
      }
    }
    return new Totals(at, count, errors, totalMs);
  }

  private double heapUsagePercent() {
    double used = sum("jvm.memory.used");
    double max = sum("jvm.memory.max");
    return max > 0 ? used / max * 100.0 : 0.0;
  }

  private double diskUsagePercent() {
    double total = gauge("disk.total");
    return total > 0 ? (total - gauge("disk.free")) / total * 100.0 : 0.0;
  }

  private double gauge(String name) {
    Gauge gauge = registry.find(name).gauge();
    if (gauge == null) {
      return 0.0;
    }
    double value = gauge.value();
    return Double.isFinite(value) ? value : 0.0;
  }

  // max is -1 for pools without a limit
  private double sum(String name) {
    double total = 0;
    for (Gauge gauge : registry.find(name).tag("area", "heap").gauges()) {
      double value = gauge.value();
      if (Double.isFinite(value) && value > 0) {
        total += value;
      }
    }
    return total;
  }

  private record Totals(Instant at, long count, long errors, double totalMs) {}
}

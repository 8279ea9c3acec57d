package perf.foresight.core.engine;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import perf.foresight.core.baseline.BaselineManager;
import perf.foresight.core.config.AnalyticsConfig;
import perf.foresight.core.detector.DetectorRegistry;
import perf.foresight.core.detector.RegressionDetector;
import perf.foresight.core.domain.model.MetricType;
import perf.foresight.core.domain.model.ModelType;
import perf.foresight.core.domain.model.PerformanceBaseline;
import perf.foresight.core.domain.model.PerformanceDataPoint;
import perf.foresight.core.domain.model.PerformanceMetrics;
import perf.foresight.core.domain.model.PredictionAlert;
import perf.foresight.core.domain.model.PredictionResult;
import perf.foresight.core.domain.model.RegressionEvent;
import perf.foresight.core.domain.model.RegressionEventType;
import perf.foresight.core.domain.model.RegressionResult;
import perf.foresight.core.feature.FeatureEngineer;
import perf.foresight.core.model.ModelRegistry;
import perf.foresight.core.model.PredictionModel;
import perf.foresight.core.model.PredictionModel.Forecast;
import perf.foresight.core.model.TrainedModelStore;
import perf.foresight.core.port.out.AnalyticsResultSink;
import perf.foresight.core.port.out.PerformanceMonitor;
import perf.foresight.core.prediction.PredictionEnhancer;
import perf.foresight.core.prediction.PredictiveAlertEvaluator;
import perf.foresight.core.store.DataPointStore;
import perf.foresight.error.exception.ModelNotTrainedException;
import perf.foresight.global.executor.LogicExecutor;
import perf.foresight.global.executor.TaskContext;

/**
 * Orchestrates collection, prediction, retraining, detection and baseline refresh.
 *
 * <h3>Tasks</h3>
 *
 * <pre>
 * collect   every collectionInterval        snapshot → features → append
 * predict   every predictionInterval        best model × horizon → sink (+ predictive alerts)
 * retrain   every retrainInterval           fresh models on a history snapshot → publish
 * detect    every detectionInterval         baseline vs. window, per applicable detector
 * baseline  every baselineRefreshInterval   recompute baselines
 * </pre>
 *
 * <p>The tasks share only the data point store, the baseline manager and the model store, each
 * behind its own lock. Each metric's pipeline runs through {@link LogicExecutor} so one
 * metric's failure is logged and skipped without affecting the others.
 *
 * <p>{@link #stop()} is cooperative: it raises a flag every task checks and shuts the scheduler
 * down without interrupting work in progress.
 */
@Slf4j
public class PerformanceAnalyticsEngine {

  private static final String COMPONENT = "Engine";
  private static final Duration STOP_TIMEOUT = Duration.ofSeconds(10);

  private final AnalyticsConfig config;
  private final PerformanceMonitor monitor;
  private final AnalyticsResultSink sink;
  private final LogicExecutor executor;
  private final Clock clock;

  private final DataPointStore store;
  private final FeatureEngineer featureEngineer;
  private final ModelRegistry modelRegistry;
  private final TrainedModelStore models = new TrainedModelStore();
  private final BaselineManager baselineManager;
  private final DetectorRegistry detectorRegistry;
  private final PredictionEnhancer enhancer;
  private final PredictiveAlertEvaluator alertEvaluator;

  private final BoundedHistory<PredictionResult> recentPredictions;
  private final BoundedHistory<RegressionResult> recentDetections;
  private final BoundedHistory<RegressionEvent> regressionHistory;

  /** metric:detector → result that is currently flagged. */
  private final Map<String, RegressionResult> openRegressions = new ConcurrentHashMap<>();

  private final Object lifecycleMonitor = new Object();
  private ScheduledExecutorService scheduler;
  private volatile boolean stopRequested;

  public PerformanceAnalyticsEngine(
      AnalyticsConfig config,
      PerformanceMonitor monitor,
      AnalyticsResultSink sink,
      LogicExecutor executor,
      Clock clock) {
    this.config = Objects.requireNonNull(config, "config").validate();
    this.monitor = Objects.requireNonNull(monitor, "monitor");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.clock = Objects.requireNonNull(clock, "clock");

    this.store = new DataPointStore(config.getMaxDataPoints(), config.getRetentionPeriod(), clock);
    this.featureEngineer = new FeatureEngineer(config.getZoneId());
    this.modelRegistry = new ModelRegistry(config.getSamplingInterval(), clock);
    this.baselineManager = new BaselineManager(config.getMinBaselineSamples(), clock);
    this.detectorRegistry = new DetectorRegistry(config, clock);
    this.enhancer = new PredictionEnhancer(config);
    this.alertEvaluator = new PredictiveAlertEvaluator(config);

    this.recentPredictions = new BoundedHistory<>(config.getHistoryLimit());
    this.recentDetections = new BoundedHistory<>(config.getHistoryLimit());
    this.regressionHistory = new BoundedHistory<>(config.getHistoryLimit());
  }

  // ==================== Lifecycle ====================

  public void start() {
    synchronized (lifecycleMonitor) {
      if (scheduler != null) {
        log.warn("[Engine] Already running");
        return;
      }
      stopRequested = false;
      scheduler = Executors.newScheduledThreadPool(5, threadFactory());

      schedule("Collect", this::collectOnce, Duration.ZERO, config.getCollectionInterval());
      schedule(
          "Predict",
          this::predictOnce,
          config.getPredictionInterval(),
          config.getPredictionInterval());
      if (config.isAutoRetrain()) {
        schedule(
            "Retrain",
            this::retrainModels,
            config.getRetrainInterval(),
            config.getRetrainInterval());
      }
      schedule(
          "Detect", this::detectOnce, config.getDetectionInterval(), config.getDetectionInterval());
      schedule(
          "RefreshBaselines",
          this::refreshBaselines,
          config.getBaselineRefreshInterval(),
          config.getBaselineRefreshInterval());

      log.info(
          "[Engine] Started: collection={}, prediction={}, detection={}, autoRetrain={}",
          config.getCollectionInterval(),
          config.getPredictionInterval(),
          config.getDetectionInterval(),
          config.isAutoRetrain());
    }
  }

  public void stop() {
    ScheduledExecutorService current;
    synchronized (lifecycleMonitor) {
      if (scheduler == null) {
        return;
      }
      stopRequested = true;
      current = scheduler;
      scheduler = null;
    }
    current.shutdown();
    try {
      if (!current.awaitTermination(STOP_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("[Engine] Tasks still running after {}", STOP_TIMEOUT);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("[Engine] Interrupted while waiting for tasks to finish");
    }
    log.info("[Engine] Stopped");
  }

  public boolean isRunning() {
    synchronized (lifecycleMonitor) {
      return scheduler != null;
    }
  }

  private void schedule(String operation, Runnable task, Duration initialDelay, Duration period) {
    TaskContext context = TaskContext.of(COMPONENT, operation);
    scheduler.scheduleWithFixedDelay(
        () -> {
          if (stopRequested) {
            return;
          }
          executor.executeQuietly(task::run, context);
        },
        initialDelay.toMillis(),
        period.toMillis(),
        TimeUnit.MILLISECONDS);
  }

  private static ThreadFactory threadFactory() {
    AtomicInteger sequence = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable, "analytics-engine-" + sequence.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }

  // ==================== Collection ====================

  /**
   * Reads one snapshot and stores it with its features.
   *
   * @return the stored point, or empty when the monitor had no snapshot
   */
  public Optional<PerformanceDataPoint> collectOnce() {
    PerformanceMetrics snapshot = monitor.currentMetrics();
    if (snapshot == null) {
      log.debug("[Engine] No metrics snapshot available, collection skipped");
      return Optional.empty();
    }
    Instant timestamp = snapshot.collectedAt() != null ? snapshot.collectedAt() : clock.instant();
    return Optional.of(store.record(snapshot, timestamp, featureEngineer));
  }

  // ==================== Prediction ====================

  /** Predicts every configured metric × horizon with the best trained model. */
  public List<PredictionResult> predictOnce() {
    Optional<PerformanceDataPoint> latest = store.latest();
    if (latest.isEmpty()) {
      log.debug("[Engine] No data points yet, prediction skipped");
      return List.of();
    }

    List<PredictionResult> results = new ArrayList<>();
    for (MetricType metric : config.getPredictedMetrics()) {
      results.addAll(
          executor.executeOrDefault(
              () -> predictMetric(metric, latest.get()),
              List.of(),
              TaskContext.of(COMPONENT, "Predict", metric.getKey())));
    }
    return results;
  }

  private List<PredictionResult> predictMetric(MetricType metric, PerformanceDataPoint latest) {
    if (!models.hasModels(metric)) {
      List<PerformanceDataPoint> history = store.snapshot();
      if (history.size() < config.getMinRetrainPoints()) {
        log.debug(
            "[Engine] Prediction skipped for {}: {} of {} points",
            metric.getKey(),
            history.size(),
            config.getMinRetrainPoints());
        return List.of();
      }
      trainMetric(metric, history);
    }
    PredictionModel model =
        models.best(metric).orElseThrow(() -> new ModelNotTrainedException(metric.getKey()));

    List<PredictionResult> results = new ArrayList<>();
    for (Duration horizon : config.getPredictionHorizons()) {
      Map<String, Double> features = new HashMap<>(latest.features());
      features.putAll(featureEngineer.seasonalFeatures(latest.timestamp().plus(horizon)));

      Forecast forecast = model.forecast(features, horizon);
      PredictionResult result =
          enhancer.enhance(metric, latest, model, forecast, horizon, clock.instant());
      recentPredictions.add(result);
      sink.onPrediction(result);

      for (PredictionAlert alert : alertEvaluator.evaluate(result)) {
        log.info(
            "[Engine] Predictive alert: {} {} {}",
            alert.metric().getKey(),
            alert.type(),
            alert.severity());
        sink.onPredictiveAlert(alert);
      }
      results.add(result);
    }
    return results;
  }

  // ==================== Training ====================

  /**
   * Trains fresh models of every enabled type on a history snapshot and publishes them.
   *
   * @return number of models published
   */
  public int retrainModels() {
    List<PerformanceDataPoint> history = store.snapshot();
    if (history.size() < config.getMinRetrainPoints()) {
      log.debug(
          "[Engine] Retrain skipped: {} of {} points",
          history.size(),
          config.getMinRetrainPoints());
      return 0;
    }
    int published = 0;
    for (MetricType metric : config.getPredictedMetrics()) {
      published += trainMetric(metric, history).size();
    }
    log.info("[Engine] Retrained {} models on {} points", published, history.size());
    return published;
  }

  private List<PredictionModel> trainMetric(MetricType metric, List<PerformanceDataPoint> history) {
    List<PredictionModel> trained = new ArrayList<>();
    for (ModelType type : config.getEnabledModels()) {
      PredictionModel model = modelRegistry.create(type, metric);
      PredictionModel result =
          executor.executeOrDefault(
              () -> {
                model.train(history);
                return model;
              },
              null,
              TaskContext.of(COMPONENT, "Train", model.name()));
      if (result != null) {
        trained.add(result);
      }
    }
    if (!trained.isEmpty()) {
      models.publish(metric, trained);
    }
    return trained;
  }

  // ==================== Detection ====================

  /** Runs every applicable enabled detector for every monitored metric. */
  public List<RegressionResult> detectOnce() {
    List<RegressionResult> results = new ArrayList<>();
    for (MetricType metric : config.getMonitoredMetrics()) {
      results.addAll(
          executor.executeOrDefault(
              () -> detectMetric(metric),
              List.of(),
              TaskContext.of(COMPONENT, "Detect", metric.getKey())));
    }
    return results;
  }

  private List<RegressionResult> detectMetric(MetricType metric) {
    Optional<PerformanceBaseline> baseline =
        baselineManager.getOrCreate(metric, () -> store.window(config.getBaselineWindow()));
    if (baseline.isEmpty()) {
      log.debug("[Engine] No baseline for {} yet, detection skipped", metric.getKey());
      return List.of();
    }
    List<PerformanceDataPoint> window = store.window(config.getDetectionWindow());

    List<RegressionResult> results = new ArrayList<>();
    for (RegressionDetector detector :
        detectorRegistry.applicable(metric, config.getEnabledDetectors())) {
      RegressionResult result =
          executor.executeOrDefault(
              () -> detector.detect(baseline.get(), window),
              null,
              TaskContext.of(COMPONENT, "Detect", metric.getKey() + ":" + detector.name()));
      if (result != null) {
        record(result);
        results.add(result);
      }
    }
    return results;
  }

  private void record(RegressionResult result) {
    recentDetections.add(result);
    String key = result.metric().getKey() + ":" + result.detector();

    if (result.isFlagged()) {
      sink.onRegression(result);
      if (openRegressions.put(key, result) == null) {
        log.warn(
            "[Engine] Regression detected: {} by {} ({}, {}, change={}%)",
            result.metric().getKey(),
            result.detector(),
            result.type(),
            result.severity(),
            String.format("%.2f", result.changePercent()));
        addRegressionEvent(event(RegressionEventType.DETECTED, result, null, null));
      }
      return;
    }

    RegressionResult resolved = openRegressions.remove(key);
    if (resolved != null) {
      log.info(
          "[Engine] Regression resolved: {} by {}", result.metric().getKey(), result.detector());
      addRegressionEvent(event(RegressionEventType.RESOLVED, resolved, null, null));
    }
  }

  private RegressionEvent event(
      RegressionEventType type, RegressionResult result, String actor, String notes) {
    return RegressionEvent.builder()
        .id(UUID.randomUUID().toString())
        .type(type)
        .metric(result.metric())
        .detector(result.detector())
        .severity(result.severity())
        .timestamp(clock.instant())
        .relatedResultId(result.id())
        .actor(actor)
        .notes(notes)
        .build();
  }

  // ==================== Baselines ====================

  /**
   * Recomputes the baseline of every monitored metric.
   *
   * @return number of baselines that were replaced
   */
  public int refreshBaselines() {
    int refreshed = 0;
    for (MetricType metric : config.getMonitoredMetrics()) {
      boolean updated =
          executor.executeOrDefault(
              () -> updateBaseline(metric).isPresent(),
              false,
              TaskContext.of("BaselineManager", "Refresh", metric.getKey()));
      if (updated) {
        refreshed++;
      }
    }
    return refreshed;
  }

  /** Recomputes one metric's baseline; empty when too few points keep the old one. */
  public Optional<PerformanceBaseline> updateBaseline(MetricType metric) {
    return baselineManager.refreshBaseline(metric, store.window(config.getBaselineWindow()));
  }

  public Optional<PerformanceBaseline> deactivateBaseline(MetricType metric) {
    return baselineManager.deactivate(metric);
  }

  // ==================== Events ====================

  public void addRegressionEvent(RegressionEvent event) {
    regressionHistory.add(Objects.requireNonNull(event, "event"));
    sink.onRegressionEvent(event);
  }

  /**
   * Records an acknowledgement of an earlier event.
   *
   * @return the ACKNOWLEDGED event, or empty when {@code eventId} is not in the history
   */
  public Optional<RegressionEvent> acknowledge(String eventId, String actor, String notes) {
    Optional<RegressionEvent> original = regressionHistory.find(e -> e.id().equals(eventId));
    if (original.isEmpty()) {
      log.debug("[Engine] Acknowledge ignored, unknown event {}", eventId);
      return Optional.empty();
    }
    RegressionEvent source = original.get();
    RegressionEvent acknowledged =
        RegressionEvent.builder()
            .id(UUID.randomUUID().toString())
            .type(RegressionEventType.ACKNOWLEDGED)
            .metric(source.metric())
            .detector(source.detector())
            .severity(source.severity())
            .timestamp(clock.instant())
            .relatedResultId(source.relatedResultId())
            .actor(actor)
            .notes(notes)
            .build();
    addRegressionEvent(acknowledged);
    return Optional.of(acknowledged);
  }

  // ==================== Accessors ====================

  public Optional<PerformanceBaseline> getBaseline(MetricType metric) {
    return baselineManager.getBaseline(metric);
  }

  public Map<MetricType, PerformanceBaseline> getBaselines() {
    return baselineManager.getBaselines();
  }

  public List<RegressionEvent> getRegressionHistory() {
    return regressionHistory.snapshot();
  }

  /** Model name → accuracy of every published model. */
  public Map<String, Double> getPredictionAccuracy() {
    return models.accuracies();
  }

  public List<PerformanceDataPoint> getHistoricalData() {
    return store.snapshot();
  }

  public List<PerformanceDataPoint> getHistoricalData(Duration window) {
    return store.window(window);
  }

  public List<PredictionResult> getRecentPredictions() {
    return recentPredictions.snapshot();
  }

  public List<RegressionResult> getRecentDetections() {
    return recentDetections.snapshot();
  }

  public int getDataPointCount() {
    return store.size();
  }

  public int getBaselineCount() {
    return baselineManager.size();
  }

  public AnalyticsConfig getConfig() {
    return config;
  }
}

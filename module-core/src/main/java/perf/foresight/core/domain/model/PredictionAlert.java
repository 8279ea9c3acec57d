package perf.foresight.core.domain.model;

import java.time.Duration;
import java.time.Instant;
import lombok.Builder;

/** Early warning raised from a prediction before the metric actually degrades. */
@Builder
public record PredictionAlert(
    String id,
    MetricType metric,
    PredictionAlertType type,
    Severity severity,
    String message,
    double predictedValue,
    double threshold,
    Duration horizon,
    double confidence,
    Instant timestamp) {}

package perf.foresight.core.domain.model;

import java.time.Instant;
import lombok.Builder;

/** Append-only audit record of the regression lifecycle. */
@Builder
public record RegressionEvent(
    String id,
    RegressionEventType type,
    MetricType metric,
    String detector,
    Severity severity,
    Instant timestamp,
    String relatedResultId,
    String actor,
    String notes) {}

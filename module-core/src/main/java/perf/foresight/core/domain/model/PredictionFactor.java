package perf.foresight.core.domain.model;

/**
 * Condition that contributed to a prediction.
 *
 * @param impact -1 (pulls the metric towards healthy) .. 1 (pushes it towards unhealthy)
 */
public record PredictionFactor(String name, double impact, double confidence, String description) {}

package perf.foresight.error;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum AnalyticsErrorCode implements ErrorCode {
  // === Data / state conditions ===
  INSUFFICIENT_DATA("A001", "Insufficient data for %s: need at least %d points, got %d", false),
  MODEL_NOT_TRAINED("A002", "Model is not trained: %s", false),
  INACTIVE_BASELINE("A003", "Baseline is not active (metric: %s)", false),
  INVALID_CONFIGURATION("A004", "Invalid analytics configuration: %s", true),
  MODEL_TRAINING_FAILURE("A005", "Model training failed (%s): %s", false),

  // === Internal ===
  INTERNAL_ERROR("S001", "Internal analytics error (%s)", false);

  private final String code;
  private final String message;
  private final boolean fatal;
}

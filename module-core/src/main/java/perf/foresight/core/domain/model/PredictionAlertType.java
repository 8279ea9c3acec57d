package perf.foresight.core.domain.model;

public enum PredictionAlertType {
  THRESHOLD_BREACH,
  TREND_CHANGE
}

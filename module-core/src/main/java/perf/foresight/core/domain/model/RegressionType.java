package perf.foresight.core.domain.model;

public enum RegressionType {
  DEGRADATION,
  IMPROVEMENT,
  ANOMALY,
  NONE
}

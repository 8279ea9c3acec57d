package perf.foresight.core.domain.model;

public enum RegressionEventType {
  DETECTED,
  RESOLVED,
  ACKNOWLEDGED
}

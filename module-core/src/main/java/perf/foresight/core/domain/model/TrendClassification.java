package perf.foresight.core.domain.model;

public enum TrendClassification {
  IMPROVING,
  STABLE,
  DEGRADING
}

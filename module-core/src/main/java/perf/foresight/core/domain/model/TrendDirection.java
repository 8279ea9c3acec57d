package perf.foresight.core.domain.model;

public enum TrendDirection {
  INCREASING,
  DECREASING,
  STABLE
}

package perf.foresight.core.domain.model;

public enum ChangeDirection {
  INCREASE,
  DECREASE,
  STABLE;

  public static ChangeDirection of(double changePercent) {
    if (changePercent > 0) {
      return INCREASE;
    }
    if (changePercent < 0) {
      return DECREASE;
    }
    return STABLE;
  }
}

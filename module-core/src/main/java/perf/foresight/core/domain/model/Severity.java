package perf.foresight.core.domain.model;

public enum Severity {
  LOW,
  MEDIUM,
  HIGH,
  CRITICAL;

  /**
   * Grades a change by how far it overshoots its threshold.
   *
   * @param ratio |change %| / threshold %
   */
  public static Severity fromRatio(double ratio) {
    if (ratio >= 3.0) {
      return CRITICAL;
    }
    if (ratio >= 2.0) {
      return HIGH;
    }
    if (ratio >= 1.5) {
      return MEDIUM;
    }
    return LOW;
  }
}

package perf.foresight.core.domain.model;

/**
 * @param threshold k in {@code mean ± k·σ}
 * @param method detection method name, e.g. {@code "z-score"}
 */
public record OutlierAnalysis(
    int outlierCount,
    double outlierRatio,
    double outlierPercent,
    double threshold,
    String method) {}

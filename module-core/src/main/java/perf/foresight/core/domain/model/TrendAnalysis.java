package perf.foresight.core.domain.model;

/**
 * OLS trend over a detection window.
 *
 * @param strength r² of the fit (0..1)
 */
public record TrendAnalysis(
    TrendDirection direction, double strength, double slope, double rSquared, double pValue) {}

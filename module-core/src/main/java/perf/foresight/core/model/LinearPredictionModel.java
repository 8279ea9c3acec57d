package perf.foresight.core.model;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import perf.foresight.core.domain.model.MetricType;
import perf.foresight.core.domain.model.ModelType;
import perf.foresight.core.domain.model.PerformanceDataPoint;
import perf.foresight.core.feature.FeatureEngineer;
import perf.foresight.core.stat.LinearFit;
import perf.foresight.error.exception.ModelTrainingException;

/**
 * OLS line over the sample index plus a seasonal correction.
 *
 * <p>The seasonal term fits {@code hour_sin}/{@code hour_cos} to the residuals of the line; it
 * is zero when the residuals carry no signal or the training points have no seasonal features.
 *
 * <pre>
 * predict = intercept + slope · (n − 1 + steps) + s · hour_sin + c · hour_cos
 * </pre>
 */
public class LinearPredictionModel extends AbstractPredictionModel {

  public static final int MIN_POINTS = 10;

  private static final double SINGULAR_EPSILON = 1e-12;

  private volatile LinearFit line;
  private volatile double sinCoefficient;
  private volatile double cosCoefficient;

  public LinearPredictionModel(MetricType metric, Duration samplingInterval, Clock clock) {
    super(metric, samplingInterval, clock);
  }

  @Override
  public ModelType type() {
    return ModelType.LINEAR;
  }

  @Override
  public int minimumPoints() {
    return MIN_POINTS;
  }

  public double intercept() {
    return line.intercept();
  }

  public double slope() {
    return line.slope();
  }

  @Override
  protected double[] fit(double[] values, List<PerformanceDataPoint> history) {
    LinearFit line = LinearFit.overIndex(values);
    if (!Double.isFinite(line.slope()) || !Double.isFinite(line.intercept())) {
      throw new ModelTrainingException(name(), "non-finite fit");
    }

    int n = values.length;
    double[] sin = new double[n];
    double[] cos = new double[n];
    double[] residuals = new double[n];
    for (int i = 0; i < n; i++) {
      PerformanceDataPoint point = history.get(i);
      sin[i] = point.feature(FeatureEngineer.HOUR_SIN).orElse(0.0);
      cos[i] = point.feature(FeatureEngineer.HOUR_COS).orElse(0.0);
      residuals[i] = values[i] - line.valueAt(i);
    }
    fitSeasonal(sin, cos, residuals);
    this.line = line;

    double[] fitted = new double[n];
    for (int i = 0; i < n; i++) {
      fitted[i] = line.valueAt(i) + sinCoefficient * sin[i] + cosCoefficient * cos[i];
    }
    return fitted;
  }

  @Override
  protected double extrapolate(Map<String, Double> features, double steps) {
    double trend = line.valueAt(line.n() - 1 + steps);
    double seasonal =
        sinCoefficient * features.getOrDefault(FeatureEngineer.HOUR_SIN, 0.0)
            + cosCoefficient * features.getOrDefault(FeatureEngineer.HOUR_COS, 0.0);
    return trend + seasonal;
  }

  // Least squares of residuals on (sin, cos) without intercept: the residuals are centred.
  private void fitSeasonal(double[] sin, double[] cos, double[] residuals) {
    double ss = 0;
    double sc = 0;
    double cc = 0;
    double sr = 0;
    double cr = 0;
    for (int i = 0; i < residuals.length; i++) {
      ss += sin[i] * sin[i];
      sc += sin[i] * cos[i];
      cc += cos[i] * cos[i];
      sr += sin[i] * residuals[i];
      cr += cos[i] * residuals[i];
    }
    double det = ss * cc - sc * sc;
    if (Math.abs(det) < SINGULAR_EPSILON) {
      // collinear or constant regressors: fall back to whichever single term varies
      sinCoefficient = ss > SINGULAR_EPSILON ? sr / ss : 0.0;
      cosCoefficient = ss <= SINGULAR_EPSILON && cc > SINGULAR_EPSILON ? cr / cc : 0.0;
      return;
    }
    sinCoefficient = (sr * cc - cr * sc) / det;
    cosCoefficient = (cr * ss - sr * sc) / det;
  }
}

package perf.foresight.core.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import lombok.Builder;

@Builder(toBuilder = true)
public record PredictionResult(
    String id,
    MetricType metric,
    double currentValue,
    double predictedValue,
    double confidence,
    Duration horizon,
    String modelUsed,
    Instant timestamp,
    double lowerBound,
    double upperBound,
    double standardDeviation,
    TrendClassification trend,
    double trendStrength,
    boolean seasonal,
    List<PredictionFactor> factors,
    double modelAccuracy,
    Instant modelLastTraining) {

  public PredictionResult {
    factors = factors == null ? List.of() : List.copyOf(factors);
  }
}

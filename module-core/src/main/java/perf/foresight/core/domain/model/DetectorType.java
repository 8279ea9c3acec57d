package perf.foresight.core.domain.model;

import java.util.Arrays;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import perf.foresight.error.exception.InvalidConfigurationException;

@Getter
@RequiredArgsConstructor
public enum DetectorType {
  STATISTICAL("statistical"),
  TREND("trend"),
  THRESHOLD("threshold"),
  ANOMALY("anomaly");

  private final String detectorName;

  public static DetectorType fromName(String name) {
    return Arrays.stream(values())
        .filter(type -> type.detectorName.equalsIgnoreCase(name))
        .findFirst()
        .orElseThrow(
            () -> new InvalidConfigurationException("unknown detector type '" + name + "'"));
  }
}

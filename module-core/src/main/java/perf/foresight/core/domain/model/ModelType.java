package perf.foresight.core.domain.model;

import java.util.Arrays;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import perf.foresight.error.exception.InvalidConfigurationException;

@Getter
@RequiredArgsConstructor
public enum ModelType {
  LINEAR("linear"),
  EXPONENTIAL("exponential"),
  ARIMA("arima"),
  ENSEMBLE("ensemble");

  private final String modelName;

  public static ModelType fromName(String name) {
    return Arrays.stream(values())
        .filter(type -> type.modelName.equalsIgnoreCase(name))
        .findFirst()
        .orElseThrow(() -> new InvalidConfigurationException("unknown model type '" + name + "'"));
  }
}

package perf.foresight.error.exception;

import perf.foresight.error.AnalyticsErrorCode;
import perf.foresight.error.exception.base.ClientBaseException;

/**
 * Unknown metric, model or detector names and degenerate thresholds or intervals.
 *
 * <p>The only fatal condition: thrown while the engine is being assembled it stops startup.
 */
public class InvalidConfigurationException extends ClientBaseException {

  public InvalidConfigurationException(String detail) {
    super(AnalyticsErrorCode.INVALID_CONFIGURATION, detail);
  }
}

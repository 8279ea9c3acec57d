package perf.foresight.error.exception;

import lombok.Getter;
import perf.foresight.error.AnalyticsErrorCode;
import perf.foresight.error.exception.base.ClientBaseException;

/**
 * Raised when a training set, baseline sample or detection window is below the component's
 * minimum size.
 */
@Getter
public class InsufficientDataException extends ClientBaseException {

  private final int required;
  private final int actual;

  public InsufficientDataException(String operation, int required, int actual) {
    super(AnalyticsErrorCode.INSUFFICIENT_DATA, operation, required, actual);
    this.required = required;
    this.actual = actual;
  }
}

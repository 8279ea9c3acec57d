package perf.foresight.error.exception;

import perf.foresight.error.AnalyticsErrorCode;
import perf.foresight.error.exception.base.ClientBaseException;

public class InactiveBaselineException extends ClientBaseException {

  public InactiveBaselineException(String metric) {
    super(AnalyticsErrorCode.INACTIVE_BASELINE, metric);
  }
}

package perf.foresight.error.exception;

import perf.foresight.error.AnalyticsErrorCode;
import perf.foresight.error.exception.base.ServerBaseException;

/** Wraps an unexpected throwable escaping a task run through the LogicExecutor. */
public class InternalSystemException extends ServerBaseException {

  public InternalSystemException(String taskName, Throwable cause) {
    super(AnalyticsErrorCode.INTERNAL_ERROR, cause, taskName);
  }
}

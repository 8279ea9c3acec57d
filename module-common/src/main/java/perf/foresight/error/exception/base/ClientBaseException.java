package perf.foresight.error.exception.base;

import perf.foresight.error.ErrorCode;

/**
 * ClientBaseException: conditions caused by the caller's input or by the current data state
 * (too few points, untrained model, inactive baseline, bad configuration). The message is meant
 * to tell the caller exactly what was missing.
 */
public abstract class ClientBaseException extends BaseException {

  public ClientBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  public ClientBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }
}

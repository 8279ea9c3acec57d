package perf.foresight.error.exception.base;

import perf.foresight.error.ErrorCode;

/**
 * ServerBaseException: internal failures (numerical degeneracy, unexpected runtime errors). Keeps
 * the root cause so the failure can be diagnosed from the log.
 */
public abstract class ServerBaseException extends BaseException {

  public ServerBaseException(ErrorCode errorCode) {
    super(errorCode);
  }

  public ServerBaseException(ErrorCode errorCode, Object... args) {
    super(errorCode, args);
  }

  public ServerBaseException(ErrorCode errorCode, Throwable cause) {
    super(errorCode, cause);
  }

  public ServerBaseException(ErrorCode errorCode, Throwable cause, Object... args) {
    super(errorCode, cause, args);
  }
}

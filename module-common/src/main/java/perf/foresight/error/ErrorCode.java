package perf.foresight.error;

/**
 * Error code contract shared by every analytics exception.
 *
 * <p>{@link #getMessage()} is a {@link String#format(String, Object...)} template; the dynamic
 * arguments are supplied by the exception constructor.
 */
public interface ErrorCode {
  String getCode();

  String getMessage();

  /** Whether the condition should abort startup instead of being skipped for one cycle. */
  boolean isFatal();
}

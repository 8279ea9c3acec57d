package perf.foresight.global.executor.strategy;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import perf.foresight.error.exception.InternalSystemException;
import perf.foresight.error.exception.base.BaseException;
import perf.foresight.global.executor.TaskContext;

/** Translates a task failure into the unchecked exception the executor rethrows. */
@FunctionalInterface
public interface ExceptionTranslator {

  RuntimeException translate(Throwable e, TaskContext context);

  /**
   * Decorator applied by every factory below:
   *
   * <ol>
   *   <li>Error → rethrown immediately
   *   <li>CompletionException/ExecutionException → unwrapped to the cause
   *   <li>BaseException → passed through untouched
   *   <li>anything else → delegated to {@code inner}
   * </ol>
   */
  static ExceptionTranslator withErrorGuardAndUnwrap(ExceptionTranslator inner) {
    return (e, context) -> {
      if (e instanceof Error err) {
        throw err;
      }
      Throwable unwrapped = unwrapAsync(e);
      if (unwrapped instanceof BaseException be) {
        return be;
      }
      return inner.translate(unwrapped, context);
    };
  }

  /** Wraps non-domain failures into {@link InternalSystemException}. */
  static ExceptionTranslator defaultTranslator() {
    return withErrorGuardAndUnwrap(
        (unwrapped, context) -> {
          if (unwrapped instanceof InterruptedException) {
            Thread.currentThread().interrupt();
          }
          return new InternalSystemException(context.toTaskName(), unwrapped);
        });
  }

  private static Throwable unwrapAsync(Throwable e) {
    Throwable current = e;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }
}

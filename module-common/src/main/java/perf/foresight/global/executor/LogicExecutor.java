package perf.foresight.global.executor;

import java.util.function.Function;
import perf.foresight.global.executor.function.ThrowingRunnable;
import perf.foresight.global.executor.function.ThrowingSupplier;

/**
 * Execution template that removes try-catch from analytics code.
 *
 * <h3>Contract</h3>
 *
 * <ul>
 *   <li>{@link Error} is never translated or recovered
 *   <li>{@code execute*} rethrows the translated {@link RuntimeException}
 *   <li>{@code executeOrDefault}/{@code executeOrCatch} log the failure and recover, which is
 *       how one metric's failure is kept from blocking the others
 * </ul>
 *
 * <pre>{@code
 * PredictionResult result = executor.executeOrDefault(
 *     () -> predict(metric, horizon),
 *     null,
 *     TaskContext.of("Engine", "Predict", metric.key()));
 * }</pre>
 */
public interface LogicExecutor {

  <T> T execute(ThrowingSupplier<T> task, TaskContext context);

  <T> T executeOrDefault(ThrowingSupplier<T> task, T defaultValue, TaskContext context);

  <T> T executeOrCatch(
      ThrowingSupplier<T> task, Function<Throwable, T> recovery, TaskContext context);

  void executeVoid(ThrowingRunnable task, TaskContext context);

  /** Runs {@code task} and swallows (logs) any non-Error failure. */
  default void executeQuietly(ThrowingRunnable task, TaskContext context) {
    executeOrDefault(
        () -> {
          task.run();
          return null;
        },
        null,
        context);
  }
}

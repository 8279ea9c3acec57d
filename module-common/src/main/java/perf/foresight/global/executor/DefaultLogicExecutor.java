package perf.foresight.global.executor;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import perf.foresight.error.exception.base.BaseException;
import perf.foresight.error.exception.base.ClientBaseException;
import perf.foresight.global.executor.function.ThrowingRunnable;
import perf.foresight.global.executor.function.ThrowingSupplier;
import perf.foresight.global.executor.strategy.ExceptionTranslator;

/**
 * Default {@link LogicExecutor}.
 *
 * <ul>
 *   <li>Client exceptions (missing data, untrained model) are expected per-cycle conditions and
 *       are logged at DEBUG when recovered
 *   <li>everything else is logged at WARN with the stack trace
 *   <li>an optional failure listener receives every recovered non-client failure
 * </ul>
 */
@Slf4j
public class DefaultLogicExecutor implements LogicExecutor {

  private final ExceptionTranslator translator;
  private final Consumer<TaskContext> failureListener;

  public DefaultLogicExecutor() {
    this(ExceptionTranslator.defaultTranslator(), context -> {});
  }

  public DefaultLogicExecutor(
      ExceptionTranslator translator, Consumer<TaskContext> failureListener) {
    this.translator = Objects.requireNonNull(translator, "translator");
    this.failureListener = Objects.requireNonNull(failureListener, "failureListener");
  }

  @Override
  public <T> T execute(ThrowingSupplier<T> task, TaskContext context) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(context, "context");

    try {
      return task.get();
    } catch (Error e) {
      throw e;
    } catch (Throwable t) {
      throw translator.translate(t, context);
    }
  }

  @Override
  public <T> T executeOrDefault(ThrowingSupplier<T> task, T defaultValue, TaskContext context) {
    return executeOrCatch(task, e -> defaultValue, context);
  }

  @Override
  public <T> T executeOrCatch(
      ThrowingSupplier<T> task, Function<Throwable, T> recovery, TaskContext context) {
    Objects.requireNonNull(task, "task");
    Objects.requireNonNull(recovery, "recovery");
    Objects.requireNonNull(context, "context");

    try {
      return task.get();
    } catch (Error e) {
      throw e;
    } catch (Throwable t) {
      RuntimeException translated = translator.translate(t, context);
      recovered(translated, context);
      return recovery.apply(translated);
    }
  }

  @Override
  public void executeVoid(ThrowingRunnable task, TaskContext context) {
    Objects.requireNonNull(task, "task");
    execute(
        () -> {
          task.run();
          return null;
        },
        context);
  }

  private void recovered(RuntimeException e, TaskContext context) {
    if (e instanceof ClientBaseException) {
      log.debug("[LogicExecutor] {} skipped: {}", context.toTaskName(), e.getMessage());
      return;
    }
    failureListener.accept(context);
    String code = e instanceof BaseException be ? be.getErrorCode().getCode() : "-";
    log.warn(
        "[LogicExecutor] {} failed (code={}): {}",
        context.toTaskName(),
        code,
        e.getMessage(),
        e);
  }
}

package perf.foresight.global.executor.function;

/**
 * Supplier that may throw any {@link Throwable}; run through {@link
 * perf.foresight.global.executor.LogicExecutor} so callers never write their own try-catch.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface ThrowingSupplier<T> {
  T get() throws Throwable;
}

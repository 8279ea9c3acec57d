package perf.foresight.global.executor.function;

/** Void counterpart of {@link ThrowingSupplier}. */
@FunctionalInterface
public interface ThrowingRunnable {
  void run() throws Throwable;
}

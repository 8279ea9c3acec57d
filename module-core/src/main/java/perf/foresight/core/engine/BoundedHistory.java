package perf.foresight.core.engine;

import java.util.ArrayDeque;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/** Synchronized FIFO that drops its oldest entry beyond {@code limit}. */
final class BoundedHistory<T> {

  private final int limit;
  private final ArrayDeque<T> entries = new ArrayDeque<>();

  BoundedHistory(int limit) {
    this.limit = limit;
  }

  synchronized void add(T entry) {
    entries.addLast(entry);
    while (entries.size() > limit) {
      entries.pollFirst();
    }
  }

  synchronized List<T> snapshot() {
    return List.copyOf(entries);
  }

  synchronized Optional<T> find(Predicate<T> predicate) {
    return entries.stream().filter(predicate).findFirst();
  }

  synchronized int size() {
    return entries.size();
  }
}

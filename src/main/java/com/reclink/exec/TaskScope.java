package com.reclink.exec;

import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Map;

/**
 * State of one attempt of one partition task, bound to the worker thread
 * running it. Collects the partial counts of every counter the attempt
 * updates.
 */
final class TaskScope {

  private static final ThreadLocal<TaskScope> CURRENT = new ThreadLocal<>();

  private final Map<MapLongCounter<?>, Map<?, Long>> partials = new IdentityHashMap<>();

  private TaskScope() {}

  static TaskScope begin() {
    TaskScope scope = new TaskScope();
    CURRENT.set(scope);
    return scope;
  }

  /** Scope of the attempt running on this thread, or null outside a task. */
  static TaskScope current() {
    return CURRENT.get();
  }

  static void end() {
    CURRENT.remove();
  }

  @SuppressWarnings("unchecked")
  <K> Map<K, Long> partialOf(MapLongCounter<K> counter) {
    return (Map<K, Long>) partials.computeIfAbsent(counter, c -> new HashMap<K, Long>());
  }

  Map<MapLongCounter<?>, Map<?, Long>> partials() {
    return partials;
  }
}

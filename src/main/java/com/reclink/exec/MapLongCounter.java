package com.reclink.exec;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process {@link DistributedCounter}.
 *
 * <p>Each partition task writes to the partial map of its own attempt. A
 * successful attempt stages its partial under (pass, partition), replacing
 * any earlier attempt of that partition. Staged partials are published only
 * once their pass has cleared the barrier, and the published counts are those
 * of the last completed pass that updated this counter. Passes that never
 * update it leave it untouched.
 */
public final class MapLongCounter<K> implements DistributedCounter<K> {

  private final String name;
  private final ConcurrentHashMap<Long, ConcurrentHashMap<Integer, Map<K, Long>>> staged =
    new ConcurrentHashMap<>();

  // null until a pass has completed
  private volatile Map<K, Long> published;

  MapLongCounter(String name) {
    this.name = name;
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public void add(K key, long amount) {
    TaskScope scope = TaskScope.current();
    if (scope == null) {
      throw new IllegalStateException(
        "counter '" + name + "' updated outside of a partition task"
      );
    }
    scope.partialOf(this).merge(key, amount, Long::sum);
  }

  @Override
  public boolean isReady() {
    return published != null;
  }

  @Override
  public Map<K, Long> value() {
    Map<K, Long> counts = published;
    if (counts == null) {
      throw new IllegalStateException(
        "counter '" + name + "' read before all partitions completed"
      );
    }
    return counts;
  }

  @SuppressWarnings("unchecked")
  void stage(long pass, int partition, Map<?, Long> partial) {
    staged
      .computeIfAbsent(pass, p -> new ConcurrentHashMap<>())
      .put(partition, (Map<K, Long>) partial);
  }

  /** Publishes the staged partials of a pass that cleared the barrier. */
  synchronized void complete(long pass) {
    Map<Integer, Map<K, Long>> partitions = staged.remove(pass);
    Map<K, Long> total = new HashMap<>();
    if (partitions != null) {
      for (Map<K, Long> contribution : partitions.values()) {
        for (Map.Entry<K, Long> e : contribution.entrySet()) {
          total.merge(e.getKey(), e.getValue(), Long::sum);
        }
      }
    }
    published = Collections.unmodifiableMap(total);
  }

  /**
   * Completes a pass that did not update this counter. Only a counter that no
   * pass has published yet becomes readable, with no counts.
   */
  synchronized void completeUntouched() {
    if (published == null) {
      published = Collections.emptyMap();
    }
  }

  void abort(long pass) {
    staged.remove(pass);
  }

  @Override
  public String toString() {
    return "MapLongCounter{" + name + ", ready=" + isReady() + "}";
  }
}

package com.reclink.exec;

import java.util.Map;

/**
 * Key to count aggregator updated independently by every partition task and
 * read once by the coordinator.
 *
 * <p>Partial counts of a partition are merged only when its task completes,
 * and a re-executed partition replaces its earlier contribution, so a retried
 * task is never counted twice. The counts read are those of the last completed
 * pass that updated the counter.
 *
 * @param <K> key type
 */
public interface DistributedCounter<K> {

  String name();

  /** Adds {@code amount} to the count of {@code key}. Only valid inside a partition task. */
  void add(K key, long amount);

  default void increment(K key) {
    add(key, 1L);
  }

  /** True once a pass has completed every partition and published its counts. */
  boolean isReady();

  /**
   * Global counts, summed over every partition.
   *
   * @throws IllegalStateException if no pass updating it has completed yet
   */
  Map<K, Long> value();
}

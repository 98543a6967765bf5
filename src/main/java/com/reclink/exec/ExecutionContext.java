package com.reclink.exec;

import java.io.Serializable;
import java.util.Iterator;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Data-parallel execution over partitioned datasets.
 *
 * <p>Every call blocks until all partitions are done. Counters registered here
 * become readable only after the pass that updated them completed.
 */
public interface ExecutionContext {

  /**
   * @throws com.reclink.CounterRegistrationException if the name is taken
   */
  <K> DistributedCounter<K> registerCounter(String name);

  /** Unregisters a counter so its name can be registered again. */
  void releaseCounter(DistributedCounter<?> counter);

  <T> void foreachPartition(PartitionedDataset<T> data, Consumer<Iterator<T>> fn);

  default <T> void foreach(PartitionedDataset<T> data, Consumer<? super T> fn) {
    foreachPartition(data, it -> it.forEachRemaining(fn));
  }

  /** Applies {@code fn} to every partition; partition {@code i} of the result comes from partition {@code i}. */
  <T, R> PartitionedDataset<R> mapPartitions(
    PartitionedDataset<T> data,
    Function<Iterator<T>, Iterator<R>> fn
  );

  <T extends Serializable> Broadcast<T> broadcast(T value);
}

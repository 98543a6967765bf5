package com.reclink.exec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Immutable collection split into ordered partitions.
 */
public final class PartitionedDataset<T> {

  private final List<List<T>> partitions;

  private PartitionedDataset(List<List<T>> partitions) {
    this.partitions = partitions;
  }

  public static <T> PartitionedDataset<T> of(List<? extends List<T>> partitions) {
    List<List<T>> copy = new ArrayList<>(partitions.size());
    for (List<T> p : partitions) {
      copy.add(Collections.unmodifiableList(new ArrayList<>(p)));
    }
    return new PartitionedDataset<>(Collections.unmodifiableList(copy));
  }

  /** Splits {@code items} into {@code numPartitions} contiguous, nearly equal partitions. */
  public static <T> PartitionedDataset<T> parallelize(List<T> items, int numPartitions) {
    if (numPartitions < 1) {
      throw new IllegalArgumentException("numPartitions must be positive, got " + numPartitions);
    }
    List<List<T>> parts = new ArrayList<>(numPartitions);
    int n = items.size();
    for (int p = 0; p < numPartitions; p++) {
      int from = (int) ((long) n * p / numPartitions);
      int to = (int) ((long) n * (p + 1) / numPartitions);
      parts.add(items.subList(from, to));
    }
    return of(parts);
  }

  public static <T> PartitionedDataset<T> empty() {
    return new PartitionedDataset<>(Collections.emptyList());
  }

  public int numPartitions() {
    return partitions.size();
  }

  public List<T> partition(int index) {
    return partitions.get(index);
  }

  public List<List<T>> partitions() {
    return partitions;
  }

  public long count() {
    long n = 0;
    for (List<T> p : partitions) {
      n += p.size();
    }
    return n;
  }

  public boolean isEmpty() {
    return count() == 0;
  }

  public Optional<T> first() {
    for (List<T> p : partitions) {
      if (!p.isEmpty()) {
        return Optional.of(p.get(0));
      }
    }
    return Optional.empty();
  }

  /** All elements, in partition order. */
  public List<T> collect() {
    List<T> all = new ArrayList<>();
    for (List<T> p : partitions) {
      all.addAll(p);
    }
    return all;
  }
}

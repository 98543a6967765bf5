package com.reclink.exec;

import com.reclink.CounterRegistrationException;
import com.reclink.RecordsIndexException;
import java.io.Closeable;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs partition tasks on a fixed pool of worker threads.
 *
 * <p>A task that fails with an unexpected exception is re-run from the start of
 * its partition, up to {@code maxAttempts} times. {@link RecordsIndexException}s
 * are data errors and fail the pass immediately.
 */
public class LocalExecutionContext implements ExecutionContext, Closeable {

  private static final Logger LOG = LoggerFactory.getLogger(LocalExecutionContext.class);

  private final ExecutorService pool;
  private final int maxAttempts;
  private final Map<String, MapLongCounter<?>> counters = new LinkedHashMap<>();
  private final AtomicLong passes = new AtomicLong();

  public LocalExecutionContext() {
    this(Runtime.getRuntime().availableProcessors(), 2);
  }

  public LocalExecutionContext(int parallelism, int maxAttempts) {
    if (parallelism < 1 || maxAttempts < 1) {
      throw new IllegalArgumentException("parallelism and maxAttempts must be positive");
    }
    this.maxAttempts = maxAttempts;
    this.pool = Executors.newFixedThreadPool(parallelism, new WorkerThreadFactory());
  }

  @Override
  public synchronized <K> DistributedCounter<K> registerCounter(String name) {
    if (counters.containsKey(name)) {
      throw new CounterRegistrationException(name);
    }
    MapLongCounter<K> counter = new MapLongCounter<>(name);
    counters.put(name, counter);
    return counter;
  }

  @Override
  public synchronized void releaseCounter(DistributedCounter<?> counter) {
    counters.remove(counter.name(), counter);
  }

  @Override
  public <T> void foreachPartition(PartitionedDataset<T> data, Consumer<Iterator<T>> fn) {
    runPartitions(
      data,
      partition -> {
        fn.accept(partition.iterator());
        return null;
      }
    );
  }

  @Override
  public <T, R> PartitionedDataset<R> mapPartitions(
    PartitionedDataset<T> data,
    Function<Iterator<T>, Iterator<R>> fn
  ) {
    List<List<R>> out = runPartitions(
      data,
      partition -> {
        List<R> result = new ArrayList<>(partition.size());
        fn.apply(partition.iterator()).forEachRemaining(result::add);
        return result;
      }
    );
    return PartitionedDataset.of(out);
  }

  @Override
  public <T extends Serializable> Broadcast<T> broadcast(T value) {
    return new LocalBroadcast<>(value);
  }

  private <T, R> List<R> runPartitions(
    PartitionedDataset<T> data,
    Function<List<T>, R> task
  ) {
    long pass = passes.incrementAndGet();
    List<MapLongCounter<?>> unpublished = new ArrayList<>();
    synchronized (this) {
      for (MapLongCounter<?> counter : counters.values()) {
        if (!counter.isReady()) {
          unpublished.add(counter);
        }
      }
    }
    Set<MapLongCounter<?>> updated = ConcurrentHashMap.newKeySet();

    List<Future<R>> futures = new ArrayList<>(data.numPartitions());
    for (int p = 0; p < data.numPartitions(); p++) {
      final int partition = p;
      futures.add(pool.submit(() -> runWithRetry(pass, partition, data.partition(partition), task, updated)));
    }

    // Barrier: counters are published only when every partition succeeded
    List<R> results = new ArrayList<>(futures.size());
    RuntimeException failure = null;
    for (Future<R> future : futures) {
      try {
        results.add(future.get());
      } catch (ExecutionException e) {
        if (failure == null) {
          failure = e.getCause() instanceof RuntimeException
            ? (RuntimeException) e.getCause()
            : new IllegalStateException("partition task failed", e.getCause());
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        futures.forEach(f -> f.cancel(true));
        updated.forEach(counter -> counter.abort(pass));
        throw new IllegalStateException("interrupted while waiting for partition tasks", e);
      }
    }
    if (failure != null) {
      updated.forEach(counter -> counter.abort(pass));
      throw failure;
    }
    for (MapLongCounter<?> counter : updated) {
      counter.complete(pass);
    }
    for (MapLongCounter<?> counter : unpublished) {
      if (!updated.contains(counter)) {
        counter.completeUntouched();
      }
    }
    return results;
  }

  private <T, R> R runWithRetry(
    long pass,
    int partition,
    List<T> rows,
    Function<List<T>, R> task,
    Set<MapLongCounter<?>> updated
  ) {
    int attempt = 1;
    while (true) {
      TaskScope scope = TaskScope.begin();
      try {
        R result = task.apply(rows);
        for (Map.Entry<MapLongCounter<?>, Map<?, Long>> e : scope.partials().entrySet()) {
          e.getKey().stage(pass, partition, e.getValue());
          updated.add(e.getKey());
        }
        return result;
      } catch (RecordsIndexException e) {
        throw e;
      } catch (RuntimeException e) {
        if (attempt >= maxAttempts) {
          throw e;
        }
        LOG.warn("Partition {} failed on attempt {}/{}, retrying", partition, attempt, maxAttempts, e);
        attempt++;
      } finally {
        TaskScope.end();
      }
    }
  }

  @Override
  public void close() {
    pool.shutdown();
    try {
      if (!pool.awaitTermination(30, TimeUnit.SECONDS)) {
        pool.shutdownNow();
      }
    } catch (InterruptedException e) {
      pool.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private static final class WorkerThreadFactory implements ThreadFactory {

    private final AtomicInteger next = new AtomicInteger();

    @Override
    public Thread newThread(Runnable r) {
      Thread t = new Thread(r, "reclink-worker-" + next.getAndIncrement());
      t.setDaemon(true);
      return t;
    }
  }
}

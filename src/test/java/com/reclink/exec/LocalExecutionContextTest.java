package com.reclink.exec;

import static org.junit.jupiter.api.Assertions.*;

import com.reclink.CounterRegistrationException;
import com.reclink.SchemaMismatchException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class LocalExecutionContextTest {

  private LocalExecutionContext ctx;

  @BeforeEach
  void setUp() {
    ctx = new LocalExecutionContext(3, 3);
  }

  @AfterEach
  void tearDown() {
    ctx.close();
  }

  private static List<String> words() {
    List<String> words = new ArrayList<>();
    for (int i = 0; i < 1000; i++) {
      words.add("w" + (i % 7));
    }
    return words;
  }

  // ----------------------------
  // Counters
  // ----------------------------

  @Test
  void countsAreSummedOverPartitions() {
    DistributedCounter<String> counter = ctx.registerCounter("words");
    ctx.foreach(PartitionedDataset.parallelize(words(), 6), counter::increment);

    Map<String, Long> counts = counter.value();
    assertEquals(7, counts.size());
    long total = 0;
    for (long c : counts.values()) total += c;
    assertEquals(1000, total);
    assertEquals(143L, counts.get("w0"));
  }

  @Test
  void countsDoNotDependOnPartitioning() {
    DistributedCounter<String> a = ctx.registerCounter("a");
    ctx.foreach(PartitionedDataset.parallelize(words(), 1), a::increment);
    Map<String, Long> one = a.value();
    ctx.releaseCounter(a);

    DistributedCounter<String> b = ctx.registerCounter("b");
    ctx.foreach(PartitionedDataset.parallelize(words(), 17), b::increment);
    assertEquals(one, b.value());
  }

  @Test
  void retriedPartitionIsNotCountedTwice() {
    DistributedCounter<String> counter = ctx.registerCounter("words");
    Map<Integer, AtomicInteger> attempts = new ConcurrentHashMap<>();
    PartitionedDataset<String> data = PartitionedDataset.of(
      Arrays.asList(Arrays.asList("a", "b", "c"), Arrays.asList("a", "a"))
    );

    ctx.foreachPartition(
      data,
      it -> {
        List<String> seen = new ArrayList<>();
        while (it.hasNext()) {
          String w = it.next();
          seen.add(w);
          counter.increment(w);
        }
        // The first attempt of the first partition fails after counting
        if (seen.get(0).equals("a") && seen.size() == 3
          && attempts.computeIfAbsent(0, k -> new AtomicInteger()).getAndIncrement() == 0) {
          throw new RuntimeException("transient failure");
        }
      }
    );

    assertEquals(2, attempts.get(0).get());
    assertEquals(Map.of("a", 3L, "b", 1L, "c", 1L), counter.value());
  }

  @Test
  void exhaustedRetriesFailThePass() {
    DistributedCounter<String> counter = ctx.registerCounter("words");
    AtomicInteger attempts = new AtomicInteger();
    RuntimeException e = assertThrows(
      RuntimeException.class,
      () -> ctx.foreachPartition(
        PartitionedDataset.of(Collections.singletonList(Arrays.asList("x"))),
        it -> {
          it.forEachRemaining(counter::increment);
          attempts.incrementAndGet();
          throw new RuntimeException("always");
        }
      )
    );
    assertEquals("always", e.getMessage());
    assertEquals(3, attempts.get());
    assertFalse(counter.isReady());
    assertThrows(IllegalStateException.class, counter::value);
  }

  @Test
  void dataErrorsAreNotRetried() {
    AtomicInteger attempts = new AtomicInteger();
    assertThrows(
      SchemaMismatchException.class,
      () -> ctx.foreachPartition(
        PartitionedDataset.of(Collections.singletonList(Arrays.asList("x"))),
        it -> {
          attempts.incrementAndGet();
          throw new SchemaMismatchException("r1", 2, 1);
        }
      )
    );
    assertEquals(1, attempts.get());
  }

  @Test
  void counterIsReadableOnlyAfterThePass() {
    DistributedCounter<String> counter = ctx.registerCounter("words");
    assertFalse(counter.isReady());
    assertThrows(IllegalStateException.class, counter::value);
    assertThrows(IllegalStateException.class, () -> counter.add("x", 1));

    ctx.foreach(PartitionedDataset.parallelize(Arrays.asList("x"), 1), counter::increment);
    assertTrue(counter.isReady());
    assertEquals(Map.of("x", 1L), counter.value());
  }

  @Test
  void duplicateCounterNamesAreRejected() {
    DistributedCounter<String> first = ctx.registerCounter("words");
    assertThrows(CounterRegistrationException.class, () -> ctx.registerCounter("words"));
    ctx.releaseCounter(first);
    assertNotNull(ctx.registerCounter("words"));
  }

  @Test
  void passesThatDoNotUpdateACounterLeaveItAlone() {
    DistributedCounter<String> counter = ctx.registerCounter("letters");
    ctx.foreach(PartitionedDataset.parallelize(Arrays.asList("a", "b", "a", "c"), 4), counter::increment);
    Map<String, Long> expected = Map.of("a", 2L, "b", 1L, "c", 1L);
    assertEquals(expected, counter.value());

    DistributedCounter<String> other = ctx.registerCounter("other");
    ctx.foreach(PartitionedDataset.parallelize(Arrays.asList("z", "z"), 2), other::increment);
    ctx.mapPartitions(PartitionedDataset.parallelize(words(), 5), it -> it);
    ctx.foreachPartition(PartitionedDataset.parallelize(words(), 3), it -> it.forEachRemaining(w -> {}));

    assertEquals(expected, counter.value());
    assertEquals(Map.of("z", 2L), other.value());
  }

  @Test
  void laterPassReplacesEarlierCounts() {
    DistributedCounter<String> counter = ctx.registerCounter("letters");
    ctx.foreach(PartitionedDataset.parallelize(Arrays.asList("a", "b", "c", "d"), 4), counter::increment);
    ctx.foreach(PartitionedDataset.parallelize(Arrays.asList("x", "y"), 2), counter::increment);
    assertEquals(Map.of("x", 1L, "y", 1L), counter.value());
  }

  @Test
  void failedPassKeepsThePreviousCounts() {
    DistributedCounter<String> counter = ctx.registerCounter("letters");
    ctx.foreach(PartitionedDataset.parallelize(Arrays.asList("a", "b"), 2), counter::increment);

    assertThrows(
      SchemaMismatchException.class,
      () -> ctx.foreach(
        PartitionedDataset.parallelize(Arrays.asList("x", "bad", "y"), 3),
        w -> {
          if (w.equals("bad")) {
            throw new SchemaMismatchException("r1", 2, 1);
          }
          counter.increment(w);
        }
      )
    );
    assertEquals(Map.of("a", 1L, "b", 1L), counter.value());
  }

  @Test
  void emptyPassMakesAFreshCounterReadable() {
    DistributedCounter<String> counter = ctx.registerCounter("letters");
    ctx.foreach(PartitionedDataset.<String>empty(), counter::increment);
    assertTrue(counter.isReady());
    assertEquals(Collections.emptyMap(), counter.value());
  }

  @Test
  void concurrentPassesKeepTheirCountsApart() throws Exception {
    DistributedCounter<String> left = ctx.registerCounter("left");
    DistributedCounter<String> right = ctx.registerCounter("right");
    List<String> many = new ArrayList<>();
    for (int i = 0; i < 20_000; i++) {
      many.add("k" + (i % 5));
    }

    Thread other = new Thread(() -> ctx.foreach(PartitionedDataset.parallelize(many, 11), right::increment));
    other.start();
    ctx.foreach(PartitionedDataset.parallelize(words(), 13), left::increment);
    other.join();

    assertEquals(7, left.value().size());
    assertEquals(143L, left.value().get("w0"));
    assertEquals(5, right.value().size());
    for (long c : right.value().values()) {
      assertEquals(4000L, c);
    }
  }

  // ----------------------------
  // mapPartitions / broadcast
  // ----------------------------

  @Test
  void mapPartitionsKeepsPartitionOrder() {
    PartitionedDataset<Integer> data = PartitionedDataset.parallelize(Arrays.asList(1, 2, 3, 4, 5, 6, 7), 3);
    PartitionedDataset<Integer> squared = ctx.mapPartitions(
      data,
      it -> {
        List<Integer> out = new ArrayList<>();
        it.forEachRemaining(x -> out.add(x * x));
        return out.iterator();
      }
    );
    assertEquals(3, squared.numPartitions());
    assertEquals(Arrays.asList(1, 4, 9, 16, 25, 36, 49), squared.collect());
    for (int p = 0; p < 3; p++) {
      assertEquals(data.partition(p).size(), squared.partition(p).size());
    }
  }

  @Test
  void broadcastGivesEachWorkerItsOwnCopy() {
    ArrayList<String> value = new ArrayList<>(Arrays.asList("a", "b"));
    Broadcast<ArrayList<String>> broadcast = ctx.broadcast(value);
    Map<Integer, Integer> identities = new ConcurrentHashMap<>();

    ctx.foreachPartition(
      PartitionedDataset.parallelize(Arrays.asList(0, 1, 2, 3, 4, 5), 6),
      it -> {
        ArrayList<String> copy = broadcast.value();
        assertEquals(Arrays.asList("a", "b"), copy);
        identities.put(it.next(), System.identityHashCode(copy));
      }
    );
    assertNotSame(value, broadcast.value());
    // 3 worker threads at most
    assertTrue(identities.values().stream().distinct().count() <= 3);
    broadcast.destroy();
  }

  @Test
  void destroyDropsEveryWorkerCopy() {
    Broadcast<ArrayList<String>> broadcast = ctx.broadcast(new ArrayList<>(Arrays.asList("a")));
    ctx.foreachPartition(
      PartitionedDataset.parallelize(Arrays.asList(0, 1, 2, 3, 4, 5), 6),
      it -> assertEquals(1, broadcast.value().size())
    );
    LocalBroadcast<ArrayList<String>> local = (LocalBroadcast<ArrayList<String>>) broadcast;
    assertTrue(local.numCopies() >= 1);

    broadcast.destroy();
    assertEquals(0, local.numCopies());
    assertThrows(IllegalStateException.class, broadcast::value);
  }
}

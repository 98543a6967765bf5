package com.reclink;

import static org.junit.jupiter.api.Assertions.*;

import com.reclink.exec.Broadcast;
import com.reclink.exec.DistributedCounter;
import com.reclink.exec.LocalExecutionContext;
import com.reclink.exec.PartitionedDataset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import org.apache.commons.math3.random.MersenneTwister;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class RecordsCacheTest {

  private LocalExecutionContext ctx;

  @BeforeEach
  void setUp() {
    ctx = new LocalExecutionContext(4, 2);
  }

  @AfterEach
  void tearDown() {
    ctx.close();
  }

  private static Attribute attribute(String name) {
    return new Attribute(name, new ConstantSimilarityFn(), new BetaShapeParameters(1.0, 99.0));
  }

  private static List<Record<String>> sampleRecords() {
    return Arrays.asList(
      Record.of("r1", "f1", "ann"),
      Record.of("r2", "f1", "bob"),
      Record.of("r3", "f2", "ann")
    );
  }

  /** Random records over a few files and small value domains. */
  private static List<Record<String>> randomRecords(int n, long seed) {
    Random random = new Random(seed);
    String[] names = {"ann", "bob", "cat", "dan", "eve", "fay"};
    String[] years = {"1970", "1971", "1980", "1990"};
    List<Record<String>> records = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      records.add(
        Record.of(
          "r" + i,
          "f" + random.nextInt(3),
          names[random.nextInt(names.length)],
          years[random.nextInt(years.length)]
        )
      );
    }
    return records;
  }

  private static final List<Attribute> NAME_ONLY = Collections.singletonList(attribute("name"));
  private static final List<Attribute> NAME_YEAR = Arrays.asList(attribute("name"), attribute("year"));

  // ----------------------------
  // Build
  // ----------------------------

  @Test
  void buildsCacheForThreeRecordsInTwoFiles() {
    PartitionedDataset<Record<String>> records = PartitionedDataset.parallelize(sampleRecords(), 2);
    List<String> messages = new ArrayList<>();

    RecordsCache cache = RecordsCache.build(records, NAME_ONLY, 5, ctx, messages::add);

    assertEquals(3, cache.numRecords());
    assertEquals(1, cache.numAttributes());
    assertEquals(Map.of("f1", 2L, "f2", 1L), cache.getFileSizes());

    AttributeIndex index = cache.getIndexedAttribute(0).getIndex();
    assertEquals(2, index.domainSize());
    assertEquals(2, index.countOf(index.idOf("ann")));
    assertEquals(1, index.countOf(index.idOf("bob")));
    assertEquals(5, index.maxClusterSize());

    assertTrue(messages.contains("Gathering statistics from source data files."));
    assertTrue(messages.contains("Finished gathering statistics from 3 records across 2 file(s)."));
    assertTrue(messages.contains("Indexing attribute 'name'."));

    PartitionedDataset<Record<Integer>> coded = cache.transformRecords(records, ctx);
    List<Record<Integer>> out = coded.collect();
    assertEquals(3, out.size());
    assertEquals("ann", index.valueOf(out.get(0).getValue(0)));
    assertEquals("bob", index.valueOf(out.get(1).getValue(0)));
    assertEquals("ann", index.valueOf(out.get(2).getValue(0)));
    assertEquals(out.get(0).getValue(0), out.get(2).getValue(0));
    assertEquals("r2", out.get(1).getId());
    assertEquals("f2", out.get(2).getFileId());
  }

  @Test
  void attributeCountAndFileSizesAreConsistent() {
    List<Record<String>> raw = randomRecords(500, 11L);
    RecordsCache cache = RecordsCache.build(PartitionedDataset.parallelize(raw, 7), NAME_YEAR, 3, ctx);

    assertEquals(2, cache.numAttributes());
    assertEquals(500, cache.numRecords());
    long sum = 0;
    for (long size : cache.getFileSizes().values()) sum += size;
    assertEquals(cache.numRecords(), sum);

    for (IndexedAttribute attribute : cache.getIndexedAttributes()) {
      assertEquals(500, attribute.getIndex().totalCount());
    }
    assertEquals("name", cache.getIndexedAttribute(0).getName());
    assertEquals("year", cache.getIndexedAttribute(1).getName());
    assertEquals(Arrays.asList(new BetaShapeParameters(1.0, 99.0), new BetaShapeParameters(1.0, 99.0)),
      cache.distortionPriors());
  }

  @Test
  void idsAreIdenticalAcrossBuildsAndPartitionings() {
    List<Record<String>> raw = randomRecords(300, 5L);
    RecordsCache a = RecordsCache.build(PartitionedDataset.parallelize(raw, 1), NAME_YEAR, 2, ctx);

    List<Record<String>> shuffled = new ArrayList<>(raw);
    Collections.shuffle(shuffled, new Random(99L));
    RecordsCache b = RecordsCache.build(PartitionedDataset.parallelize(shuffled, 9), NAME_YEAR, 2, ctx);

    for (int i = 0; i < 2; i++) {
      assertEquals(
        a.getIndexedAttribute(i).getIndex().values(),
        b.getIndexedAttribute(i).getIndex().values()
      );
    }

    List<Record<Integer>> one = a.transformRecords(PartitionedDataset.parallelize(raw, 1), ctx).collect();
    List<Record<Integer>> many = b.transformRecords(PartitionedDataset.parallelize(raw, 13), ctx).collect();
    assertEquals(one, many);
  }

  @Test
  void schemaMismatchFailsBeforeAnyWork() {
    PartitionedDataset<Record<String>> records = PartitionedDataset.parallelize(sampleRecords(), 2);
    SchemaMismatchException e = assertThrows(
      SchemaMismatchException.class,
      () -> RecordsCache.build(records, NAME_YEAR, 1, ctx)
    );
    assertEquals("r1", e.getRecordId());
    assertEquals(2, e.getExpected());
    assertEquals(1, e.getActual());
  }

  @Test
  void schemaMismatchInLaterRecordAbortsThePass() {
    List<Record<String>> raw = new ArrayList<>(sampleRecords());
    raw.add(Record.of("bad", "f2", "ann", "extra"));
    SchemaMismatchException e = assertThrows(
      SchemaMismatchException.class,
      () -> RecordsCache.build(PartitionedDataset.parallelize(raw, 2), NAME_ONLY, 1, ctx)
    );
    assertEquals("bad", e.getRecordId());

    // Counters were released, a new build on the same context works
    RecordsCache cache = RecordsCache.build(PartitionedDataset.parallelize(sampleRecords(), 2), NAME_ONLY, 1, ctx);
    assertEquals(3, cache.numRecords());
  }

  @Test
  void emptyCollectionHasEmptyDomains() {
    assertThrows(
      EmptyDomainException.class,
      () -> RecordsCache.build(PartitionedDataset.<Record<String>>empty(), NAME_ONLY, 1, ctx)
    );
  }

  @Test
  void duplicateAttributeNamesConflict() {
    List<Attribute> twice = Arrays.asList(attribute("name"), attribute("name"));
    List<Record<String>> raw = Collections.singletonList(Record.of("r1", "f1", "ann", "ann"));
    assertThrows(
      CounterRegistrationException.class,
      () -> RecordsCache.build(PartitionedDataset.parallelize(raw, 1), twice, 1, ctx)
    );
  }

  // ----------------------------
  // Transform
  // ----------------------------

  @Test
  void transformingNothingYieldsNothing() {
    RecordsCache cache = RecordsCache.build(PartitionedDataset.parallelize(sampleRecords(), 2), NAME_ONLY, 1, ctx);
    PartitionedDataset<Record<Integer>> out = cache.transformRecords(PartitionedDataset.empty(), ctx);
    assertTrue(out.isEmpty());

    PartitionedDataset<Record<Integer>> emptyParts = cache.transformRecords(
      PartitionedDataset.of(Arrays.asList(Collections.<Record<String>>emptyList(), Collections.<Record<String>>emptyList())),
      ctx
    );
    assertEquals(2, emptyParts.numPartitions());
    assertEquals(0, emptyParts.count());
  }

  @Test
  void unseenValueFailsTheTransformation() {
    RecordsCache cache = RecordsCache.build(PartitionedDataset.parallelize(sampleRecords(), 2), NAME_ONLY, 1, ctx);
    List<Record<String>> fresh = Arrays.asList(Record.of("r1", "f1", "ann"), Record.of("r9", "f3", "zoe"));
    UnseenValueException e = assertThrows(
      UnseenValueException.class,
      () -> cache.transformRecords(PartitionedDataset.parallelize(fresh, 2), ctx)
    );
    assertEquals("zoe", e.getValue());
    assertEquals("r9", e.getRecordId());
    assertEquals("name", e.getAttribute());
  }

  @Test
  void transformPreservesPartitioning() {
    RecordsCache cache = RecordsCache.build(PartitionedDataset.parallelize(randomRecords(50, 3L), 3), NAME_YEAR, 1, ctx);
    PartitionedDataset<Record<String>> raw = PartitionedDataset.parallelize(randomRecords(50, 3L), 4);
    PartitionedDataset<Record<Integer>> coded = cache.transformRecords(raw, ctx);
    assertEquals(4, coded.numPartitions());
    for (int p = 0; p < 4; p++) {
      assertEquals(raw.partition(p).size(), coded.partition(p).size());
    }
  }

  @Test
  void buildLeavesOtherCountersOfTheContextIntact() {
    DistributedCounter<String> letters = ctx.registerCounter("letters");
    ctx.foreach(PartitionedDataset.parallelize(Arrays.asList("a", "b", "a", "c"), 2), letters::increment);

    RecordsCache cache = RecordsCache.build(
      PartitionedDataset.parallelize(sampleRecords(), 3),
      NAME_ONLY,
      2,
      ctx,
      StatusListener.silent()
    );
    cache.transformRecords(PartitionedDataset.parallelize(sampleRecords(), 2), ctx);

    assertEquals(Map.of("a", 2L, "b", 1L, "c", 1L), letters.value());
    assertEquals(3, cache.numRecords());
  }

  // ----------------------------
  // Replication
  // ----------------------------

  @Test
  void broadcastCopiesHaveTheirOwnGenerators() throws Exception {
    RecordsCache cache = RecordsCache.build(PartitionedDataset.parallelize(randomRecords(100, 8L), 2), NAME_YEAR, 2, ctx);
    Broadcast<RecordsCache> broadcast = ctx.broadcast(cache);

    RecordsCache local = broadcast.value();
    assertNotSame(cache, local);
    local.setGenerator(new MersenneTwister(1L));

    RecordsCache[] other = new RecordsCache[1];
    Thread worker = new Thread(() -> other[0] = broadcast.value());
    worker.start();
    worker.join();

    assertNotSame(local, other[0]);
    assertNull(other[0].getIndexedAttribute(0).getIndex().getGenerator());
    assertNotNull(local.getIndexedAttribute(0).getIndex().getGenerator());
    for (int i = 0; i < cache.numAttributes(); i++) {
      assertEquals(
        cache.getIndexedAttribute(i).getIndex().values(),
        other[0].getIndexedAttribute(i).getIndex().values()
      );
    }
    broadcast.destroy();
    assertThrows(IllegalStateException.class, broadcast::value);
  }
}

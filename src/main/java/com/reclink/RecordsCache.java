package com.reclink;

import com.reclink.exec.Broadcast;
import com.reclink.exec.DistributedCounter;
import com.reclink.exec.ExecutionContext;
import com.reclink.exec.PartitionedDataset;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * Statistics and attribute indexes for a collection of records.
 *
 * Built once on the coordinator in a single pass over the records, then
 * broadcast to every worker. Apart from the per-copy random generators it is
 * immutable.
 */
public final class RecordsCache implements Serializable {

  private static final long serialVersionUID = 1L;

  private final List<IndexedAttribute> indexedAttributes;
  private final Map<String, Long> fileSizes;
  private final long numRecords;

  /**
   * @param indexedAttributes indexes for the attributes, in record value order
   * @param fileSizes number of records in each file
   */
  public RecordsCache(List<IndexedAttribute> indexedAttributes, Map<String, Long> fileSizes) {
    long total = 0;
    for (Map.Entry<String, Long> e : fileSizes.entrySet()) {
      if (e.getValue() < 0) {
        throw new IllegalArgumentException(
          "negative size " + e.getValue() + " for file '" + e.getKey() + "'"
        );
      }
      total += e.getValue();
    }
    this.indexedAttributes = Collections.unmodifiableList(new ArrayList<>(indexedAttributes));
    this.fileSizes = Collections.unmodifiableMap(new TreeMap<>(fileSizes));
    this.numRecords = total;
  }

  /**
   * Builds a cache, logging progress through SLF4J.
   *
   * @see #build(PartitionedDataset, List, int, ExecutionContext, StatusListener)
   */
  public static RecordsCache build(
    PartitionedDataset<Record<String>> records,
    List<Attribute> attributeSpecs,
    int expectedMaxClusterSize,
    ExecutionContext ctx
  ) {
    return build(
      records,
      attributeSpecs,
      expectedMaxClusterSize,
      ctx,
      StatusListener.logTo(RecordsCache.class)
    );
  }

  /**
   * Gathers file sizes and value counts in one pass over the records, then
   * indexes every attribute.
   *
   * @param records raw records
   * @param attributeSpecs attribute specifications, in record value order
   * @param expectedMaxClusterSize largest expected cluster size, bounds the
   *                               proposals precomputed by each index
   * @param ctx execution substrate running the pass
   * @param status receives progress messages
   * @throws SchemaMismatchException if a record does not have one value per attribute
   * @throws EmptyDomainException if there are no records
   * @throws CounterRegistrationException if two attributes share a name
   */
  public static RecordsCache build(
    PartitionedDataset<Record<String>> records,
    List<Attribute> attributeSpecs,
    int expectedMaxClusterSize,
    ExecutionContext ctx,
    StatusListener status
  ) {
    if (attributeSpecs.isEmpty()) {
      throw new IllegalArgumentException("at least one attribute is required");
    }
    if (expectedMaxClusterSize < 0) {
      throw new IllegalArgumentException("expectedMaxClusterSize must be non-negative");
    }
    final int numAttributes = attributeSpecs.size();
    Record<String> firstRecord = records
      .first()
      .orElseThrow(() -> new EmptyDomainException(attributeSpecs.get(0).getName()));
    if (firstRecord.numValues() != numAttributes) {
      throw new SchemaMismatchException(firstRecord.getId(), numAttributes, firstRecord.numValues());
    }

    List<DistributedCounter<?>> registered = new ArrayList<>();
    try {
      DistributedCounter<String> fileSizesCounter = ctx.registerCounter("number of records per file");
      registered.add(fileSizesCounter);
      List<DistributedCounter<String>> valueCounters = new ArrayList<>(numAttributes);
      for (Attribute attribute : attributeSpecs) {
        DistributedCounter<String> counter = ctx.registerCounter(
          "value counts for attribute " + attribute.getName() + "."
        );
        registered.add(counter);
        valueCounters.add(counter);
      }

      status.emit("Gathering statistics from source data files.");
      ctx.foreach(
        records,
        record -> {
          if (record.numValues() != numAttributes) {
            throw new SchemaMismatchException(record.getId(), numAttributes, record.numValues());
          }
          fileSizesCounter.increment(record.getFileId());
          for (int i = 0; i < numAttributes; i++) {
            valueCounters.get(i).increment(record.getValue(i));
          }
        }
      );

      Map<String, Long> fileSizes = fileSizesCounter.value();
      long total = 0;
      for (long size : fileSizes.values()) {
        total += size;
      }
      status.emit(
        String.format(
          "Finished gathering statistics from %d records across %d file(s).",
          total,
          fileSizes.size()
        )
      );

      List<Map<String, Long>> valueCounts = new ArrayList<>(numAttributes);
      for (DistributedCounter<String> counter : valueCounters) {
        valueCounts.add(counter.value());
      }
      return assemble(attributeSpecs, valueCounts, fileSizes, expectedMaxClusterSize, status);
    } finally {
      registered.forEach(ctx::releaseCounter);
    }
  }

  /**
   * Builds the cache from counts that were already gathered.
   *
   * @param valueCounts value counts of each attribute, in attribute order
   */
  public static RecordsCache assemble(
    List<Attribute> attributeSpecs,
    List<Map<String, Long>> valueCounts,
    Map<String, Long> fileSizes,
    int expectedMaxClusterSize,
    StatusListener status
  ) {
    if (valueCounts.size() != attributeSpecs.size()) {
      throw new IllegalArgumentException(
        "got value counts for " + valueCounts.size() + " attribute(s), expected " + attributeSpecs.size()
      );
    }
    List<IndexedAttribute> indexedAttributes = new ArrayList<>(attributeSpecs.size());
    for (int attrId = 0; attrId < attributeSpecs.size(); attrId++) {
      Attribute attribute = attributeSpecs.get(attrId);
      status.emit("Indexing attribute '" + attribute.getName() + "'.");
      AttributeIndex index = AttributeIndex.build(
        attribute.getName(),
        valueCounts.get(attrId),
        attribute.getSimilarityFn(),
        expectedMaxClusterSize
      );
      indexedAttributes.add(new IndexedAttribute(attribute, index));
    }
    return new RecordsCache(indexedAttributes, fileSizes);
  }

  public List<IndexedAttribute> getIndexedAttributes() {
    return indexedAttributes;
  }

  public IndexedAttribute getIndexedAttribute(int attrId) {
    return indexedAttributes.get(attrId);
  }

  /** Number of records in each file, keyed by file id */
  public Map<String, Long> getFileSizes() {
    return fileSizes;
  }

  /** Number of records across all files */
  public long numRecords() {
    return numRecords;
  }

  /** Number of attributes used for matching */
  public int numAttributes() {
    return indexedAttributes.size();
  }

  public List<BetaShapeParameters> distortionPriors() {
    List<BetaShapeParameters> priors = new ArrayList<>(indexedAttributes.size());
    for (IndexedAttribute attribute : indexedAttributes) {
      priors.add(attribute.getDistortionPrior());
    }
    return priors;
  }

  /**
   * Sets the random generator of every attribute index in this copy. Called
   * by each worker at the start of an iteration.
   */
  public void setGenerator(RandomGenerator rand) {
    for (IndexedAttribute attribute : indexedAttributes) {
      attribute.getIndex().setGenerator(rand);
    }
  }

  public RecordTransformer transformer() {
    return new RecordTransformer(indexedAttributes);
  }

  /**
   * Replaces raw values by value ids. The result has the same partitioning as
   * the input. The first unseen value fails the whole transformation.
   *
   * @throws SchemaMismatchException if a record does not have one value per attribute
   * @throws UnseenValueException if a value is missing from its attribute's index
   */
  public PartitionedDataset<Record<Integer>> transformRecords(
    PartitionedDataset<Record<String>> records,
    ExecutionContext ctx
  ) {
    records
      .first()
      .ifPresent(first -> {
        if (first.numValues() != numAttributes()) {
          throw new SchemaMismatchException(first.getId(), numAttributes(), first.numValues());
        }
      });

    Broadcast<RecordTransformer> transformer = ctx.broadcast(transformer());
    try {
      return ctx.mapPartitions(records, partition -> transformer.value().transformPartition(partition));
    } finally {
      transformer.destroy();
    }
  }

  @Override
  public String toString() {
    return "RecordsCache{numRecords=" + numRecords + ", files=" + fileSizes.size() + ", attributes=" + indexedAttributes + "}";
  }
}

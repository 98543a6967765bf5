package com.reclink;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * Index over the observed values of one attribute.
 *
 * Maps each distinct value to a dense id in {@code [0, domainSize)} and back,
 * keeps the observed count of every value, and samples value ids in proportion
 * to those counts. Ids are assigned by descending count, ties broken by the
 * natural order of the values, so the same counts always give the same ids.
 *
 * <p>For cluster sizes {@code 1..maxClusterSize} the index precomputes the
 * proposal distribution over values for an entity linked to that many
 * distorted records. With a constant similarity function every proposal is the
 * frequency distribution itself. Otherwise the proposal for size {@code k}
 * weights value {@code v} by {@code p(v) * Z(v)^-k}, where
 * {@code Z(v) = sum_w p(w) * exp(sim(v, w))}.
 *
 * <p>The mapping is immutable. The only mutable state is the generator used by
 * {@link #draw()}, which is local to each copy and is never serialized.
 */
public final class AttributeIndex implements Serializable {

  private static final long serialVersionUID = 1L;

  /** Id assignment order: descending count, then ascending value. */
  static final Comparator<Map.Entry<String, Long>> ID_ORDER =
    Map.Entry.<String, Long>comparingByValue().reversed()
      .thenComparing(Map.Entry.<String, Long>comparingByKey());

  private final String attribute;
  private final String[] values;
  private final long[] counts;
  private final long totalCount;
  private final HashMap<String, Integer> ids;
  private final double[] probabilities;
  private final SimilarityFn similarityFn;

  // null for a constant similarity function
  private final double[] simNormalizations;

  private final AliasTable sampler;
  private final AliasTable[] proposals;

  private transient RandomGenerator rand;

  private AttributeIndex(
    String attribute,
    String[] values,
    long[] counts,
    SimilarityFn similarityFn,
    int maxClusterSize
  ) {
    this.attribute = attribute;
    this.values = values;
    this.counts = counts;
    this.similarityFn = similarityFn;

    int n = values.length;
    ids = new HashMap<>(n * 2);
    long total = 0;
    for (int i = 0; i < n; i++) {
      if (counts[i] <= 0) {
        throw new IllegalArgumentException(
          String.format(
            "count of value '%s' for attribute '%s' must be positive, got %d",
            values[i],
            attribute,
            counts[i]
          )
        );
      }
      if (ids.put(values[i], i) != null) {
        throw new IllegalArgumentException(
          String.format("duplicate value '%s' for attribute '%s'", values[i], attribute)
        );
      }
      total += counts[i];
    }
    totalCount = total;

    probabilities = new double[n];
    for (int i = 0; i < n; i++) {
      probabilities[i] = (double) counts[i] / totalCount;
    }
    sampler = new AliasTable(probabilities);

    simNormalizations = similarityFn.isConstant() ? null : computeSimNormalizations();

    proposals = new AliasTable[maxClusterSize];
    for (int k = 1; k <= maxClusterSize; k++) {
      proposals[k - 1] = simNormalizations == null ? sampler : new AliasTable(proposalWeights(k));
    }
  }

  /**
   * Builds an index from the final value counts of one attribute.
   *
   * @param attribute attribute name, used in error messages
   * @param valueCounts observed count of every distinct value
   * @param similarityFn similarity function of the attribute
   * @param maxClusterSize largest cluster size to precompute proposals for,
   *                       0 to precompute none
   * @throws EmptyDomainException if no value was observed
   */
  public static AttributeIndex build(
    String attribute,
    Map<String, Long> valueCounts,
    SimilarityFn similarityFn,
    int maxClusterSize
  ) {
    if (valueCounts.isEmpty()) {
      throw new EmptyDomainException(attribute);
    }
    List<Map.Entry<String, Long>> entries = new ArrayList<>(valueCounts.entrySet());
    entries.sort(ID_ORDER);

    String[] values = new String[entries.size()];
    long[] counts = new long[entries.size()];
    for (int i = 0; i < values.length; i++) {
      values[i] = entries.get(i).getKey();
      counts[i] = entries.get(i).getValue();
    }
    return fromOrderedValues(attribute, values, counts, similarityFn, maxClusterSize);
  }

  /**
   * Rebuilds an index whose ids are already fixed: {@code values[i]} gets id
   * {@code i}. Used to replicate an index verbatim.
   */
  public static AttributeIndex fromOrderedValues(
    String attribute,
    String[] values,
    long[] counts,
    SimilarityFn similarityFn,
    int maxClusterSize
  ) {
    if (values.length == 0) {
      throw new EmptyDomainException(attribute);
    }
    if (values.length != counts.length) {
      throw new IllegalArgumentException("values and counts differ in length");
    }
    if (maxClusterSize < 0) {
      throw new IllegalArgumentException("maxClusterSize must be non-negative");
    }
    return new AttributeIndex(
      attribute,
      values.clone(),
      counts.clone(),
      similarityFn,
      maxClusterSize
    );
  }

  private double[] computeSimNormalizations() {
    int n = values.length;
    double[] z = new double[n];
    for (int v = 0; v < n; v++) {
      double sum = 0.0;
      for (int w = 0; w < n; w++) {
        sum += probabilities[w] * Math.exp(similarityFn.getSimilarity(values[v], values[w]));
      }
      z[v] = sum;
    }
    return z;
  }

  // Computed in log space, large k underflows otherwise
  private double[] proposalWeights(int clusterSize) {
    int n = values.length;
    double[] logWeights = new double[n];
    double max = Double.NEGATIVE_INFINITY;
    for (int v = 0; v < n; v++) {
      logWeights[v] = Math.log(probabilities[v]) - clusterSize * Math.log(simNormalizations[v]);
      max = Math.max(max, logWeights[v]);
    }
    double[] weights = new double[n];
    for (int v = 0; v < n; v++) {
      weights[v] = Math.exp(logWeights[v] - max);
    }
    return weights;
  }

  public String getAttribute() {
    return attribute;
  }

  public SimilarityFn getSimilarityFn() {
    return similarityFn;
  }

  /** Number of distinct observed values */
  public int domainSize() {
    return values.length;
  }

  /** Largest cluster size with a precomputed proposal */
  public int maxClusterSize() {
    return proposals.length;
  }

  /** Sum of all value counts */
  public long totalCount() {
    return totalCount;
  }

  /**
   * @throws UnseenValueException if the value was not observed
   */
  public int idOf(String value) {
    Integer id = ids.get(value);
    if (id == null) {
      throw new UnseenValueException(attribute, value);
    }
    return id;
  }

  public boolean contains(String value) {
    return ids.containsKey(value);
  }

  /**
   * @throws IndexOutOfBoundsException if the id is not in {@code [0, domainSize)}
   */
  public String valueOf(int id) {
    checkId(id);
    return values[id];
  }

  public long countOf(int id) {
    checkId(id);
    return counts[id];
  }

  /** Empirical probability of the value with this id */
  public double probabilityOf(int id) {
    checkId(id);
    return probabilities[id];
  }

  /**
   * Similarity normalisation {@code Z(v)} of a value. Always 1 for a constant
   * similarity function.
   */
  public double simNormalizationOf(int id) {
    checkId(id);
    return simNormalizations == null ? 1.0 : simNormalizations[id];
  }

  /** {@code exp(sim(a, b))} for two value ids */
  public double expSimOf(int a, int b) {
    checkId(a);
    checkId(b);
    return simNormalizations == null
      ? 1.0
      : Math.exp(similarityFn.getSimilarity(values[a], values[b]));
  }

  /** Values in id order */
  public List<String> values() {
    return Collections.unmodifiableList(Arrays.asList(values));
  }

  /** Counts in id order */
  public long[] counts() {
    return counts.clone();
  }

  private void checkId(int id) {
    if (id < 0 || id >= values.length) {
      throw new IndexOutOfBoundsException(
        String.format(
          "value id %d out of range [0, %d) for attribute '%s'",
          id,
          values.length,
          attribute
        )
      );
    }
  }

  /**
   * Replaces the generator used by {@link #draw()}. Affects this copy only.
   */
  public void setGenerator(RandomGenerator rand) {
    this.rand = rand;
  }

  public RandomGenerator getGenerator() {
    return rand;
  }

  /**
   * Draws a value id with probability proportional to its count, using the
   * generator of this copy.
   *
   * @throws IllegalStateException if no generator was set on this copy
   */
  public int draw() {
    if (rand == null) {
      throw new IllegalStateException(
        "no random generator set for attribute '" + attribute + "'"
      );
    }
    return sampler.sample(rand);
  }

  /** Draws a value id with probability proportional to its count. */
  public int sample(RandomGenerator rand) {
    return sampler.sample(rand);
  }

  /**
   * Draws a value id from the proposal for an entity with
   * {@code clusterSize} linked records. Sizes up to {@link #maxClusterSize()}
   * reuse a precomputed table; larger sizes build one for this draw.
   */
  public int sample(RandomGenerator rand, int clusterSize) {
    if (clusterSize < 1) {
      throw new IllegalArgumentException("clusterSize must be positive, got " + clusterSize);
    }
    if (clusterSize <= proposals.length) {
      return proposals[clusterSize - 1].sample(rand);
    }
    if (simNormalizations == null) {
      return sampler.sample(rand);
    }
    return new AliasTable(proposalWeights(clusterSize)).sample(rand);
  }

  /** Probability of a value id under the proposal for {@code clusterSize}. */
  public double proposalProbabilityOf(int id, int clusterSize) {
    checkId(id);
    if (clusterSize < 1) {
      throw new IllegalArgumentException("clusterSize must be positive, got " + clusterSize);
    }
    if (simNormalizations == null) {
      return probabilities[id];
    }
    double[] weights = proposalWeights(clusterSize);
    double sum = 0.0;
    for (double w : weights) {
      sum += w;
    }
    return weights[id] / sum;
  }

  @Override
  public String toString() {
    return "AttributeIndex{" + attribute + ", domainSize=" + values.length + ", totalCount=" + totalCount + "}";
  }
}

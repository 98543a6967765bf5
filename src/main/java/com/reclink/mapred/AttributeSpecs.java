package com.reclink.mapred;

import com.reclink.Attribute;
import com.reclink.BetaShapeParameters;
import com.reclink.ConstantSimilarityFn;
import com.reclink.SimilarityFn;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.util.ReflectionUtils;

/**
 * Configuration keys of the indexing jobs and the attribute specifications
 * they describe.
 *
 * <pre>
 * reclink.attributes = name,birthYear
 * reclink.attribute.name.similarity = com.example.LevenshteinSimilarityFn
 * reclink.attribute.name.prior.alpha = 10
 * reclink.attribute.name.prior.beta = 1000
 * </pre>
 */
public final class AttributeSpecs {

  private AttributeSpecs() {} // Utility class

  public static final String ATTRIBUTES_KEY = "reclink.attributes";
  public static final String ATTRIBUTE_PREFIX = "reclink.attribute.";
  public static final String SIMILARITY_SUFFIX = ".similarity";
  public static final String PRIOR_ALPHA_SUFFIX = ".prior.alpha";
  public static final String PRIOR_BETA_SUFFIX = ".prior.beta";

  public static final String MAX_CLUSTER_SIZE_KEY = "reclink.max.cluster.size";
  public static final int DEFAULT_MAX_CLUSTER_SIZE = 10;

  /** Max entries in the statistics mapper's local maps before flush */
  public static final String MAX_LOCAL_ENTRIES_KEY = "reclink.stats.max.local.entries";
  public static final int DEFAULT_MAX_LOCAL_ENTRIES = 450_000;

  public static final double DEFAULT_PRIOR_ALPHA = 1.0;
  public static final double DEFAULT_PRIOR_BETA = 99.0;

  /**
   * Reads the attribute specifications, in the order given by
   * {@link #ATTRIBUTES_KEY}.
   *
   * @throws IllegalArgumentException if no attribute is configured
   */
  public static List<Attribute> fromConfiguration(Configuration conf) {
    String[] names = conf.getTrimmedStrings(ATTRIBUTES_KEY);
    if (names.length == 0) {
      throw new IllegalArgumentException("no attributes configured under " + ATTRIBUTES_KEY);
    }
    List<Attribute> attributes = new ArrayList<>(names.length);
    for (String name : names) {
      String prefix = ATTRIBUTE_PREFIX + name;
      Class<? extends SimilarityFn> fnClass = conf.getClass(
        prefix + SIMILARITY_SUFFIX,
        ConstantSimilarityFn.class,
        SimilarityFn.class
      );
      BetaShapeParameters prior = new BetaShapeParameters(
        conf.getDouble(prefix + PRIOR_ALPHA_SUFFIX, DEFAULT_PRIOR_ALPHA),
        conf.getDouble(prefix + PRIOR_BETA_SUFFIX, DEFAULT_PRIOR_BETA)
      );
      attributes.add(new Attribute(name, ReflectionUtils.newInstance(fnClass, conf), prior));
    }
    return Collections.unmodifiableList(attributes);
  }

  /** Writes attribute specifications so that {@link #fromConfiguration} reads them back. */
  public static void toConfiguration(List<Attribute> attributes, Configuration conf) {
    String[] names = new String[attributes.size()];
    for (int i = 0; i < names.length; i++) {
      Attribute attribute = attributes.get(i);
      names[i] = attribute.getName();
      String prefix = ATTRIBUTE_PREFIX + attribute.getName();
      conf.setClass(
        prefix + SIMILARITY_SUFFIX,
        attribute.getSimilarityFn().getClass(),
        SimilarityFn.class
      );
      conf.setDouble(prefix + PRIOR_ALPHA_SUFFIX, attribute.getDistortionPrior().getAlpha());
      conf.setDouble(prefix + PRIOR_BETA_SUFFIX, attribute.getDistortionPrior().getBeta());
    }
    conf.setStrings(ATTRIBUTES_KEY, names);
  }

  public static int maxClusterSize(Configuration conf) {
    return conf.getInt(MAX_CLUSTER_SIZE_KEY, DEFAULT_MAX_CLUSTER_SIZE);
  }
}

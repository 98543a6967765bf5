package com.reclink;

import java.io.Serializable;

/**
 * Similarity between two raw values of an attribute.
 *
 * Implementations are replicated to every worker and recreated from their
 * class name when a cache is read back, so they must be stateless and expose a
 * public no-argument constructor.
 */
public interface SimilarityFn extends Serializable {

  double getSimilarity(String a, String b);

  /** True if the similarity does not depend on the values compared. */
  default boolean isConstant() {
    return false;
  }
}

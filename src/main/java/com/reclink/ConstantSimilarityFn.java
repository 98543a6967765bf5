package com.reclink;

/**
 * Similarity that ignores the values compared. Attributes using it are matched
 * on exact equality only.
 */
public final class ConstantSimilarityFn implements SimilarityFn {

  private static final long serialVersionUID = 1L;

  @Override
  public double getSimilarity(String a, String b) {
    return 0.0;
  }

  @Override
  public boolean isConstant() {
    return true;
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof ConstantSimilarityFn;
  }

  @Override
  public int hashCode() {
    return ConstantSimilarityFn.class.hashCode();
  }

  @Override
  public String toString() {
    return "ConstantSimilarityFn";
  }
}

package com.reclink;

import java.io.Serializable;
import java.util.Objects;

/**
 * Specification of one record attribute, as supplied by configuration.
 */
public final class Attribute implements Serializable {

  private static final long serialVersionUID = 1L;

  private final String name;
  private final SimilarityFn similarityFn;
  private final BetaShapeParameters distortionPrior;

  public Attribute(
    String name,
    SimilarityFn similarityFn,
    BetaShapeParameters distortionPrior
  ) {
    this.name = Objects.requireNonNull(name, "name");
    this.similarityFn = Objects.requireNonNull(similarityFn, "similarityFn");
    this.distortionPrior = Objects.requireNonNull(distortionPrior, "distortionPrior");
  }

  public String getName() {
    return name;
  }

  public SimilarityFn getSimilarityFn() {
    return similarityFn;
  }

  public BetaShapeParameters getDistortionPrior() {
    return distortionPrior;
  }

  @Override
  public String toString() {
    return "Attribute{" + name + ", " + similarityFn + ", " + distortionPrior + "}";
  }
}

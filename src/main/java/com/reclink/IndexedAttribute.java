package com.reclink;

import java.io.Serializable;

/**
 * An attribute specification together with the index built for it.
 */
public final class IndexedAttribute implements Serializable {

  private static final long serialVersionUID = 1L;

  private final String name;
  private final SimilarityFn similarityFn;
  private final BetaShapeParameters distortionPrior;
  private final AttributeIndex index;

  public IndexedAttribute(Attribute attribute, AttributeIndex index) {
    this(
      attribute.getName(),
      attribute.getSimilarityFn(),
      attribute.getDistortionPrior(),
      index
    );
  }

  public IndexedAttribute(
    String name,
    SimilarityFn similarityFn,
    BetaShapeParameters distortionPrior,
    AttributeIndex index
  ) {
    this.name = name;
    this.similarityFn = similarityFn;
    this.distortionPrior = distortionPrior;
    this.index = index;
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

  public AttributeIndex getIndex() {
    return index;
  }

  @Override
  public String toString() {
    return "IndexedAttribute{" + name + ", domainSize=" + index.domainSize() + "}";
  }
}

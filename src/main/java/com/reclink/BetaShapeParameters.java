package com.reclink;

import java.io.Serializable;

/**
 * Shape parameters of the Beta prior on an attribute's distortion probability.
 */
public final class BetaShapeParameters implements Serializable {

  private static final long serialVersionUID = 1L;

  private final double alpha;
  private final double beta;

  public BetaShapeParameters(double alpha, double beta) {
    if (!(alpha > 0) || !(beta > 0)) {
      throw new IllegalArgumentException(
        "shape parameters must be positive, got alpha=" + alpha + ", beta=" + beta
      );
    }
    this.alpha = alpha;
    this.beta = beta;
  }

  public double getAlpha() {
    return alpha;
  }

  public double getBeta() {
    return beta;
  }

  /** Prior mean of the distortion probability */
  public double mean() {
    return alpha / (alpha + beta);
  }

  @Override
  public boolean equals(Object obj) {
    if (obj instanceof BetaShapeParameters) {
      BetaShapeParameters o = (BetaShapeParameters) obj;
      return Double.compare(alpha, o.alpha) == 0 && Double.compare(beta, o.beta) == 0;
    }
    return false;
  }

  @Override
  public int hashCode() {
    return 31 * Double.hashCode(alpha) + Double.hashCode(beta);
  }

  @Override
  public String toString() {
    return "Beta(" + alpha + ", " + beta + ")";
  }
}

package com.reclink;

import java.io.Serializable;
import java.util.ArrayDeque;
import java.util.Deque;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * Walker/Vose alias table over {@code [0, n)}. Built in O(n), draws in O(1)
 * with a caller-supplied generator.
 */
final class AliasTable implements Serializable {

  private static final long serialVersionUID = 1L;

  private final double[] prob;
  private final int[] alias;

  /**
   * @param weights non-negative weights, not necessarily normalised, with a
   *                positive sum
   */
  AliasTable(double[] weights) {
    int n = weights.length;
    double sum = 0.0;
    for (double w : weights) {
      if (!(w >= 0.0) || Double.isInfinite(w)) {
        throw new IllegalArgumentException("weights must be finite and non-negative");
      }
      sum += w;
    }
    if (n == 0 || !(sum > 0.0)) {
      throw new IllegalArgumentException("weights must have a positive sum");
    }

    prob = new double[n];
    alias = new int[n];
    double[] scaled = new double[n];
    Deque<Integer> small = new ArrayDeque<>();
    Deque<Integer> large = new ArrayDeque<>();
    for (int i = 0; i < n; i++) {
      scaled[i] = weights[i] * n / sum;
      if (scaled[i] < 1.0) {
        small.push(i);
      } else {
        large.push(i);
      }
    }

    while (!small.isEmpty() && !large.isEmpty()) {
      int s = small.pop();
      int l = large.pop();
      prob[s] = scaled[s];
      alias[s] = l;
      scaled[l] = (scaled[l] + scaled[s]) - 1.0;
      if (scaled[l] < 1.0) {
        small.push(l);
      } else {
        large.push(l);
      }
    }
    // Leftovers are 1 up to rounding error
    while (!large.isEmpty()) {
      int l = large.pop();
      prob[l] = 1.0;
      alias[l] = l;
    }
    while (!small.isEmpty()) {
      int s = small.pop();
      prob[s] = 1.0;
      alias[s] = s;
    }
  }

  int size() {
    return prob.length;
  }

  int sample(RandomGenerator rand) {
    int i = rand.nextInt(prob.length);
    return rand.nextDouble() < prob[i] ? i : alias[i];
  }
}

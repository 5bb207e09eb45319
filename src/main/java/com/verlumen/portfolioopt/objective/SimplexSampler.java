package com.verlumen.portfolioopt.objective;

import com.google.common.collect.ImmutableList;
import org.apache.commons.math3.random.RandomGenerator;

/** Draws starting populations that already lie on the probability simplex. */
public interface SimplexSampler {
  /**
   * Draws {@code count} independent points uniformly distributed over the simplex of the given
   * dimension.
   *
   * @param random the random source owned by the calling run
   */
  ImmutableList<double[]> sample(int count, int dimension, RandomGenerator random);
}

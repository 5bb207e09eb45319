package com.verlumen.portfolioopt.objective;

/** Maps arbitrary vectors onto the probability simplex. */
public interface SimplexProjector {
  /**
   * Clamps negative components to zero and rescales the result to sum to one. When nothing
   * positive remains the uniform vector is returned.
   *
   * @param vector any non-empty vector; it is not modified
   * @return a new vector with non-negative entries summing to one
   */
  double[] project(double[] vector);
}

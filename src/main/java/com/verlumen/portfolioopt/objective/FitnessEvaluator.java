package com.verlumen.portfolioopt.objective;

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * Scores a weight vector for minimisation. Implementations are pure functions of their arguments
 * and may be shared by concurrently running engines.
 */
public interface FitnessEvaluator {
  /**
   * Computes the fitness of {@code weights}. Lower is better.
   *
   * @param weights candidate weights; feasibility is the caller's responsibility
   * @param meanReturns expected return of every asset
   * @param covariance covariance of asset returns
   * @return the fitness, or {@code NaN} when the portfolio has no positive variance
   */
  double evaluate(double[] weights, RealVector meanReturns, RealMatrix covariance);

  default double evaluate(double[] weights, OptimizationProblem problem) {
    return evaluate(weights, problem.meanVector(), problem.covarianceMatrix());
  }
}

package com.verlumen.portfolioopt.objective;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.inject.Inject;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * Fitness equal to the negated Sharpe ratio {@code -(w·μ) / sqrt(wᵀΣw)}, so that a higher Sharpe
 * ratio yields a lower fitness.
 */
final class NegativeSharpeEvaluator implements FitnessEvaluator {
  @Inject
  NegativeSharpeEvaluator() {}

  @Override
  public double evaluate(double[] weights, RealVector meanReturns, RealMatrix covariance) {
    checkArgument(
        weights.length == meanReturns.getDimension(),
        "Expected %s weights but got %s",
        meanReturns.getDimension(),
        weights.length);
    RealVector w = new ArrayRealVector(weights, false);
    double portfolioReturn = w.dotProduct(meanReturns);
    double variance = w.dotProduct(covariance.operate(w));
    // Zero, negative or NaN variance has no meaningful ratio.
    if (!(variance > 0.0)) {
      return Double.NaN;
    }
    return -portfolioReturn / Math.sqrt(variance);
  }
}

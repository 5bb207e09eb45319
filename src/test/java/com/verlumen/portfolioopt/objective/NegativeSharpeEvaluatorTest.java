package com.verlumen.portfolioopt.objective;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.inject.Guice;
import com.google.inject.Inject;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class NegativeSharpeEvaluatorTest {
  @Inject private FitnessEvaluator evaluator;

  @Before
  public void setUp() {
    Guice.createInjector(ObjectiveModule.create()).injectMembers(this);
  }

  @Test
  public void evaluate_uniformWeights_returnsNegatedSharpeRatio() {
    double[] mean = {0.010, 0.020, 0.015};
    double[][] covariance = {
      {0.0004, 0.0001, 0.0000},
      {0.0001, 0.0009, 0.0002},
      {0.0000, 0.0002, 0.0006},
    };
    OptimizationProblem problem = OptimizationProblem.of(mean, covariance);
    double[] weights = {1.0 / 3, 1.0 / 3, 1.0 / 3};

    double fitness = evaluator.evaluate(weights, problem);

    double portfolioReturn = (0.010 + 0.020 + 0.015) / 3;
    double variance = 0.0;
    for (double[] row : covariance) {
      for (double entry : row) {
        variance += entry / 9;
      }
    }
    assertThat(fitness).isLessThan(0.0);
    assertThat(-fitness).isWithin(1e-12).of(portfolioReturn / Math.sqrt(variance));
  }

  @Test
  public void evaluate_singleAssetPortfolio_returnsThatAssetsRatio() {
    OptimizationProblem problem =
        OptimizationProblem.of(
            new double[] {0.01, 0.02}, new double[][] {{0.0004, 0.0}, {0.0, 0.0009}});

    assertThat(evaluator.evaluate(new double[] {0.0, 1.0}, problem))
        .isWithin(1e-12)
        .of(-0.02 / 0.03);
    assertThat(evaluator.evaluate(new double[] {1.0, 0.0}, problem)).isWithin(1e-12).of(-0.5);
  }

  @Test
  public void evaluate_negativeMeanReturn_isPositive() {
    OptimizationProblem problem =
        OptimizationProblem.of(new double[] {-0.01}, new double[][] {{0.0001}});

    assertThat(evaluator.evaluate(new double[] {1.0}, problem)).isWithin(1e-12).of(1.0);
  }

  @Test
  public void evaluate_zeroVariance_returnsNaN() {
    OptimizationProblem problem =
        OptimizationProblem.of(new double[] {0.01, 0.02}, new double[][] {{0.0, 0.0}, {0.0, 0.0}});

    assertThat(evaluator.evaluate(new double[] {0.5, 0.5}, problem)).isNaN();
  }

  @Test
  public void evaluate_negativeQuadraticForm_returnsNaN() {
    // Not positive semi-definite, as can happen with too few observations.
    OptimizationProblem problem =
        OptimizationProblem.of(
            new double[] {0.01, 0.02}, new double[][] {{0.0001, -0.0004}, {-0.0004, 0.0001}});

    assertThat(evaluator.evaluate(new double[] {0.5, 0.5}, problem)).isNaN();
  }

  @Test
  public void evaluate_dimensionMismatch_throws() {
    OptimizationProblem problem =
        OptimizationProblem.of(new double[] {0.01, 0.02}, new double[][] {{1, 0}, {0, 1}});

    assertThrows(
        IllegalArgumentException.class, () -> evaluator.evaluate(new double[] {1.0}, problem));
  }
}

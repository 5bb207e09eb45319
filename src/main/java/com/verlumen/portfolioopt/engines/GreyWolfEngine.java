package com.verlumen.portfolioopt.engines;

import static com.verlumen.portfolioopt.engines.EngineConstants.INITIAL_CONTROL;
import static com.verlumen.portfolioopt.engines.EngineConstants.LEADER_COUNT;
import static com.verlumen.portfolioopt.engines.EngineConstants.MAX_ENCIRCLING_COEFFICIENT;

import com.google.inject.Inject;
import com.verlumen.portfolioopt.objective.FitnessEvaluator;
import com.verlumen.portfolioopt.objective.SimplexProjector;
import com.verlumen.portfolioopt.objective.SimplexSampler;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * Grey wolf optimiser. Every wolf moves to the average of three positions, each obtained by
 * encircling one of the alpha, beta and delta leaders. Leaders are re-selected from the whole pack
 * once all wolves have moved, and the control coefficient {@code a} falls linearly from 2 to 0.
 */
final class GreyWolfEngine extends AbstractPopulationEngine {
  @Inject
  GreyWolfEngine(
      FitnessEvaluator fitnessEvaluator, SimplexProjector projector, SimplexSampler sampler) {
    super(fitnessEvaluator, projector, sampler);
  }

  @Override
  public EngineType type() {
    return EngineType.GREY_WOLF;
  }

  @Override
  OptimizationResult search(Run run, double[][] wolves, RandomGenerator random) {
    int dimension = run.dimension();
    double[] fitness = run.fitnessOf(wolves);
    int[] order = FitnessRanking.ascendingOrder(fitness);
    double[][] leaders = selectLeaders(wolves, order);
    double[] best = leaders[0].clone();
    double bestFitness = fitness[order[0]];

    for (int t = 0; t < run.generations(); t++) {
      double a = controlCoefficient(t, run.generations());
      for (int i = 0; i < wolves.length; i++) {
        double[] sum = new double[dimension];
        for (double[] leader : leaders) {
          double[] encircled = encircle(leader, wolves[i], a, random);
          for (int d = 0; d < dimension; d++) {
            sum[d] += encircled[d];
          }
        }
        for (int d = 0; d < dimension; d++) {
          sum[d] /= LEADER_COUNT;
        }
        wolves[i] = run.project(sum);
      }

      fitness = run.fitnessOf(wolves);
      order = FitnessRanking.ascendingOrder(fitness);
      leaders = selectLeaders(wolves, order);
      if (FitnessRanking.isBetter(fitness[order[0]], bestFitness)) {
        best = leaders[0].clone();
        bestFitness = fitness[order[0]];
      }
      run.completeGeneration(t, wolves, bestFitness);
    }
    return run.result(best, bestFitness);
  }

  /** {@code a = 2 - 2t/T}. */
  static double controlCoefficient(int generation, int generations) {
    return INITIAL_CONTROL - INITIAL_CONTROL * ((double) generation / generations);
  }

  /**
   * Candidate position {@code leader - A·|C·leader - wolf|} with {@code A} uniform in
   * {@code [-a, a]} and {@code C} uniform in {@code [0, 2]} per dimension. All of {@code A} is
   * drawn before {@code C}.
   */
  static double[] encircle(double[] leader, double[] wolf, double a, RandomGenerator random) {
    int dimension = leader.length;
    double[] coefficientA = new double[dimension];
    for (int d = 0; d < dimension; d++) {
      coefficientA[d] = a * (2.0 * random.nextDouble() - 1.0);
    }
    double[] coefficientC = new double[dimension];
    for (int d = 0; d < dimension; d++) {
      coefficientC[d] = MAX_ENCIRCLING_COEFFICIENT * random.nextDouble();
    }
    double[] candidate = new double[dimension];
    for (int d = 0; d < dimension; d++) {
      double distance = Math.abs(coefficientC[d] * leader[d] - wolf[d]);
      candidate[d] = leader[d] - coefficientA[d] * distance;
    }
    return candidate;
  }

  private static double[][] selectLeaders(double[][] wolves, int[] order) {
    double[][] leaders = new double[LEADER_COUNT][];
    for (int k = 0; k < LEADER_COUNT; k++) {
      leaders[k] = wolves[order[k]].clone();
    }
    return leaders;
  }
}

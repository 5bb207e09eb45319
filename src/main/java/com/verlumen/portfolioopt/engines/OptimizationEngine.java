package com.verlumen.portfolioopt.engines;

import com.google.common.collect.ImmutableList;
import com.verlumen.portfolioopt.objective.OptimizationProblem;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * A stochastic search for the weight vector with the highest Sharpe ratio. Engines keep no state
 * between calls; everything a run mutates is owned by that run, so one instance can serve
 * concurrent runs as long as each brings its own random source.
 */
public interface OptimizationEngine {
  EngineType type();

  /**
   * Runs the engine from a population drawn uniformly over the simplex.
   *
   * @param problem mean returns and covariance to optimise against
   * @param params population size and generation budget
   * @param random random source owned by this run
   */
  OptimizationResult optimize(
      OptimizationProblem problem, EngineParams params, RandomGenerator random);

  /**
   * Runs the engine from the given population. {@link EngineParams#populationSize()} is ignored in
   * favour of the size of {@code initialPopulation}. Members are projected onto the simplex before
   * the first generation; the caller's arrays are not modified.
   *
   * @throws IllegalArgumentException if the population is too small for the engine or a member
   *     has the wrong dimension
   */
  OptimizationResult optimize(
      OptimizationProblem problem,
      ImmutableList<double[]> initialPopulation,
      EngineParams params,
      RandomGenerator random);
}

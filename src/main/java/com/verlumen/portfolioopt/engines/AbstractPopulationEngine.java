package com.verlumen.portfolioopt.engines;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.verlumen.portfolioopt.objective.FitnessEvaluator;
import com.verlumen.portfolioopt.objective.OptimizationProblem;
import com.verlumen.portfolioopt.objective.SimplexProjector;
import com.verlumen.portfolioopt.objective.SimplexSampler;
import java.util.Arrays;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * Shared plumbing of the engines: initial sampling, argument checks, fitness evaluation through
 * the simplex gate and generation reporting. Subclasses implement a single run in {@link #search}.
 */
abstract class AbstractPopulationEngine implements OptimizationEngine {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final FitnessEvaluator fitnessEvaluator;
  private final SimplexProjector projector;
  private final SimplexSampler sampler;

  AbstractPopulationEngine(
      FitnessEvaluator fitnessEvaluator, SimplexProjector projector, SimplexSampler sampler) {
    this.fitnessEvaluator = fitnessEvaluator;
    this.projector = projector;
    this.sampler = sampler;
  }

  @Override
  public final OptimizationResult optimize(
      OptimizationProblem problem, EngineParams params, RandomGenerator random) {
    checkPopulationSize(params.populationSize());
    ImmutableList<double[]> population =
        sampler.sample(params.populationSize(), problem.dimension(), random);
    return optimize(problem, population, params, random);
  }

  @Override
  public final OptimizationResult optimize(
      OptimizationProblem problem,
      ImmutableList<double[]> initialPopulation,
      EngineParams params,
      RandomGenerator random) {
    checkPopulationSize(initialPopulation.size());
    double[][] population = new double[initialPopulation.size()][];
    for (int i = 0; i < population.length; i++) {
      double[] member = initialPopulation.get(i);
      checkArgument(
          member.length == problem.dimension(),
          "Member %s has dimension %s, expected %s",
          i,
          member.length,
          problem.dimension());
      population[i] = projector.project(member);
    }

    logger.atInfo().log(
        "Running %s with %d members for %d generations over %d assets",
        type().displayName(),
        population.length,
        params.generations(),
        problem.dimension());
    OptimizationResult result = search(new Run(problem, params), population, random);
    if (Double.isNaN(result.sharpeRatio())) {
      logger.atWarning().log(
          "%s found no portfolio with positive variance", type().displayName());
    } else {
      logger.atInfo().log(
          "%s finished with Sharpe ratio %.4f", type().displayName(), result.sharpeRatio());
    }
    return result;
  }

  /**
   * Runs the engine-specific search.
   *
   * @param run the problem, parameters and history of this run
   * @param population projected starting members; the search may replace them in place
   * @param random random source of this run
   */
  abstract OptimizationResult search(Run run, double[][] population, RandomGenerator random);

  private void checkPopulationSize(int size) {
    checkArgument(
        size >= type().minimumPopulationSize(),
        "%s needs at least %s members but got %s",
        type().displayName(),
        type().minimumPopulationSize(),
        size);
  }

  /** Per-run view of the problem: fitness, projection and the convergence history. */
  final class Run {
    private final OptimizationProblem problem;
    private final EngineParams params;
    private final ImmutableList.Builder<Double> history = ImmutableList.builder();

    private Run(OptimizationProblem problem, EngineParams params) {
      this.problem = problem;
      this.params = params;
    }

    int dimension() {
      return problem.dimension();
    }

    int generations() {
      return params.generations();
    }

    double mutationRate() {
      return params.mutationRate();
    }

    double fitness(double[] weights) {
      return fitnessEvaluator.evaluate(weights, problem);
    }

    double[] fitnessOf(double[][] population) {
      double[] fitness = new double[population.length];
      for (int i = 0; i < population.length; i++) {
        fitness[i] = fitness(population[i]);
      }
      return fitness;
    }

    double[] project(double[] vector) {
      return projector.project(vector);
    }

    /** Appends the best-so-far Sharpe ratio and notifies the listener. */
    void completeGeneration(int generation, double[][] population, double bestFitness) {
      double bestSharpeRatio = -bestFitness;
      history.add(bestSharpeRatio);
      logger.atFine().log(
          "%s generation %d best Sharpe ratio %.6f",
          type().displayName(),
          generation,
          bestSharpeRatio);
      if (params.generationListener() != GenerationListener.NONE) {
        params
            .generationListener()
            .onGeneration(
                generation,
                Arrays.stream(population)
                    .map(double[]::clone)
                    .collect(ImmutableList.toImmutableList()),
                bestSharpeRatio);
      }
    }

    OptimizationResult result(double[] bestWeights, double bestFitness) {
      return OptimizationResult.create(type(), bestWeights, -bestFitness, history.build());
    }
  }
}

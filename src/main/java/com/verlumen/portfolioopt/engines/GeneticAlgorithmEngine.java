package com.verlumen.portfolioopt.engines;

import static com.verlumen.portfolioopt.engines.EngineConstants.CROSSOVER_MASK_PROBABILITY;
import static com.verlumen.portfolioopt.engines.EngineConstants.MUTATION_SIGMA;

import com.google.inject.Inject;
import com.verlumen.portfolioopt.objective.FitnessEvaluator;
import com.verlumen.portfolioopt.objective.SimplexProjector;
import com.verlumen.portfolioopt.objective.SimplexSampler;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * Genetic algorithm with truncation selection and elitism. Each generation ranks the population
 * and records its best member before breeding. The better half survives unchanged; the rest is
 * replaced by offspring bred from two parents of that half using a uniform crossover mask and an
 * occasional Gaussian mutation of every gene.
 */
final class GeneticAlgorithmEngine extends AbstractPopulationEngine {
  @Inject
  GeneticAlgorithmEngine(
      FitnessEvaluator fitnessEvaluator, SimplexProjector projector, SimplexSampler sampler) {
    super(fitnessEvaluator, projector, sampler);
  }

  @Override
  public EngineType type() {
    return EngineType.GENETIC;
  }

  @Override
  OptimizationResult search(Run run, double[][] population, RandomGenerator random) {
    int size = population.length;
    int eliteCount = size / 2;

    double[][] members = population;
    double[] fitness = run.fitnessOf(members);
    double[][] ranked = members;
    double[] rankedFitness = fitness;
    for (int generation = 0; generation < run.generations(); generation++) {
      // Elites lead the unsorted array, so a stable sort keeps the incumbent on ties.
      int[] order = FitnessRanking.ascendingOrder(fitness);
      ranked = reorder(members, order);
      rankedFitness = reorder(fitness, order);
      run.completeGeneration(generation, ranked, rankedFitness[0]);

      members = new double[size][];
      fitness = new double[size];
      System.arraycopy(ranked, 0, members, 0, eliteCount);
      System.arraycopy(rankedFitness, 0, fitness, 0, eliteCount);
      for (int k = eliteCount; k < size; k++) {
        int[] parents = selectParents(eliteCount, random);
        double[] child = uniformCrossover(ranked[parents[0]], ranked[parents[1]], random);
        if (random.nextDouble() < run.mutationRate()) {
          mutate(child, random);
        }
        members[k] = run.project(child);
        fitness[k] = run.fitness(members[k]);
      }
    }
    // The offspring of the last generation are never ranked; the best recorded member is kept.
    return run.result(ranked[0].clone(), rankedFitness[0]);
  }

  /**
   * Draws two parent indices independently and uniformly from {@code [0, eliteCount)}. The two
   * indices may be equal, in which case the child is a copy of that parent before mutation.
   */
  static int[] selectParents(int eliteCount, RandomGenerator random) {
    return new int[] {random.nextInt(eliteCount), random.nextInt(eliteCount)};
  }

  /** Takes each gene from {@code first} with probability one half, else from {@code second}. */
  static double[] uniformCrossover(double[] first, double[] second, RandomGenerator random) {
    double[] child = new double[first.length];
    for (int d = 0; d < child.length; d++) {
      child[d] = random.nextDouble() < CROSSOVER_MASK_PROBABILITY ? first[d] : second[d];
    }
    return child;
  }

  private static void mutate(double[] child, RandomGenerator random) {
    for (int d = 0; d < child.length; d++) {
      child[d] += MUTATION_SIGMA * random.nextGaussian();
    }
  }

  private static double[][] reorder(double[][] members, int[] order) {
    double[][] reordered = new double[order.length][];
    for (int i = 0; i < order.length; i++) {
      reordered[i] = members[order[i]];
    }
    return reordered;
  }

  private static double[] reorder(double[] values, int[] order) {
    double[] reordered = new double[order.length];
    for (int i = 0; i < order.length; i++) {
      reordered[i] = values[order[i]];
    }
    return reordered;
  }
}

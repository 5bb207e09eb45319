package com.verlumen.portfolioopt.engines;

import static com.verlumen.portfolioopt.engines.EngineConstants.LOCAL_WALK_SIGMA;
import static com.verlumen.portfolioopt.engines.EngineConstants.LOUDNESS_DECAY;
import static com.verlumen.portfolioopt.engines.EngineConstants.MAX_FREQUENCY;
import static com.verlumen.portfolioopt.engines.EngineConstants.MIN_FREQUENCY;
import static com.verlumen.portfolioopt.engines.EngineConstants.PULSE_RATE_GROWTH;

import com.google.inject.Inject;
import com.verlumen.portfolioopt.objective.FitnessEvaluator;
import com.verlumen.portfolioopt.objective.SimplexProjector;
import com.verlumen.portfolioopt.objective.SimplexSampler;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * Bat algorithm. Each bat flies with a velocity pulled by the global best at a random frequency,
 * or, with probability {@code 1 - r}, takes a short Gaussian walk around the global best instead.
 * A move is kept only if it is no worse and a draw falls below the bat's loudness; each kept move
 * makes the bat quieter and rescales its pulse rate.
 */
final class BatAlgorithmEngine extends AbstractPopulationEngine {
  @Inject
  BatAlgorithmEngine(
      FitnessEvaluator fitnessEvaluator, SimplexProjector projector, SimplexSampler sampler) {
    super(fitnessEvaluator, projector, sampler);
  }

  @Override
  public EngineType type() {
    return EngineType.BAT;
  }

  @Override
  OptimizationResult search(Run run, double[][] bats, RandomGenerator random) {
    int size = bats.length;
    int dimension = run.dimension();
    double[] fitness = run.fitnessOf(bats);

    double[] loudness = new double[size];
    for (int i = 0; i < size; i++) {
      loudness[i] = random.nextDouble();
    }
    double[] pulseRate = new double[size];
    for (int i = 0; i < size; i++) {
      pulseRate[i] = random.nextDouble();
    }
    double[][] velocities = new double[size][dimension];

    int bestIndex = FitnessRanking.bestIndex(fitness);
    double[] best = bats[bestIndex].clone();
    double bestFitness = fitness[bestIndex];

    for (int t = 0; t < run.generations(); t++) {
      for (int i = 0; i < size; i++) {
        double frequency = MIN_FREQUENCY + (MAX_FREQUENCY - MIN_FREQUENCY) * random.nextDouble();
        double[] flight = new double[dimension];
        for (int d = 0; d < dimension; d++) {
          velocities[i][d] += (bats[i][d] - best[d]) * frequency;
          flight[d] = bats[i][d] + velocities[i][d];
        }
        double[] candidate = run.project(flight);

        if (random.nextDouble() > pulseRate[i]) {
          candidate = run.project(localWalk(best, random));
        }

        double candidateFitness = run.fitness(candidate);
        // The loudness draw is only taken for candidates that pass the fitness comparison.
        if (FitnessRanking.isNoWorse(candidateFitness, fitness[i])
            && random.nextDouble() < loudness[i]) {
          bats[i] = candidate;
          fitness[i] = candidateFitness;
          loudness[i] *= LOUDNESS_DECAY;
          pulseRate[i] = pulseRate[i] * (1.0 - Math.exp(-PULSE_RATE_GROWTH * t));

          if (FitnessRanking.isNoWorse(candidateFitness, bestFitness)) {
            best = candidate.clone();
            bestFitness = candidateFitness;
          }
        }
      }
      run.completeGeneration(t, bats, bestFitness);
    }
    return run.result(best, bestFitness);
  }

  /** Gaussian perturbation of {@code center}; the result still needs projecting. */
  static double[] localWalk(double[] center, RandomGenerator random) {
    double[] walk = new double[center.length];
    for (int d = 0; d < center.length; d++) {
      walk[d] = center[d] + LOCAL_WALK_SIGMA * random.nextGaussian();
    }
    return walk;
  }
}

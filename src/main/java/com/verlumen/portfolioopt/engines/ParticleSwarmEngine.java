package com.verlumen.portfolioopt.engines;

import static com.verlumen.portfolioopt.engines.EngineConstants.INERTIA_WEIGHT;

import com.google.inject.Inject;
import com.verlumen.portfolioopt.objective.FitnessEvaluator;
import com.verlumen.portfolioopt.objective.SimplexProjector;
import com.verlumen.portfolioopt.objective.SimplexSampler;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * Particle swarm optimisation with a fixed inertia weight. The cognitive and social pulls are
 * scaled only by one uniform draw each per particle and generation.
 */
final class ParticleSwarmEngine extends AbstractPopulationEngine {
  @Inject
  ParticleSwarmEngine(
      FitnessEvaluator fitnessEvaluator, SimplexProjector projector, SimplexSampler sampler) {
    super(fitnessEvaluator, projector, sampler);
  }

  @Override
  public EngineType type() {
    return EngineType.PARTICLE_SWARM;
  }

  @Override
  OptimizationResult search(Run run, double[][] particles, RandomGenerator random) {
    int size = particles.length;
    int dimension = run.dimension();
    double[][] velocities = new double[size][dimension];
    double[][] personalBest = new double[size][];
    for (int i = 0; i < size; i++) {
      personalBest[i] = particles[i].clone();
    }
    double[] personalBestFitness = run.fitnessOf(personalBest);
    double[] globalBest = personalBest[FitnessRanking.bestIndex(personalBestFitness)].clone();

    for (int generation = 0; generation < run.generations(); generation++) {
      for (int i = 0; i < size; i++) {
        double r1 = random.nextDouble();
        double r2 = random.nextDouble();
        double[] moved = new double[dimension];
        for (int d = 0; d < dimension; d++) {
          velocities[i][d] =
              INERTIA_WEIGHT * velocities[i][d]
                  + r1 * (personalBest[i][d] - particles[i][d])
                  + r2 * (globalBest[d] - particles[i][d]);
          moved[d] = particles[i][d] + velocities[i][d];
        }
        particles[i] = run.project(moved);

        double score = run.fitness(particles[i]);
        if (FitnessRanking.isBetter(score, personalBestFitness[i])) {
          personalBest[i] = particles[i].clone();
          personalBestFitness[i] = score;
          // The global best is re-scored here rather than cached alongside it.
          if (FitnessRanking.isBetter(score, run.fitness(globalBest))) {
            globalBest = particles[i].clone();
          }
        }
      }
      run.completeGeneration(generation, particles, run.fitness(globalBest));
    }
    return run.result(globalBest, run.fitness(globalBest));
  }
}

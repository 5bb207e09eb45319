package com.verlumen.portfolioopt.engines;

/** Tuning constants of the engines that are not exposed as parameters. */
final class EngineConstants {
  // Bat algorithm
  static final double MIN_FREQUENCY = 0.0;
  static final double MAX_FREQUENCY = 5.0;
  static final double LOCAL_WALK_SIGMA = 0.05;
  static final double LOUDNESS_DECAY = 0.95;
  static final double PULSE_RATE_GROWTH = 0.1;

  // Genetic algorithm
  static final double CROSSOVER_MASK_PROBABILITY = 0.5;
  static final double MUTATION_SIGMA = 0.1;

  // Particle swarm
  static final double INERTIA_WEIGHT = 0.5;

  // Grey wolf
  static final double INITIAL_CONTROL = 2.0;
  static final double MAX_ENCIRCLING_COEFFICIENT = 2.0;
  static final int LEADER_COUNT = 3;

  private EngineConstants() {}
}

package com.verlumen.portfolioopt.engines;

/** The population-based search engines, in reporting order. */
public enum EngineType {
  BAT("Bat Algorithm", 1, 30),
  GENETIC("Genetic Algorithm", 2, 50),
  PARTICLE_SWARM("Particle Swarm", 1, 30),
  GREY_WOLF("Grey Wolf", 3, 30);

  private final String displayName;
  private final int minimumPopulationSize;
  private final int defaultPopulationSize;

  EngineType(String displayName, int minimumPopulationSize, int defaultPopulationSize) {
    this.displayName = displayName;
    this.minimumPopulationSize = minimumPopulationSize;
    this.defaultPopulationSize = defaultPopulationSize;
  }

  public String displayName() {
    return displayName;
  }

  /** Smallest population the engine can run with. */
  public int minimumPopulationSize() {
    return minimumPopulationSize;
  }

  public int defaultPopulationSize() {
    return defaultPopulationSize;
  }
}

package com.verlumen.portfolioopt.engines;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;

/** Size and budget of a single engine run. */
@AutoValue
public abstract class EngineParams {
  public static final double DEFAULT_MUTATION_RATE = 0.1;

  public static Builder builder() {
    return new AutoValue_EngineParams.Builder()
        .setMutationRate(DEFAULT_MUTATION_RATE)
        .setGenerationListener(GenerationListener.NONE);
  }

  public static EngineParams create(int populationSize, int generations) {
    return builder().setPopulationSize(populationSize).setGenerations(generations).build();
  }

  public abstract int populationSize();

  public abstract int generations();

  /** Probability that a genetic offspring is mutated. Ignored by the other engines. */
  public abstract double mutationRate();

  public abstract GenerationListener generationListener();

  public abstract Builder toBuilder();

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setPopulationSize(int populationSize);

    public abstract Builder setGenerations(int generations);

    public abstract Builder setMutationRate(double mutationRate);

    public abstract Builder setGenerationListener(GenerationListener generationListener);

    abstract EngineParams autoBuild();

    public EngineParams build() {
      EngineParams params = autoBuild();
      checkArgument(
          params.populationSize() > 0,
          "Population size must be positive: %s",
          params.populationSize());
      checkArgument(
          params.generations() > 0, "Generations must be positive: %s", params.generations());
      checkArgument(
          params.mutationRate() >= 0.0 && params.mutationRate() <= 1.0,
          "Mutation rate must be in [0, 1]: %s",
          params.mutationRate());
      return params;
    }
  }
}

package com.verlumen.portfolioopt.app;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import com.verlumen.portfolioopt.engines.EngineParams;
import com.verlumen.portfolioopt.engines.EngineType;
import java.nio.file.Path;

/** Settings of one command line invocation. */
@AutoValue
abstract class OptimizerConfig {
  static Builder builder() {
    return new AutoValue_OptimizerConfig.Builder();
  }

  abstract Path pricesCsv();

  /** How many of the highest-mean-return assets are optimised over. */
  abstract int topAssets();

  abstract int runs();

  abstract int generations();

  abstract int batPopulation();

  abstract int geneticPopulation();

  abstract double mutationRate();

  abstract int swarmPopulation();

  abstract int wolfPopulation();

  abstract long seed();

  abstract int parallelism();

  /** How many of the largest weights are listed per engine in the report. */
  abstract int topWeights();

  ImmutableMap<EngineType, EngineParams> engineParams() {
    return ImmutableMap.of(
        EngineType.BAT, EngineParams.create(batPopulation(), generations()),
        EngineType.GENETIC,
            EngineParams.builder()
                .setPopulationSize(geneticPopulation())
                .setGenerations(generations())
                .setMutationRate(mutationRate())
                .build(),
        EngineType.PARTICLE_SWARM, EngineParams.create(swarmPopulation(), generations()),
        EngineType.GREY_WOLF, EngineParams.create(wolfPopulation(), generations()));
  }

  @AutoValue.Builder
  abstract static class Builder {
    abstract Builder setPricesCsv(Path pricesCsv);

    abstract Builder setTopAssets(int topAssets);

    abstract Builder setRuns(int runs);

    abstract Builder setGenerations(int generations);

    abstract Builder setBatPopulation(int batPopulation);

    abstract Builder setGeneticPopulation(int geneticPopulation);

    abstract Builder setMutationRate(double mutationRate);

    abstract Builder setSwarmPopulation(int swarmPopulation);

    abstract Builder setWolfPopulation(int wolfPopulation);

    abstract Builder setSeed(long seed);

    abstract Builder setParallelism(int parallelism);

    abstract Builder setTopWeights(int topWeights);

    abstract OptimizerConfig autoBuild();

    OptimizerConfig build() {
      OptimizerConfig config = autoBuild();
      checkArgument(config.topAssets() > 0, "topAssets must be positive: %s", config.topAssets());
      checkArgument(config.runs() > 0, "runs must be positive: %s", config.runs());
      checkArgument(
          config.topWeights() > 0, "topWeights must be positive: %s", config.topWeights());
      checkArgument(
          config.parallelism() > 0, "parallelism must be positive: %s", config.parallelism());
      return config;
    }
  }
}

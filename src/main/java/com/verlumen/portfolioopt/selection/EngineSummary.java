package com.verlumen.portfolioopt.selection;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.verlumen.portfolioopt.engines.EngineType;
import com.verlumen.portfolioopt.engines.OptimizationResult;

/** Best-of-N outcome of one engine. */
@AutoValue
public abstract class EngineSummary {
  public static EngineSummary create(
      EngineType engineType, OptimizationResult bestRun, ImmutableList<Double> runSharpeRatios) {
    return new AutoValue_EngineSummary(engineType, bestRun, runSharpeRatios);
  }

  public abstract EngineType engineType();

  /** The run with the highest Sharpe ratio, including its weights and convergence history. */
  public abstract OptimizationResult bestRun();

  /** Sharpe ratio reached by every run, in run order. */
  public abstract ImmutableList<Double> runSharpeRatios();

  public double bestSharpeRatio() {
    return bestRun().sharpeRatio();
  }
}

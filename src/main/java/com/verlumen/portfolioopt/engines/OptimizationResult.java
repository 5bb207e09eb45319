package com.verlumen.portfolioopt.engines;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Doubles;

/** Outcome of one engine run. */
@AutoValue
public abstract class OptimizationResult {
  public static OptimizationResult create(
      EngineType engineType, double[] weights, double sharpeRatio, ImmutableList<Double> history) {
    return new AutoValue_OptimizationResult(
        engineType, ImmutableList.copyOf(Doubles.asList(weights)), sharpeRatio, history);
  }

  public abstract EngineType engineType();

  /** Best weights found; non-negative and summing to one. */
  public abstract ImmutableList<Double> weights();

  /** Sharpe ratio of {@link #weights()}, possibly NaN when no candidate had positive variance. */
  public abstract double sharpeRatio();

  /** Best Sharpe ratio so far after each generation. */
  public abstract ImmutableList<Double> history();

  public double[] weightArray() {
    return Doubles.toArray(weights());
  }
}

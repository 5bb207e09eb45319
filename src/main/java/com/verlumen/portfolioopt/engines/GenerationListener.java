package com.verlumen.portfolioopt.engines;

import com.google.common.collect.ImmutableList;

/** Receives the state of a run after every completed generation. */
@FunctionalInterface
public interface GenerationListener {
  GenerationListener NONE = (generation, population, bestSharpeRatio) -> {};

  /**
   * @param generation zero-based index of the generation that just completed
   * @param population copies of the members after the generation
   * @param bestSharpeRatio best Sharpe ratio found so far in the run
   */
  void onGeneration(int generation, ImmutableList<double[]> population, double bestSharpeRatio);
}

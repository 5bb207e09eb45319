package com.verlumen.portfolioopt.selection;

import com.google.common.collect.ImmutableMap;
import com.verlumen.portfolioopt.engines.EngineParams;
import com.verlumen.portfolioopt.engines.EngineType;
import com.verlumen.portfolioopt.objective.OptimizationProblem;

/**
 * Repeats every engine a number of times with fresh random starts and keeps, per engine, the run
 * that reached the highest Sharpe ratio.
 */
public interface MultiRunSelector {
  /**
   * Runs each engine in {@code engineParams} {@code runs} times.
   *
   * @param problem the problem shared read-only by all runs
   * @param engineParams the engines to compare and their parameters
   * @param runs independent runs per engine
   * @param seed master seed; equal seeds give equal reports
   * @return one summary per requested engine
   */
  SelectionReport select(
      OptimizationProblem problem,
      ImmutableMap<EngineType, EngineParams> engineParams,
      int runs,
      long seed);
}

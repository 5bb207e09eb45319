package com.verlumen.portfolioopt.app;

import com.verlumen.portfolioopt.objective.OptimizationProblem;
import com.verlumen.portfolioopt.selection.SelectionReport;

/** Writes the outcome of an engine comparison as plain text. */
interface ResultReporter {
  /**
   * @param problem supplies the asset names for the weight listings
   * @param report the best-of-N results per engine
   * @param topWeights how many of the largest weights to list per engine
   */
  void report(OptimizationProblem problem, SelectionReport report, int topWeights);
}

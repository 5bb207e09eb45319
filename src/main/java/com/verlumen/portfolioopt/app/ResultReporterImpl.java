package com.verlumen.portfolioopt.app;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.inject.Inject;
import com.verlumen.portfolioopt.engines.OptimizationResult;
import com.verlumen.portfolioopt.objective.OptimizationProblem;
import com.verlumen.portfolioopt.selection.EngineSummary;
import com.verlumen.portfolioopt.selection.SelectionReport;
import java.io.PrintStream;
import java.util.Comparator;
import java.util.Locale;
import java.util.stream.IntStream;

final class ResultReporterImpl implements ResultReporter {
  private final PrintStream out;

  @Inject
  ResultReporterImpl(PrintStream out) {
    this.out = out;
  }

  @Override
  public void report(OptimizationProblem problem, SelectionReport report, int topWeights) {
    out.printf(
        Locale.ROOT,
        "Best Sharpe Ratio after %d Runs (seed %d)%n",
        report.runs(),
        report.seed());
    for (EngineSummary summary : report.summaries().values()) {
      out.printf(
          Locale.ROOT,
          "%s Sharpe Ratio: %s%n",
          summary.engineType().displayName(),
          format(summary.bestSharpeRatio()));
    }

    out.println();
    out.println("Best Convergence per Algorithm");
    for (EngineSummary summary : report.summaries().values()) {
      ImmutableList<Double> history = summary.bestRun().history();
      out.printf(
          Locale.ROOT,
          "%s: %d iterations, %s -> %s%n",
          summary.engineType().displayName(),
          history.size(),
          history.isEmpty() ? "n/a" : format(history.get(0)),
          history.isEmpty() ? "n/a" : format(Iterables.getLast(history)));
    }

    for (EngineSummary summary : report.summaries().values()) {
      OptimizationResult best = summary.bestRun();
      int shown = Math.min(topWeights, best.weights().size());
      out.println();
      out.printf(
          Locale.ROOT,
          "Top %d Portfolio Weights - %s%n",
          shown,
          summary.engineType().displayName());
      for (int asset : largestWeights(best.weights(), shown)) {
        out.printf(
            Locale.ROOT,
            "  %-10s %.4f%n",
            problem.assetNames().get(asset),
            best.weights().get(asset));
      }
    }
  }

  /** Indices of the {@code count} largest weights, largest first; ties keep asset order. */
  static int[] largestWeights(ImmutableList<Double> weights, int count) {
    return IntStream.range(0, weights.size())
        .boxed()
        .sorted(Comparator.comparing((Integer i) -> weights.get(i)).reversed())
        .limit(count)
        .mapToInt(Integer::intValue)
        .toArray();
  }

  private static String format(double value) {
    return Double.isFinite(value) ? String.format(Locale.ROOT, "%.4f", value) : "n/a";
  }
}

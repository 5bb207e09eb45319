package com.verlumen.portfolioopt.selection;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.portfolioopt.engines.EngineParams;
import com.verlumen.portfolioopt.engines.EngineType;
import com.verlumen.portfolioopt.engines.OptimizationEngine;
import com.verlumen.portfolioopt.engines.OptimizationResult;
import com.verlumen.portfolioopt.objective.OptimizationProblem;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

/**
 * Runs are submitted to the injected executor in (run, engine) order and collected in the same
 * order. Every run gets its own {@link Well19937c} seeded from the master seed before anything is
 * submitted, so the report does not depend on how many threads execute the runs.
 */
final class MultiRunSelectorImpl implements MultiRunSelector {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final Map<EngineType, OptimizationEngine> engines;
  private final ExecutorService executor;

  @Inject
  MultiRunSelectorImpl(Map<EngineType, OptimizationEngine> engines, ExecutorService executor) {
    this.engines = engines;
    this.executor = executor;
  }

  @Override
  public SelectionReport select(
      OptimizationProblem problem,
      ImmutableMap<EngineType, EngineParams> engineParams,
      int runs,
      long seed) {
    checkArgument(runs > 0, "Run count must be positive: %s", runs);
    checkArgument(!engineParams.isEmpty(), "No engines requested");
    // Reject every bad request before the first run starts.
    for (Map.Entry<EngineType, EngineParams> entry : engineParams.entrySet()) {
      EngineType type = entry.getKey();
      checkArgument(engines.containsKey(type), "No engine bound for %s", type);
      checkArgument(
          entry.getValue().populationSize() >= type.minimumPopulationSize(),
          "%s needs at least %s members but got %s",
          type.displayName(),
          type.minimumPopulationSize(),
          entry.getValue().populationSize());
    }
    logger.atInfo().log(
        "Comparing %s over %d runs with seed %d", engineParams.keySet(), runs, seed);

    RandomGenerator seeds = new Well19937c(seed);
    List<Future<OptimizationResult>> futures = new ArrayList<>();
    for (int run = 0; run < runs; run++) {
      for (Map.Entry<EngineType, EngineParams> entry : engineParams.entrySet()) {
        OptimizationEngine engine = engines.get(entry.getKey());
        EngineParams params = entry.getValue();
        long runSeed = seeds.nextLong();
        futures.add(
            executor.submit(() -> engine.optimize(problem, params, new Well19937c(runSeed))));
      }
    }

    Map<EngineType, OptimizationResult> bestRuns = new EnumMap<>(EngineType.class);
    Map<EngineType, ImmutableList.Builder<Double>> ratios = new EnumMap<>(EngineType.class);
    int index = 0;
    for (int run = 0; run < runs; run++) {
      for (EngineType type : engineParams.keySet()) {
        OptimizationResult result = await(futures.get(index++));
        logger.atInfo().log(
            "Run %d/%d of %s reached Sharpe ratio %.4f",
            run + 1,
            runs,
            type.displayName(),
            result.sharpeRatio());
        ratios.computeIfAbsent(type, unused -> ImmutableList.builder()).add(result.sharpeRatio());
        OptimizationResult incumbent = bestRuns.get(type);
        if (incumbent == null || isHigher(result.sharpeRatio(), incumbent.sharpeRatio())) {
          bestRuns.put(type, result);
        }
      }
    }

    ImmutableMap.Builder<EngineType, EngineSummary> summaries = ImmutableMap.builder();
    for (EngineType type : EngineType.values()) {
      if (bestRuns.containsKey(type)) {
        summaries.put(
            type, EngineSummary.create(type, bestRuns.get(type), ratios.get(type).build()));
      }
    }
    return SelectionReport.create(runs, seed, summaries.build());
  }

  /** Strictly higher wins, so the earliest run is kept on ties; NaN never beats a number. */
  static boolean isHigher(double candidate, double incumbent) {
    if (Double.isNaN(candidate)) {
      return false;
    }
    return Double.isNaN(incumbent) || candidate > incumbent;
  }

  private static OptimizationResult await(Future<OptimizationResult> future) {
    try {
      return future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while waiting for an optimization run", e);
    } catch (ExecutionException e) {
      logger.atSevere().withCause(e.getCause()).log("Optimization run failed");
      Throwables.throwIfUnchecked(e.getCause());
      throw new IllegalStateException("Optimization run failed", e.getCause());
    }
  }
}

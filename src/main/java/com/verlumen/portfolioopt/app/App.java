package com.verlumen.portfolioopt.app;

import com.google.common.flogger.FluentLogger;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.google.inject.Injector;
import com.verlumen.portfolioopt.objective.OptimizationProblem;
import com.verlumen.portfolioopt.returns.PriceCsvLoader;
import com.verlumen.portfolioopt.returns.ReturnMatrix;
import com.verlumen.portfolioopt.selection.MultiRunSelector;
import com.verlumen.portfolioopt.selection.SelectionReport;
import java.nio.file.Paths;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.Namespace;

final class App {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final OptimizerConfig config;
  private final PriceCsvLoader priceCsvLoader;
  private final MultiRunSelector multiRunSelector;
  private final ResultReporter resultReporter;

  @Inject
  App(
      OptimizerConfig config,
      PriceCsvLoader priceCsvLoader,
      MultiRunSelector multiRunSelector,
      ResultReporter resultReporter) {
    this.config = config;
    this.priceCsvLoader = priceCsvLoader;
    this.multiRunSelector = multiRunSelector;
    this.resultReporter = resultReporter;
  }

  SelectionReport run() {
    ReturnMatrix returns =
        priceCsvLoader.load(config.pricesCsv()).selectTopByMeanReturn(config.topAssets());
    logger.atInfo().log("Optimizing over %s", returns.assetNames());
    OptimizationProblem problem = OptimizationProblem.fromReturns(returns);

    SelectionReport report =
        multiRunSelector.select(problem, config.engineParams(), config.runs(), config.seed());
    resultReporter.report(problem, report, config.topWeights());
    return report;
  }

  public static void main(String[] args) throws Exception {
    logger.atInfo().log("Portfolio optimizer starting up with %d arguments", args.length);
    ArgumentParser parser = createParser();
    OptimizerConfig config;
    try {
      config = parseConfig(parser, args);
    } catch (ArgumentParserException e) {
      parser.handleError(e);
      System.exit(2);
      return;
    }

    try {
      OptimizerModule module = OptimizerModule.create(config);
      Injector injector = Guice.createInjector(module);
      try {
        injector.getInstance(App.class).run();
      } finally {
        injector.getInstance(ExecutorService.class).shutdownNow();
      }
    } catch (Exception e) {
      logger.atSevere().withCause(e).log("Fatal error while optimizing portfolios");
      throw e;
    }
  }

  static OptimizerConfig parseConfig(ArgumentParser parser, String... args)
      throws ArgumentParserException {
    Namespace namespace = parser.parseArgs(args);
    int topAssets = namespace.getInt("topAssets");
    Long seed = namespace.getLong("seed");
    if (seed == null) {
      seed = ThreadLocalRandom.current().nextLong();
      logger.atInfo().log("No seed given, using %d", seed);
    }
    Integer topWeights = namespace.getInt("topWeights");
    return OptimizerConfig.builder()
        .setPricesCsv(Paths.get(namespace.getString("pricesCsv")))
        .setTopAssets(topAssets)
        .setRuns(namespace.getInt("runs"))
        .setGenerations(namespace.getInt("generations"))
        .setBatPopulation(namespace.getInt("batPopulation"))
        .setGeneticPopulation(namespace.getInt("geneticPopulation"))
        .setMutationRate(namespace.getDouble("mutationRate"))
        .setSwarmPopulation(namespace.getInt("swarmPopulation"))
        .setWolfPopulation(namespace.getInt("wolfPopulation"))
        .setSeed(seed)
        .setParallelism(namespace.getInt("parallelism"))
        .setTopWeights(topWeights == null ? topAssets : topWeights)
        .build();
  }

  static ArgumentParser createParser() {
    ArgumentParser parser =
        ArgumentParsers.newFor("PortfolioOptimizer")
            .build()
            .defaultHelp(true)
            .description(
                "Searches for maximum Sharpe ratio portfolios with swarm and evolutionary engines");

    // Input data
    parser.addArgument("--pricesCsv")
        .required(true)
        .help("Long-format price file with date, close and Name columns");

    parser.addArgument("--topAssets")
        .type(Integer.class)
        .setDefault(10)
        .help("Number of highest mean return assets to optimize over");

    // Search budget
    parser.addArgument("--runs")
        .type(Integer.class)
        .setDefault(5)
        .help("Independent runs per engine; the best one is reported");

    parser.addArgument("--generations")
        .type(Integer.class)
        .setDefault(100)
        .help("Generations per run");

    parser.addArgument("--batPopulation")
        .type(Integer.class)
        .setDefault(30)
        .help("Bats per run");

    parser.addArgument("--geneticPopulation")
        .type(Integer.class)
        .setDefault(50)
        .help("Genetic algorithm population size");

    parser.addArgument("--mutationRate")
        .type(Double.class)
        .setDefault(0.1)
        .help("Probability that a genetic offspring is mutated");

    parser.addArgument("--swarmPopulation")
        .type(Integer.class)
        .setDefault(30)
        .help("Particles per run");

    parser.addArgument("--wolfPopulation")
        .type(Integer.class)
        .setDefault(30)
        .help("Wolves per run (at least 3)");

    // Execution
    parser.addArgument("--seed")
        .type(Long.class)
        .help("Master random seed (default: random)");

    parser.addArgument("--parallelism")
        .type(Integer.class)
        .setDefault(1)
        .help("Runs executed concurrently");

    parser.addArgument("--topWeights")
        .type(Integer.class)
        .help("Weights listed per engine in the report (default: value of --topAssets)");

    return parser;
  }
}

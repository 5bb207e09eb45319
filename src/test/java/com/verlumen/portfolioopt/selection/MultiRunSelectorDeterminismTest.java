package com.verlumen.portfolioopt.selection;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableMap;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.verlumen.portfolioopt.engines.EngineParams;
import com.verlumen.portfolioopt.engines.EngineType;
import com.verlumen.portfolioopt.engines.EnginesModule;
import com.verlumen.portfolioopt.objective.ObjectiveModule;
import com.verlumen.portfolioopt.objective.OptimizationProblem;
import java.util.concurrent.ExecutorService;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Runs the real engines to check that reports depend only on the seed. */
@RunWith(JUnit4.class)
public class MultiRunSelectorDeterminismTest {
  private static final OptimizationProblem PROBLEM =
      OptimizationProblem.of(
          new double[] {0.010, 0.020, 0.015},
          new double[][] {
            {0.0004, 0.0001, 0.0000},
            {0.0001, 0.0009, 0.0002},
            {0.0000, 0.0002, 0.0006},
          });
  private static final ImmutableMap<EngineType, EngineParams> PARAMS =
      ImmutableMap.of(
          EngineType.BAT, EngineParams.create(8, 10),
          EngineType.GENETIC, EngineParams.create(8, 10),
          EngineType.PARTICLE_SWARM, EngineParams.create(8, 10),
          EngineType.GREY_WOLF, EngineParams.create(8, 10));

  private Injector sequential;
  private Injector parallel;

  @Before
  public void setUp() {
    sequential = createInjector(1);
    parallel = createInjector(4);
  }

  @After
  public void tearDown() {
    parallel.getInstance(ExecutorService.class).shutdownNow();
  }

  private static Injector createInjector(int parallelism) {
    return Guice.createInjector(
        EnginesModule.create(), ObjectiveModule.create(), SelectionModule.create(parallelism));
  }

  @Test
  public void select_sameSeed_givesSameReport() {
    MultiRunSelector selector = sequential.getInstance(MultiRunSelector.class);

    SelectionReport first = selector.select(PROBLEM, PARAMS, 3, 99L);
    SelectionReport second = selector.select(PROBLEM, PARAMS, 3, 99L);

    assertThat(first).isEqualTo(second);
  }

  @Test
  public void select_parallelRuns_matchSequentialRuns() {
    SelectionReport expected =
        sequential.getInstance(MultiRunSelector.class).select(PROBLEM, PARAMS, 4, 7L);

    SelectionReport actual =
        parallel.getInstance(MultiRunSelector.class).select(PROBLEM, PARAMS, 4, 7L);

    assertThat(actual).isEqualTo(expected);
  }

  @Test
  public void select_runsUseDifferentRandomStreams() {
    SelectionReport report =
        sequential.getInstance(MultiRunSelector.class).select(PROBLEM, PARAMS, 3, 5L);

    // Identical streams would make every run of an engine reach the same ratio.
    assertThat(report.summaries().get(EngineType.BAT).runSharpeRatios())
        .containsNoDuplicates();
  }

  @Test
  public void select_reportsEveryRequestedEngine() {
    SelectionReport report =
        sequential.getInstance(MultiRunSelector.class).select(PROBLEM, PARAMS, 2, 3L);

    assertThat(report.summaries().keySet()).containsExactlyElementsIn(EngineType.values());
    for (EngineSummary summary : report.summaries().values()) {
      assertThat(summary.runSharpeRatios()).hasSize(2);
      assertThat(summary.bestRun().engineType()).isEqualTo(summary.engineType());
    }
  }
}

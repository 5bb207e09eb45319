package com.verlumen.portfolioopt.app;

import com.google.auto.value.AutoValue;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.verlumen.portfolioopt.engines.EnginesModule;
import com.verlumen.portfolioopt.objective.ObjectiveModule;
import com.verlumen.portfolioopt.returns.ReturnsModule;
import com.verlumen.portfolioopt.selection.SelectionModule;
import java.io.PrintStream;

@AutoValue
abstract class OptimizerModule extends AbstractModule {
  static OptimizerModule create(OptimizerConfig config) {
    return new AutoValue_OptimizerModule(config);
  }

  abstract OptimizerConfig config();

  @Override
  protected void configure() {
    bind(ResultReporter.class).to(ResultReporterImpl.class);

    install(EnginesModule.create());
    install(ObjectiveModule.create());
    install(ReturnsModule.create());
    install(SelectionModule.create(config().parallelism()));
  }

  @Provides
  OptimizerConfig provideOptimizerConfig() {
    return config();
  }

  @Provides
  PrintStream provideReportStream() {
    return System.out;
  }
}

package com.verlumen.portfolioopt.objective;

import com.google.inject.AbstractModule;

public final class ObjectiveModule extends AbstractModule {
  public static ObjectiveModule create() {
    return new ObjectiveModule();
  }

  private ObjectiveModule() {}

  @Override
  protected void configure() {
    bind(FitnessEvaluator.class).to(NegativeSharpeEvaluator.class);
    bind(SimplexProjector.class).to(SimplexProjectorImpl.class);
    bind(SimplexSampler.class).to(DirichletSimplexSampler.class);
  }
}

package com.verlumen.portfolioopt.engines;

import com.google.inject.AbstractModule;
import com.google.inject.multibindings.MapBinder;

public final class EnginesModule extends AbstractModule {
  public static EnginesModule create() {
    return new EnginesModule();
  }

  private EnginesModule() {}

  @Override
  protected void configure() {
    MapBinder<EngineType, OptimizationEngine> engines =
        MapBinder.newMapBinder(binder(), EngineType.class, OptimizationEngine.class);
    engines.addBinding(EngineType.BAT).to(BatAlgorithmEngine.class);
    engines.addBinding(EngineType.GENETIC).to(GeneticAlgorithmEngine.class);
    engines.addBinding(EngineType.PARTICLE_SWARM).to(ParticleSwarmEngine.class);
    engines.addBinding(EngineType.GREY_WOLF).to(GreyWolfEngine.class);
  }
}

package com.verlumen.portfolioopt.returns;

import com.google.inject.AbstractModule;

public final class ReturnsModule extends AbstractModule {
  public static ReturnsModule create() {
    return new ReturnsModule();
  }

  private ReturnsModule() {}

  @Override
  protected void configure() {
    bind(PriceCsvLoader.class).to(PriceCsvLoaderImpl.class);
  }
}

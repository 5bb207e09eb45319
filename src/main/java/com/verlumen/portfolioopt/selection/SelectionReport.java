package com.verlumen.portfolioopt.selection;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import com.verlumen.portfolioopt.engines.EngineType;

/** Per-engine summaries of a multi-run comparison, in {@link EngineType} order. */
@AutoValue
public abstract class SelectionReport {
  public static SelectionReport create(
      int runs, long seed, ImmutableMap<EngineType, EngineSummary> summaries) {
    return new AutoValue_SelectionReport(runs, seed, summaries);
  }

  public abstract int runs();

  /** Master seed from which every run's random source was derived. */
  public abstract long seed();

  public abstract ImmutableMap<EngineType, EngineSummary> summaries();
}

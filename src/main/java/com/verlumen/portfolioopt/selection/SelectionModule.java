package com.verlumen.portfolioopt.selection;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@AutoValue
public abstract class SelectionModule extends AbstractModule {
  /**
   * @param parallelism number of runs executed at once; 1 runs everything on the calling thread
   */
  public static SelectionModule create(int parallelism) {
    checkArgument(parallelism > 0, "Parallelism must be positive: %s", parallelism);
    return new AutoValue_SelectionModule(parallelism);
  }

  abstract int parallelism();

  @Override
  protected void configure() {
    bind(MultiRunSelector.class).to(MultiRunSelectorImpl.class);
  }

  @Provides
  @Singleton
  ExecutorService provideExecutorService() {
    if (parallelism() == 1) {
      return MoreExecutors.newDirectExecutorService();
    }
    return Executors.newFixedThreadPool(
        parallelism(),
        new ThreadFactoryBuilder().setNameFormat("optimizer-run-%d").setDaemon(true).build());
  }
}

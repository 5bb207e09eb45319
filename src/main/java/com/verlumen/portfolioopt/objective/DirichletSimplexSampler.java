package com.verlumen.portfolioopt.objective;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import org.apache.commons.math3.distribution.GammaDistribution;
import org.apache.commons.math3.random.RandomGenerator;

/**
 * Symmetric Dirichlet sampler with every concentration equal to one: independent Gamma(1, 1)
 * draws normalised by their sum.
 */
final class DirichletSimplexSampler implements SimplexSampler {
  private static final double CONCENTRATION = 1.0;
  private static final double SCALE = 1.0;

  private final SimplexProjector projector;

  @Inject
  DirichletSimplexSampler(SimplexProjector projector) {
    this.projector = projector;
  }

  @Override
  public ImmutableList<double[]> sample(int count, int dimension, RandomGenerator random) {
    checkArgument(count > 0, "Sample count must be positive: %s", count);
    checkArgument(dimension > 0, "Dimension must be positive: %s", dimension);
    GammaDistribution gamma = new GammaDistribution(random, CONCENTRATION, SCALE);
    ImmutableList.Builder<double[]> samples = ImmutableList.builderWithExpectedSize(count);
    for (int i = 0; i < count; i++) {
      double[] draws = new double[dimension];
      for (int d = 0; d < dimension; d++) {
        draws[d] = gamma.sample();
      }
      samples.add(projector.project(draws));
    }
    return samples.build();
  }
}

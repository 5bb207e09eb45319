package com.verlumen.portfolioopt.objective;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.inject.Inject;
import java.util.Arrays;

final class SimplexProjectorImpl implements SimplexProjector {
  @Inject
  SimplexProjectorImpl() {}

  @Override
  public double[] project(double[] vector) {
    checkArgument(vector.length > 0, "Cannot project an empty vector");
    double[] projected = new double[vector.length];
    double sum = 0.0;
    for (int i = 0; i < vector.length; i++) {
      // NaN components are clamped along with negative ones.
      projected[i] = vector[i] > 0.0 ? vector[i] : 0.0;
      sum += projected[i];
    }
    if (sum == 0.0 || !Double.isFinite(sum)) {
      Arrays.fill(projected, 1.0 / vector.length);
      return projected;
    }
    for (int i = 0; i < projected.length; i++) {
      projected[i] /= sum;
    }
    return projected;
  }
}

package com.verlumen.portfolioopt.engines;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * Orders fitness values for minimisation. {@code NaN} ranks after every number, so candidates
 * without a defined Sharpe ratio never lead a population.
 */
final class FitnessRanking {
  private FitnessRanking() {}

  /** Index of the lowest fitness; the first one on ties. */
  static int bestIndex(double[] fitness) {
    checkArgument(fitness.length > 0, "Cannot rank an empty population");
    int best = 0;
    for (int i = 1; i < fitness.length; i++) {
      if (Double.compare(fitness[i], fitness[best]) < 0) {
        best = i;
      }
    }
    return best;
  }

  /** Member indices sorted by ascending fitness; stable, so ties keep population order. */
  static int[] ascendingOrder(double[] fitness) {
    return IntStream.range(0, fitness.length)
        .boxed()
        .sorted(Comparator.comparingDouble(i -> fitness[i]))
        .mapToInt(Integer::intValue)
        .toArray();
  }

  /**
   * Whether {@code candidate} ranks no later than {@code incumbent}. A NaN candidate never
   * qualifies, while any number qualifies against a NaN incumbent.
   */
  static boolean isNoWorse(double candidate, double incumbent) {
    return !Double.isNaN(candidate) && Double.compare(candidate, incumbent) <= 0;
  }

  /** Whether {@code candidate} ranks strictly before {@code incumbent}. */
  static boolean isBetter(double candidate, double incumbent) {
    return Double.compare(candidate, incumbent) < 0;
  }
}

package com.verlumen.portfolioopt.returns;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;
import org.apache.commons.math3.stat.StatUtils;

/**
 * Immutable table of fractional period-over-period returns, one row per period and one column per
 * asset. Dimensions are checked once at construction and entries are always finite.
 */
public final class ReturnMatrix {
  private final ImmutableList<String> assetNames;
  private final ImmutableList<String> periods;
  private final double[][] values;

  private ReturnMatrix(
      ImmutableList<String> assetNames, ImmutableList<String> periods, double[][] values) {
    this.assetNames = assetNames;
    this.periods = periods;
    this.values = values;
  }

  /**
   * Creates a return matrix.
   *
   * @param assetNames distinct column labels
   * @param periods row labels, usually the closing date of each period
   * @param values row-major returns, {@code values[period][asset]}
   * @throws IllegalArgumentException if the shapes disagree or any entry is not finite
   */
  public static ReturnMatrix create(
      List<String> assetNames, List<String> periods, double[][] values) {
    checkArgument(!assetNames.isEmpty(), "Return matrix needs at least one asset");
    checkArgument(!periods.isEmpty(), "Return matrix needs at least one period");
    checkArgument(
        ImmutableSet.copyOf(assetNames).size() == assetNames.size(),
        "Asset names must be distinct: %s",
        assetNames);
    checkArgument(
        values.length == periods.size(),
        "Expected %s rows but got %s",
        periods.size(),
        values.length);

    double[][] copy = new double[values.length][];
    for (int t = 0; t < values.length; t++) {
      checkArgument(
          values[t].length == assetNames.size(),
          "Row %s has %s columns, expected %s",
          t,
          values[t].length,
          assetNames.size());
      for (int a = 0; a < values[t].length; a++) {
        checkArgument(
            Double.isFinite(values[t][a]),
            "Non-finite return for %s in period %s",
            assetNames.get(a),
            periods.get(t));
      }
      copy[t] = values[t].clone();
    }
    return new ReturnMatrix(ImmutableList.copyOf(assetNames), ImmutableList.copyOf(periods), copy);
  }

  public ImmutableList<String> assetNames() {
    return assetNames;
  }

  public ImmutableList<String> periods() {
    return periods;
  }

  public int assetCount() {
    return assetNames.size();
  }

  public int periodCount() {
    return periods.size();
  }

  public double get(int period, int asset) {
    checkElementIndex(period, periodCount(), "period");
    checkElementIndex(asset, assetCount(), "asset");
    return values[period][asset];
  }

  /** Returns a copy of the returns of one asset, in period order. */
  public double[] column(int asset) {
    checkElementIndex(asset, assetCount(), "asset");
    double[] column = new double[periodCount()];
    for (int t = 0; t < column.length; t++) {
      column[t] = values[t][asset];
    }
    return column;
  }

  /** Arithmetic mean return of every asset. */
  public double[] meanReturns() {
    double[] means = new double[assetCount()];
    for (int a = 0; a < means.length; a++) {
      means[a] = StatUtils.mean(column(a));
    }
    return means;
  }

  /**
   * Keeps the {@code count} assets with the highest mean return, ordered by descending mean. Ties
   * keep their original column order. A count larger than the number of assets keeps all of them.
   */
  public ReturnMatrix selectTopByMeanReturn(int count) {
    checkArgument(count >= 1, "Asset count must be positive: %s", count);
    double[] means = meanReturns();
    int[] selected =
        IntStream.range(0, assetCount())
            .boxed()
            .sorted(Comparator.comparingDouble((Integer a) -> means[a]).reversed())
            .limit(count)
            .mapToInt(Integer::intValue)
            .toArray();

    ImmutableList.Builder<String> names = ImmutableList.builder();
    for (int a : selected) {
      names.add(assetNames.get(a));
    }
    double[][] subset = new double[periodCount()][selected.length];
    for (int t = 0; t < subset.length; t++) {
      for (int k = 0; k < selected.length; k++) {
        subset[t][k] = values[t][selected[k]];
      }
    }
    return new ReturnMatrix(names.build(), periods, subset);
  }

  /** Returns a row-major copy of the matrix. */
  public double[][] toArray() {
    double[][] copy = new double[values.length][];
    for (int t = 0; t < values.length; t++) {
      copy[t] = values[t].clone();
    }
    return copy;
  }

  @Override
  public String toString() {
    return String.format(
        "ReturnMatrix{assets=%s, periods=%d}", assetNames, periods.size());
  }
}

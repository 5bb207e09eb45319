package com.verlumen.portfolioopt.objective;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.verlumen.portfolioopt.returns.ReturnMatrix;
import java.util.stream.IntStream;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.stat.correlation.Covariance;

/**
 * Mean return vector and covariance matrix shared, read-only, by every engine of a run. The
 * public accessors hand out copies; evaluation in this package reads the private originals.
 */
@AutoValue
public abstract class OptimizationProblem {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  /**
   * Derives the arithmetic mean and the bias-corrected sample covariance of every asset column.
   *
   * @throws IllegalArgumentException if the matrix has fewer than two periods
   */
  public static OptimizationProblem fromReturns(ReturnMatrix returns) {
    checkArgument(
        returns.periodCount() >= 2,
        "Covariance needs at least two periods but got %s",
        returns.periodCount());
    int assets = returns.assetCount();
    double[][] columns = new double[assets][];
    for (int a = 0; a < assets; a++) {
      columns[a] = returns.column(a);
    }

    Covariance covariance = new Covariance();
    double[][] sigma = new double[assets][assets];
    for (int i = 0; i < assets; i++) {
      for (int j = i; j < assets; j++) {
        sigma[i][j] = covariance.covariance(columns[i], columns[j]);
        sigma[j][i] = sigma[i][j];
      }
    }
    return create(
        returns.assetNames(),
        new ArrayRealVector(returns.meanReturns(), false),
        new Array2DRowRealMatrix(sigma, false));
  }

  /** Builds a problem with generated asset names, mostly useful for synthetic inputs. */
  public static OptimizationProblem of(double[] meanReturns, double[][] covariance) {
    ImmutableList<String> names =
        IntStream.range(0, meanReturns.length)
            .mapToObj(i -> "asset-" + i)
            .collect(ImmutableList.toImmutableList());
    return create(
        names, new ArrayRealVector(meanReturns), MatrixUtils.createRealMatrix(covariance));
  }

  public static OptimizationProblem create(
      ImmutableList<String> assetNames, RealVector meanReturns, RealMatrix covariance) {
    int dimension = meanReturns.getDimension();
    checkArgument(dimension > 0, "Problem needs at least one asset");
    checkArgument(
        assetNames.size() == dimension,
        "Got %s asset names for %s mean returns",
        assetNames.size(),
        dimension);
    checkArgument(
        covariance.getRowDimension() == dimension && covariance.getColumnDimension() == dimension,
        "Covariance must be %sx%s but is %sx%s",
        dimension,
        dimension,
        covariance.getRowDimension(),
        covariance.getColumnDimension());
    for (int i = 0; i < dimension; i++) {
      if (!(covariance.getEntry(i, i) > 0.0)) {
        logger.atWarning().log(
            "Asset %s has variance %s; some portfolios will score NaN",
            assetNames.get(i),
            covariance.getEntry(i, i));
      }
    }
    return new AutoValue_OptimizationProblem(assetNames, meanReturns.copy(), covariance.copy());
  }

  public abstract ImmutableList<String> assetNames();

  abstract RealVector meanVector();

  abstract RealMatrix covarianceMatrix();

  /** Returns a copy of the expected return of every asset. */
  public RealVector meanReturns() {
    return meanVector().copy();
  }

  /** Returns a copy of the covariance of asset returns. */
  public RealMatrix covariance() {
    return covarianceMatrix().copy();
  }

  public int dimension() {
    return meanVector().getDimension();
  }
}

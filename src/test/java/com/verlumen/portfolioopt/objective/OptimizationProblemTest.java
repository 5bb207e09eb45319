package com.verlumen.portfolioopt.objective;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.verlumen.portfolioopt.returns.ReturnMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.MatrixUtils;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class OptimizationProblemTest {
  @Test
  public void fromReturns_derivesMeanAndSampleCovariance() {
    ReturnMatrix returns =
        ReturnMatrix.create(
            ImmutableList.of("A", "B"),
            ImmutableList.of("1", "2", "3"),
            new double[][] {{0.01, 0.02}, {0.03, 0.00}, {0.02, 0.04}});

    OptimizationProblem problem = OptimizationProblem.fromReturns(returns);

    assertThat(problem.assetNames()).containsExactly("A", "B").inOrder();
    assertThat(problem.dimension()).isEqualTo(2);
    assertThat(problem.meanReturns().getEntry(0)).isWithin(1e-12).of(0.02);
    assertThat(problem.meanReturns().getEntry(1)).isWithin(1e-12).of(0.02);
    // Divisor n - 1 = 2.
    assertThat(problem.covariance().getEntry(0, 0)).isWithin(1e-12).of(0.0001);
    assertThat(problem.covariance().getEntry(1, 1)).isWithin(1e-12).of(0.0004);
    assertThat(problem.covariance().getEntry(0, 1)).isWithin(1e-12).of(-0.0001);
    assertThat(problem.covariance().getEntry(1, 0))
        .isEqualTo(problem.covariance().getEntry(0, 1));
  }

  @Test
  public void fromReturns_singleAsset_works() {
    ReturnMatrix returns =
        ReturnMatrix.create(
            ImmutableList.of("ONLY"), ImmutableList.of("1", "2"), new double[][] {{0.01}, {0.03}});

    OptimizationProblem problem = OptimizationProblem.fromReturns(returns);

    assertThat(problem.dimension()).isEqualTo(1);
    assertThat(problem.covariance().getEntry(0, 0)).isWithin(1e-12).of(0.0002);
  }

  @Test
  public void fromReturns_singlePeriod_throws() {
    ReturnMatrix returns =
        ReturnMatrix.create(ImmutableList.of("A"), ImmutableList.of("1"), new double[][] {{0.01}});

    assertThrows(IllegalArgumentException.class, () -> OptimizationProblem.fromReturns(returns));
  }

  @Test
  public void create_nonSquareCovariance_throws() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            OptimizationProblem.create(
                ImmutableList.of("A", "B"),
                new ArrayRealVector(new double[] {0.1, 0.2}),
                MatrixUtils.createRealMatrix(new double[][] {{1.0, 0.0}})));
  }

  @Test
  public void create_copiesInputs() {
    ArrayRealVector mean = new ArrayRealVector(new double[] {0.1});

    OptimizationProblem problem =
        OptimizationProblem.create(
            ImmutableList.of("A"), mean, MatrixUtils.createRealMatrix(new double[][] {{1.0}}));
    mean.setEntry(0, 5.0);

    assertThat(problem.meanReturns().getEntry(0)).isEqualTo(0.1);
  }

  @Test
  public void of_generatesAssetNames() {
    OptimizationProblem problem =
        OptimizationProblem.of(new double[] {0.1, 0.2}, new double[][] {{1, 0}, {0, 1}});

    assertThat(problem.assetNames()).containsExactly("asset-0", "asset-1").inOrder();
  }

  @Test
  public void accessors_returnCopiesThatCannotAlterProblem() {
    OptimizationProblem problem =
        OptimizationProblem.of(
            new double[] {0.01, 0.02}, new double[][] {{0.0004, 0.0}, {0.0, 0.0009}});

    problem.meanReturns().setEntry(0, 5.0);
    problem.covariance().setEntry(1, 1, -1.0);

    assertThat(problem.meanReturns().getEntry(0)).isEqualTo(0.01);
    assertThat(problem.covariance().getEntry(1, 1)).isEqualTo(0.0009);
  }
}

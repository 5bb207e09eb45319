package com.verlumen.portfolioopt.returns;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ReturnMatrixTest {
  private static final ImmutableList<String> ASSETS = ImmutableList.of("AAA", "BBB", "CCC");
  private static final ImmutableList<String> PERIODS =
      ImmutableList.of("2020-01-02", "2020-01-03", "2020-01-06");

  private static ReturnMatrix sampleMatrix() {
    return ReturnMatrix.create(
        ASSETS,
        PERIODS,
        new double[][] {
          {0.01, 0.03, -0.01},
          {0.02, 0.01, 0.00},
          {0.00, 0.02, 0.01},
        });
  }

  @Test
  public void meanReturns_averagesEachColumn() {
    double[] means = sampleMatrix().meanReturns();

    assertThat(means[0]).isWithin(1e-12).of(0.01);
    assertThat(means[1]).isWithin(1e-12).of(0.02);
    assertThat(means[2]).isWithin(1e-12).of(0.0);
  }

  @Test
  public void selectTopByMeanReturn_keepsHighestMeansInDescendingOrder() {
    ReturnMatrix top = sampleMatrix().selectTopByMeanReturn(2);

    assertThat(top.assetNames()).containsExactly("BBB", "AAA").inOrder();
    assertThat(top.column(0)).isEqualTo(new double[] {0.03, 0.01, 0.02});
    assertThat(top.periods()).isEqualTo(PERIODS);
  }

  @Test
  public void selectTopByMeanReturn_tiedMeans_keepColumnOrder() {
    ReturnMatrix matrix =
        ReturnMatrix.create(
            ImmutableList.of("LATE", "EARLY", "LOW"),
            ImmutableList.of("1", "2"),
            new double[][] {{0.02, 0.02, 0.01}, {0.04, 0.04, 0.01}});

    ReturnMatrix top = matrix.selectTopByMeanReturn(2);

    assertThat(top.assetNames()).containsExactly("LATE", "EARLY").inOrder();
  }

  @Test
  public void selectTopByMeanReturn_countAboveAssetCount_keepsAllAssets() {
    ReturnMatrix top = sampleMatrix().selectTopByMeanReturn(10);

    assertThat(top.assetNames()).containsExactly("BBB", "AAA", "CCC").inOrder();
  }

  @Test
  public void selectTopByMeanReturn_nonPositiveCount_throws() {
    assertThrows(IllegalArgumentException.class, () -> sampleMatrix().selectTopByMeanReturn(0));
  }

  @Test
  public void create_copiesInput() {
    double[][] values = {{0.01}, {0.02}};
    ReturnMatrix matrix =
        ReturnMatrix.create(ImmutableList.of("A"), ImmutableList.of("1", "2"), values);

    values[0][0] = 99.0;

    assertThat(matrix.get(0, 0)).isEqualTo(0.01);
  }

  @Test
  public void create_rowWithWrongWidth_throws() {
    IllegalArgumentException thrown =
        assertThrows(
            IllegalArgumentException.class,
            () ->
                ReturnMatrix.create(
                    ImmutableList.of("A", "B"),
                    ImmutableList.of("1", "2"),
                    new double[][] {{0.01, 0.02}, {0.03}}));

    assertThat(thrown).hasMessageThat().contains("Row 1 has 1 columns");
  }

  @Test
  public void create_nonFiniteEntry_throws() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            ReturnMatrix.create(
                ImmutableList.of("A"), ImmutableList.of("1"), new double[][] {{Double.NaN}}));
  }

  @Test
  public void create_duplicateAssetNames_throws() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            ReturnMatrix.create(
                ImmutableList.of("A", "A"), ImmutableList.of("1"), new double[][] {{0.1, 0.2}}));
  }
}

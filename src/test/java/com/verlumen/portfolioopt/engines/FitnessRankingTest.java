package com.verlumen.portfolioopt.engines;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class FitnessRankingTest {
  @Test
  public void bestIndex_returnsLowestFitness() {
    assertThat(FitnessRanking.bestIndex(new double[] {-0.2, -0.9, 0.4})).isEqualTo(1);
  }

  @Test
  public void bestIndex_tie_returnsFirst() {
    assertThat(FitnessRanking.bestIndex(new double[] {0.3, -0.5, -0.5})).isEqualTo(1);
  }

  @Test
  public void bestIndex_skipsNaN() {
    assertThat(FitnessRanking.bestIndex(new double[] {Double.NaN, 0.7, -0.1})).isEqualTo(2);
  }

  @Test
  public void bestIndex_allNaN_returnsFirst() {
    assertThat(FitnessRanking.bestIndex(new double[] {Double.NaN, Double.NaN})).isEqualTo(0);
  }

  @Test
  public void bestIndex_empty_throws() {
    assertThrows(IllegalArgumentException.class, () -> FitnessRanking.bestIndex(new double[0]));
  }

  @Test
  public void ascendingOrder_sortsStablyWithNaNLast() {
    int[] order = FitnessRanking.ascendingOrder(new double[] {0.5, Double.NaN, -1.0, 0.5, -2.0});

    assertThat(order).isEqualTo(new int[] {4, 2, 0, 3, 1});
  }

  @Test
  public void isBetter_isStrict() {
    assertThat(FitnessRanking.isBetter(-1.0, -0.5)).isTrue();
    assertThat(FitnessRanking.isBetter(-0.5, -0.5)).isFalse();
    assertThat(FitnessRanking.isBetter(Double.NaN, -0.5)).isFalse();
    assertThat(FitnessRanking.isBetter(-0.5, Double.NaN)).isTrue();
  }

  @Test
  public void isNoWorse_acceptsTiesAndReplacesNaN() {
    assertThat(FitnessRanking.isNoWorse(-0.5, -0.5)).isTrue();
    assertThat(FitnessRanking.isNoWorse(-0.4, -0.5)).isFalse();
    assertThat(FitnessRanking.isNoWorse(0.3, Double.NaN)).isTrue();
    assertThat(FitnessRanking.isNoWorse(Double.NaN, -0.5)).isFalse();
    assertThat(FitnessRanking.isNoWorse(Double.NaN, Double.NaN)).isFalse();
  }
}

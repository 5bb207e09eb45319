package com.verlumen.portfolioopt.returns;

import java.nio.file.Path;

/**
 * Loads long-format daily prices ({@code date,open,high,low,close,volume,Name}) and reshapes them
 * into a {@link ReturnMatrix}.
 */
public interface PriceCsvLoader {
  /**
   * Reads the file, pivots close prices to one column per asset, forward-fills gaps and converts
   * the prices into period-over-period returns. Periods in which some asset still has no price are
   * dropped.
   *
   * @param csvPath the price file
   * @return the return matrix, assets ordered by name and periods by date
   * @throws java.io.UncheckedIOException if the file cannot be read
   * @throws IllegalArgumentException if required columns are missing or fewer than two return
   *     periods remain
   */
  ReturnMatrix load(Path csvPath);
}

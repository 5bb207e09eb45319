package com.verlumen.portfolioopt.returns;

import static com.google.common.base.Preconditions.checkArgument;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Table;
import com.google.common.collect.TreeBasedTable;
import com.google.common.flogger.FluentLogger;
import com.google.common.primitives.Doubles;
import com.google.inject.Inject;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

final class PriceCsvLoaderImpl implements PriceCsvLoader {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final Splitter CSV_SPLITTER = Splitter.on(',').trimResults();

  static final String DATE_COLUMN = "date";
  static final String CLOSE_COLUMN = "close";
  static final String NAME_COLUMN = "Name";

  @Inject
  PriceCsvLoaderImpl() {}

  @Override
  public ReturnMatrix load(Path csvPath) {
    logger.atInfo().log("Loading prices from %s", csvPath);
    Table<String, String, Double> closes = readCloses(csvPath);
    checkArgument(!closes.isEmpty(), "No prices found in %s", csvPath);

    List<String> dates = new ArrayList<>(closes.rowKeySet());
    List<String> assets = new ArrayList<>(closes.columnKeySet());
    double[][] prices = forwardFill(closes, dates, assets);

    List<String> periods = new ArrayList<>();
    List<double[]> rows = new ArrayList<>();
    int incompleteRows = 0;
    for (int t = 1; t < dates.size(); t++) {
      double[] row = new double[assets.size()];
      boolean complete = true;
      for (int a = 0; a < row.length; a++) {
        row[a] = prices[t][a] / prices[t - 1][a] - 1.0;
        complete &= Double.isFinite(row[a]);
      }
      if (complete) {
        periods.add(dates.get(t));
        rows.add(row);
      } else {
        incompleteRows++;
      }
    }
    if (incompleteRows > 0) {
      logger.atWarning().log(
          "Dropped %d periods with missing prices out of %d", incompleteRows, dates.size() - 1);
    }
    checkArgument(
        rows.size() >= 2,
        "Need at least two complete return periods but %s has %s",
        csvPath,
        rows.size());

    ReturnMatrix matrix = ReturnMatrix.create(assets, periods, rows.toArray(new double[0][]));
    logger.atInfo().log(
        "Loaded %d assets over %d return periods", matrix.assetCount(), matrix.periodCount());
    return matrix;
  }

  private static Table<String, String, Double> readCloses(Path csvPath) {
    Table<String, String, Double> closes = TreeBasedTable.create();
    try (BufferedReader reader = Files.newBufferedReader(csvPath, UTF_8)) {
      String headerLine = reader.readLine();
      checkArgument(headerLine != null, "Price file %s is empty", csvPath);
      List<String> header = CSV_SPLITTER.splitToList(headerLine);
      int dateIndex = columnIndex(header, DATE_COLUMN);
      int closeIndex = columnIndex(header, CLOSE_COLUMN);
      int nameIndex = columnIndex(header, NAME_COLUMN);
      int required = Math.max(dateIndex, Math.max(closeIndex, nameIndex));

      int skipped = 0;
      String line;
      while ((line = reader.readLine()) != null) {
        if (line.isBlank()) {
          continue;
        }
        List<String> fields = CSV_SPLITTER.splitToList(line);
        Double close = fields.size() > required ? Doubles.tryParse(fields.get(closeIndex)) : null;
        if (close == null || fields.get(dateIndex).isEmpty() || fields.get(nameIndex).isEmpty()) {
          skipped++;
          continue;
        }
        closes.put(fields.get(dateIndex), fields.get(nameIndex), close);
      }
      if (skipped > 0) {
        logger.atWarning().log("Skipped %d rows without a usable close price", skipped);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to read price file " + csvPath, e);
    }
    return closes;
  }

  private static int columnIndex(List<String> header, String column) {
    for (int i = 0; i < header.size(); i++) {
      if (header.get(i).equalsIgnoreCase(column)) {
        return i;
      }
    }
    throw new IllegalArgumentException(
        "Missing column '" + column + "' in header " + ImmutableList.copyOf(header));
  }

  // Missing prices stay NaN until the first quote of the asset.
  private static double[][] forwardFill(
      Table<String, String, Double> closes, List<String> dates, List<String> assets) {
    double[][] prices = new double[dates.size()][assets.size()];
    double[] last = new double[assets.size()];
    Arrays.fill(last, Double.NaN);
    for (int t = 0; t < dates.size(); t++) {
      for (int a = 0; a < assets.size(); a++) {
        Double close = closes.get(dates.get(t), assets.get(a));
        if (close != null) {
          last[a] = close;
        }
        prices[t][a] = last[a];
      }
    }
    return prices;
  }
}

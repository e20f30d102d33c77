package io.github.brokerbench.results;

import java.util.List;

/**
 * Utility methods for statistical calculations over per-instance results.
 */
public final class StatisticalUtils {

  private StatisticalUtils() {}

  /**
   * Calculates mean and population standard deviation (divide by n, not n-1) since every
   * subscriber instance of the run is present, not a sample.
   *
   * @param values the values to analyze
   * @return statistics containing mean and standard deviation, zeros for no values
   */
  public static Stats calculateStats(List<? extends Number> values) {
    if (values == null || values.isEmpty()) {
      return new Stats(0.0, 0.0);
    }

    int n = values.size();
    double sum = 0.0;
    for (Number value : values) {
      sum += value.doubleValue();
    }
    double mean = sum / n;

    double sumSquaredDiffs = 0.0;
    for (Number value : values) {
      double diff = value.doubleValue() - mean;
      sumSquaredDiffs += diff * diff;
    }
    return new Stats(mean, Math.sqrt(sumSquaredDiffs / n));
  }

  /**
   * @param mean the arithmetic mean
   * @param stdDev the population standard deviation
   */
  public record Stats(double mean, double stdDev) {}
}

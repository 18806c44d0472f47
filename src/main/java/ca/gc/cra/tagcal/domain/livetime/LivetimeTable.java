package ca.gc.cra.tagcal.domain.livetime;

import java.util.Arrays;

/**
 * <strong>What:</strong> Observed-rate to livetime-factor curve for one segment.
 * <p><strong>Why:</strong> At high count rates the detector misses events; the factor returned here is the
 * fraction of time the detector was able to register them.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public final class LivetimeTable {
  private final double[] rates;
  private final double[] factors;
  private final double timestep;

  /**
   * Creates a table.
   *
   * @param rates sampled observed rates, strictly increasing
   * @param factors livetime factor per sampled rate
   * @param timestep width in seconds of the windows used for time-resolved estimation
   * @throws IllegalArgumentException when the arrays are empty, differ in length or the rate axis is not
   *     strictly increasing
   */
  public LivetimeTable(double[] rates, double[] factors, double timestep) {
    if (rates == null || factors == null || rates.length == 0) {
      throw new IllegalArgumentException("livetime table needs at least one sample");
    }
    if (rates.length != factors.length) {
      throw new IllegalArgumentException(
          "livetime table has " + rates.length + " rates but " + factors.length + " factors");
    }
    for (int i = 1; i < rates.length; i++) {
      if (!(rates[i] > rates[i - 1])) {
        throw new IllegalArgumentException(
            "livetime rate axis must be strictly increasing (row " + i + ": " + rates[i - 1] + " >= " + rates[i] + ")");
      }
    }
    this.rates = rates.clone();
    this.factors = factors.clone();
    this.timestep = timestep;
  }

  public double timestep() {
    return timestep;
  }

  public int size() {
    return rates.length;
  }

  public double[] rates() {
    return rates.clone();
  }

  public double[] factors() {
    return factors.clone();
  }

  /**
   * Interpolates the livetime factor for an observed count rate.
   *
   * <p>Non-positive rates and rates below the first sample give {@code 1}; rates at or above the last
   * sample give the last factor; a single-sample table always gives its only factor.</p>
   *
   * @param countRate observed count rate
   * @return livetime factor
   */
  public double determineLivetime(double countRate) {
    int n = rates.length;
    if (countRate <= 0.0) {
      return 1.0;
    }
    if (n == 1) {
      return factors[0];
    }
    if (countRate < rates[0]) {
      return 1.0;
    }
    if (countRate >= rates[n - 1]) {
      return factors[n - 1];
    }
    int upper = 1;
    while (countRate >= rates[upper]) {
      upper++;
    }
    double p = (countRate - rates[upper - 1]) / (rates[upper] - rates[upper - 1]);
    return factors[upper - 1] * (1.0 - p) + factors[upper] * p;
  }

  @Override
  public String toString() {
    return "LivetimeTable{rates=" + Arrays.toString(rates) + ", factors=" + Arrays.toString(factors)
        + ", timestep=" + timestep + '}';
  }
}

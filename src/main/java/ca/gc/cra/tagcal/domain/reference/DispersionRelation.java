package ca.gc.cra.tagcal.domain.reference;

import java.util.Arrays;

/**
 * Polynomial pixel-to-wavelength relation {@code lambda(x) = sum c[i] * (x + delta)^i}.
 *
 * @since 0.1.0
 */
public final class DispersionRelation {
  private final double[] coefficients;
  private final double delta;

  /**
   * Creates a relation.
   *
   * @param coefficients polynomial coefficients, constant term first; at least one
   * @param delta offset added to the pixel coordinate before evaluation
   */
  public DispersionRelation(double[] coefficients, double delta) {
    if (coefficients == null || coefficients.length == 0) {
      throw new IllegalArgumentException("dispersion relation needs at least one coefficient");
    }
    this.coefficients = coefficients.clone();
    this.delta = delta;
  }

  public double[] coefficients() {
    return coefficients.clone();
  }

  public double delta() {
    return delta;
  }

  /** Wavelength in Angstroms at pixel {@code x}. */
  public double wavelength(double x) {
    double u = x + delta;
    double sum = 0.0;
    for (int i = coefficients.length - 1; i >= 0; i--) {
      sum = sum * u + coefficients[i];
    }
    return sum;
  }

  /** Local dispersion in Angstroms per pixel at {@code x}, the derivative of {@link #wavelength}. */
  public double dispersion(double x) {
    double u = x + delta;
    double sum = 0.0;
    for (int i = coefficients.length - 1; i >= 1; i--) {
      sum = sum * u + i * coefficients[i];
    }
    return sum;
  }

  @Override
  public String toString() {
    return "DispersionRelation" + Arrays.toString(coefficients) + " delta=" + delta;
  }
}

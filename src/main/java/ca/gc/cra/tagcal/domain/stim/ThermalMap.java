package ca.gc.cra.tagcal.domain.stim;

import java.util.Objects;

/**
 * Independent affine map per axis, {@code x' = x0 + x * xslope} and {@code y' = y0 + y * yslope}.
 *
 * @param x0 x intercept
 * @param xslope x slope
 * @param y0 y intercept
 * @param yslope y slope
 * @since 0.1.0
 */
public record ThermalMap(double x0, double xslope, double y0, double yslope) {
  private static final ThermalMap IDENTITY = new ThermalMap(0.0, 1.0, 0.0, 1.0);

  public static ThermalMap identity() {
    return IDENTITY;
  }

  /**
   * Derives the map that carries the measured stim positions onto their references.
   *
   * @param measured1 measured first stim
   * @param measured2 measured second stim
   * @param reference1 reference first stim
   * @param reference2 reference second stim
   * @return affine map; slopes are {@code (ref2 - ref1) / (meas2 - meas1)} per axis
   * @throws IllegalArgumentException when the two measured stims coincide on an axis
   */
  public static ThermalMap fromStims(
      StimPosition measured1, StimPosition measured2, StimPosition reference1, StimPosition reference2) {
    Objects.requireNonNull(measured1, "measured1");
    Objects.requireNonNull(measured2, "measured2");
    Objects.requireNonNull(reference1, "reference1");
    Objects.requireNonNull(reference2, "reference2");
    double dxMeasured = measured2.x() - measured1.x();
    double dyMeasured = measured2.y() - measured1.y();
    if (dxMeasured == 0.0 || dyMeasured == 0.0) {
      throw new IllegalArgumentException("measured stims coincide on an axis: " + measured1 + ", " + measured2);
    }
    double xslope = (reference2.x() - reference1.x()) / dxMeasured;
    double yslope = (reference2.y() - reference1.y()) / dyMeasured;
    double x0 = reference1.x() - measured1.x() * xslope;
    double y0 = reference1.y() - measured1.y() * yslope;
    return new ThermalMap(x0, xslope, y0, yslope);
  }

  public boolean isIdentity() {
    return x0 == 0.0 && xslope == 1.0 && y0 == 0.0 && yslope == 1.0;
  }

  public double applyX(double x) {
    return x0 + x * xslope;
  }

  public double applyY(double y) {
    return y0 + y * yslope;
  }
}

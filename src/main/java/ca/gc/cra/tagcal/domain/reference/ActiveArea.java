package ca.gc.cra.tagcal.domain.reference;

/**
 * Rectangular detector region, inclusive on all four edges.
 *
 * @param low lowest cross-dispersion pixel
 * @param high highest cross-dispersion pixel
 * @param left lowest dispersion-axis pixel
 * @param right highest dispersion-axis pixel
 * @since 0.1.0
 */
public record ActiveArea(double low, double high, double left, double right) {

  public boolean contains(double x, double y) {
    return x >= left && x <= right && y >= low && y <= high;
  }

  /**
   * Moves every edge inward.
   *
   * @param margin pixels to remove on each side
   * @return narrowed area
   */
  public ActiveArea shrink(double margin) {
    return new ActiveArea(low + margin, high - margin, left + margin, right - margin);
  }
}

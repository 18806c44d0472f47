package ca.gc.cra.tagcal.domain.reference;

/**
 * Rectangular bad-pixel region from the bad-pixel table.
 *
 * @param lx first column
 * @param ly first row
 * @param dx width in columns
 * @param dy height in rows
 * @param dq flag bits OR-ed into events and pixels inside the region
 * @since 0.1.0
 */
public record BadPixelRegion(int lx, int ly, int dx, int dy, int dq) {

  /** Tests {@code lx <= x < lx + dx} and {@code ly <= y < ly + dy}. */
  public boolean contains(double x, double y) {
    return x >= lx && x < lx + dx && y >= ly && y < ly + dy;
  }
}

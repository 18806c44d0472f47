package ca.gc.cra.tagcal.domain.exposure;

/**
 * Detector family. Sets the full-frame geometry and which corrections apply.
 *
 * @since 0.1.0
 */
public enum Detector {
  FUV(16384, 1024),
  NUV(1024, 1024);

  private final int width;
  private final int height;

  Detector(int width, int height) {
    this.width = width;
    this.height = height;
  }

  /** Number of pixels along the dispersion axis. */
  public int width() {
    return width;
  }

  /** Number of pixels along the cross-dispersion axis. */
  public int height() {
    return height;
  }

  /** Dispersion-axis midline where trace positions are evaluated. */
  public double middle() {
    return width / 2.0;
  }
}

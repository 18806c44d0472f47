package ca.gc.cra.tagcal.domain.stim;

/**
 * Detector position of a stim.
 *
 * @param x dispersion-axis pixel
 * @param y cross-dispersion pixel
 * @since 0.1.0
 */
public record StimPosition(double x, double y) {

  /** Placeholder for statistics that were never measured. */
  public static final StimPosition UNDEFINED = new StimPosition(-1.0, -1.0);
}

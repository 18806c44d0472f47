package ca.gc.cra.tagcal.domain.exposure;

/**
 * Linear-in-time wavecal offsets for one segment or stripe, measured from the first event time.
 *
 * @param shift1 dispersion-axis offset at the first event, pixels
 * @param slope1 rate of change of {@code shift1}, pixels per second
 * @param shift2 cross-dispersion offset at the first event, pixels
 * @param slope2 rate of change of {@code shift2}, pixels per second
 * @since 0.1.0
 */
public record WavecalShift(double shift1, double slope1, double shift2, double slope2) {

  /** Dispersion-axis offset at {@code dt} seconds after the first event. */
  public double dispersionShiftAt(double dt) {
    return dt * slope1 + shift1;
  }

  /** Cross-dispersion offset at {@code dt} seconds after the first event. */
  public double crossDispersionShiftAt(double dt) {
    return dt * slope2 + shift2;
  }
}

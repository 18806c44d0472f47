package ca.gc.cra.tagcal.domain.calibration;

/**
 * Orbital Doppler parameters recorded for the exposure and used to widen bad-pixel regions.
 *
 * @param magnitudePixels Doppler amplitude in pixels
 * @param zeroMjd MJD when the shift is zero and increasing
 * @param periodSeconds orbital period
 * @since 0.1.0
 */
public record DopplerParameters(double magnitudePixels, double zeroMjd, double periodSeconds) {

  /** Default orbital period used when no Doppler correction is requested. */
  public static final double DEFAULT_PERIOD = 5760.0;

  public static DopplerParameters none(double expstart) {
    return new DopplerParameters(0.0, expstart, DEFAULT_PERIOD);
  }
}

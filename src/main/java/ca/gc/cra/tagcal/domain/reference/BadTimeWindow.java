package ca.gc.cra.tagcal.domain.reference;

import ca.gc.cra.tagcal.domain.time.Interval;

/**
 * Bad-time table row, closed range in MJD.
 *
 * @param startMjd first bad instant
 * @param stopMjd last bad instant
 * @since 0.1.0
 */
public record BadTimeWindow(double startMjd, double stopMjd) {

  private static final double SECONDS_PER_DAY = 86400.0;

  /**
   * Converts the window to seconds since exposure start.
   *
   * @param expstart exposure start, MJD
   * @return interval in exposure seconds
   */
  public Interval toExposureSeconds(double expstart) {
    double start = (startMjd - expstart) * SECONDS_PER_DAY;
    double stop = (stopMjd - expstart) * SECONDS_PER_DAY;
    return new Interval(start, Math.max(start, stop));
  }
}

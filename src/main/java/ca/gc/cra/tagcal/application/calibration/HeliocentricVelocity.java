package ca.gc.cra.tagcal.application.calibration;

import ca.gc.cra.tagcal.domain.calibration.Correction;
import ca.gc.cra.tagcal.domain.event.EventTable;
import ca.gc.cra.tagcal.domain.exposure.ExposureInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Radial velocity of the target due to Earth's orbital motion (helcorr).
 *
 * <p>The value is recorded in the metadata only; event coordinates are never changed. The sign is positive when
 * the distance between Earth and the target is increasing.</p>
 *
 * @since 0.1.0
 */
public final class HeliocentricVelocity {
  private static final Logger log = LoggerFactory.getLogger(HeliocentricVelocity.class);

  private static final double REFERENCE_MJD = 51544.5;
  private static final double KM_PER_AU = 1.4959787e8;
  private static final double SECONDS_PER_DAY = 86400.0;
  private static final double DEG_TO_RAD = Math.PI / 180.0;

  private HeliocentricVelocity() {
    // Utility
  }

  /**
   * Records the heliocentric velocity of spectroscopic exposures.
   *
   * @param context run state
   */
  public static void run(RunContext context) {
    ExposureInfo info = context.info();
    if (!info.isSpectroscopic()) {
      return;
    }
    EventTable events = context.events();
    double mid = info.expstart() + (events.firstTime() + events.lastTime()) / 2.0 / SECONDS_PER_DAY;
    double velocity = radialVelocity(mid, info.raTarg(), info.decTarg());
    log.info("Heliocentric radial velocity {} km/s", velocity);
    context.metadata().heliocentricVelocity(velocity);
    context.switches().complete(Correction.HELCORR);
  }

  /**
   * Computes the contribution of Earth's heliocentric velocity to the target radial velocity.
   *
   * @param mjd time of observation
   * @param raDeg target right ascension (J2000), degrees
   * @param decDeg target declination (J2000), degrees
   * @return radial velocity in km/s; negative when Earth approaches the target
   */
  public static double radialVelocity(double mjd, double raDeg, double decDeg) {
    double ra = raDeg * DEG_TO_RAD;
    double dec = decDeg * DEG_TO_RAD;
    double tx = Math.cos(dec) * Math.cos(ra);
    double ty = Math.cos(dec) * Math.sin(ra);
    double tz = Math.sin(dec);

    double dt = mjd - REFERENCE_MJD;
    double gDot = 0.9856003 * DEG_TO_RAD;
    double lDot = 0.9856474 * DEG_TO_RAD;
    double eps = (23.439 - 0.0000004 * dt) * DEG_TO_RAD;
    double g = mod2pi((357.528 + 0.9856003 * dt) * DEG_TO_RAD);
    double l = mod2pi((280.461 + 0.9856474 * dt) * DEG_TO_RAD);
    double elong = l + 0.033423 * Math.sin(g) + 0.000349 * Math.sin(2.0 * g);
    double elongDot = lDot + 0.033423 * Math.cos(g) * gDot + 0.000349 * Math.cos(2.0 * g) * 2.0 * gDot;
    double radius = 1.00014 - 0.01671 * Math.cos(g) - 0.00014 * Math.cos(2.0 * g);
    double radiusDot = 0.01671 * Math.sin(g) * gDot + 0.00014 * Math.sin(2.0 * g) * 2.0 * gDot;

    double xDot = radiusDot * Math.cos(elong) - radius * Math.sin(elong) * elongDot;
    double yDot = radiusDot * Math.cos(eps) * Math.sin(elong) + radius * Math.cos(eps) * Math.cos(elong) * elongDot;
    double zDot = radiusDot * Math.sin(eps) * Math.sin(elong) + radius * Math.sin(eps) * Math.cos(elong) * elongDot;

    double vx = -xDot * KM_PER_AU / SECONDS_PER_DAY;
    double vy = -yDot * KM_PER_AU / SECONDS_PER_DAY;
    double vz = -zDot * KM_PER_AU / SECONDS_PER_DAY;
    return -(vx * tx + vy * ty + vz * tz);
  }

  static double mod2pi(double value) {
    double turns = value / (2.0 * Math.PI);
    double fraction = turns - (long) turns;
    if (fraction < 0.0) {
      fraction += 1.0;
    }
    return fraction * 2.0 * Math.PI;
  }
}

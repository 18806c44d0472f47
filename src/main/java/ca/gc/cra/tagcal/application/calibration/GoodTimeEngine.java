package ca.gc.cra.tagcal.application.calibration;

import ca.gc.cra.tagcal.application.port.CalibrationException;
import ca.gc.cra.tagcal.domain.calibration.Correction;
import ca.gc.cra.tagcal.domain.event.DataQuality;
import ca.gc.cra.tagcal.domain.event.EventTable;
import ca.gc.cra.tagcal.domain.exposure.ExposureInfo;
import ca.gc.cra.tagcal.domain.reference.BadTimeWindow;
import ca.gc.cra.tagcal.domain.time.Interval;
import ca.gc.cra.tagcal.domain.time.IntervalSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Burst and bad-time flagging plus good-time-interval bookkeeping.
 * <p><strong>Why:</strong> Events inside bad intervals are flagged rather than removed, while the exposure time is
 * recomputed from the good intervals that survive.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Flag events inside burst intervals and badttab windows.</li>
 *   <li>Subtract both interval lists from the declared good-time intervals.</li>
 *   <li>Adopt the recomputed exposure time and warn when it moved by more than the tolerance.</li>
 *   <li>Flag events that fall outside every final good interval.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class GoodTimeEngine {
  private static final Logger log = LoggerFactory.getLogger(GoodTimeEngine.class);

  /** Largest accepted difference between the declared and recomputed exposure time, seconds. */
  public static final double EXPTIME_TOLERANCE = 1.0;
  /** Extra seconds accepted past each good-interval stop when flagging events outside the GTI. */
  public static final double GTI_STOP_SLACK = 0.02;

  private GoodTimeEngine() {
    // Utility
  }

  /**
   * Flags burst intervals for FUV exposures when brstcorr is requested.
   *
   * @param context run state
   * @param bursts burst intervals reported by the upstream burst detector
   * @return intervals to remove from the good time; empty when the correction did not run
   */
  public static List<Interval> applyBursts(RunContext context, List<Interval> bursts) {
    if (!context.info().isFuv() || !context.switches().isPerform(Correction.BRSTCORR)) {
      return List.of();
    }
    context.addSeriousFlags(DataQuality.BURST);
    long flagged = 0;
    for (Interval burst : bursts) {
      flagged += flagWithin(context.events(), burst, DataQuality.BURST);
    }
    log.info("Flagged {} events in {} burst intervals", flagged, bursts.size());
    context.switches().complete(Correction.BRSTCORR);
    return List.copyOf(bursts);
  }

  /**
   * Flags badttab windows when badtcorr is requested.
   *
   * @param context run state
   * @return windows converted to seconds since exposure start; empty when the correction did not run
   * @throws CalibrationException when the badttab table is missing
   */
  public static List<Interval> applyBadTimes(RunContext context) throws CalibrationException {
    if (!context.switches().isPerform(Correction.BADTCORR)) {
      return List.of();
    }
    context.addSeriousFlags(DataQuality.BAD_TIME);
    ExposureInfo info = context.info();
    List<BadTimeWindow> windows = context.references().badTimes(info.segment());
    context.metadata().referenceKey("badttab", info.segment().name());
    List<Interval> bad = new ArrayList<>(windows.size());
    long flagged = 0;
    for (BadTimeWindow window : windows) {
      Interval interval = window.toExposureSeconds(info.expstart());
      bad.add(interval);
      flagged += flagWithin(context.events(), interval, DataQuality.BAD_TIME);
    }
    log.info("Flagged {} events in {} bad-time windows", flagged, bad.size());
    context.switches().complete(Correction.BADTCORR);
    return bad;
  }

  /**
   * ORs a flag into every event with {@code start <= t <= stop}.
   *
   * @param events event table
   * @param interval closed time range to flag
   * @param flag data-quality bits
   * @return number of events flagged
   */
  public static long flagWithin(EventTable events, Interval interval, int flag) {
    int[] dq = events.dq();
    int n = events.size();
    int i = events.indexRange(interval.start(), interval.start()).from();
    long flagged = 0;
    while (i < n && events.time(i) <= interval.stop()) {
      dq[i] |= flag;
      flagged++;
      i++;
    }
    return flagged;
  }

  /**
   * Removes bursts and then bad times from a good-interval set.
   *
   * @param gti declared good intervals
   * @param bursts burst intervals
   * @param badTimes bad-time intervals
   * @return narrowed set
   */
  public static IntervalSet narrow(IntervalSet gti, List<Interval> bursts, List<Interval> badTimes) {
    return gti.subtractAll(bursts).subtractAll(badTimes);
  }

  /**
   * Recomputes the good intervals and exposure time of a TIME-TAG run, then flags events outside them.
   *
   * @param context run state; the header view is replaced with the recomputed exposure time
   * @param declared good intervals from the exposure; empty means first-to-last event
   * @param bursts burst intervals returned by {@link #applyBursts}
   * @param badTimes bad-time intervals returned by {@link #applyBadTimes}
   * @return final good intervals
   */
  public static IntervalSet recompute(
      RunContext context, IntervalSet declared, List<Interval> bursts, List<Interval> badTimes) {
    EventTable events = context.events();
    IntervalSet gti = declared;
    if (gti.isEmpty()) {
      log.info("No good-time intervals recorded; using the span of the events");
      gti = IntervalSet.single(events.firstTime(), events.lastTime());
    }
    IntervalSet narrowed = narrow(gti, bursts, badTimes);
    double exptime = narrowed.duration();
    double previous = context.info().exptime();
    if (exptime != previous) {
      context.updateInfo(context.info().withExptime(exptime));
      if (Math.abs(exptime - previous) > EXPTIME_TOLERANCE) {
        context.warn(String.format(Locale.ROOT,
            "exposure time in header was %.3f; corrected to %.3f", previous, exptime));
      }
    }
    int outside = flagOutsideGti(events, narrowed);
    if (outside > 0) {
      log.info("Flagged {} events outside the good-time intervals", outside);
    }
    return narrowed;
  }

  /**
   * Flags events that lie in no interval {@code [start, stop + 0.02)}.
   *
   * <p>Nothing is flagged when one interval already spans every event. Flags are only ever OR-ed in.</p>
   *
   * @param events event table
   * @param gti good intervals
   * @return number of events flagged
   */
  public static int flagOutsideGti(EventTable events, IntervalSet gti) {
    if (events.isEmpty()) {
      return 0;
    }
    if (gti.size() == 1) {
      Interval only = gti.intervals().get(0);
      if (only.start() <= events.firstTime() && only.stop() >= events.lastTime()) {
        return 0;
      }
    }
    int[] dq = events.dq();
    int flagged = 0;
    for (int i = 0; i < events.size(); i++) {
      if (!gti.covers(events.time(i), GTI_STOP_SLACK)) {
        dq[i] |= DataQuality.BAD_TIME;
        flagged++;
      }
    }
    return flagged;
  }
}

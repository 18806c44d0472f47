package ca.gc.cra.tagcal.application.calibration;

import ca.gc.cra.tagcal.application.port.CalibrationException;
import ca.gc.cra.tagcal.domain.calibration.Correction;
import ca.gc.cra.tagcal.domain.event.EventTable;
import ca.gc.cra.tagcal.domain.exposure.ExposureInfo;
import ca.gc.cra.tagcal.domain.livetime.DeadtimeMethod;
import ca.gc.cra.tagcal.domain.livetime.DeadtimeResult;
import ca.gc.cra.tagcal.domain.livetime.LivetimeTable;
import ca.gc.cra.tagcal.domain.livetime.LivetimeWindow;
import ca.gc.cra.tagcal.domain.stim.ThermalParameters;
import ca.gc.cra.tagcal.domain.time.IndexRange;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Divides event weights by the detector livetime (deadcorr).
 * <p><strong>Why:</strong> At high count rates the detector misses events; the livetime factor interpolated from the
 * deadtab rate axis restores the lost flux.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Compare the livetime implied by the measured event rate with the one from the hardware counter.</li>
 *   <li>Apply a time-resolved livetime per deadtab timestep, or a single counter-based factor for sub-array
 *   exposures whose estimates disagree.</li>
 *   <li>Report the rate and method used, and the livetime diagnostic lines.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class DeadtimeCorrector {
  private static final Logger log = LoggerFactory.getLogger(DeadtimeCorrector.class);

  /** Relative livetime difference above which the two estimates are said to disagree. */
  public static final double LIVETIME_CRITERION = 0.1;

  private DeadtimeCorrector() {
    // Utility
  }

  /**
   * Runs deadcorr when requested.
   *
   * @param context run state
   * @param thermal stim tracking result providing the stim rate for the report
   * @throws CalibrationException when the deadtab rows are missing or the timestep is not positive
   */
  public static void run(RunContext context, Optional<ThermalParameters> thermal) throws CalibrationException {
    if (!context.switches().isPerform(Correction.DEADCORR)) {
      return;
    }
    ExposureInfo info = context.info();
    LivetimeTable table = context.references().livetime(info.segment());
    context.metadata().referenceKey("deadtab", info.segment().name());
    OptionalDouble stimRate = thermal.map(ThermalParameters::stimCountRate).orElse(OptionalDouble.empty());
    double stimLivetime = thermal.map(ThermalParameters::stimLivetime).orElse(1.0);
    DeadtimeResult result;
    if (info.isTimeTag()) {
      result = correctTimeTag(context.events(), table, info, stimRate, stimLivetime, context::appendLivetimeLog);
    } else {
      result = correctAccum(context.events(), table, info, stimRate, stimLivetime, context::appendLivetimeLog);
    }
    if (result.method() == DeadtimeMethod.SKIPPED) {
      context.warn(String.format(Locale.ROOT, "can't do deadcorr, exptime = %.6g", info.exptime()));
    } else if (result.estimatesDisagree()) {
      context.warn(String.format(Locale.ROOT,
          "livetime estimates differ: actual rate %.6g gives %.4f, %s rate %.6g gives %.4f; using %s",
          result.actualRate(), result.actualLivetime(), counterKeyword(info), result.counterRate(),
          result.counterLivetime(), result.method()));
    }
    log.info("Deadtime correction used {} at {} counts/s", result.method(), result.rate());
    context.metadata().deadtime(result);
    context.switches().complete(Correction.DEADCORR);
  }

  /**
   * Deadtime correction for TIME-TAG data.
   *
   * @param events non-empty event table; EPSILON is divided in place
   * @param table rate to livetime mapping with its timestep
   * @param info exposure header with the counter rate and sub-array keywords
   * @param stimRate stim count rate for the report
   * @param stimLivetime stim livetime for the report
   * @param livetimeLog receives the report and one line per window
   * @return decision and the windows that were applied
   * @throws CalibrationException when a time-resolved correction needs a non-positive timestep
   */
  public static DeadtimeResult correctTimeTag(
      EventTable events,
      LivetimeTable table,
      ExposureInfo info,
      OptionalDouble stimRate,
      double stimLivetime,
      Consumer<String> livetimeLog) throws CalibrationException {
    int n = events.size();
    double first = events.firstTime();
    double last = events.lastTime();
    double actualRate = last > first ? n / (last - first) : 0.0;
    double actualLivetime = table.determineLivetime(actualRate);
    double counterRate = info.countrate();
    double counterLivetime = table.determineLivetime(counterRate);
    boolean disagree = Math.abs(counterLivetime - actualLivetime) > LIVETIME_CRITERION * actualLivetime;
    boolean useActual = !(disagree && info.subarray() && info.nsubarray() > 0);

    String source = useActual ? "actual count rate" : "digital event counter (" + counterKeyword(info) + ")";
    livetimeLog.accept("");
    for (String line : report(info, stimRate, stimLivetime, actualRate, actualLivetime,
        counterRate, counterLivetime)) {
      livetimeLog.accept(line);
    }
    livetimeLog.accept("Livetime is based on " + source + ".");

    if (!useActual) {
      divide(events.epsilon(), 0, n, counterLivetime);
      return new DeadtimeResult(counterRate, counterMethod(info), actualRate, actualLivetime, counterRate,
          counterLivetime, stimRate, stimLivetime, true, List.of());
    }
    double dt = table.timestep();
    if (!(dt > 0.0)) {
      throw new CalibrationException("deadtab timestep must be positive (was " + dt + ")", Correction.DEADCORR);
    }
    livetimeLog.accept("# " + info.rootname());
    livetimeLog.accept("# t0 t1 countrate livetime");
    List<LivetimeWindow> windows = scan(events, table, dt, livetimeLog);
    return new DeadtimeResult(actualRate, DeadtimeMethod.DATA, actualRate, actualLivetime, counterRate,
        counterLivetime, stimRate, stimLivetime, disagree, windows);
  }

  /**
   * Time-resolved livetime: one factor per window of width {@code dt}.
   *
   * <p>A final window shorter than half the width reuses the previous window's livetime.</p>
   *
   * @param events event table; EPSILON is divided in place
   * @param table rate to livetime mapping
   * @param dt window width in seconds
   * @param livetimeLog receives one line per window
   * @return applied windows
   */
  public static List<LivetimeWindow> scan(
      EventTable events, LivetimeTable table, double dt, Consumer<String> livetimeLog) {
    double[] epsilon = events.epsilon();
    double last = events.lastTime();
    double t0 = events.firstTime();
    double lastLivetime = 1.0;
    double countRate = 0.0;
    boolean first = true;
    List<LivetimeWindow> windows = new ArrayList<>();
    while (t0 < last) {
      double t1 = t0 + dt;
      boolean finalWindow = t1 >= last;
      // The final window is closed so an event at exactly the last time is corrected.
      IndexRange rows = finalWindow ? events.indexRange(t0, Math.nextUp(last)) : events.indexRange(t0, t1);
      if (rows.isEmpty()) {
        t0 = t1;
        continue;
      }
      double stop = t1;
      double livetime;
      boolean reused = false;
      if (!finalWindow) {
        countRate = rows.size() / dt;
        livetime = table.determineLivetime(countRate);
      } else {
        stop = last;
        if (last - t0 < 0.5 * dt && !first) {
          livetime = lastLivetime;
          reused = true;
          log.debug("Last time interval is short ({} s); previous livetime reused", last - t0);
        } else {
          countRate = rows.size() / (last - t0);
          livetime = table.determineLivetime(countRate);
        }
      }
      if (livetime > 0.0) {
        divide(epsilon, rows.from(), rows.to(), livetime);
        lastLivetime = livetime;
      }
      first = false;
      windows.add(new LivetimeWindow(t0, stop, countRate, livetime, reused));
      livetimeLog.accept(String.format(Locale.ROOT, "%.0f %.0f %.6g %.6g", t0, stop, countRate, livetime));
      log.debug("{} {} rate {} livetime {}", t0, stop, countRate, livetime);
      t0 = t1;
    }
    return windows;
  }

  /**
   * Deadtime correction for ACCUM data: one factor for the whole exposure.
   *
   * @param events event table; EPSILON is divided in place
   * @param table rate to livetime mapping
   * @param info exposure header
   * @param stimRate stim count rate for the report
   * @param stimLivetime stim livetime for the report
   * @param livetimeLog receives the report
   * @return decision; {@link DeadtimeMethod#SKIPPED} when the exposure time is not positive
   */
  public static DeadtimeResult correctAccum(
      EventTable events,
      LivetimeTable table,
      ExposureInfo info,
      OptionalDouble stimRate,
      double stimLivetime,
      Consumer<String> livetimeLog) {
    livetimeLog.accept("# " + info.rootname());
    double counterRate = info.countrate();
    double counterLivetime = table.determineLivetime(counterRate);
    if (!(info.exptime() > 0.0)) {
      return DeadtimeResult.skipped(counterRate);
    }
    double actualRate = events.size() / info.exptime();
    double actualLivetime = table.determineLivetime(actualRate);
    double livetime;
    double rate;
    DeadtimeMethod method;
    String source;
    if (info.subarray()) {
      livetime = counterLivetime;
      rate = counterRate;
      method = counterMethod(info);
      source = "digital event counter (" + counterKeyword(info) + ")";
    } else {
      livetime = actualLivetime;
      rate = actualRate;
      method = DeadtimeMethod.DATA;
      source = "actual count rate";
    }
    if (livetime > 0.0) {
      divide(events.epsilon(), 0, events.size(), livetime);
    }
    boolean disagree = Math.abs(counterLivetime - actualLivetime) > LIVETIME_CRITERION * actualLivetime;
    for (String line : report(info, stimRate, stimLivetime, actualRate, actualLivetime,
        counterRate, counterLivetime)) {
      livetimeLog.accept(line);
    }
    livetimeLog.accept(String.format(Locale.ROOT, "livetime %6.4f is based on %s.", livetime, source));
    return new DeadtimeResult(rate, method, actualRate, actualLivetime, counterRate, counterLivetime,
        stimRate, stimLivetime, disagree, List.of());
  }

  static String counterKeyword(ExposureInfo info) {
    switch (info.segment()) {
      case FUVA:
        return "DEVENTA";
      case FUVB:
        return "DEVENTB";
      default:
        return "MEVENTS";
    }
  }

  private static DeadtimeMethod counterMethod(ExposureInfo info) {
    return info.isFuv() ? DeadtimeMethod.DEVENT : DeadtimeMethod.MEVENTS;
  }

  private static List<String> report(
      ExposureInfo info,
      OptionalDouble stimRate,
      double stimLivetime,
      double actualRate,
      double actualLivetime,
      double counterRate,
      double counterLivetime) {
    List<String> lines = new ArrayList<>(3);
    if (info.isFuv()) {
      if (stimRate.isPresent()) {
        lines.add(String.format(Locale.ROOT, "stim countrate and livetime:  %.6g, %6.4f",
            stimRate.getAsDouble(), stimLivetime));
      } else {
        lines.add("stim countrate and livetime could not be determined");
      }
    }
    lines.add(String.format(Locale.ROOT, "actual (average) event rate and livetime:  %.6g, %6.4f",
        actualRate, actualLivetime));
    lines.add(String.format(Locale.ROOT, "countrate and livetime from %s:  %.6g, %6.4f",
        counterKeyword(info), counterRate, counterLivetime));
    return lines;
  }

  private static void divide(double[] epsilon, int from, int to, double livetime) {
    if (!(livetime > 0.0)) {
      return;
    }
    for (int i = from; i < to; i++) {
      epsilon[i] /= livetime;
    }
  }
}

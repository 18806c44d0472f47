package ca.gc.cra.tagcal.application.calibration;

import ca.gc.cra.tagcal.application.port.CalibrationException;
import ca.gc.cra.tagcal.domain.calibration.Correction;
import ca.gc.cra.tagcal.domain.event.EventColumn;
import ca.gc.cra.tagcal.domain.event.EventTable;
import ca.gc.cra.tagcal.domain.exposure.ExposureInfo;
import ca.gc.cra.tagcal.domain.reference.BaselineReference;
import ca.gc.cra.tagcal.domain.stim.StimMeasurement;
import ca.gc.cra.tagcal.domain.stim.StimPosition;
import ca.gc.cra.tagcal.domain.stim.StimStatistics;
import ca.gc.cra.tagcal.domain.stim.StimWindow;
import ca.gc.cra.tagcal.domain.stim.ThermalMap;
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
 * <strong>What:</strong> Locates the two FUV stims in fixed-width time windows and derives one thermal map per
 * window.
 * <p><strong>Why:</strong> The stims drift with detector temperature; comparing their measured and reference
 * positions yields an affine correction per axis for the events of the same window.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Measure each stim as the mean offset from its reference position inside a clamped search box.</li>
 *   <li>Hold the last found position for a stim missing from a window.</li>
 *   <li>Accumulate count-weighted averages and RMS for the run metadata.</li>
 *   <li>Estimate the stim count rate and the livetime it implies.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class StimTracker {
  private static final Logger log = LoggerFactory.getLogger(StimTracker.class);

  /** Lowest detector line searched for a stim; the first line is excluded. */
  public static final double SEARCH_Y_MIN = 1.0;
  /** Highest detector line searched for a stim; the last line is excluded. */
  public static final double SEARCH_Y_MAX = 1022.0;

  private StimTracker() {
    // Utility
  }

  /**
   * Tracks stims for FUV exposures when tempcorr or deadcorr is requested.
   *
   * @param context run state; stim statistics go to the metadata and window lines to the stim log
   * @return thermal parameters, or empty when stims are not tracked for this run
   * @throws CalibrationException when the baseline row is missing or its timestep is not positive
   */
  public static Optional<ThermalParameters> run(RunContext context) throws CalibrationException {
    ExposureInfo info = context.info();
    boolean wanted = context.switches().isPerform(Correction.TEMPCORR)
        || context.switches().isPerform(Correction.DEADCORR);
    if (!info.isFuv() || !wanted) {
      return Optional.empty();
    }
    EventTable events = context.events();
    BaselineReference baseline = context.references().baseline(info.segment());
    context.metadata().referenceKey("brftab", info.segment().name());
    double timestep;
    if (info.isTimeTag()) {
      timestep = baseline.timestep();
      if (!(timestep > 0.0)) {
        throw new CalibrationException(
            "brftab timestep must be positive (was " + timestep + ")", Correction.TEMPCORR);
      }
    } else {
      timestep = events.lastTime() - events.firstTime() + 1.0;
    }
    log.info("Tracking stims with a timestep of {} s", timestep);
    context.appendStimLog("# " + info.rootname());
    context.appendStimLog("# t0 t1 stim_locations");
    ThermalParameters parameters =
        track(events, baseline, timestep, info.exptime(), info.stimrate(), context::appendStimLog);
    if (!parameters.bothStimsFound()) {
      context.warn("stim " + (parameters.stim1().everFound() ? "2" : "1")
          + " was not found in any time window; no thermal correction can be derived");
    }
    context.metadata().stims(parameters.stim1(), parameters.stim2());
    return Optional.of(parameters);
  }

  /**
   * Measures both stims window by window and derives the thermal maps.
   *
   * @param events event table; XCORR and YCORR are read
   * @param baseline stim references and search box
   * @param timestep window width in seconds
   * @param exptime exposure time used for the stim count rate
   * @param stimrate commanded stim rate; {@code 0} disables the stim livetime
   * @param stimLog receives one diagnostic line per non-empty window
   * @return windows, statistics and stim rate
   */
  public static ThermalParameters track(
      EventTable events,
      BaselineReference baseline,
      double timestep,
      double exptime,
      double stimrate,
      Consumer<String> stimLog) {
    double[] x = events.column(EventColumn.XCORR);
    double[] y = events.column(EventColumn.YCORR);
    StimPosition ref1 = baseline.stim1();
    StimPosition ref2 = baseline.stim2();
    List<StimWindow> measured = new ArrayList<>();
    Accumulator acc1 = new Accumulator();
    Accumulator acc2 = new Accumulator();
    if (!events.isEmpty()) {
      double last = events.lastTime();
      double t0 = events.firstTime();
      while (t0 <= last) {
        double t1 = t0 + timestep;
        IndexRange rows = events.indexRange(t0, t1);
        if (!rows.isEmpty()) {
          StimMeasurement s1 = findStim(x, y, rows, ref1, baseline.xwidth(), baseline.ywidth());
          StimMeasurement s2 = findStim(x, y, rows, ref2, baseline.xwidth(), baseline.ywidth());
          acc1.add(s1);
          acc2.add(s2);
          stimLog.accept(formatWindow(t0, Math.min(last, t1), s1, s2));
          if (!(s1.isFound() && s2.isFound())) {
            log.debug("Rows {}..{}: stim1 {}, stim2 {}", rows.from(), rows.to() - 1,
                s1.isFound() ? "found" : "not found", s2.isFound() ? "found" : "not found");
          }
          measured.add(new StimWindow(rows, t0, t1, s1, s2, ThermalMap.identity()));
        }
        t0 = t1;
      }
    }
    List<StimWindow> windows = measured;
    if (acc1.count > 0 && acc2.count > 0) {
      windows = applyHoldLast(measured, ref1, ref2);
    }
    StimStatistics stats1 = acc1.statistics(ref1);
    StimStatistics stats2 = acc2.statistics(ref2);
    OptionalDouble countRate = stimCountRate(acc1.count, acc2.count, exptime);
    double livetime = 1.0;
    if (countRate.isPresent() && stimrate > 0.0) {
      livetime = countRate.getAsDouble() / stimrate;
    }
    return new ThermalParameters(windows, stats1, stats2, countRate, livetime);
  }

  /**
   * Measures one stim inside its search box.
   *
   * @param x dispersion-axis coordinates
   * @param y cross-dispersion coordinates
   * @param rows rows of the current window
   * @param reference nominal stim position
   * @param xwidth search half-width in x
   * @param ywidth search half-width in y, clamped to the valid line range
   * @return centroid and sums of squared deviations, or not found
   */
  public static StimMeasurement findStim(
      double[] x, double[] y, IndexRange rows, StimPosition reference, double xwidth, double ywidth) {
    double xlow = reference.x() - xwidth;
    double xhigh = reference.x() + xwidth;
    double ylow = Math.max(reference.y() - ywidth, SEARCH_Y_MIN);
    double yhigh = Math.min(reference.y() + ywidth, SEARCH_Y_MAX);
    int n = 0;
    double sumx = 0.0;
    double sumy = 0.0;
    for (int i = rows.from(); i < rows.to(); i++) {
      if (inBox(x[i], y[i], xlow, xhigh, ylow, yhigh)) {
        n++;
        sumx += x[i] - reference.x();
        sumy += y[i] - reference.y();
      }
    }
    if (n == 0) {
      return StimMeasurement.notFound();
    }
    double sx = sumx / n + reference.x();
    double sy = sumy / n + reference.y();
    double sumxsq = 0.0;
    double sumysq = 0.0;
    for (int i = rows.from(); i < rows.to(); i++) {
      if (inBox(x[i], y[i], xlow, xhigh, ylow, yhigh)) {
        sumxsq += (x[i] - sx) * (x[i] - sx);
        sumysq += (y[i] - sy) * (y[i] - sy);
      }
    }
    return StimMeasurement.found(new StimPosition(sx, sy), n, sumxsq, sumysq);
  }

  static OptionalDouble stimCountRate(long counts1, long counts2, double exptime) {
    if (!(exptime > 0.0)) {
      return OptionalDouble.empty();
    }
    if (counts1 > 0 && counts2 > 0) {
      return OptionalDouble.of((counts1 + counts2) / (2.0 * exptime));
    }
    if (counts1 > 0) {
      return OptionalDouble.of(counts1 / exptime);
    }
    if (counts2 > 0) {
      return OptionalDouble.of(counts2 / exptime);
    }
    return OptionalDouble.empty();
  }

  private static List<StimWindow> applyHoldLast(
      List<StimWindow> measured, StimPosition ref1, StimPosition ref2) {
    List<StimWindow> windows = new ArrayList<>(measured.size());
    StimPosition last1 = ref1;
    StimPosition last2 = ref2;
    for (StimWindow window : measured) {
      if (window.stim1().isFound()) {
        last1 = window.stim1().position();
      }
      if (window.stim2().isFound()) {
        last2 = window.stim2().position();
      }
      ThermalMap map = ThermalMap.identity();
      if (last1.x() != last2.x() && last1.y() != last2.y()) {
        map = ThermalMap.fromStims(last1, last2, ref1, ref2);
      } else {
        log.warn("Stims coincide on an axis in window starting at {}; using identity map", window.start());
      }
      windows.add(window.withMap(map));
    }
    return windows;
  }

  private static boolean inBox(double x, double y, double xlow, double xhigh, double ylow, double yhigh) {
    return x >= xlow && x <= xhigh && y >= ylow && y <= yhigh;
  }

  private static String formatWindow(double t0, double t1, StimMeasurement s1, StimMeasurement s2) {
    StringBuilder line = new StringBuilder(String.format(Locale.ROOT, "%.0f %.0f", t0, t1));
    appendStim(line, s1);
    appendStim(line, s2);
    return line.toString();
  }

  private static void appendStim(StringBuilder line, StimMeasurement stim) {
    if (stim.isFound()) {
      line.append(String.format(Locale.ROOT, "  %.1f %.1f", stim.position().x(), stim.position().y()));
    } else {
      line.append("  INDEF INDEF");
    }
  }

  private static final class Accumulator {
    private long count;
    private double sumX;
    private double sumY;
    private double sumSqX;
    private double sumSqY;

    void add(StimMeasurement measurement) {
      if (!measurement.isFound()) {
        return;
      }
      count += measurement.count();
      sumX += measurement.position().x() * measurement.count();
      sumY += measurement.position().y() * measurement.count();
      sumSqX += measurement.sumSquaresX();
      sumSqY += measurement.sumSquaresY();
    }

    StimStatistics statistics(StimPosition reference) {
      if (count == 0) {
        return new StimStatistics(reference, StimPosition.UNDEFINED, StimPosition.UNDEFINED, 0);
      }
      StimPosition mean = new StimPosition(sumX / count, sumY / count);
      double divisor = count > 1 ? count - 1.0 : 1.0;
      StimPosition rms = new StimPosition(Math.sqrt(sumSqX / divisor), Math.sqrt(sumSqY / divisor));
      return new StimStatistics(reference, mean, rms, count);
    }
  }
}

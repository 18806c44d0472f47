package ca.gc.cra.tagcal.application.calibration;

import ca.gc.cra.tagcal.application.port.CalibrationException;
import ca.gc.cra.tagcal.domain.calibration.Correction;
import ca.gc.cra.tagcal.domain.calibration.WavecalOffsets;
import ca.gc.cra.tagcal.domain.calibration.WavecalSummary;
import ca.gc.cra.tagcal.domain.event.EventColumn;
import ca.gc.cra.tagcal.domain.event.EventTable;
import ca.gc.cra.tagcal.domain.exposure.ExposureInfo;
import ca.gc.cra.tagcal.domain.exposure.Segment;
import ca.gc.cra.tagcal.domain.exposure.WavecalShift;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Moves XFULL/YFULL by the time-dependent shifts measured on wavecal exposures (wavecorr).
 * <p><strong>Why:</strong> Mechanism drift shifts the spectrum on the detector during an exposure; the linear shift
 * model from bracketing wavecals removes it before binning.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class WavecalShiftApplier {
  private static final Logger log = LoggerFactory.getLogger(WavecalShiftApplier.class);

  private WavecalShiftApplier() {
    // Utility
  }

  /**
   * Runs wavecorr when requested and applicable.
   *
   * @param context run state
   * @param shifts shift lookup by segment; NUV stripes are looked up individually
   * @throws CalibrationException when NUV stripe traces are missing or ambiguous
   */
  public static void run(RunContext context, Function<Segment, Optional<WavecalShift>> shifts)
      throws CalibrationException {
    if (!context.switches().isPerform(Correction.WAVECORR)) {
      return;
    }
    ExposureInfo info = context.info();
    if (!info.isSpectroscopic() || info.isWavecal()) {
      log.info("Wavecal shift not applicable to {} exposure of type {}", info.obsType(), info.exptype());
      context.switches().skip(Correction.WAVECORR);
      return;
    }
    Optional<WavecalSummary> summary = info.isFuv()
        ? applyFuv(context.events(), context.activeArea(), shifts.apply(info.segment()))
        : applyNuv(context.events(), info, context, shifts);
    if (summary.isEmpty()) {
      context.warn("no wavecal shift for " + info.segment() + "; wavecorr skipped");
      context.switches().skip(Correction.WAVECORR);
      return;
    }
    context.metadata().wavecal(summary.get());
    log.info("Wavecal shift applied: average shift1 {}, shift2 {}",
        summary.get().averageShift1(), summary.get().averageShift2());
    context.switches().complete(Correction.WAVECORR);
  }

  /**
   * FUV shift inside the active area.
   *
   * @param events event table; XFULL and YFULL are overwritten
   * @param activeArea active-area mask
   * @param shift shift model for the segment
   * @return summary, or empty when no shift was available
   */
  public static Optional<WavecalSummary> applyFuv(
      EventTable events, boolean[] activeArea, Optional<WavecalShift> shift) {
    if (shift.isEmpty()) {
      return Optional.empty();
    }
    WavecalShift model = shift.get();
    double[] time = events.timeSnapshot();
    double[] xdopp = events.column(EventColumn.XDOPP);
    double[] ycorr = events.column(EventColumn.YCORR);
    double[] xfull = events.column(EventColumn.XFULL);
    double[] yfull = events.column(EventColumn.YFULL);
    double t0 = time[0];
    for (int i = 0; i < time.length; i++) {
      if (activeArea[i]) {
        xfull[i] = xdopp[i] - model.dispersionShiftAt(time[i] - t0);
        yfull[i] = ycorr[i] - model.crossDispersionShiftAt(time[i] - t0);
      } else {
        xfull[i] = xdopp[i];
        yfull[i] = ycorr[i];
      }
    }
    return Optional.of(summarize(events, model));
  }

  private static Optional<WavecalSummary> applyNuv(
      EventTable events,
      ExposureInfo info,
      RunContext context,
      Function<Segment, Optional<WavecalShift>> shifts) throws CalibrationException {
    for (Segment stripe : Segment.nuvStripes()) {
      if (shifts.apply(stripe).isEmpty()) {
        return Optional.empty();
      }
    }
    Map<Segment, boolean[]> psa = RegionClassifier.nuvPsaRegions(
        events, RegionClassifier.nuvPsaBoundaries(info, context.references()));
    Map<Segment, boolean[]> wca = RegionClassifier.nuvWcaRegions(
        events, RegionClassifier.nuvWcaBoundaries(info, context.references()));
    double[] time = events.timeSnapshot();
    double[] xdopp = events.column(EventColumn.XDOPP);
    double[] ycorr = events.column(EventColumn.YCORR);
    double[] xfull = events.column(EventColumn.XFULL);
    double[] yfull = events.column(EventColumn.YFULL);
    double t0 = time[0];
    System.arraycopy(xdopp, 0, xfull, 0, xdopp.length);
    for (Segment stripe : Segment.nuvStripes()) {
      WavecalShift model = shifts.apply(stripe).orElseThrow();
      boolean[] inPsa = psa.get(stripe);
      boolean[] inWca = wca.get(stripe);
      for (int i = 0; i < time.length; i++) {
        if (inPsa[i] || inWca[i]) {
          xfull[i] = xdopp[i] - model.dispersionShiftAt(time[i] - t0);
        }
      }
    }
    // One cross-dispersion shift, stripe B's, for every event.
    WavecalShift stripeB = shifts.apply(Segment.NUVB).orElseThrow();
    for (int i = 0; i < time.length; i++) {
      yfull[i] = ycorr[i] - stripeB.crossDispersionShiftAt(time[i] - t0);
    }
    return Optional.of(summarize(events, stripeB));
  }

  private static WavecalSummary summarize(EventTable events, WavecalShift model) {
    double mid = (events.lastTime() - events.firstTime()) / 2.0;
    double[] xfull = events.column(EventColumn.XFULL);
    double sum = 0.0;
    for (double x : xfull) {
      sum += x - Math.rint(x);
    }
    double dpixel1 = xfull.length == 0 ? 0.0 : sum / xfull.length;
    return new WavecalSummary(model.dispersionShiftAt(mid), model.crossDispersionShiftAt(mid), dpixel1);
  }

  /**
   * Range of the applied shifts over the active area, used to widen bad-pixel regions.
   *
   * @param events event table after wavecorr
   * @param activeArea active-area mask
   * @return min and max of {@code xdopp - xfull} and {@code ycorr - yfull}; zeros when the mask is empty
   */
  public static WavecalOffsets offsets(EventTable events, boolean[] activeArea) {
    double[] xdopp = events.column(EventColumn.XDOPP);
    double[] ycorr = events.column(EventColumn.YCORR);
    double[] xfull = events.column(EventColumn.XFULL);
    double[] yfull = events.column(EventColumn.YFULL);
    double minX = Double.POSITIVE_INFINITY;
    double maxX = Double.NEGATIVE_INFINITY;
    double minY = Double.POSITIVE_INFINITY;
    double maxY = Double.NEGATIVE_INFINITY;
    boolean any = false;
    for (int i = 0; i < activeArea.length; i++) {
      if (!activeArea[i]) {
        continue;
      }
      any = true;
      double dx = xdopp[i] - xfull[i];
      double dy = ycorr[i] - yfull[i];
      minX = Math.min(minX, dx);
      maxX = Math.max(maxX, dx);
      minY = Math.min(minY, dy);
      maxY = Math.max(maxY, dy);
    }
    if (!any) {
      return WavecalOffsets.none();
    }
    return new WavecalOffsets(minX, maxX, minY, maxY);
  }
}

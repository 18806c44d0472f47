package ca.gc.cra.tagcal.application.calibration;

import ca.gc.cra.tagcal.application.port.CalibrationException;
import ca.gc.cra.tagcal.application.port.ReferenceTables;
import ca.gc.cra.tagcal.domain.calibration.Correction;
import ca.gc.cra.tagcal.domain.calibration.DopplerParameters;
import ca.gc.cra.tagcal.domain.calibration.SwitchState;
import ca.gc.cra.tagcal.domain.event.EventColumn;
import ca.gc.cra.tagcal.domain.event.EventTable;
import ca.gc.cra.tagcal.domain.exposure.ExposureInfo;
import ca.gc.cra.tagcal.domain.exposure.Segment;
import ca.gc.cra.tagcal.domain.reference.DispersionRelation;
import ca.gc.cra.tagcal.domain.reference.OpticalKey;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Removes the orbital Doppler shift from the dispersion-axis coordinate (doppcorr).
 * <p><strong>Why:</strong> The spacecraft velocity along the line of sight shifts every photon by
 * {@code v/c * wavelength / dispersion} pixels; the shift varies sinusoidally over the orbit.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Shift XDOPP for events inside the FUV Doppler region or an NUV PSA stripe.</li>
 *   <li>Copy the result to XFULL.</li>
 *   <li>Derive the Doppler amplitude in pixels used to widen bad-pixel regions.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class DopplerCorrector {
  private static final Logger log = LoggerFactory.getLogger(DopplerCorrector.class);

  /** Speed of light in km/s. */
  public static final double SPEED_OF_LIGHT = 299792.458;
  private static final double SECONDS_PER_DAY = 86400.0;

  private DopplerCorrector() {
    // Utility
  }

  /**
   * Runs doppcorr for TIME-TAG exposures; ACCUM data are corrected on board.
   *
   * @param context run state
   * @throws CalibrationException when a trace, dispersion or wcptab row is missing or ambiguous
   */
  public static void run(RunContext context) throws CalibrationException {
    ExposureInfo info = context.info();
    if (!info.isTimeTag() || !context.switches().isPerform(Correction.DOPPCORR)) {
      return;
    }
    EventTable events = context.events();
    ReferenceTables references = context.references();
    double[] xi = events.column(EventColumn.XCORR);
    double[] dopp = events.column(EventColumn.XDOPP);
    System.arraycopy(xi, 0, dopp, 0, xi.length);
    long shifted = 0;
    if (info.isFuv()) {
      double boundary = RegionClassifier.fuvDopplerBoundary(info, references);
      boolean[] region = RegionClassifier.fuvDopplerRegion(events, context.activeArea(), boundary);
      shifted += correct(events, region, relationFor(info, references, info.segment()),
          evaluationOffset(info, references), info);
    } else {
      Map<Segment, boolean[]> regions =
          RegionClassifier.nuvPsaRegions(events, RegionClassifier.nuvPsaBoundaries(info, references));
      double offset = evaluationOffset(info, references);
      for (Segment stripe : Segment.nuvStripes()) {
        shifted += correct(events, regions.get(stripe), relationFor(info, references, stripe), offset, info);
      }
    }
    events.copyColumn(EventColumn.XDOPP, EventColumn.XFULL);
    context.metadata().referenceKey("disptab", describe(info));
    log.info("Doppler correction applied to {} events", shifted);
    context.switches().complete(Correction.DOPPCORR);
  }

  /**
   * Shifts XDOPP for the events of one region.
   *
   * @param events event table; XCORR and TIME are read, XDOPP is written
   * @param region events to correct
   * @param relation dispersion relation of the region
   * @param evaluationOffset pixels subtracted from x before evaluating wavelength and dispersion
   * @param info exposure header supplying the orbital parameters
   * @return number of events shifted
   */
  public static long correct(
      EventTable events, boolean[] region, DispersionRelation relation, double evaluationOffset, ExposureInfo info) {
    double[] xi = events.column(EventColumn.XCORR);
    double[] dopp = events.column(EventColumn.XDOPP);
    long shifted = 0;
    for (int i = 0; i < xi.length; i++) {
      if (!region[i]) {
        continue;
      }
      double xEval = xi[i] - evaluationOffset;
      dopp[i] = xi[i] - orbitalShift(events.time(i), relation.wavelength(xEval), relation.dispersion(xEval), info);
      shifted++;
    }
    return shifted;
  }

  /**
   * Pixel shift caused by orbital motion at one event time.
   *
   * @param time seconds since exposure start
   * @param wavelength local wavelength, Angstroms
   * @param dispersion local dispersion, Angstroms per pixel
   * @param info exposure header with expstart, doppzero, doppmagv and orbitper
   * @return shift in pixels to subtract from the coordinate
   */
  public static double orbitalShift(double time, double wavelength, double dispersion, ExposureInfo info) {
    double t = (info.expstart() - info.doppzero()) * SECONDS_PER_DAY + time;
    return info.doppmagv() / SPEED_OF_LIGHT * wavelength / dispersion
        * Math.sin(2.0 * Math.PI * t / info.orbitper());
  }

  /**
   * Doppler amplitude, zero time and period for bad-pixel widening.
   *
   * @param context run state
   * @return parameters; magnitude zero when Doppler correction was not requested or was skipped
   * @throws CalibrationException when the dispersion row is missing or ambiguous
   */
  public static DopplerParameters parameters(RunContext context) throws CalibrationException {
    ExposureInfo info = context.info();
    SwitchState state = context.switches().state(Correction.DOPPCORR);
    if (state != SwitchState.PERFORM && state != SwitchState.COMPLETE) {
      return DopplerParameters.none(info.expstart());
    }
    Segment segment = info.isFuv() ? info.segment() : Segment.NUVB;
    DispersionRelation relation = relationFor(info, context.references(), segment);
    double dispersion = relation.dispersion(info.detector().middle());
    double magnitude = info.doppmagv() / SPEED_OF_LIGHT * info.cenwave() / dispersion;
    return new DopplerParameters(magnitude, info.doppzero(), info.orbitper());
  }

  private static DispersionRelation relationFor(ExposureInfo info, ReferenceTables references, Segment segment)
      throws CalibrationException {
    OpticalKey key = new OpticalKey(info.optElem(), info.cenwave(), info.aperture(), segment.name());
    return references.dispersion(key, info.fpoffset());
  }

  private static double evaluationOffset(ExposureInfo info, ReferenceTables references)
      throws CalibrationException {
    if (references.dispersionKeyedByFpoffset()) {
      return 0.0;
    }
    return info.fpoffset() * references.fpoffsetStepsize(info.optElem());
  }

  private static String describe(ExposureInfo info) {
    return info.optElem() + "/" + info.cenwave() + "/" + info.aperture() + "/" + info.segment();
  }
}

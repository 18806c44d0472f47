package ca.gc.cra.tagcal.application.calibration;

import ca.gc.cra.tagcal.application.port.CalibrationException;
import ca.gc.cra.tagcal.application.port.ReferenceTables;
import ca.gc.cra.tagcal.domain.event.EventColumn;
import ca.gc.cra.tagcal.domain.event.EventTable;
import ca.gc.cra.tagcal.domain.exposure.Detector;
import ca.gc.cra.tagcal.domain.exposure.ExposureInfo;
import ca.gc.cra.tagcal.domain.exposure.Segment;
import ca.gc.cra.tagcal.domain.reference.ActiveArea;
import ca.gc.cra.tagcal.domain.reference.OpticalKey;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;

/**
 * <strong>What:</strong> Classifies events into detector regions: the FUV active area, the FUV Doppler region and
 * the three NUV stripes of the PSA and WCA apertures.
 * <p><strong>Why:</strong> Area-dependent corrections only apply where the detector geometry says they are valid.
 * Membership depends on corrected coordinates, so the active area is recomputed after geometric correction.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class RegionClassifier {
  /** Pixels trimmed from every side of the calibrated active-area bounds. */
  public static final double ACTIVE_AREA_MARGIN = 2.0;

  private RegionClassifier() {
    // Utility
  }

  /**
   * Recomputes the active-area mask of a run from the current XCORR/YCORR columns.
   *
   * @param context run state receiving the mask
   * @throws CalibrationException when the FUV baseline reference row cannot be found
   */
  public static void update(RunContext context) throws CalibrationException {
    ExposureInfo info = context.info();
    ActiveArea bounds = null;
    if (info.isFuv()) {
      bounds = context.references().baseline(info.segment()).activeArea();
    }
    context.setActiveArea(activeArea(context.events(), info.detector(), bounds));
  }

  /**
   * Computes the active-area mask.
   *
   * @param events event table
   * @param detector detector family; every NUV event is inside
   * @param bounds calibrated FUV bounds before the margin is applied; ignored for NUV
   * @return one flag per event
   */
  public static boolean[] activeArea(EventTable events, Detector detector, ActiveArea bounds) {
    boolean[] mask = new boolean[events.size()];
    if (detector == Detector.NUV) {
      Arrays.fill(mask, true);
      return mask;
    }
    ActiveArea area = bounds.shrink(ACTIVE_AREA_MARGIN);
    double[] x = events.column(EventColumn.XCORR);
    double[] y = events.column(EventColumn.YCORR);
    for (int i = 0; i < mask.length; i++) {
      mask[i] = area.contains(x[i], y[i]);
    }
    return mask;
  }

  /** Number of set flags in a mask. */
  public static int count(boolean[] mask) {
    int n = 0;
    for (boolean flag : mask) {
      if (flag) {
        n++;
      }
    }
    return n;
  }

  /**
   * Events per second inside the active area over the whole exposure.
   *
   * @param activeArea active-area mask
   * @param exptime exposure time in seconds
   * @return global count rate, or {@code 0} when the exposure time is not positive
   */
  public static double globalRate(boolean[] activeArea, double exptime) {
    if (!(exptime > 0.0)) {
      return 0.0;
    }
    return count(activeArea) / exptime;
  }

  /**
   * Cross-dispersion boundary between the FUV PSA (below) and WCA (above) spectra.
   *
   * @param info exposure header; aperture BOA is kept, any other aperture uses the PSA trace
   * @param references trace lookups
   * @return rounded midpoint of the two traces at the detector middle
   * @throws CalibrationException when a trace row is missing or ambiguous
   */
  public static double fuvDopplerBoundary(ExposureInfo info, ReferenceTables references)
      throws CalibrationException {
    String aperture = "BOA".equals(info.aperture()) ? "BOA" : "PSA";
    OpticalKey key = new OpticalKey(info.optElem(), info.cenwave(), aperture, info.segment().name());
    double middle = Detector.FUV.middle();
    double science = references.trace(key).positionAt(middle);
    double wavecal = references.trace(key.withAperture("WCA")).positionAt(middle);
    return Math.rint((science + wavecal) / 2.0);
  }

  /**
   * Events inside the active area and below the science/wavecal boundary.
   *
   * @param events event table
   * @param activeArea current active-area mask
   * @param boundary cross-dispersion boundary from {@link #fuvDopplerBoundary}
   * @return one flag per event
   */
  public static boolean[] fuvDopplerRegion(EventTable events, boolean[] activeArea, double boundary) {
    double[] y = events.column(EventColumn.YCORR);
    boolean[] region = new boolean[y.length];
    for (int i = 0; i < y.length; i++) {
      region[i] = activeArea[i] && y[i] < boundary;
    }
    return region;
  }

  /**
   * Stripe boundaries for the PSA: A/B, B/C and C/WCA-A midpoints.
   *
   * @param info exposure header
   * @param references trace lookups
   * @return three ascending boundaries
   * @throws CalibrationException when a trace row is missing or ambiguous
   */
  public static double[] nuvPsaBoundaries(ExposureInfo info, ReferenceTables references)
      throws CalibrationException {
    double a = stripePosition(info, references, "PSA", Segment.NUVA);
    double b = stripePosition(info, references, "PSA", Segment.NUVB);
    double c = stripePosition(info, references, "PSA", Segment.NUVC);
    double wcaA = stripePosition(info, references, "WCA", Segment.NUVA);
    return new double[] {Math.rint((a + b) / 2.0), Math.rint((b + c) / 2.0), Math.rint((c + wcaA) / 2.0)};
  }

  /**
   * Stripe boundaries for the WCA: PSA-C/A, A/B and B/C midpoints.
   *
   * @param info exposure header
   * @param references trace lookups
   * @return three ascending boundaries
   * @throws CalibrationException when a trace row is missing or ambiguous
   */
  public static double[] nuvWcaBoundaries(ExposureInfo info, ReferenceTables references)
      throws CalibrationException {
    double psaC = stripePosition(info, references, "PSA", Segment.NUVC);
    double a = stripePosition(info, references, "WCA", Segment.NUVA);
    double b = stripePosition(info, references, "WCA", Segment.NUVB);
    double c = stripePosition(info, references, "WCA", Segment.NUVC);
    return new double[] {Math.rint((psaC + a) / 2.0), Math.rint((a + b) / 2.0), Math.rint((b + c) / 2.0)};
  }

  /**
   * PSA stripe membership: A below the first boundary, B and C between successive boundaries.
   *
   * @param events event table
   * @param boundaries result of {@link #nuvPsaBoundaries}
   * @return one mask per stripe
   */
  public static Map<Segment, boolean[]> nuvPsaRegions(EventTable events, double[] boundaries) {
    double[] y = events.column(EventColumn.YCORR);
    Map<Segment, boolean[]> regions = new EnumMap<>(Segment.class);
    boolean[] a = new boolean[y.length];
    boolean[] b = new boolean[y.length];
    boolean[] c = new boolean[y.length];
    for (int i = 0; i < y.length; i++) {
      a[i] = y[i] < boundaries[0];
      b[i] = y[i] >= boundaries[0] && y[i] < boundaries[1];
      c[i] = y[i] >= boundaries[1] && y[i] < boundaries[2];
    }
    regions.put(Segment.NUVA, a);
    regions.put(Segment.NUVB, b);
    regions.put(Segment.NUVC, c);
    return regions;
  }

  /**
   * WCA stripe membership: A and B between successive boundaries, C above the last one.
   *
   * @param events event table
   * @param boundaries result of {@link #nuvWcaBoundaries}
   * @return one mask per stripe
   */
  public static Map<Segment, boolean[]> nuvWcaRegions(EventTable events, double[] boundaries) {
    double[] y = events.column(EventColumn.YCORR);
    Map<Segment, boolean[]> regions = new EnumMap<>(Segment.class);
    boolean[] a = new boolean[y.length];
    boolean[] b = new boolean[y.length];
    boolean[] c = new boolean[y.length];
    for (int i = 0; i < y.length; i++) {
      a[i] = y[i] >= boundaries[0] && y[i] < boundaries[1];
      b[i] = y[i] >= boundaries[1] && y[i] < boundaries[2];
      c[i] = y[i] >= boundaries[2];
    }
    regions.put(Segment.NUVA, a);
    regions.put(Segment.NUVB, b);
    regions.put(Segment.NUVC, c);
    return regions;
  }

  private static double stripePosition(
      ExposureInfo info, ReferenceTables references, String aperture, Segment stripe)
      throws CalibrationException {
    OpticalKey key = new OpticalKey(info.optElem(), info.cenwave(), aperture, stripe.name());
    return references.trace(key).positionAt(Detector.NUV.middle());
  }
}

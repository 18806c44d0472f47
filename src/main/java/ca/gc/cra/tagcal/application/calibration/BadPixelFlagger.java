package ca.gc.cra.tagcal.application.calibration;

import ca.gc.cra.tagcal.application.port.CalibrationException;
import ca.gc.cra.tagcal.domain.calibration.Correction;
import ca.gc.cra.tagcal.domain.calibration.DopplerParameters;
import ca.gc.cra.tagcal.domain.calibration.WavecalOffsets;
import ca.gc.cra.tagcal.domain.event.DataQuality;
import ca.gc.cra.tagcal.domain.event.EventColumn;
import ca.gc.cra.tagcal.domain.event.EventTable;
import ca.gc.cra.tagcal.domain.exposure.ExposureInfo;
import ca.gc.cra.tagcal.domain.image.DqPlane;
import ca.gc.cra.tagcal.domain.reference.ActiveArea;
import ca.gc.cra.tagcal.domain.reference.BadPixelRegion;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Applies bad-pixel regions to the event DQ column and builds the image DQ plane (dqicorr).
 * <p><strong>Why:</strong> Events binned into an image move by the wavecal and Doppler shifts, so a detector region
 * is flagged in the image over the whole range of positions it could have been mapped to.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class BadPixelFlagger {
  private static final Logger log = LoggerFactory.getLogger(BadPixelFlagger.class);

  private BadPixelFlagger() {
    // Utility
  }

  /**
   * Runs dqicorr when requested and returns the image DQ plane.
   *
   * @param context run state
   * @param offsets wavecal shift range over the active area
   * @return DQ plane of shape {@code npix}; all zero when dqicorr is not requested
   * @throws CalibrationException when a required reference row is missing or ambiguous
   */
  public static DqPlane run(RunContext context, WavecalOffsets offsets) throws CalibrationException {
    ExposureInfo info = context.info();
    DqPlane plane = DqPlane.zeros(info.npixY(), info.npixX());
    if (!context.switches().isPerform(Correction.DQICORR)) {
      return plane;
    }
    List<BadPixelRegion> regions = context.references().badPixels(info.segment());
    context.metadata().referenceKey("bpixtab", info.segment().name());
    long flagged = flagEvents(context.events(), regions);
    DopplerParameters doppler = DopplerCorrector.parameters(context);
    context.metadata().doppler(doppler);
    flagPlane(plane, regions, offsets, doppler.magnitudePixels(), info.xOffset());
    if (info.isFuv()) {
      ActiveArea bounds = context.references().baseline(info.segment()).activeArea();
      flagOutsideActiveArea(plane, bounds, offsets, doppler.magnitudePixels(), info.xOffset());
    }
    log.info("Bad-pixel regions: {} rows, {} events flagged", regions.size(), flagged);
    context.switches().complete(Correction.DQICORR);
    return plane;
  }

  /**
   * ORs each region's flag into the DQ of the events inside it.
   *
   * @param events event table; DQ is updated in place
   * @param regions bad-pixel rows for the segment
   * @return number of events that received at least one flag
   */
  public static long flagEvents(EventTable events, List<BadPixelRegion> regions) {
    double[] x = events.column(EventColumn.XCORR);
    double[] y = events.column(EventColumn.YCORR);
    int[] dq = events.dq();
    long flagged = 0;
    for (int i = 0; i < dq.length; i++) {
      int before = dq[i];
      for (BadPixelRegion region : regions) {
        if (region.contains(x[i], y[i])) {
          dq[i] |= region.dq();
        }
      }
      if (dq[i] != before) {
        flagged++;
      }
    }
    return flagged;
  }

  /**
   * ORs each region into the image plane, widened by the shift range.
   *
   * @param plane image DQ plane
   * @param regions bad-pixel rows in detector coordinates
   * @param offsets wavecal shift range
   * @param doppler Doppler amplitude in pixels
   * @param xOffset detector-to-image column offset
   */
  public static void flagPlane(
      DqPlane plane, List<BadPixelRegion> regions, WavecalOffsets offsets, double doppler, int xOffset) {
    for (BadPixelRegion region : regions) {
      int colFrom = (int) Math.rint(region.lx() - offsets.maxShift1() - doppler) + xOffset;
      int colTo = (int) Math.rint(region.lx() + region.dx() - offsets.minShift1() + doppler) + xOffset;
      int rowFrom = (int) Math.rint(region.ly() - offsets.maxShift2());
      int rowTo = (int) Math.rint(region.ly() + region.dy() - offsets.minShift2());
      plane.orRegion(rowFrom, rowTo, colFrom, colTo, region.dq());
    }
  }

  /**
   * Flags every image pixel that no event from inside the FUV active area could land on.
   *
   * @param plane image DQ plane
   * @param bounds calibrated active-area bounds
   * @param offsets wavecal shift range
   * @param doppler Doppler amplitude in pixels
   * @param xOffset detector-to-image column offset
   */
  public static void flagOutsideActiveArea(
      DqPlane plane, ActiveArea bounds, WavecalOffsets offsets, double doppler, int xOffset) {
    int left = (int) Math.rint(bounds.left() - offsets.maxShift1() - doppler) + xOffset;
    int right = (int) Math.rint(bounds.right() - offsets.minShift1() + doppler) + xOffset;
    int low = (int) Math.rint(bounds.low() - offsets.maxShift2());
    int high = (int) Math.rint(bounds.high() - offsets.minShift2());
    int flag = DataQuality.OUT_OF_BOUNDS;
    plane.orRegion(0, low, 0, plane.columns(), flag);
    plane.orRegion(high + 1, plane.rows(), 0, plane.columns(), flag);
    plane.orRegion(low, high + 1, 0, left, flag);
    plane.orRegion(low, high + 1, right + 1, plane.columns(), flag);
  }
}

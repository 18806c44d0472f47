package ca.gc.cra.tagcal.application.calibration;

import ca.gc.cra.tagcal.application.port.CalibrationException;
import ca.gc.cra.tagcal.domain.calibration.Correction;
import ca.gc.cra.tagcal.domain.event.EventColumn;
import ca.gc.cra.tagcal.domain.event.EventTable;
import ca.gc.cra.tagcal.domain.exposure.ExposureInfo;
import ca.gc.cra.tagcal.domain.reference.GeometricDistortionMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes FUV geometric distortion from XCORR/YCORR (geocorr), optionally with bilinear interpolation of the
 * binned distortion map (igeocorr).
 *
 * @since 0.1.0
 */
public final class GeometricCorrector {
  private static final Logger log = LoggerFactory.getLogger(GeometricCorrector.class);

  private GeometricCorrector() {
    // Utility
  }

  /**
   * Runs geocorr for FUV exposures.
   *
   * @param context run state
   * @throws CalibrationException when the geofile row is missing or ambiguous
   */
  public static void run(RunContext context) throws CalibrationException {
    ExposureInfo info = context.info();
    if (!info.isFuv() || !context.switches().isPerform(Correction.GEOCORR)) {
      return;
    }
    boolean interpolate = context.switches().isPerform(Correction.IGEOCORR);
    GeometricDistortionMap map = context.references().geometricDistortion(info.segment());
    context.metadata().referenceKey("geofile", info.segment().name());
    correct(context.events(), map, interpolate);
    log.info("Geometric correction applied ({})", interpolate ? "interpolated" : "nearest bin");
    context.switches().complete(Correction.GEOCORR);
    if (interpolate) {
      context.switches().complete(Correction.IGEOCORR);
    }
  }

  /**
   * Subtracts the distortion at each event position.
   *
   * @param events event table
   * @param map binned distortion map
   * @param interpolate bilinear interpolation when {@code true}, nearest bin otherwise
   */
  public static void correct(EventTable events, GeometricDistortionMap map, boolean interpolate) {
    double[] x = events.column(EventColumn.XCORR);
    double[] y = events.column(EventColumn.YCORR);
    for (int i = 0; i < x.length; i++) {
      double dx = map.deltaX(x[i], y[i], interpolate);
      double dy = map.deltaY(x[i], y[i], interpolate);
      x[i] -= dx;
      y[i] -= dy;
    }
  }
}

package ca.gc.cra.tagcal.application.calibration;

import ca.gc.cra.tagcal.application.port.CalibrationException;
import ca.gc.cra.tagcal.domain.calibration.Correction;
import ca.gc.cra.tagcal.domain.event.EventColumn;
import ca.gc.cra.tagcal.domain.event.EventTable;
import ca.gc.cra.tagcal.domain.reference.FlatField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Divides event weights by the pixel-to-pixel flat field (flatcorr).
 *
 * @since 0.1.0
 */
public final class FlatFieldCorrector {
  private static final Logger log = LoggerFactory.getLogger(FlatFieldCorrector.class);

  private FlatFieldCorrector() {
    // Utility
  }

  /**
   * Runs flatcorr when requested.
   *
   * @param context run state
   * @throws CalibrationException when the flat-field row for the segment is missing or ambiguous
   */
  public static void run(RunContext context) throws CalibrationException {
    if (!context.switches().isPerform(Correction.FLATCORR)) {
      return;
    }
    FlatField flat = context.references().flatField(context.info().segment());
    context.metadata().referenceKey("flatfile", context.info().segment().name());
    int corrected = correct(context.events(), flat);
    log.info("Flat-field correction applied to {} of {} events", corrected, context.events().size());
    context.switches().complete(Correction.FLATCORR);
  }

  /**
   * Divides EPSILON by the flat value at each event's rounded corrected position.
   *
   * <p>Events outside the map, or on a pixel whose flat value is not positive, keep their weight.</p>
   *
   * @param events event table; EPSILON is divided in place
   * @param flat flat-field map
   * @return number of events whose weight changed
   */
  public static int correct(EventTable events, FlatField flat) {
    double[] x = events.column(EventColumn.XCORR);
    double[] y = events.column(EventColumn.YCORR);
    double[] epsilon = events.epsilon();
    int corrected = 0;
    for (int i = 0; i < epsilon.length; i++) {
      double value = flat.valueAt((int) Math.rint(x[i]), (int) Math.rint(y[i]));
      if (value > 0.0) {
        epsilon[i] /= value;
        corrected++;
      }
    }
    return corrected;
  }
}

package ca.gc.cra.tagcal.application.calibration;

import ca.gc.cra.tagcal.domain.event.EventColumn;
import ca.gc.cra.tagcal.domain.event.EventTable;
import ca.gc.cra.tagcal.domain.exposure.Detector;
import ca.gc.cra.tagcal.domain.exposure.ExposureInfo;
import ca.gc.cra.tagcal.domain.image.CsumImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Accumulates the cumulative-sum image from XCORR/YCORR and the weights after deadtime correction.
 *
 * @since 0.1.0
 */
public final class CumulativeSumBinner {
  private static final Logger log = LoggerFactory.getLogger(CumulativeSumBinner.class);

  /** Number of distinct pulse-height values, one csum plane each. */
  public static final int PHA_RANGE = 32;

  private CumulativeSumBinner() {
    // Utility
  }

  /**
   * Creates an empty csum image of the detector's shape.
   *
   * @param info exposure header
   * @param hasPha whether the event table carries pulse heights
   * @return zero image; three-dimensional for FUV TIME-TAG with pulse heights
   */
  public static CsumImage emptyFor(ExposureInfo info, boolean hasPha) {
    Detector detector = info.detector();
    int planes = detector == Detector.FUV && info.isTimeTag() && hasPha ? PHA_RANGE : 1;
    return new CsumImage(planes, detector.height(), detector.width());
  }

  /**
   * Builds the csum image of a run.
   *
   * @param info exposure header
   * @param events event table
   * @return accumulated image
   */
  public static CsumImage bin(ExposureInfo info, EventTable events) {
    CsumImage image = emptyFor(info, events.hasPha());
    double[] x = events.column(EventColumn.XCORR);
    double[] y = events.column(EventColumn.YCORR);
    double[] epsilon = events.epsilon();
    int dropped = 0;
    for (int i = 0; i < x.length; i++) {
      int plane = image.isThreeDimensional() ? events.pha(i) : 0;
      if (!image.add(plane, (int) Math.rint(y[i]), (int) Math.rint(x[i]), epsilon[i])) {
        dropped++;
      }
    }
    log.debug("csum image: {} events outside the image", dropped);
    return image;
  }
}

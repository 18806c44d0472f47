package ca.gc.cra.tagcal.application.calibration;

import ca.gc.cra.tagcal.domain.event.DataQuality;
import ca.gc.cra.tagcal.domain.event.EventColumn;
import ca.gc.cra.tagcal.domain.event.EventTable;
import ca.gc.cra.tagcal.domain.image.DqPlane;
import ca.gc.cra.tagcal.domain.image.ImagePlane;
import ca.gc.cra.tagcal.domain.image.RateImage;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Bins the fully corrected events into the count-rate and flat-fielded rate images.
 * <p><strong>Why:</strong> The count-rate image treats every event as one count; the flat-fielded image weights
 * each event by EPSILON. Both share the DQ plane built by dqicorr.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Drop events carrying a serious DQ flag and events that land outside the image.</li>
 *   <li>Propagate Poisson errors from the unweighted counts.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class ImageBinner {
  private static final Logger log = LoggerFactory.getLogger(ImageBinner.class);

  private ImageBinner() {
    // Utility
  }

  /**
   * Count-rate and flat-fielded images of one exposure.
   *
   * @param counts unweighted count rate with its error
   * @param flatfielded EPSILON-weighted count rate with its error
   */
  public record Images(RateImage counts, RateImage flatfielded) {
    public Images {
      Objects.requireNonNull(counts, "counts");
      Objects.requireNonNull(flatfielded, "flatfielded");
    }
  }

  /**
   * Bins a run's events with its current exposure time and serious flag set.
   *
   * @param context run state
   * @param quality DQ plane shared by both images
   * @return binned images
   */
  public static Images run(RunContext context, DqPlane quality) {
    double exptime = context.info().exptime();
    if (!(exptime > 0.0)) {
      context.warn("exposure time is " + exptime + ", so output images are dummy");
    }
    Images images = bin(context.events(), quality, context.info().xOffset(), exptime, context.seriousFlags());
    log.info("Binned {} events into {}x{} images", context.events().size(), quality.rows(), quality.columns());
    return images;
  }

  /**
   * Builds both images.
   *
   * <p>Each event lands at row {@code rint(YFULL)} and column {@code rint(XFULL) + xOffset}. With
   * {@code C} the count image and {@code E} the weighted image, the planes are {@code C/t} with error
   * {@code sqrt(C)/t}, and {@code E/t} with error {@code (E/t) / errC / t}, where zero {@code errC} values are
   * replaced by one.</p>
   *
   * @param events event table
   * @param quality DQ plane; defines the image shape
   * @param xOffset detector-to-image column offset
   * @param exptime exposure time in seconds; zero images when not positive
   * @param seriousFlags DQ bits that exclude an event
   * @return binned images
   */
  public static Images bin(EventTable events, DqPlane quality, int xOffset, double exptime, int seriousFlags) {
    int rows = quality.rows();
    int columns = quality.columns();
    if (!(exptime > 0.0)) {
      return new Images(RateImage.zeros(quality), RateImage.zeros(quality));
    }
    ImagePlane countRate = ImagePlane.zeros(rows, columns);
    ImagePlane countError = ImagePlane.zeros(rows, columns);
    ImagePlane flatRate = ImagePlane.zeros(rows, columns);
    ImagePlane flatError = ImagePlane.zeros(rows, columns);
    double[] x = events.column(EventColumn.XFULL);
    double[] y = events.column(EventColumn.YFULL);
    double[] epsilon = events.epsilon();
    int[] dq = events.dq();
    for (int i = 0; i < x.length; i++) {
      if (DataQuality.intersects(dq[i], seriousFlags)) {
        continue;
      }
      int row = (int) Math.rint(y[i]);
      int column = (int) Math.rint(x[i]) + xOffset;
      if (!countRate.contains(row, column)) {
        continue;
      }
      countRate.add(row, column, 1.0);
      flatRate.add(row, column, epsilon[i]);
    }
    // Planes hold summed counts until here; convert in place to rates.
    float[] cr = countRate.data();
    float[] ce = countError.data();
    float[] fr = flatRate.data();
    float[] fe = flatError.data();
    for (int p = 0; p < cr.length; p++) {
      double errC = Math.sqrt(cr[p]) / exptime;
      double rate = fr[p] / exptime;
      cr[p] = (float) (cr[p] / exptime);
      ce[p] = (float) errC;
      fr[p] = (float) rate;
      fe[p] = (float) (rate / (errC == 0.0 ? 1.0 : errC) / exptime);
    }
    return new Images(new RateImage(countRate, countError, quality), new RateImage(flatRate, flatError, quality));
  }
}

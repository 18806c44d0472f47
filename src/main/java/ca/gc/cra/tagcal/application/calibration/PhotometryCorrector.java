package ca.gc.cra.tagcal.application.calibration;

import ca.gc.cra.tagcal.application.port.CalibrationException;
import ca.gc.cra.tagcal.domain.calibration.Correction;
import ca.gc.cra.tagcal.domain.exposure.ExposureInfo;
import ca.gc.cra.tagcal.domain.exposure.ObsType;
import ca.gc.cra.tagcal.domain.reference.PhotometryParameters;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Records the photometric keywords of NUV imaging exposures (photcorr).
 *
 * @since 0.1.0
 */
public final class PhotometryCorrector {
  private static final Logger log = LoggerFactory.getLogger(PhotometryCorrector.class);

  private PhotometryCorrector() {
    // Utility
  }

  /**
   * Runs photcorr for NUV imaging when requested.
   *
   * @param context run state
   * @throws CalibrationException when no unique photometry row matches the observing mode
   */
  public static void run(RunContext context) throws CalibrationException {
    ExposureInfo info = context.info();
    if (info.isFuv() || info.obsType() != ObsType.IMAGING
        || !context.switches().isPerform(Correction.PHOTCORR)) {
      return;
    }
    String obsmode = obsmode(info);
    PhotometryParameters parameters = context.references().photometry(obsmode);
    context.metadata().referenceKey("imphttab", obsmode);
    context.metadata().photometry(parameters);
    log.info("Photometry for {}: photflam {}", obsmode, parameters.photflam());
    context.switches().complete(Correction.PHOTCORR);
  }

  /** Observing-mode key, e.g. {@code cos,nuv,mirrora,psa}. */
  static String obsmode(ExposureInfo info) {
    return ("cos,nuv," + info.optElem() + "," + info.aperture()).toLowerCase(Locale.ROOT);
  }
}

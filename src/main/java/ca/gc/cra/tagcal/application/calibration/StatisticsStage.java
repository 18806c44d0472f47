package ca.gc.cra.tagcal.application.calibration;

import ca.gc.cra.tagcal.domain.calibration.Correction;
import ca.gc.cra.tagcal.domain.image.ImageStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes good-pixel statistics of the output images (statflag).
 *
 * @since 0.1.0
 */
public final class StatisticsStage {
  private static final Logger log = LoggerFactory.getLogger(StatisticsStage.class);

  /** Metadata name of the count-rate image. */
  public static final String COUNTS = "counts";
  /** Metadata name of the flat-fielded image. */
  public static final String FLT = "flt";

  private StatisticsStage() {
    // Utility
  }

  public static void run(RunContext context, ImageBinner.Images images) {
    if (!context.switches().isPerform(Correction.STATFLAG)) {
      return;
    }
    ImageStatistics counts = ImageStatistics.of(images.counts());
    ImageStatistics flt = ImageStatistics.of(images.flatfielded());
    context.metadata().statistics(COUNTS, counts);
    context.metadata().statistics(FLT, flt);
    log.info("Image statistics: {} good pixels, flt mean {}", flt.goodPixels(), flt.mean());
    context.switches().complete(Correction.STATFLAG);
  }
}

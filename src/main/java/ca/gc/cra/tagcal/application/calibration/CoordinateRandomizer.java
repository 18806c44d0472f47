package ca.gc.cra.tagcal.application.calibration;

import ca.gc.cra.tagcal.domain.calibration.Correction;
import ca.gc.cra.tagcal.domain.event.EventColumn;
import ca.gc.cra.tagcal.domain.event.EventTable;
import java.util.OptionalLong;
import java.util.SplittableRandom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dithers FUV coordinates inside the active area by uniform deviates in {@code (-0.5, 0.5)} (randcorr).
 *
 * <p>The same seed always produces the same coordinates. A seed of {@code -1} requests a time-based seed, which
 * is recorded in the run metadata.</p>
 *
 * @since 0.1.0
 */
public final class CoordinateRandomizer {
  private static final Logger log = LoggerFactory.getLogger(CoordinateRandomizer.class);

  /** Header value requesting a seed derived from the clock. */
  public static final long TIME_BASED_SEED = -1L;

  private CoordinateRandomizer() {
    // Utility
  }

  /**
   * Runs randcorr when requested for an FUV exposure.
   *
   * @param context run state
   * @param seedOverride seed from configuration, replacing the header seed when present
   */
  public static void run(RunContext context, OptionalLong seedOverride) {
    if (!context.info().isFuv() || !context.switches().isPerform(Correction.RANDCORR)) {
      return;
    }
    long seed = seedOverride.orElse(context.info().randseed());
    if (seed == TIME_BASED_SEED) {
      seed = System.currentTimeMillis() / 1000L;
    }
    randomize(context.events(), context.activeArea(), seed);
    log.debug("Randomized coordinates with seed {}", seed);
    context.metadata().randomSeed(seed);
    context.switches().complete(Correction.RANDCORR);
  }

  /**
   * Subtracts uniform deviates from XCORR, then from YCORR, for events in the active area.
   *
   * @param events event table
   * @param activeArea active-area mask
   * @param seed generator seed
   */
  public static void randomize(EventTable events, boolean[] activeArea, long seed) {
    SplittableRandom random = new SplittableRandom(seed);
    double[] x = events.column(EventColumn.XCORR);
    double[] y = events.column(EventColumn.YCORR);
    for (int i = 0; i < x.length; i++) {
      double deviate = random.nextDouble(-0.5, 0.5);
      if (activeArea[i]) {
        x[i] -= deviate;
      }
    }
    for (int i = 0; i < y.length; i++) {
      double deviate = random.nextDouble(-0.5, 0.5);
      if (activeArea[i]) {
        y[i] -= deviate;
      }
    }
  }
}

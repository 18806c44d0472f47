package ca.gc.cra.tagcal.application.calibration;

import ca.gc.cra.tagcal.application.port.CalibrationException;
import ca.gc.cra.tagcal.domain.calibration.Correction;
import ca.gc.cra.tagcal.domain.calibration.PulseHeightSummary;
import ca.gc.cra.tagcal.domain.event.DataQuality;
import ca.gc.cra.tagcal.domain.event.EventTable;
import ca.gc.cra.tagcal.domain.exposure.ExposureInfo;
import ca.gc.cra.tagcal.domain.reference.PulseHeightLimits;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flags FUV events whose pulse height lies outside the phatab limits (phacorr).
 *
 * <p>TIME-TAG events inside the active area are flagged {@link DataQuality#PH_LOW} or
 * {@link DataQuality#PH_HIGH}; for ACCUM exposures only the limits are recorded.</p>
 *
 * @since 0.1.0
 */
public final class PulseHeightFilter {
  private static final Logger log = LoggerFactory.getLogger(PulseHeightFilter.class);

  private PulseHeightFilter() {
    // Utility
  }

  /**
   * Runs phacorr when requested for an FUV exposure.
   *
   * @param context run state
   * @throws CalibrationException when the phatab row is missing or the event table has no PHA column
   */
  public static void run(RunContext context) throws CalibrationException {
    ExposureInfo info = context.info();
    if (!info.isFuv() || !context.switches().isPerform(Correction.PHACORR)) {
      return;
    }
    context.addSeriousFlags(DataQuality.PH_LOW | DataQuality.PH_HIGH);
    PulseHeightLimits limits = context.references().pulseHeightLimits(info.segment());
    context.metadata().referenceKey("phatab", info.segment().name());
    PulseHeightSummary summary;
    if (info.isTimeTag()) {
      if (!context.events().hasPha()) {
        throw new CalibrationException("phacorr requires a PHA column", Correction.PHACORR);
      }
      summary = filter(context.events(), context.activeArea(), limits);
      log.info("Pulse-height filter rejected {} events below {} and {} above {}",
          summary.rejectedLow(), limits.lowerThreshold(), summary.rejectedHigh(), limits.upperThreshold());
    } else {
      summary = new PulseHeightSummary(limits.lowerThreshold(), limits.upperThreshold(), 0, 0);
    }
    context.metadata().pulseHeight(summary);
    context.switches().complete(Correction.PHACORR);
  }

  /**
   * Flags out-of-range pulse heights inside the active area.
   *
   * @param events event table with a PHA column
   * @param activeArea active-area mask
   * @param limits accepted range
   * @return limits and the number of events carrying each flag afterwards
   */
  public static PulseHeightSummary filter(EventTable events, boolean[] activeArea, PulseHeightLimits limits) {
    int[] dq = events.dq();
    long low = 0;
    long high = 0;
    for (int i = 0; i < dq.length; i++) {
      if (activeArea[i]) {
        int pha = events.pha(i);
        if (pha < limits.lowerThreshold()) {
          dq[i] |= DataQuality.PH_LOW;
        } else if (pha > limits.upperThreshold()) {
          dq[i] |= DataQuality.PH_HIGH;
        }
      }
      if ((dq[i] & DataQuality.PH_LOW) != 0) {
        low++;
      }
      if ((dq[i] & DataQuality.PH_HIGH) != 0) {
        high++;
      }
    }
    return new PulseHeightSummary(limits.lowerThreshold(), limits.upperThreshold(), low, high);
  }
}

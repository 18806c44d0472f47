package ca.gc.cra.tagcal.domain.calibration;

/**
 * Pulse-height limits applied to an exposure and the number of events each limit rejected.
 *
 * @param lowerThreshold lowest accepted pulse height
 * @param upperThreshold highest accepted pulse height
 * @param rejectedLow events flagged below the lower threshold
 * @param rejectedHigh events flagged above the upper threshold
 * @since 0.1.0
 */
public record PulseHeightSummary(int lowerThreshold, int upperThreshold, long rejectedLow, long rejectedHigh) {

  public long rejected() {
    return rejectedLow + rejectedHigh;
  }
}

package ca.gc.cra.tagcal.domain.reference;

/**
 * Lower and upper pulse-height thresholds for one segment.
 *
 * @param lowerThreshold events below this amplitude are flagged low
 * @param upperThreshold events above this amplitude are flagged high
 * @since 0.1.0
 */
public record PulseHeightLimits(int lowerThreshold, int upperThreshold) {

  public PulseHeightLimits {
    if (upperThreshold < lowerThreshold) {
      throw new IllegalArgumentException(
          "pulse-height upper threshold " + upperThreshold + " is below lower threshold " + lowerThreshold);
    }
  }
}

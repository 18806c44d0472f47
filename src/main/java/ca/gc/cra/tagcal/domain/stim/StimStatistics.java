package ca.gc.cra.tagcal.domain.stim;

import java.util.Objects;

/**
 * Count-weighted mean and RMS position of one stim over an exposure.
 *
 * @param reference nominal position
 * @param mean weighted mean, {@link StimPosition#UNDEFINED} when never found
 * @param rms RMS scatter, {@link StimPosition#UNDEFINED} when never found
 * @param totalCount events found over all windows
 * @since 0.1.0
 */
public record StimStatistics(StimPosition reference, StimPosition mean, StimPosition rms, long totalCount) {

  public StimStatistics {
    Objects.requireNonNull(reference, "reference");
    Objects.requireNonNull(mean, "mean");
    Objects.requireNonNull(rms, "rms");
  }

  public boolean everFound() {
    return totalCount > 0;
  }
}

package ca.gc.cra.tagcal.domain.reference;

import ca.gc.cra.tagcal.domain.stim.StimPosition;
import java.util.Objects;

/**
 * Baseline reference row: calibrated active-area bounds, nominal stim positions and stim search box.
 *
 * @param activeArea active-area bounds before the margin is applied
 * @param stim1 nominal position of the first stim
 * @param stim2 nominal position of the second stim
 * @param xwidth half-width of the stim search box along x
 * @param ywidth half-height of the stim search box along y
 * @param timestep stim-tracking window width in seconds
 * @since 0.1.0
 */
public record BaselineReference(
    ActiveArea activeArea,
    StimPosition stim1,
    StimPosition stim2,
    double xwidth,
    double ywidth,
    double timestep) {

  public BaselineReference {
    Objects.requireNonNull(activeArea, "activeArea");
    Objects.requireNonNull(stim1, "stim1");
    Objects.requireNonNull(stim2, "stim2");
    if (xwidth < 0 || ywidth < 0) {
      throw new IllegalArgumentException("stim search box half-widths must not be negative");
    }
  }
}

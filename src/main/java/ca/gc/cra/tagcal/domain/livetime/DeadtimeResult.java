package ca.gc.cra.tagcal.domain.livetime;

import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Outcome of deadtime correction, kept for output metadata and the livetime report.
 *
 * @param rate count rate that determined the correction
 * @param method which estimate supplied {@code rate}
 * @param actualRate events divided by elapsed time
 * @param actualLivetime livetime factor for {@code actualRate}
 * @param counterRate hardware counter rate from the exposure header
 * @param counterLivetime livetime factor for {@code counterRate}
 * @param stimRate observed stim rate when known
 * @param stimLivetime stim-derived livetime factor
 * @param estimatesDisagree {@code true} when the two livetime estimates differ beyond tolerance
 * @param windows time-resolved windows; empty when a single global factor was used
 * @since 0.1.0
 */
public record DeadtimeResult(
    double rate,
    DeadtimeMethod method,
    double actualRate,
    double actualLivetime,
    double counterRate,
    double counterLivetime,
    OptionalDouble stimRate,
    double stimLivetime,
    boolean estimatesDisagree,
    List<LivetimeWindow> windows) {

  public DeadtimeResult {
    Objects.requireNonNull(method, "method");
    Objects.requireNonNull(stimRate, "stimRate");
    windows = windows == null ? List.of() : List.copyOf(windows);
  }

  /** Result for an exposure whose deadtime could not be estimated. */
  public static DeadtimeResult skipped(double counterRate) {
    return new DeadtimeResult(
        0.0, DeadtimeMethod.SKIPPED, 0.0, 1.0, counterRate, 1.0, OptionalDouble.empty(), 1.0, false, List.of());
  }
}

package ca.gc.cra.tagcal.domain.stim;

import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Result of stim tracking over a whole exposure.
 *
 * @param windows non-empty windows in time order
 * @param stim1 statistics for the first stim
 * @param stim2 statistics for the second stim
 * @param stimCountRate observed stim count rate, empty when neither stim was found
 * @param stimLivetime observed over commanded stim rate, {@code 1} when unknown
 * @since 0.1.0
 */
public record ThermalParameters(
    List<StimWindow> windows,
    StimStatistics stim1,
    StimStatistics stim2,
    OptionalDouble stimCountRate,
    double stimLivetime) {

  public ThermalParameters {
    windows = List.copyOf(Objects.requireNonNull(windows, "windows"));
    Objects.requireNonNull(stim1, "stim1");
    Objects.requireNonNull(stim2, "stim2");
    Objects.requireNonNull(stimCountRate, "stimCountRate");
  }

  /** Indicates that both stims were seen in at least one window. */
  public boolean bothStimsFound() {
    return stim1.everFound() && stim2.everFound();
  }
}

package ca.gc.cra.tagcal.domain.stim;

import ca.gc.cra.tagcal.domain.time.IndexRange;
import java.util.Objects;

/**
 * One stim-tracking window: its rows, both stim measurements and the derived thermal map.
 *
 * @param rows event rows covered by the window
 * @param start window start in seconds
 * @param stop window end in seconds, clipped to the last event time
 * @param stim1 first stim measurement
 * @param stim2 second stim measurement
 * @param map thermal map for the rows of this window
 * @since 0.1.0
 */
public record StimWindow(
    IndexRange rows, double start, double stop, StimMeasurement stim1, StimMeasurement stim2, ThermalMap map) {

  public StimWindow {
    Objects.requireNonNull(rows, "rows");
    Objects.requireNonNull(stim1, "stim1");
    Objects.requireNonNull(stim2, "stim2");
    Objects.requireNonNull(map, "map");
  }

  public StimWindow withMap(ThermalMap newMap) {
    return new StimWindow(rows, start, stop, stim1, stim2, newMap);
  }
}

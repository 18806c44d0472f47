package ca.gc.cra.tagcal.application.calibration;

import ca.gc.cra.tagcal.domain.calibration.Correction;
import ca.gc.cra.tagcal.domain.event.EventColumn;
import ca.gc.cra.tagcal.domain.event.EventTable;
import ca.gc.cra.tagcal.domain.stim.StimWindow;
import ca.gc.cra.tagcal.domain.stim.ThermalMap;
import ca.gc.cra.tagcal.domain.stim.ThermalParameters;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the per-window thermal maps to XCORR/YCORR (tempcorr).
 *
 * @since 0.1.0
 */
public final class ThermalDistortionCorrector {
  private static final Logger log = LoggerFactory.getLogger(ThermalDistortionCorrector.class);

  private ThermalDistortionCorrector() {
    // Utility
  }

  /**
   * Runs tempcorr for FUV exposures; the switch is SKIPPED when both stims were not found or no window
   * moves a coordinate.
   *
   * @param context run state
   * @param parameters stim tracking result, empty when stims were not tracked
   */
  public static void run(RunContext context, Optional<ThermalParameters> parameters) {
    if (!context.info().isFuv() || !context.switches().isPerform(Correction.TEMPCORR)) {
      return;
    }
    if (parameters.isEmpty() || !parameters.get().bothStimsFound()) {
      context.warn("tempcorr was skipped: no usable stim positions");
      context.switches().skip(Correction.TEMPCORR);
      return;
    }
    if (apply(context.events(), parameters.get().windows())) {
      log.info("Thermal distortion correction applied");
      context.switches().complete(Correction.TEMPCORR);
    } else {
      context.warn("tempcorr was skipped: stims are at their reference positions in every window");
      context.switches().skip(Correction.TEMPCORR);
    }
  }

  /**
   * Applies each non-identity window map to the rows of that window.
   *
   * @param events event table
   * @param windows stim windows with their maps
   * @return {@code true} when at least one window was corrected
   */
  public static boolean apply(EventTable events, List<StimWindow> windows) {
    double[] x = events.column(EventColumn.XCORR);
    double[] y = events.column(EventColumn.YCORR);
    boolean applied = false;
    for (StimWindow window : windows) {
      ThermalMap map = window.map();
      if (map.isIdentity()) {
        continue;
      }
      for (int i = window.rows().from(); i < window.rows().to(); i++) {
        x[i] = map.applyX(x[i]);
        y[i] = map.applyY(y[i]);
      }
      applied = true;
    }
    return applied;
  }
}

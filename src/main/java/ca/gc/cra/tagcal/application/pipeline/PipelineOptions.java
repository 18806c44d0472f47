package ca.gc.cra.tagcal.application.pipeline;

import ca.gc.cra.tagcal.domain.calibration.Correction;
import ca.gc.cra.tagcal.domain.calibration.SwitchState;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Per-run knobs of the calibration pipeline that do not come from the exposure itself.
 *
 * @param csum whether the cumulative-sum image is produced
 * @param stimLog whether stim diagnostic lines are collected
 * @param livetimeLog whether livetime diagnostic lines are collected
 * @param seedOverride randomization seed replacing the header value when present
 * @param switchOverrides switch requests replacing the exposure's own requests
 * @since 0.1.0
 */
public record PipelineOptions(
    boolean csum,
    boolean stimLog,
    boolean livetimeLog,
    OptionalLong seedOverride,
    Map<Correction, SwitchState> switchOverrides) {

  public PipelineOptions {
    seedOverride = Objects.requireNonNullElse(seedOverride, OptionalLong.empty());
    switchOverrides = switchOverrides == null ? Map.of() : Map.copyOf(switchOverrides);
  }

  /** Options with every extra product disabled and no overrides. */
  public static PipelineOptions defaults() {
    return new PipelineOptions(false, false, false, OptionalLong.empty(), Map.of());
  }

  /**
   * Applies the overrides on top of the exposure's requests.
   *
   * @param requested switch requests read from the exposure
   * @return merged requests
   */
  public Map<Correction, SwitchState> effectiveSwitches(Map<Correction, SwitchState> requested) {
    Map<Correction, SwitchState> merged = new EnumMap<>(Correction.class);
    merged.putAll(requested);
    merged.putAll(switchOverrides);
    return merged;
  }
}

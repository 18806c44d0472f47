package ca.gc.cra.tagcal.domain.calibration;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Per-run record of the state of every calibration switch.
 * <p><strong>Why:</strong> Downstream readers audit which corrections ran, which were skipped and which were
 * never requested, so every transition is kept in one place.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; owned by a single calibration run.</p>
 *
 * @since 0.1.0
 */
public final class CalibrationSwitches {
  private final EnumMap<Correction, SwitchState> states = new EnumMap<>(Correction.class);

  private CalibrationSwitches(Map<Correction, SwitchState> requested) {
    for (Correction correction : Correction.values()) {
      states.put(correction, SwitchState.OMIT);
    }
    states.putAll(requested);
  }

  /**
   * Creates switches from the requested states; missing corrections default to {@link SwitchState#OMIT}.
   *
   * @param requested requested states; only {@code OMIT} and {@code PERFORM} are accepted
   * @return mutable switch set
   * @throws IllegalArgumentException when a request is already {@code COMPLETE} or {@code SKIPPED}
   */
  public static CalibrationSwitches of(Map<Correction, SwitchState> requested) {
    Objects.requireNonNull(requested, "requested");
    for (Map.Entry<Correction, SwitchState> entry : requested.entrySet()) {
      SwitchState state = Objects.requireNonNull(entry.getValue(), "state");
      if (state != SwitchState.OMIT && state != SwitchState.PERFORM) {
        throw new IllegalArgumentException(
            "switch " + entry.getKey().keyword() + " must be requested as OMIT or PERFORM (was " + state + ")");
      }
    }
    return new CalibrationSwitches(requested);
  }

  public SwitchState state(Correction correction) {
    return states.get(Objects.requireNonNull(correction, "correction"));
  }

  public boolean isPerform(Correction correction) {
    return state(correction) == SwitchState.PERFORM;
  }

  /** Indicates the correction was requested, whether or not it has run yet. */
  public boolean isRequested(Correction correction) {
    return state(correction) != SwitchState.OMIT;
  }

  /**
   * Marks a pending correction as applied. Calls for corrections that are not pending are ignored.
   *
   * @param correction correction that finished
   */
  public void complete(Correction correction) {
    if (isPerform(correction)) {
      states.put(correction, SwitchState.COMPLETE);
    }
  }

  /**
   * Downgrades a pending correction to {@link SwitchState#SKIPPED}.
   *
   * @param correction correction whose precondition failed
   */
  public void skip(Correction correction) {
    if (isPerform(correction)) {
      states.put(correction, SwitchState.SKIPPED);
    }
  }

  /** Downgrades every pending correction to {@link SwitchState#SKIPPED}. */
  public void skipAllPending() {
    for (Correction correction : Correction.values()) {
      skip(correction);
    }
  }

  /**
   * Returns a read-only copy of the current states in declaration order.
   *
   * @return snapshot map
   */
  public Map<Correction, SwitchState> snapshot() {
    return Collections.unmodifiableMap(new EnumMap<>(states));
  }

  @Override
  public String toString() {
    return "CalibrationSwitches" + states;
  }
}

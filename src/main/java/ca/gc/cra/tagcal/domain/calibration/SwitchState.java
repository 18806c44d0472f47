package ca.gc.cra.tagcal.domain.calibration;

import java.util.Locale;

/**
 * Lifecycle state of one calibration switch.
 *
 * @since 0.1.0
 */
public enum SwitchState {
  /** Not requested. */
  OMIT,
  /** Requested and not yet applied. */
  PERFORM,
  /** Applied. */
  COMPLETE,
  /** Requested but its precondition failed, so nothing was applied. */
  SKIPPED;

  /**
   * Parses a header or CLI switch value.
   *
   * @param raw value such as {@code PERFORM} or {@code omit}
   * @return parsed state
   * @throws IllegalArgumentException when unrecognised
   */
  public static SwitchState parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("switch value must not be blank");
    }
    try {
      return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("unknown switch value: " + raw, ex);
    }
  }
}

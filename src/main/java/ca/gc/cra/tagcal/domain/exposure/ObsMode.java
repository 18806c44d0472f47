package ca.gc.cra.tagcal.domain.exposure;

import java.util.Locale;

/**
 * Observing mode: events tagged individually in time, or accumulated on board.
 *
 * @since 0.1.0
 */
public enum ObsMode {
  TIME_TAG("TIME-TAG"),
  ACCUM("ACCUM");

  private final String label;

  ObsMode(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }

  /**
   * Parses {@code TIME-TAG}, {@code TIME_TAG} or {@code ACCUM}.
   *
   * @param raw header value
   * @return parsed mode
   * @throws IllegalArgumentException when unrecognised
   */
  public static ObsMode parse(String raw) {
    if (raw == null) {
      throw new IllegalArgumentException("obsmode must not be null");
    }
    String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('_', '-');
    for (ObsMode mode : values()) {
      if (mode.label.equals(normalized)) {
        return mode;
      }
    }
    throw new IllegalArgumentException("unknown obsmode: " + raw);
  }
}

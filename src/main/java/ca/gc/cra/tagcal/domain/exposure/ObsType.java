package ca.gc.cra.tagcal.domain.exposure;

import java.util.Locale;

/**
 * Observation type.
 *
 * @since 0.1.0
 */
public enum ObsType {
  SPECTROSCOPIC,
  IMAGING;

  public static ObsType parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("obstype must not be blank");
    }
    try {
      return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("unknown obstype: " + raw, ex);
    }
  }
}

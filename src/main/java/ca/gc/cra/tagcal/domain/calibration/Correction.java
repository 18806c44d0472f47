package ca.gc.cra.tagcal.domain.calibration;

import java.util.Locale;

/**
 * Calibration steps that can be requested per exposure.
 *
 * @since 0.1.0
 */
public enum Correction {
  PHOTCORR,
  BRSTCORR,
  BADTCORR,
  PHACORR,
  RANDCORR,
  TEMPCORR,
  GEOCORR,
  IGEOCORR,
  DOPPCORR,
  HELCORR,
  DEADCORR,
  FLATCORR,
  WAVECORR,
  DQICORR,
  STATFLAG;

  /** Lower-case keyword used in headers, metadata and metric names. */
  public String keyword() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Parses a keyword case-insensitively.
   *
   * @param raw keyword such as {@code deadcorr}
   * @return correction
   * @throws IllegalArgumentException when unrecognised
   */
  public static Correction parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("correction name must not be blank");
    }
    try {
      return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("unknown correction: " + raw, ex);
    }
  }
}

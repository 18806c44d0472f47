package ca.gc.cra.tagcal.domain.exposure;

import java.util.Locale;

/**
 * Detector segment or stripe name used as a reference-table key.
 *
 * <p>FUV exposures carry one segment; NUV exposures are keyed as {@link #NUV} but their spectra fall on
 * three stripes {@link #NUVA}, {@link #NUVB} and {@link #NUVC}.</p>
 *
 * @since 0.1.0
 */
public enum Segment {
  FUVA(Detector.FUV),
  FUVB(Detector.FUV),
  NUV(Detector.NUV),
  NUVA(Detector.NUV),
  NUVB(Detector.NUV),
  NUVC(Detector.NUV);

  private final Detector detector;

  Segment(Detector detector) {
    this.detector = detector;
  }

  public Detector detector() {
    return detector;
  }

  /**
   * Returns the trailing letter used to key wavecal shifts ({@code A}, {@code B}, {@code C}).
   *
   * @return single-letter suffix, or {@code "V"} for the undivided NUV key
   */
  public String letter() {
    String name = name();
    return name.substring(name.length() - 1);
  }

  /**
   * Parses a header value such as {@code FUVA} case-insensitively.
   *
   * @param raw header value
   * @return matching segment
   * @throws IllegalArgumentException when the value names no segment
   */
  public static Segment parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("segment must not be blank");
    }
    try {
      return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("unknown segment: " + raw, ex);
    }
  }

  /** NUV spectral stripes in cross-dispersion order. */
  public static Segment[] nuvStripes() {
    return new Segment[] {NUVA, NUVB, NUVC};
  }
}

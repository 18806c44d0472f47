package ca.gc.cra.tagcal.domain.reference;

import java.util.Locale;
import java.util.Objects;

/**
 * Lookup key shared by the dispersion and trace tables.
 *
 * @param optElem grating name
 * @param cenwave central wavelength setting
 * @param aperture aperture name
 * @param segment segment or stripe name (e.g. {@code FUVA}, {@code NUVB})
 * @since 0.1.0
 */
public record OpticalKey(String optElem, int cenwave, String aperture, String segment) {

  public OpticalKey {
    optElem = Objects.requireNonNull(optElem, "optElem").toUpperCase(Locale.ROOT);
    aperture = Objects.requireNonNull(aperture, "aperture").toUpperCase(Locale.ROOT);
    segment = Objects.requireNonNull(segment, "segment").toUpperCase(Locale.ROOT);
  }

  public OpticalKey withAperture(String value) {
    return new OpticalKey(optElem, cenwave, value, segment);
  }

  public OpticalKey withSegment(String value) {
    return new OpticalKey(optElem, cenwave, aperture, value);
  }
}

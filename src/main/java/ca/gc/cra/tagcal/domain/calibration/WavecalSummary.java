package ca.gc.cra.tagcal.domain.calibration;

/**
 * Shifts applied by wavecal correction, evaluated at the middle of the exposure.
 *
 * @param averageShift1 mean dispersion-axis shift, pixels
 * @param averageShift2 mean cross-dispersion shift, pixels
 * @param dpixel1 mean fractional part {@code xfull - round(xfull)}
 * @since 0.1.0
 */
public record WavecalSummary(double averageShift1, double averageShift2, double dpixel1) {}

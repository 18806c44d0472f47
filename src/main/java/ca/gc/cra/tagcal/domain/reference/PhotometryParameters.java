package ca.gc.cra.tagcal.domain.reference;

/**
 * Imaging photometry keywords for one observing mode.
 *
 * @param photflam inverse sensitivity, erg/s/cm2/A per count/s
 * @param photfnu inverse sensitivity, erg/s/cm2/Hz per count/s
 * @param photplam pivot wavelength, Angstroms
 * @param photbw RMS bandwidth, Angstroms
 * @since 0.1.0
 */
public record PhotometryParameters(double photflam, double photfnu, double photplam, double photbw) {}

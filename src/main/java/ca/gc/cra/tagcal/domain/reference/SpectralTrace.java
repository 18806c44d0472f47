package ca.gc.cra.tagcal.domain.reference;

/**
 * Linear spectral trace {@code y = bSpec + slope * x} from the extraction table.
 *
 * @param bSpec cross-dispersion intercept
 * @param slope cross-dispersion change per pixel along x
 * @since 0.1.0
 */
public record SpectralTrace(double bSpec, double slope) {

  public double positionAt(double x) {
    return bSpec + slope * x;
  }
}

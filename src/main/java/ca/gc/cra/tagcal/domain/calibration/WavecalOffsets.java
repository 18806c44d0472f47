package ca.gc.cra.tagcal.domain.calibration;

/**
 * Range of the shifts actually applied over the active area, used to widen bad-pixel regions.
 *
 * @param minShift1 smallest {@code xdopp - xfull}
 * @param maxShift1 largest {@code xdopp - xfull}
 * @param minShift2 smallest {@code ycorr - yfull}
 * @param maxShift2 largest {@code ycorr - yfull}
 * @since 0.1.0
 */
public record WavecalOffsets(double minShift1, double maxShift1, double minShift2, double maxShift2) {
  private static final WavecalOffsets NONE = new WavecalOffsets(0.0, 0.0, 0.0, 0.0);

  public static WavecalOffsets none() {
    return NONE;
  }
}

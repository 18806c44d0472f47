package ca.gc.cra.tagcal.domain.image;

/**
 * Summary statistics over the good pixels (DQ = 0) of one science plane.
 *
 * @param goodPixels number of pixels with no DQ flag
 * @param mean mean of the good pixels, {@code 0} when there are none
 * @param max maximum of the good pixels, {@code 0} when there are none
 * @since 0.1.0
 */
public record ImageStatistics(long goodPixels, double mean, double max) {

  /**
   * Computes the statistics of an image.
   *
   * @param image science and quality planes
   * @return statistics over good pixels
   */
  public static ImageStatistics of(RateImage image) {
    float[] science = image.science().data();
    int[] quality = image.quality().data();
    long good = 0;
    double sum = 0.0;
    double max = Double.NEGATIVE_INFINITY;
    for (int i = 0; i < science.length; i++) {
      if (quality[i] != 0) {
        continue;
      }
      good++;
      sum += science[i];
      if (science[i] > max) {
        max = science[i];
      }
    }
    if (good == 0) {
      return new ImageStatistics(0, 0.0, 0.0);
    }
    return new ImageStatistics(good, sum / good, max);
  }
}

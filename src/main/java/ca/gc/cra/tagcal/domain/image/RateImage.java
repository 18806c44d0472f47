package ca.gc.cra.tagcal.domain.image;

import java.util.Objects;

/**
 * Count-rate science plane with its error and data-quality planes.
 *
 * @param science rate per pixel, counts/s
 * @param error one-sigma error per pixel
 * @param quality data-quality flags per pixel
 * @since 0.1.0
 */
public record RateImage(ImagePlane science, ImagePlane error, DqPlane quality) {

  public RateImage {
    Objects.requireNonNull(science, "science");
    Objects.requireNonNull(error, "error");
    Objects.requireNonNull(quality, "quality");
    if (science.rows() != error.rows() || science.columns() != error.columns()
        || science.rows() != quality.rows() || science.columns() != quality.columns()) {
      throw new IllegalArgumentException("science, error and quality planes differ in shape");
    }
  }

  /**
   * Zero-valued image of the given shape.
   *
   * @param quality data-quality plane that fixes the shape
   * @return image with zero science and error planes
   */
  public static RateImage zeros(DqPlane quality) {
    return new RateImage(
        ImagePlane.zeros(quality.rows(), quality.columns()),
        ImagePlane.zeros(quality.rows(), quality.columns()),
        quality);
  }
}

package ca.gc.cra.tagcal.domain.image;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class ImageStatisticsTest {

  @Test
  void flaggedPixelsAreExcluded() {
    RateImage image = RateImage.zeros(DqPlane.zeros(1, 3));
    image.science().set(0, 0, -2.0f);
    image.science().set(0, 1, 6.0f);
    image.science().set(0, 2, 100.0f);
    image.quality().or(0, 2, 16);

    assertEquals(new ImageStatistics(2, 2.0, 6.0), ImageStatistics.of(image));
  }

  @Test
  void fullyFlaggedImageGivesZeros() {
    DqPlane quality = DqPlane.zeros(2, 2);
    quality.orRegion(0, 2, 0, 2, 8);

    assertEquals(new ImageStatistics(0, 0.0, 0.0), ImageStatistics.of(RateImage.zeros(quality)));
  }

  @Test
  void planesMustShareShape() {
    assertThrows(IllegalArgumentException.class,
        () -> new RateImage(ImagePlane.zeros(2, 2), ImagePlane.zeros(2, 3), DqPlane.zeros(2, 2)));
  }
}

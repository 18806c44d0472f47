package ca.gc.cra.tagcal.application.calibration;

import static ca.gc.cra.tagcal.application.calibration.CalibrationFixtures.fuvInfo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.tagcal.domain.event.EventTable;
import ca.gc.cra.tagcal.domain.exposure.ObsMode;
import ca.gc.cra.tagcal.domain.image.CsumImage;
import org.junit.jupiter.api.Test;

class CumulativeSumBinnerTest {

  @Test
  void timeTagWithPulseHeightsGetsOnePlanePerValue() {
    EventTable events = EventTable.builder(
            new double[] {0, 1, 2}, new double[] {5000.4, 5000.4, 20000}, new double[] {500.2, 500.2, 500})
        .pha(new int[] {3, 7, 3})
        .epsilon(new double[] {1.25, 1.5, 1.0})
        .build();

    CsumImage image = CumulativeSumBinner.bin(fuvInfo().build(), events);

    assertTrue(image.isThreeDimensional());
    assertEquals(CumulativeSumBinner.PHA_RANGE, image.planes());
    assertEquals(1.25, image.get(3, 500, 5000), 1e-12);
    assertEquals(1.5, image.get(7, 500, 5000), 1e-12);
    assertEquals(2.75, image.total(), 1e-12);
  }

  @Test
  void accumImageIsFlat() {
    EventTable events = EventTable.builder(new double[] {0, 0}, new double[] {10, 10}, new double[] {20, 20}).build();

    CsumImage image = CumulativeSumBinner.bin(fuvInfo().obsMode(ObsMode.ACCUM).build(), events);

    assertFalse(image.isThreeDimensional());
    assertEquals(1024, image.rows());
    assertEquals(16384, image.columns());
    assertEquals(2.0, image.get(0, 20, 10), 1e-12);
    assertEquals(1, image.nonZeroCells().size());
  }
}

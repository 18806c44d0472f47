package ca.gc.cra.tagcal.application.calibration;

import static ca.gc.cra.tagcal.application.calibration.CalibrationFixtures.context;
import static ca.gc.cra.tagcal.application.calibration.CalibrationFixtures.fuvInfo;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.cra.tagcal.application.calibration.CalibrationFixtures.InMemoryReferenceTables;
import ca.gc.cra.tagcal.application.port.CalibrationException;
import ca.gc.cra.tagcal.domain.calibration.Correction;
import ca.gc.cra.tagcal.domain.calibration.SwitchState;
import ca.gc.cra.tagcal.domain.calibration.WavecalOffsets;
import ca.gc.cra.tagcal.domain.event.DataQuality;
import ca.gc.cra.tagcal.domain.event.EventTable;
import ca.gc.cra.tagcal.domain.image.DqPlane;
import ca.gc.cra.tagcal.domain.reference.ActiveArea;
import ca.gc.cra.tagcal.domain.reference.BadPixelRegion;
import java.util.List;
import org.junit.jupiter.api.Test;

class BadPixelFlaggerTest {
  private static final BadPixelRegion DEAD = new BadPixelRegion(10, 5, 4, 2, 8);
  private static final BadPixelRegion HOT = new BadPixelRegion(12, 5, 4, 2, 16);

  @Test
  void eventsCollectEveryOverlappingRegionFlag() {
    EventTable events = EventTable.builder(
        new double[] {0, 0, 0, 0}, new double[] {10, 13, 16, 9.9}, new double[] {5, 6.5, 5, 5}).build();

    long flagged = BadPixelFlagger.flagEvents(events, List.of(DEAD, HOT));

    assertEquals(2, flagged);
    assertArrayEquals(new int[] {8, 24, 0, 0}, events.dq());
  }

  @Test
  void planeRegionIsWidenedByShiftRange() {
    DqPlane plane = DqPlane.zeros(10, 30);
    WavecalOffsets offsets = new WavecalOffsets(-1.0, 2.0, 0.0, 0.0);

    BadPixelFlagger.flagPlane(plane, List.of(DEAD), offsets, 0.0, 0);

    assertEquals(0, plane.get(5, 7));
    assertEquals(8, plane.get(5, 8));
    assertEquals(8, plane.get(6, 14));
    assertEquals(0, plane.get(5, 15));
    assertEquals(0, plane.get(7, 10));
  }

  @Test
  void pixelsOutsideActiveAreaAreOutOfBounds() {
    DqPlane plane = DqPlane.zeros(10, 20);

    BadPixelFlagger.flagOutsideActiveArea(plane, new ActiveArea(2, 6, 3, 15), WavecalOffsets.none(), 0.0, 0);

    assertEquals(DataQuality.OUT_OF_BOUNDS, plane.get(1, 10));
    assertEquals(0, plane.get(2, 10));
    assertEquals(0, plane.get(6, 3));
    assertEquals(DataQuality.OUT_OF_BOUNDS, plane.get(7, 10));
    assertEquals(DataQuality.OUT_OF_BOUNDS, plane.get(4, 2));
    assertEquals(0, plane.get(4, 15));
    assertEquals(DataQuality.OUT_OF_BOUNDS, plane.get(4, 16));
  }

  @Test
  void runBuildsPlaneOnlyWhenRequested() throws CalibrationException {
    InMemoryReferenceTables references = new InMemoryReferenceTables();
    references.badPixels.add(DEAD);
    EventTable events = EventTable.builder(new double[] {0}, new double[] {11}, new double[] {5}).build();

    RunContext skipped = context(fuvInfo().build(), events, references);
    DqPlane empty = BadPixelFlagger.run(skipped, WavecalOffsets.none());
    assertEquals(0, events.dq()[0]);
    assertEquals(0, empty.get(5, 11));

    RunContext requested = context(fuvInfo().build(), events, references, Correction.DQICORR);
    DqPlane plane = BadPixelFlagger.run(requested, WavecalOffsets.none());

    assertEquals(8, events.dq()[0]);
    assertEquals(64, plane.rows());
    assertEquals(256, plane.columns());
    assertEquals(8 | DataQuality.OUT_OF_BOUNDS, plane.get(5, 11));
    assertEquals(SwitchState.COMPLETE, requested.switches().state(Correction.DQICORR));
  }
}

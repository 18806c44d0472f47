package ca.gc.cra.tagcal.application.calibration;

import static ca.gc.cra.tagcal.application.calibration.CalibrationFixtures.context;
import static ca.gc.cra.tagcal.application.calibration.CalibrationFixtures.fuvInfo;
import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.cra.tagcal.application.calibration.CalibrationFixtures.InMemoryReferenceTables;
import ca.gc.cra.tagcal.application.port.CalibrationException;
import ca.gc.cra.tagcal.domain.calibration.Correction;
import ca.gc.cra.tagcal.domain.calibration.SwitchState;
import ca.gc.cra.tagcal.domain.event.EventColumn;
import ca.gc.cra.tagcal.domain.event.EventTable;
import ca.gc.cra.tagcal.domain.reference.GeometricDistortionMap;
import org.junit.jupiter.api.Test;

class GeometricCorrectorTest {
  private static final GeometricDistortionMap MAP = new GeometricDistortionMap(
      0, 0, 10, 10, new double[][] {{1.0, 3.0}}, new double[][] {{0.5, 0.5}});

  private static EventTable oneEvent() {
    return EventTable.builder(new double[] {0}, new double[] {5}, new double[] {0}).build();
  }

  @Test
  void nearestBinAndInterpolationDiffer() {
    EventTable nearest = oneEvent();
    EventTable interpolated = oneEvent();

    GeometricCorrector.correct(nearest, MAP, false);
    GeometricCorrector.correct(interpolated, MAP, true);

    assertEquals(2.0, nearest.column(EventColumn.XCORR)[0], 1e-12);
    assertEquals(3.0, interpolated.column(EventColumn.XCORR)[0], 1e-12);
    assertEquals(-0.5, interpolated.column(EventColumn.YCORR)[0], 1e-12);
  }

  @Test
  void runCompletesBothSwitchesWhenInterpolating() throws CalibrationException {
    InMemoryReferenceTables references = new InMemoryReferenceTables();
    references.geometric = MAP;
    RunContext context = context(fuvInfo().build(), oneEvent(), references,
        Correction.GEOCORR, Correction.IGEOCORR);

    GeometricCorrector.run(context);

    assertEquals(SwitchState.COMPLETE, context.switches().state(Correction.GEOCORR));
    assertEquals(SwitchState.COMPLETE, context.switches().state(Correction.IGEOCORR));
    assertEquals(1, references.calls("geofile"));
  }
}

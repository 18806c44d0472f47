package ca.gc.cra.tagcal.application.calibration;

import static ca.gc.cra.tagcal.application.calibration.CalibrationFixtures.context;
import static ca.gc.cra.tagcal.application.calibration.CalibrationFixtures.fuvInfo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.tagcal.application.calibration.CalibrationFixtures.InMemoryReferenceTables;
import ca.gc.cra.tagcal.application.port.CalibrationException;
import ca.gc.cra.tagcal.domain.calibration.Correction;
import ca.gc.cra.tagcal.domain.calibration.SwitchState;
import ca.gc.cra.tagcal.domain.calibration.WavecalOffsets;
import ca.gc.cra.tagcal.domain.calibration.WavecalSummary;
import ca.gc.cra.tagcal.domain.event.EventColumn;
import ca.gc.cra.tagcal.domain.event.EventTable;
import ca.gc.cra.tagcal.domain.exposure.Segment;
import ca.gc.cra.tagcal.domain.exposure.WavecalShift;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class WavecalShiftApplierTest {
  private static final WavecalShift DRIFT = new WavecalShift(2.0, 0.1, -1.0, 0.0);

  private static EventTable threeEvents() {
    return EventTable.builder(
        new double[] {10, 20, 30}, new double[] {5000, 5000, 5000}, new double[] {500, 500, 500}).build();
  }

  @Test
  void fuvShiftIsMeasuredFromFirstEvent() {
    EventTable events = threeEvents();

    Optional<WavecalSummary> summary =
        WavecalShiftApplier.applyFuv(events, new boolean[] {true, true, false}, Optional.of(DRIFT));

    double[] xfull = events.column(EventColumn.XFULL);
    double[] yfull = events.column(EventColumn.YFULL);
    assertEquals(4998.0, xfull[0], 1e-9);
    assertEquals(4997.0, xfull[1], 1e-9);
    assertEquals(5000.0, xfull[2], 1e-9);
    assertEquals(501.0, yfull[0], 1e-9);
    assertEquals(500.0, yfull[2], 1e-9);
    assertEquals(3.0, summary.orElseThrow().averageShift1(), 1e-9);
    assertEquals(-1.0, summary.orElseThrow().averageShift2(), 1e-9);
  }

  @Test
  void offsetsSpanActiveEventsOnly() {
    EventTable events = threeEvents();
    boolean[] active = {true, true, false};
    WavecalShiftApplier.applyFuv(events, active, Optional.of(DRIFT));

    WavecalOffsets offsets = WavecalShiftApplier.offsets(events, active);

    assertEquals(2.0, offsets.minShift1(), 1e-9);
    assertEquals(3.0, offsets.maxShift1(), 1e-9);
    assertEquals(-1.0, offsets.minShift2(), 1e-9);
    assertEquals(-1.0, offsets.maxShift2(), 1e-9);
    assertEquals(WavecalOffsets.none(), WavecalShiftApplier.offsets(events, new boolean[3]));
  }

  @Test
  void runSkipsWithWarningWhenNoShiftIsAvailable() throws CalibrationException {
    RunContext context = context(fuvInfo().build(), threeEvents(), new InMemoryReferenceTables(),
        Correction.WAVECORR);

    WavecalShiftApplier.run(context, segment -> Optional.empty());

    assertEquals(SwitchState.SKIPPED, context.switches().state(Correction.WAVECORR));
    assertTrue(context.metadata().warnings().stream().anyMatch(w -> w.contains("no wavecal shift")));
  }

  @Test
  void wavecalExposuresAreNotShifted() throws CalibrationException {
    RunContext context = context(fuvInfo().exptype("WAVECAL").build(), threeEvents(),
        new InMemoryReferenceTables(), Correction.WAVECORR);

    WavecalShiftApplier.run(context, segment -> Optional.of(DRIFT));

    assertEquals(SwitchState.SKIPPED, context.switches().state(Correction.WAVECORR));
    assertEquals(5000.0, context.events().column(EventColumn.XFULL)[0]);
  }

  @Test
  void runUsesShiftOfExposureSegment() throws CalibrationException {
    RunContext context = context(fuvInfo().build(), threeEvents(), new InMemoryReferenceTables(),
        Correction.WAVECORR);

    WavecalShiftApplier.run(context,
        segment -> segment == Segment.FUVA ? Optional.of(DRIFT) : Optional.empty());

    assertEquals(SwitchState.COMPLETE, context.switches().state(Correction.WAVECORR));
    assertEquals(3.0, context.metadata().build().wavecal().averageShift1(), 1e-9);
  }
}

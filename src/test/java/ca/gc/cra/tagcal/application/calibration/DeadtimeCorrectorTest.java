package ca.gc.cra.tagcal.application.calibration;

import static ca.gc.cra.tagcal.application.calibration.CalibrationFixtures.context;
import static ca.gc.cra.tagcal.application.calibration.CalibrationFixtures.fuvInfo;
import static ca.gc.cra.tagcal.application.calibration.CalibrationFixtures.uniformEvents;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.tagcal.application.calibration.CalibrationFixtures.InMemoryReferenceTables;
import ca.gc.cra.tagcal.application.port.CalibrationException;
import ca.gc.cra.tagcal.domain.calibration.Correction;
import ca.gc.cra.tagcal.domain.calibration.SwitchState;
import ca.gc.cra.tagcal.domain.event.EventTable;
import ca.gc.cra.tagcal.domain.exposure.ExposureInfo;
import ca.gc.cra.tagcal.domain.exposure.ObsMode;
import ca.gc.cra.tagcal.domain.exposure.Segment;
import ca.gc.cra.tagcal.domain.livetime.DeadtimeMethod;
import ca.gc.cra.tagcal.domain.livetime.DeadtimeResult;
import ca.gc.cra.tagcal.domain.livetime.LivetimeTable;
import ca.gc.cra.tagcal.domain.livetime.LivetimeWindow;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import org.junit.jupiter.api.Test;

class DeadtimeCorrectorTest {
  private static final LivetimeTable TABLE =
      new LivetimeTable(new double[] {0, 100, 200}, new double[] {1.0, 0.9, 0.7}, 10.0);

  /** 1200 events at 100 per second, spanning 0 to 11.99 s. */
  private static EventTable steady() {
    int n = 1200;
    double[] time = new double[n];
    double[] x = new double[n];
    double[] y = new double[n];
    for (int i = 0; i < n; i++) {
      time[i] = i / 100.0;
      x[i] = 5000;
      y[i] = 500;
    }
    return EventTable.builder(time, x, y).build();
  }

  private static void assertAllEpsilon(EventTable events, double expected) {
    for (double value : events.epsilon()) {
      assertEquals(expected, value, 1e-12);
    }
  }

  @Test
  void shortFinalWindowReusesPreviousLivetime() {
    EventTable events = steady();
    List<String> log = new ArrayList<>();

    List<LivetimeWindow> windows = DeadtimeCorrector.scan(events, TABLE, 10.0, log::add);

    assertEquals(2, windows.size());
    assertEquals(100.0, windows.get(0).countRate(), 1e-12);
    assertEquals(0.9, windows.get(0).livetime(), 1e-12);
    assertFalse(windows.get(0).reusedPrevious());
    assertTrue(windows.get(1).reusedPrevious());
    assertEquals(11.99, windows.get(1).stop(), 1e-12);
    assertAllEpsilon(events, 1.0 / 0.9);
    assertEquals(2, log.size());
  }

  @Test
  void windowEndingOnLastEventStillCorrectsIt() {
    double[] time = new double[11];
    double[] x = new double[11];
    double[] y = new double[11];
    for (int i = 0; i < time.length; i++) {
      time[i] = i;
      x[i] = 5000;
      y[i] = 500;
    }
    EventTable events = EventTable.builder(time, x, y).build();
    LivetimeTable halving = new LivetimeTable(new double[] {0, 1}, new double[] {1.0, 0.5}, 5.0);

    List<LivetimeWindow> windows = DeadtimeCorrector.scan(events, halving, 5.0, line -> {});

    assertEquals(2, windows.size());
    assertEquals(10.0, windows.get(1).stop(), 1e-12);
    assertEquals(1.2, windows.get(1).countRate(), 1e-12);
    assertAllEpsilon(events, 2.0);
  }

  @Test
  void disagreeingSubarrayUsesHardwareCounter() throws CalibrationException {
    EventTable events = steady();
    ExposureInfo info = fuvInfo().countrate(200.0).subarray(true).nsubarray(1).build();
    List<String> log = new ArrayList<>();

    DeadtimeResult result = DeadtimeCorrector.correctTimeTag(
        events, TABLE, info, OptionalDouble.empty(), 1.0, log::add);

    assertEquals(DeadtimeMethod.DEVENT, result.method());
    assertEquals(200.0, result.rate());
    assertTrue(result.estimatesDisagree());
    assertTrue(result.windows().isEmpty());
    assertAllEpsilon(events, 1.0 / 0.7);
    assertTrue(log.contains("Livetime is based on digital event counter (DEVENTA)."));
  }

  @Test
  void disagreementWithoutSubarrayKeepsTimeResolvedFactorAndWarns() throws CalibrationException {
    EventTable events = steady();
    RunContext context = context(fuvInfo().countrate(200.0).build(), events, new InMemoryReferenceTables(),
        Correction.DEADCORR);

    DeadtimeCorrector.run(context, Optional.empty());

    DeadtimeResult result = context.metadata().build().deadtimeResult().orElseThrow();
    assertEquals(DeadtimeMethod.DATA, result.method());
    assertTrue(result.estimatesDisagree());
    assertEquals(2, result.windows().size());
    assertAllEpsilon(events, 1.0 / 0.9);
    assertEquals(SwitchState.COMPLETE, context.switches().state(Correction.DEADCORR));
    assertTrue(context.metadata().warnings().stream().anyMatch(w -> w.startsWith("livetime estimates differ")));
    assertTrue(context.livetimeLog().contains("stim countrate and livetime could not be determined"));
  }

  @Test
  void nonPositiveTimestepIsFatal() {
    LivetimeTable noStep = new LivetimeTable(new double[] {0, 100}, new double[] {1.0, 0.9}, 0.0);

    CalibrationException ex = assertThrows(CalibrationException.class, () -> DeadtimeCorrector.correctTimeTag(
        steady(), noStep, fuvInfo().build(), OptionalDouble.empty(), 1.0, line -> {}));

    assertEquals(Optional.of(Correction.DEADCORR), ex.correction());
  }

  @Test
  void accumWithoutExposureTimeIsSkippedButComplete() throws CalibrationException {
    ExposureInfo info = fuvInfo().obsMode(ObsMode.ACCUM).exptime(0.0).build();
    EventTable events = uniformEvents(10, 0, 0, 5000, 500);
    RunContext context = context(info, events, new InMemoryReferenceTables(), Correction.DEADCORR);

    DeadtimeCorrector.run(context, Optional.empty());

    assertEquals(DeadtimeMethod.SKIPPED, context.metadata().build().deadtimeResult().orElseThrow().method());
    assertEquals(SwitchState.COMPLETE, context.switches().state(Correction.DEADCORR));
    assertTrue(context.metadata().warnings().stream().anyMatch(w -> w.startsWith("can't do deadcorr")));
    assertAllEpsilon(events, 1.0);
  }

  @Test
  void accumUsesOneFactorForWholeExposure() {
    ExposureInfo info = fuvInfo().obsMode(ObsMode.ACCUM).exptime(1.0).build();
    EventTable events = uniformEvents(50, 0, 0, 5000, 500);

    DeadtimeResult result = DeadtimeCorrector.correctAccum(
        events, TABLE, info, OptionalDouble.empty(), 1.0, line -> {});

    assertEquals(DeadtimeMethod.DATA, result.method());
    assertEquals(50.0, result.rate(), 1e-12);
    assertAllEpsilon(events, 1.0 / 0.95);
  }

  @Test
  void counterKeywordFollowsSegment() {
    assertEquals("DEVENTA", DeadtimeCorrector.counterKeyword(fuvInfo().build()));
    assertEquals("DEVENTB", DeadtimeCorrector.counterKeyword(fuvInfo().segment(Segment.FUVB).build()));
  }
}

package ca.gc.cra.tagcal.application.calibration;

import static ca.gc.cra.tagcal.application.calibration.CalibrationFixtures.context;
import static ca.gc.cra.tagcal.application.calibration.CalibrationFixtures.fuvInfo;
import static ca.gc.cra.tagcal.application.calibration.CalibrationFixtures.uniformEvents;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.tagcal.application.calibration.CalibrationFixtures.InMemoryReferenceTables;
import ca.gc.cra.tagcal.domain.calibration.Correction;
import ca.gc.cra.tagcal.domain.calibration.SwitchState;
import ca.gc.cra.tagcal.domain.event.EventColumn;
import ca.gc.cra.tagcal.domain.event.EventTable;
import java.util.Arrays;
import java.util.OptionalLong;
import org.junit.jupiter.api.Test;

class CoordinateRandomizerTest {

  @Test
  void sameSeedGivesSameCoordinates() {
    EventTable first = uniformEvents(50, 0, 1, 5000, 500);
    EventTable second = uniformEvents(50, 0, 1, 5000, 500);
    boolean[] active = new boolean[50];
    Arrays.fill(active, true);

    CoordinateRandomizer.randomize(first, active, 7L);
    CoordinateRandomizer.randomize(second, active, 7L);

    assertArrayEquals(first.column(EventColumn.XCORR), second.column(EventColumn.XCORR));
    assertArrayEquals(first.column(EventColumn.YCORR), second.column(EventColumn.YCORR));
  }

  @Test
  void deviatesStayWithinHalfPixelAndSkipInactiveEvents() {
    EventTable events = uniformEvents(200, 0, 1, 5000, 500);
    boolean[] active = new boolean[200];
    for (int i = 0; i < active.length; i += 2) {
      active[i] = true;
    }

    CoordinateRandomizer.randomize(events, active, 11L);

    double[] x = events.column(EventColumn.XCORR);
    double[] y = events.column(EventColumn.YCORR);
    for (int i = 0; i < x.length; i++) {
      if (active[i]) {
        assertTrue(Math.abs(x[i] - 5000) <= 0.5);
        assertTrue(Math.abs(y[i] - 500) <= 0.5);
      } else {
        assertEquals(5000.0, x[i]);
        assertEquals(500.0, y[i]);
      }
    }
    assertNotEquals(5000.0, x[0]);
  }

  @Test
  void seedOverrideIsRecorded() {
    RunContext context = context(fuvInfo().randseed(3L).build(), uniformEvents(5, 0, 1, 5000, 500),
        new InMemoryReferenceTables(), Correction.RANDCORR);

    CoordinateRandomizer.run(context, OptionalLong.of(99L));

    assertEquals(SwitchState.COMPLETE, context.switches().state(Correction.RANDCORR));
    assertEquals(99L, context.metadata().build().randomSeed().getAsLong());
  }

  @Test
  void timeBasedSeedWhenHeaderAsksForIt() {
    RunContext context = context(fuvInfo().randseed(CoordinateRandomizer.TIME_BASED_SEED).build(),
        uniformEvents(5, 0, 1, 5000, 500), new InMemoryReferenceTables(), Correction.RANDCORR);

    CoordinateRandomizer.run(context, OptionalLong.empty());

    assertTrue(context.metadata().build().randomSeed().getAsLong() > 0);
  }
}

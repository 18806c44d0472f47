package ca.gc.cra.tagcal.domain.livetime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class LivetimeTableTest {
  private final LivetimeTable table =
      new LivetimeTable(new double[] {0, 100, 200}, new double[] {1.0, 0.9, 0.7}, 10.0);

  @Test
  void interpolatesBetweenSamples() {
    assertEquals(0.95, table.determineLivetime(50), 1e-12);
    assertEquals(0.8, table.determineLivetime(150), 1e-12);
    assertEquals(0.9, table.determineLivetime(100), 1e-12);
  }

  @Test
  void clampsToLastFactorAtOrAboveHighestRate() {
    assertEquals(0.7, table.determineLivetime(200), 1e-12);
    assertEquals(0.7, table.determineLivetime(250), 1e-12);
  }

  @Test
  void belowLowestSampleIsFullyLive() {
    LivetimeTable offset = new LivetimeTable(new double[] {100, 200}, new double[] {0.9, 0.7}, 10.0);

    assertEquals(1.0, offset.determineLivetime(50), 1e-12);
    assertEquals(1.0, offset.determineLivetime(0), 1e-12);
  }

  @Test
  void singleSampleAppliesEverywhereAboveZero() {
    LivetimeTable single = new LivetimeTable(new double[] {100}, new double[] {0.85}, 1.0);

    assertEquals(0.85, single.determineLivetime(5), 1e-12);
    assertEquals(1.0, single.determineLivetime(0), 1e-12);
  }

  @Test
  void rateAxisMustIncrease() {
    assertThrows(IllegalArgumentException.class,
        () -> new LivetimeTable(new double[] {0, 100, 100}, new double[] {1, 0.9, 0.8}, 1.0));
    assertThrows(IllegalArgumentException.class,
        () -> new LivetimeTable(new double[] {0, 100}, new double[] {1}, 1.0));
  }
}

package ca.gc.cra.tagcal.application.calibration;

import static ca.gc.cra.tagcal.application.calibration.CalibrationFixtures.fuvInfo;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.cra.tagcal.application.calibration.CalibrationFixtures.InMemoryReferenceTables;
import ca.gc.cra.tagcal.application.port.CalibrationException;
import ca.gc.cra.tagcal.domain.event.EventTable;
import ca.gc.cra.tagcal.domain.exposure.Detector;
import ca.gc.cra.tagcal.domain.exposure.Segment;
import ca.gc.cra.tagcal.domain.reference.SpectralTrace;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RegionClassifierTest {

  private static EventTable at(double[] x, double[] y) {
    return EventTable.builder(new double[x.length], x, y).build();
  }

  @Test
  void activeAreaAppliesMarginOnEverySide() {
    EventTable events = at(
        new double[] {1001, 1002, 14998, 14999, 5000, 5000},
        new double[] {500, 500, 500, 500, 102, 101});

    boolean[] mask = RegionClassifier.activeArea(events, Detector.FUV, CalibrationFixtures.AREA);

    assertArrayEquals(new boolean[] {false, true, true, false, true, false}, mask);
    assertEquals(3, RegionClassifier.count(mask));
  }

  @Test
  void everyNuvEventIsActive() {
    EventTable events = at(new double[] {-5, 5000}, new double[] {-5, 5000});

    assertArrayEquals(new boolean[] {true, true}, RegionClassifier.activeArea(events, Detector.NUV, null));
  }

  @Test
  void globalRateIsZeroWithoutExposureTime() {
    boolean[] mask = {true, true, false, true};

    assertEquals(0.3, RegionClassifier.globalRate(mask, 10.0), 1e-12);
    assertEquals(0.0, RegionClassifier.globalRate(mask, 0.0));
  }

  @Test
  void dopplerBoundaryIsRoundedTraceMidpoint() throws CalibrationException {
    InMemoryReferenceTables references = new InMemoryReferenceTables();
    references.traces.put("PSA", new SpectralTrace(480.2, 0));
    references.traces.put("WCA", new SpectralTrace(781.1, 0));

    double boundary = RegionClassifier.fuvDopplerBoundary(fuvInfo().build(), references);

    assertEquals(631.0, boundary);
    boolean[] region = RegionClassifier.fuvDopplerRegion(
        at(new double[] {5000, 5000, 5000}, new double[] {630, 631, 200}), new boolean[] {true, true, false}, boundary);
    assertArrayEquals(new boolean[] {true, false, false}, region);
  }

  @Test
  void nuvStripesSplitAtTraceMidpoints() {
    double[] boundaries = {200, 400, 600};
    EventTable events = at(new double[5], new double[] {100, 200, 450, 599, 700});

    Map<Segment, boolean[]> psa = RegionClassifier.nuvPsaRegions(events, boundaries);
    Map<Segment, boolean[]> wca = RegionClassifier.nuvWcaRegions(events, boundaries);

    assertArrayEquals(new boolean[] {true, false, false, false, false}, psa.get(Segment.NUVA));
    assertArrayEquals(new boolean[] {false, true, false, false, false}, psa.get(Segment.NUVB));
    assertArrayEquals(new boolean[] {false, false, true, true, false}, psa.get(Segment.NUVC));
    assertArrayEquals(new boolean[] {false, true, false, false, false}, wca.get(Segment.NUVA));
    assertArrayEquals(new boolean[] {false, false, true, true, false}, wca.get(Segment.NUVB));
    assertArrayEquals(new boolean[] {false, false, false, false, true}, wca.get(Segment.NUVC));
  }
}

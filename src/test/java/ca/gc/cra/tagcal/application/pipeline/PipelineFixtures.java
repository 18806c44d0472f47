package ca.gc.cra.tagcal.application.pipeline;

import ca.gc.cra.tagcal.application.calibration.CalibrationFixtures;
import ca.gc.cra.tagcal.domain.calibration.Correction;
import ca.gc.cra.tagcal.domain.calibration.SwitchState;
import ca.gc.cra.tagcal.domain.event.EventTable;
import ca.gc.cra.tagcal.domain.exposure.Exposure;
import ca.gc.cra.tagcal.domain.exposure.ExposureInfo;
import ca.gc.cra.tagcal.domain.time.IntervalSet;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

final class PipelineFixtures {
  private PipelineFixtures() {}

  /** FUVA header whose 1024x256 image holds detector column 5000 at image column 100. */
  static ExposureInfo info() {
    return CalibrationFixtures.fuvInfo().exptime(20.0).npix(1024, 256).xOffset(-4900).build();
  }

  static Map<Correction, SwitchState> requests(Correction... perform) {
    Map<Correction, SwitchState> requests = new EnumMap<>(Correction.class);
    for (Correction correction : Correction.values()) {
      requests.put(correction, SwitchState.OMIT);
    }
    for (Correction correction : perform) {
      requests.put(correction, SwitchState.PERFORM);
    }
    return requests;
  }

  /** Twenty events, one per second, in the middle of the science spectrum. */
  static Exposure exposure(Correction... perform) {
    EventTable events = CalibrationFixtures.uniformEvents(20, 0, 1, 5000, 500);
    return new Exposure(info(), requests(perform), IntervalSet.single(0, 20), List.of(), Map.of(), events);
  }

  static Exposure empty(Correction... perform) {
    return new Exposure(info(), requests(perform), IntervalSet.empty(), List.of(), Map.of(), EventTable.empty());
  }
}

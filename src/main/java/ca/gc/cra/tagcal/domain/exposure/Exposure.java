package ca.gc.cra.tagcal.domain.exposure;

import ca.gc.cra.tagcal.domain.calibration.Correction;
import ca.gc.cra.tagcal.domain.calibration.SwitchState;
import ca.gc.cra.tagcal.domain.event.EventTable;
import ca.gc.cra.tagcal.domain.time.Interval;
import ca.gc.cra.tagcal.domain.time.IntervalSet;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything ingested for one exposure: header, switch requests, time intervals, wavecal results and events.
 *
 * @param info typed header
 * @param switchRequests requested state per correction; corrections not listed are {@link SwitchState#OMIT}
 * @param gti good time intervals recorded with the exposure; empty when none were recorded
 * @param bursts bad intervals reported by the upstream burst detector
 * @param wavecalShifts shifts keyed by segment letter ({@code A}, {@code B}, {@code C})
 * @param events event table owned by the run that receives this exposure
 * @since 0.1.0
 */
public record Exposure(
    ExposureInfo info,
    Map<Correction, SwitchState> switchRequests,
    IntervalSet gti,
    List<Interval> bursts,
    Map<String, WavecalShift> wavecalShifts,
    EventTable events) {

  public Exposure {
    Objects.requireNonNull(info, "info");
    Objects.requireNonNull(events, "events");
    EnumMap<Correction, SwitchState> requests = new EnumMap<>(Correction.class);
    if (switchRequests != null) {
      requests.putAll(switchRequests);
    }
    switchRequests = Map.copyOf(requests);
    gti = Objects.requireNonNullElse(gti, IntervalSet.empty());
    bursts = bursts == null ? List.of() : List.copyOf(bursts);
    wavecalShifts = wavecalShifts == null ? Map.of() : Map.copyOf(wavecalShifts);
  }

  /**
   * Looks up the wavecal shift recorded for a segment or stripe.
   *
   * @param segment segment whose letter keys the shift
   * @return shift when present
   */
  public Optional<WavecalShift> wavecalShift(Segment segment) {
    return Optional.ofNullable(wavecalShifts.get(segment.letter()));
  }
}

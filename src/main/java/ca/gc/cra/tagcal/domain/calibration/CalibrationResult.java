package ca.gc.cra.tagcal.domain.calibration;

import ca.gc.cra.tagcal.domain.event.EventTable;
import ca.gc.cra.tagcal.domain.exposure.ExposureInfo;
import ca.gc.cra.tagcal.domain.image.CsumImage;
import ca.gc.cra.tagcal.domain.image.RateImage;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Products of one completed calibration run.
 *
 * @param info exposure header after corrections (exposure time may have been recomputed)
 * @param events corrected event table
 * @param counts count-rate image
 * @param flatfielded effective (weighted) count-rate image
 * @param csum cumulative-sum image when requested
 * @param metadata run audit record
 * @param stimLog stim diagnostic lines, empty when not requested
 * @param livetimeLog livetime diagnostic lines, empty when not requested
 * @since 0.1.0
 */
public record CalibrationResult(
    ExposureInfo info,
    EventTable events,
    RateImage counts,
    RateImage flatfielded,
    Optional<CsumImage> csum,
    CalibrationMetadata metadata,
    List<String> stimLog,
    List<String> livetimeLog) {

  public CalibrationResult {
    Objects.requireNonNull(info, "info");
    Objects.requireNonNull(events, "events");
    Objects.requireNonNull(counts, "counts");
    Objects.requireNonNull(flatfielded, "flatfielded");
    Objects.requireNonNull(csum, "csum");
    Objects.requireNonNull(metadata, "metadata");
    stimLog = List.copyOf(Objects.requireNonNull(stimLog, "stimLog"));
    livetimeLog = List.copyOf(Objects.requireNonNull(livetimeLog, "livetimeLog"));
  }
}

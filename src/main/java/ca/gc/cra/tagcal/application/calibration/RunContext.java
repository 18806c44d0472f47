package ca.gc.cra.tagcal.application.calibration;

import ca.gc.cra.tagcal.application.port.ReferenceTables;
import ca.gc.cra.tagcal.domain.calibration.CalibrationMetadata;
import ca.gc.cra.tagcal.domain.calibration.CalibrationSwitches;
import ca.gc.cra.tagcal.domain.event.EventTable;
import ca.gc.cra.tagcal.domain.exposure.ExposureInfo;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Per-run state threaded through every calibration stage.
 * <p><strong>Why:</strong> The active-area mask, the serious data-quality set and the switch states belong to one
 * exposure; keeping them here instead of in static fields lets independent runs proceed side by side.</p>
 * <p><strong>Role:</strong> Created once by the pipeline for each exposure and discarded at the end of the run.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Own the event table, the header view and the calibration switches of the run.</li>
 *   <li>Carry the active-area mask between the stages that recompute and consume it.</li>
 *   <li>Collect metadata, consistency warnings and diagnostic log lines.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; confined to the thread running the pipeline.</p>
 *
 * @since 0.1.0
 */
public final class RunContext {
  private static final Logger log = LoggerFactory.getLogger(RunContext.class);

  private final EventTable events;
  private final CalibrationSwitches switches;
  private final ReferenceTables references;
  private final CalibrationMetadata.Builder metadata;
  private final boolean stimLogEnabled;
  private final boolean livetimeLogEnabled;
  private final List<String> stimLog = new ArrayList<>();
  private final List<String> livetimeLog = new ArrayList<>();
  private ExposureInfo info;
  private boolean[] activeArea;
  private int seriousFlags;

  /**
   * Creates the context of one run.
   *
   * @param info exposure header view
   * @param events event table exclusively owned by the run
   * @param switches requested calibration switches
   * @param references reference-table queries
   * @param stimLogEnabled whether stim diagnostic lines are collected
   * @param livetimeLogEnabled whether livetime diagnostic lines are collected
   */
  public RunContext(
      ExposureInfo info,
      EventTable events,
      CalibrationSwitches switches,
      ReferenceTables references,
      boolean stimLogEnabled,
      boolean livetimeLogEnabled) {
    this.info = Objects.requireNonNull(info, "info");
    this.events = Objects.requireNonNull(events, "events");
    this.switches = Objects.requireNonNull(switches, "switches");
    this.references = Objects.requireNonNull(references, "references");
    this.stimLogEnabled = stimLogEnabled;
    this.livetimeLogEnabled = livetimeLogEnabled;
    this.metadata = CalibrationMetadata.builder(info.rootname());
    this.seriousFlags = info.sdqflags();
    this.activeArea = new boolean[events.size()];
  }

  public ExposureInfo info() {
    return info;
  }

  /** Replaces the header view, e.g. after the exposure time was recomputed. */
  public void updateInfo(ExposureInfo updated) {
    this.info = Objects.requireNonNull(updated, "updated");
  }

  @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "Stages mutate the run's event table in place.")
  public EventTable events() {
    return events;
  }

  @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "Stages record their outcome on the run's switches.")
  public CalibrationSwitches switches() {
    return switches;
  }

  public ReferenceTables references() {
    return references;
  }

  @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "Stages add their results to the run's metadata.")
  public CalibrationMetadata.Builder metadata() {
    return metadata;
  }

  /**
   * Lends the active-area mask computed by the last {@link RegionClassifier#update(RunContext)}.
   *
   * @return live mask, one flag per event
   */
  @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "The mask is shared read-only between stages.")
  public boolean[] activeArea() {
    return activeArea;
  }

  @SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "Mask ownership transfers to the run.")
  public void setActiveArea(boolean[] mask) {
    if (mask.length != events.size()) {
      throw new IllegalArgumentException(
          "active-area mask has " + mask.length + " entries but the table has " + events.size() + " events");
    }
    this.activeArea = mask;
  }

  public int seriousFlags() {
    return seriousFlags;
  }

  public void addSeriousFlags(int flags) {
    this.seriousFlags |= flags;
  }

  /**
   * Records a non-fatal consistency warning.
   *
   * @param message human-readable warning kept in the run metadata
   */
  public void warn(String message) {
    log.warn(message);
    metadata.warning(message);
  }

  public boolean stimLogEnabled() {
    return stimLogEnabled;
  }

  public boolean livetimeLogEnabled() {
    return livetimeLogEnabled;
  }

  public void appendStimLog(String line) {
    if (stimLogEnabled) {
      stimLog.add(line);
    }
  }

  public void appendLivetimeLog(String line) {
    if (livetimeLogEnabled) {
      livetimeLog.add(line);
    }
  }

  public List<String> stimLog() {
    return List.copyOf(stimLog);
  }

  public List<String> livetimeLog() {
    return List.copyOf(livetimeLog);
  }
}

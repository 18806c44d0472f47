package ca.gc.cra.tagcal.application.pipeline;

import ca.gc.cra.tagcal.application.calibration.BadPixelFlagger;
import ca.gc.cra.tagcal.application.calibration.CoordinateRandomizer;
import ca.gc.cra.tagcal.application.calibration.CumulativeSumBinner;
import ca.gc.cra.tagcal.application.calibration.DeadtimeCorrector;
import ca.gc.cra.tagcal.application.calibration.DopplerCorrector;
import ca.gc.cra.tagcal.application.calibration.FlatFieldCorrector;
import ca.gc.cra.tagcal.application.calibration.GeometricCorrector;
import ca.gc.cra.tagcal.application.calibration.GoodTimeEngine;
import ca.gc.cra.tagcal.application.calibration.HeliocentricVelocity;
import ca.gc.cra.tagcal.application.calibration.ImageBinner;
import ca.gc.cra.tagcal.application.calibration.PhotometryCorrector;
import ca.gc.cra.tagcal.application.calibration.PulseHeightFilter;
import ca.gc.cra.tagcal.application.calibration.RegionClassifier;
import ca.gc.cra.tagcal.application.calibration.RunContext;
import ca.gc.cra.tagcal.application.calibration.StatisticsStage;
import ca.gc.cra.tagcal.application.calibration.StimTracker;
import ca.gc.cra.tagcal.application.calibration.ThermalDistortionCorrector;
import ca.gc.cra.tagcal.application.calibration.WavecalShiftApplier;
import ca.gc.cra.tagcal.application.port.CalibrationException;
import ca.gc.cra.tagcal.application.port.ReferenceTables;
import ca.gc.cra.tagcal.domain.calibration.CalibrationMetadata;
import ca.gc.cra.tagcal.domain.calibration.CalibrationResult;
import ca.gc.cra.tagcal.domain.calibration.CalibrationSwitches;
import ca.gc.cra.tagcal.domain.calibration.Correction;
import ca.gc.cra.tagcal.domain.calibration.SwitchState;
import ca.gc.cra.tagcal.domain.calibration.WavecalOffsets;
import ca.gc.cra.tagcal.domain.event.EventColumn;
import ca.gc.cra.tagcal.domain.event.EventTable;
import ca.gc.cra.tagcal.domain.exposure.Exposure;
import ca.gc.cra.tagcal.domain.exposure.ExposureInfo;
import ca.gc.cra.tagcal.domain.image.CsumImage;
import ca.gc.cra.tagcal.domain.image.DqPlane;
import ca.gc.cra.tagcal.domain.image.RateImage;
import ca.gc.cra.tagcal.domain.stim.ThermalParameters;
import ca.gc.cra.tagcal.domain.time.Interval;
import ca.gc.cra.tagcal.domain.time.IntervalSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Runs the fixed sequence of event corrections over one exposure and bins the result.
 * <p><strong>Why:</strong> Several corrections depend on each other's outputs (stim tracking feeds thermal and
 * deadtime correction, region classification feeds Doppler and wavecal), so the order is fixed in one place.</p>
 * <p><strong>Role:</strong> Application orchestrator invoked by {@link CalibrateUseCase}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Build the run's switches from the exposure requests and the configured overrides.</li>
 *   <li>Thread a fresh {@link RunContext} through every stage.</li>
 *   <li>Short-circuit empty exposures to zero-valued products.</li>
 *   <li>Downgrade requests that no stage acted on to {@link SwitchState#SKIPPED}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Holds no per-run state; one instance may calibrate several exposures, one
 * call at a time per exposure. Each call asks the reference supplier for its own view, so a per-run query cache
 * is not shared between exposures.</p>
 *
 * @since 0.1.0
 */
public final class TimeTagCalibrationPipeline {
  private static final Logger log = LoggerFactory.getLogger(TimeTagCalibrationPipeline.class);

  private final Supplier<? extends ReferenceTables> referencesPerRun;
  private final PipelineOptions options;

  /**
   * Creates a pipeline that queries the same reference tables on every run.
   *
   * @param references reference-table queries; must not be {@code null}
   * @param options run options; must not be {@code null}
   */
  public TimeTagCalibrationPipeline(ReferenceTables references, PipelineOptions options) {
    this(constant(Objects.requireNonNull(references, "references")), options);
  }

  /**
   * Creates a pipeline that obtains a fresh reference-table view for each {@link #calibrate(Exposure)} call.
   *
   * @param referencesPerRun called once per run, for example to wrap the loaded tables in a new query cache
   * @param options run options; must not be {@code null}
   */
  public TimeTagCalibrationPipeline(Supplier<? extends ReferenceTables> referencesPerRun, PipelineOptions options) {
    this.referencesPerRun = Objects.requireNonNull(referencesPerRun, "referencesPerRun");
    this.options = Objects.requireNonNull(options, "options");
  }

  private static Supplier<ReferenceTables> constant(ReferenceTables references) {
    return () -> references;
  }

  /**
   * Calibrates one exposure.
   *
   * <p>The exposure's event table is mutated in place and returned inside the result.</p>
   *
   * @param exposure exposure to calibrate; must not be {@code null}
   * @return corrected events, images and metadata
   * @throws CalibrationException when a stage cannot proceed (missing or ambiguous reference rows, missing columns)
   */
  public CalibrationResult calibrate(Exposure exposure) throws CalibrationException {
    Objects.requireNonNull(exposure, "exposure");
    ExposureInfo info = exposure.info();
    EventTable events = exposure.events();
    CalibrationSwitches switches = CalibrationSwitches.of(options.effectiveSwitches(exposure.switchRequests()));
    RunContext context = new RunContext(
        info, events, switches, Objects.requireNonNull(referencesPerRun.get(), "references"),
        options.stimLog(), options.livetimeLog());
    log.info("Calibrating {}: {} {} {} with {} events",
        info.rootname(), info.segment(), info.obsMode().label(), info.obsType(), events.size());

    if (events.isEmpty()) {
      return nullResult(context, exposure.gti());
    }

    RegionClassifier.update(context);
    PhotometryCorrector.run(context);
    context.metadata().globrate(RegionClassifier.globalRate(context.activeArea(), context.info().exptime()));

    List<Interval> bursts = GoodTimeEngine.applyBursts(context, exposure.bursts());
    List<Interval> badTimes = GoodTimeEngine.applyBadTimes(context);
    IntervalSet gti = exposure.gti();
    if (context.info().isTimeTag()) {
      gti = GoodTimeEngine.recompute(context, gti, bursts, badTimes);
    }
    context.metadata().gti(gti);

    PulseHeightFilter.run(context);
    CoordinateRandomizer.run(context, options.seedOverride());
    Optional<ThermalParameters> thermal = StimTracker.run(context);
    ThermalDistortionCorrector.run(context, thermal);
    GeometricCorrector.run(context);
    RegionClassifier.update(context);
    copyColumns(events);
    DopplerCorrector.run(context);
    HeliocentricVelocity.run(context);
    DeadtimeCorrector.run(context, thermal);

    Optional<CsumImage> csum = Optional.empty();
    if (options.csum()) {
      csum = Optional.of(CumulativeSumBinner.bin(context.info(), events));
    }

    FlatFieldCorrector.run(context);
    WavecalShiftApplier.run(context, exposure::wavecalShift);
    WavecalOffsets offsets = WavecalShiftApplier.offsets(events, context.activeArea());
    context.metadata().wavecalOffsets(offsets);
    DqPlane quality = BadPixelFlagger.run(context, offsets);
    ImageBinner.Images images = ImageBinner.run(context, quality);
    StatisticsStage.run(context, images);

    return finish(context, images.counts(), images.flatfielded(), csum, false);
  }

  /**
   * Seeds the post-correction coordinate columns from XCORR/YCORR so that stages which do not run still leave
   * binnable coordinates behind.
   *
   * @param events event table
   */
  static void copyColumns(EventTable events) {
    events.copyColumn(EventColumn.XCORR, EventColumn.XDOPP);
    events.copyColumn(EventColumn.XCORR, EventColumn.XFULL);
    events.copyColumn(EventColumn.YCORR, EventColumn.YDOPP);
    events.copyColumn(EventColumn.YCORR, EventColumn.YFULL);
  }

  private CalibrationResult nullResult(RunContext context, IntervalSet gti) {
    ExposureInfo info = context.info();
    context.warn("exposure " + info.rootname() + " contains no events; writing null-valued products");
    context.metadata().nullData(true).globrate(0.0).gti(gti);
    DqPlane quality = DqPlane.zeros(info.npixY(), info.npixX());
    Optional<CsumImage> csum = Optional.empty();
    if (options.csum()) {
      csum = Optional.of(CumulativeSumBinner.emptyFor(info, context.events().hasPha()));
    }
    return finish(context, RateImage.zeros(quality), RateImage.zeros(quality), csum, true);
  }

  private CalibrationResult finish(
      RunContext context,
      RateImage counts,
      RateImage flatfielded,
      Optional<CsumImage> csum,
      boolean nullData) {
    CalibrationSwitches switches = context.switches();
    List<String> pending = new ArrayList<>();
    for (Map.Entry<Correction, SwitchState> entry : switches.snapshot().entrySet()) {
      if (entry.getValue() == SwitchState.PERFORM) {
        pending.add(entry.getKey().keyword());
      }
    }
    if (!pending.isEmpty()) {
      log.info("Corrections not applicable to this exposure, marked SKIPPED: {}", pending);
      switches.skipAllPending();
    }
    CalibrationMetadata metadata = context.metadata()
        .switches(switches.snapshot())
        .exptime(context.info().exptime())
        .nullData(nullData)
        .build();
    log.info("Calibration of {} finished: {}", context.info().rootname(), switches);
    return new CalibrationResult(
        context.info(),
        context.events(),
        counts,
        flatfielded,
        csum,
        metadata,
        context.stimLog(),
        context.livetimeLog());
  }
}

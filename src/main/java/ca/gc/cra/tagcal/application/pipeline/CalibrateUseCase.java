package ca.gc.cra.tagcal.application.pipeline;

import ca.gc.cra.tagcal.application.port.CalibrationException;
import ca.gc.cra.tagcal.application.port.ExposureSource;
import ca.gc.cra.tagcal.application.port.MetricsPort;
import ca.gc.cra.tagcal.application.port.ProductSink;
import ca.gc.cra.tagcal.domain.calibration.CalibrationResult;
import ca.gc.cra.tagcal.domain.calibration.Correction;
import ca.gc.cra.tagcal.domain.calibration.SwitchState;
import ca.gc.cra.tagcal.domain.exposure.Exposure;
import java.io.IOException;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Reads one exposure, calibrates it and hands the products to the sink.
 * <p><strong>Why:</strong> Keeps input, calibration and output wiring out of the CLI so the same flow can be driven
 * from tests with in-memory adapters.</p>
 * <p><strong>Role:</strong> Application-layer use case coordinating the exposure source, the pipeline and the
 * product sink.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; create one instance per CLI invocation.</p>
 * <p><strong>Observability:</strong> Emits {@code calibrate.*} metrics and tags log lines with the
 * {@code calibrate.exposure} MDC key.</p>
 *
 * @since 0.1.0
 */
public final class CalibrateUseCase {
  private static final Logger log = LoggerFactory.getLogger(CalibrateUseCase.class);

  /** MDC key holding the root name of the exposure being calibrated. */
  public static final String MDC_EXPOSURE = "calibrate.exposure";

  private final ExposureSource source;
  private final TimeTagCalibrationPipeline pipeline;
  private final ProductSink sink;
  private final MetricsPort metrics;

  /**
   * Creates the use case.
   *
   * @param source exposure reader; must not be {@code null}
   * @param pipeline calibration pipeline; must not be {@code null}
   * @param sink product writer; must not be {@code null}
   * @param metrics metrics port; must not be {@code null}
   */
  public CalibrateUseCase(
      ExposureSource source, TimeTagCalibrationPipeline pipeline, ProductSink sink, MetricsPort metrics) {
    this.source = Objects.requireNonNull(source, "source");
    this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Runs the calibration end to end.
   *
   * <p>Products are written only after the pipeline finished, so a failed run leaves no partial output.</p>
   *
   * @return calibration result that was written
   * @throws IOException when reading the exposure or writing products fails
   * @throws CalibrationException when the exposure or its reference tables are inconsistent
   */
  public CalibrationResult run() throws IOException, CalibrationException {
    long started = System.nanoTime();
    try {
      Exposure exposure = source.read();
      MDC.put(MDC_EXPOSURE, exposure.info().rootname());
      metrics.observe("calibrate.events", exposure.events().size());
      CalibrationResult result = pipeline.calibrate(exposure);
      sink.write(result);
      recordOutcome(result);
      metrics.increment("calibrate.runs.success");
      log.info("Calibrated {} ({} warnings)", result.info().rootname(), result.metadata().warnings().size());
      return result;
    } catch (IOException | CalibrationException | RuntimeException ex) {
      metrics.increment("calibrate.runs.failed");
      log.error("Calibration failed", ex);
      throw ex;
    } finally {
      metrics.observe("calibrate.durationMillis", (System.nanoTime() - started) / 1_000_000L);
      MDC.remove(MDC_EXPOSURE);
    }
  }

  private void recordOutcome(CalibrationResult result) {
    for (Map.Entry<Correction, SwitchState> entry : result.metadata().switches().entrySet()) {
      if (entry.getValue() == SwitchState.COMPLETE) {
        metrics.increment("calibrate.stage." + entry.getKey().keyword() + ".complete");
      } else if (entry.getValue() == SwitchState.SKIPPED) {
        metrics.increment("calibrate.stage." + entry.getKey().keyword() + ".skipped");
      }
    }
    for (int i = 0; i < result.metadata().warnings().size(); i++) {
      metrics.increment("calibrate.warnings");
    }
  }
}

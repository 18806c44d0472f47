package ca.gc.cra.tagcal.config;

import ca.gc.cra.tagcal.application.pipeline.CalibrateUseCase;
import ca.gc.cra.tagcal.application.pipeline.PipelineOptions;
import ca.gc.cra.tagcal.application.pipeline.TimeTagCalibrationPipeline;
import ca.gc.cra.tagcal.application.port.CalibrationException;
import ca.gc.cra.tagcal.application.port.MetricsPort;
import ca.gc.cra.tagcal.application.port.ReferenceTables;
import ca.gc.cra.tagcal.infrastructure.exposure.JsonExposureReader;
import ca.gc.cra.tagcal.infrastructure.product.FileProductSink;
import ca.gc.cra.tagcal.infrastructure.reference.CachingReferenceTables;
import ca.gc.cra.tagcal.infrastructure.reference.TableBackedReferenceTables;
import ca.gc.cra.tagcal.infrastructure.reference.YamlReferenceTableLoader;
import java.io.IOException;
import java.util.Objects;

/**
 * <strong>What:</strong> Wires the calibrate use case to its concrete adapters.
 * <p><strong>Why:</strong> Keeps adapter construction in one place so the CLI only deals with configuration and exit
 * codes.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Load the reference tables and wrap them in a per-run cache.</li>
 *   <li>Translate {@link CalibrateConfig} into {@link PipelineOptions}.</li>
 *   <li>Attach the JSON exposure reader and the file product sink.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; one instance per CLI invocation.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private final CalibrateConfig config;
  private final MetricsPort metrics;

  /**
   * Creates the root.
   *
   * @param config calibrate settings
   * @param metrics metrics port shared by the run
   */
  public CompositionRoot(CalibrateConfig config, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Builds the use case; loads the reference tables eagerly so a bad document fails before any exposure is read.
   *
   * @return ready-to-run use case
   * @throws IOException when the reference document cannot be read
   * @throws CalibrationException when the reference document is malformed
   */
  public CalibrateUseCase calibrateUseCase() throws IOException, CalibrationException {
    ReferenceTables tables = new TableBackedReferenceTables(YamlReferenceTableLoader.load(config.references()));
    TimeTagCalibrationPipeline pipeline =
        new TimeTagCalibrationPipeline(() -> new CachingReferenceTables(tables), pipelineOptions());
    return new CalibrateUseCase(
        new JsonExposureReader(config.input()),
        pipeline,
        new FileProductSink(config.outputDirectory(), config.stimLog(), config.livetimeLog()),
        metrics);
  }

  PipelineOptions pipelineOptions() {
    return new PipelineOptions(
        config.csum(),
        config.stimLog().isPresent(),
        config.livetimeLog().isPresent(),
        config.randomSeed(),
        config.switchOverrides());
  }
}

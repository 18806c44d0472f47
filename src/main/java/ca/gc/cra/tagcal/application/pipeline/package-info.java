/**
 * Application-level pipeline that calibrates one exposure at a time.
 * <p>{@link ca.gc.cra.tagcal.application.pipeline.TimeTagCalibrationPipeline} owns the stage order;
 * {@link ca.gc.cra.tagcal.application.pipeline.CalibrateUseCase} wires it to the exposure source, the product sink
 * and {@link ca.gc.cra.tagcal.application.port.MetricsPort}. Runs are not thread-safe; create a fresh use case per
 * CLI invocation.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.tagcal.application.pipeline;

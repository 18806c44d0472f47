/**
 * <strong>Purpose:</strong> Ports the calibration pipeline depends on: reference-table queries, exposure input,
 * product output and metrics.
 * <p><strong>Pipeline role:</strong> Application boundary; infrastructure adapters implement these interfaces.</p>
 * <p><strong>Errors:</strong> Fatal conditions surface as the checked {@link ca.gc.cra.tagcal.application.port.CalibrationException}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.tagcal.application.port;

/**
 * Command-line entry points: the {@code tagcal} dispatcher, {@code calibrate} and {@code refcheck}.
 * <p><strong>Role:</strong> Outermost adapter translating arguments into configuration and outcomes into
 * {@link ca.gc.cra.tagcal.api.ExitCode}s.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.tagcal.api;

/**
 * Metrics adapters bridging the TAGCAL metrics port to OpenTelemetry or a no-op implementation.
 * <p><strong>Concurrency:</strong> Implementations are thread-safe.</p>
 * <p><strong>Metrics:</strong> Publishes under the {@code calibrate.*} namespace.</p>
 */
package ca.gc.cra.tagcal.infrastructure.metrics;

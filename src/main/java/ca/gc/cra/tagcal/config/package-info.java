/**
 * Configuration loading and wiring: embedded defaults, YAML sections, CLI overrides and the composition root.
 * <p><strong>Concurrency:</strong> Configuration records are immutable; loaders run once on the CLI thread.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.tagcal.config;

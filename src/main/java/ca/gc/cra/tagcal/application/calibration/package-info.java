/**
 * Event corrections and the estimators they depend on.
 * <p>Each stage is a stateless utility class whose {@code run} method reads and updates a
 * {@link ca.gc.cra.tagcal.application.calibration.RunContext}; the numeric core of every stage is exposed as a
 * separate static method over plain domain values so it can be tested without reference tables.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.tagcal.application.calibration;

package ca.gc.cra.tagcal.application.port;

import ca.gc.cra.tagcal.domain.calibration.Correction;
import java.util.Optional;

/**
 * Checked exception signalling a fatal calibration condition: malformed input, a missing required reference
 * table or an ambiguous lookup. The run aborts at the stage boundary and no product is written.
 *
 * @since 0.1.0
 */
public class CalibrationException extends Exception {
  private static final long serialVersionUID = 1L;

  private final transient Correction correction;

  /**
   * Creates an exception not tied to a single correction.
   *
   * @param message human-readable error
   */
  public CalibrationException(String message) {
    this(message, null, null);
  }

  /**
   * Creates an exception raised while a correction was running.
   *
   * @param message human-readable error
   * @param correction failing correction; may be {@code null}
   */
  public CalibrationException(String message, Correction correction) {
    this(message, correction, null);
  }

  /**
   * Creates an exception with an underlying cause.
   *
   * @param message human-readable error
   * @param correction failing correction; may be {@code null}
   * @param cause root cause; may be {@code null}
   */
  public CalibrationException(String message, Correction correction, Throwable cause) {
    super(message, cause);
    this.correction = correction;
  }

  public Optional<Correction> correction() {
    return Optional.ofNullable(correction);
  }
}

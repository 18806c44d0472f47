package ca.gc.cra.tagcal.api;

/**
 * <strong>What:</strong> Process exit codes shared by the TAGCAL commands.
 * <p><strong>Why:</strong> Batch schedulers driving many exposures distinguish bad invocations from inconsistent
 * calibration inputs and from infrastructure failures.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Products written, including the empty-exposure case. */
  SUCCESS(0),
  /** Command-line arguments or configuration values were invalid. */
  INVALID_ARGS(2),
  /** Reading the exposure or reference document, or writing products, failed. */
  IO_ERROR(3),
  /** The exposure and its reference tables are inconsistent, or a reference document is malformed. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure. */
  RUNTIME_FAILURE(5);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }
}

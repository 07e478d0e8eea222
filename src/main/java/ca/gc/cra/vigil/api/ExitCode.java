package ca.gc.cra.vigil.api;

/**
 * <strong>What:</strong> Canonical exit codes shared by VIGIL command-line tools.
 * <p><strong>Why:</strong> Scripts distinguish invalid data from invalid invocations and I/O failures.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Every validated value passed. */
  SUCCESS(0),
  /** At least one validated value failed. */
  VALIDATION_FAILED(1),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** IO failure occurred while reading a profile or batch input. */
  IO_ERROR(3),
  /** Configuration was missing, malformed or contradictory. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value reported to the operating system.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}

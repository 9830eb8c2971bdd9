package ca.gc.cra.vantage.api;

/**
 * <strong>What:</strong> Process exit codes shared by the controller commands.
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** Reading inputs or writing the plan failed. */
  IO_ERROR(3),
  /** Configuration or input documents were missing or malformed. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure. */
  RUNTIME_FAILURE(5),
  /** Process was interrupted. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric process status.
   *
   * @return exit status passed to {@link System#exit(int)}
   */
  public int code() {
    return code;
  }
}

package ca.gc.cra.tide.api;

/**
 * <strong>What:</strong> Process exit statuses returned by the TIDE commands.
 * <p><strong>Why:</strong> Service managers restart on some failures and not others, so each outcome maps to a
 * stable number.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Command completed. */
  SUCCESS(0),
  /** Arguments could not be parsed. */
  INVALID_ARGS(2),
  /** A local file could not be read. */
  IO_ERROR(3),
  /** Connection configuration missing, contradictory or invalid. */
  CONFIG_ERROR(4),
  /** Unexpected failure. */
  RUNTIME_FAILURE(5),
  /** Authentication, host discovery or channel open failed before streaming started. */
  STARTUP_FAILURE(6),
  /** Interrupted while running. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Numeric status handed to {@link System#exit(int)}.
   *
   * @return exit status
   */
  public int code() {
    return code;
  }
}

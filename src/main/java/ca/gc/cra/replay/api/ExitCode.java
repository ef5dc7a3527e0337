package ca.gc.cra.replay.api;

/**
 * <strong>What:</strong> Process exit statuses of the {@code replay} command.
 * <p><strong>Role:</strong> Returned by every CLI entry point and passed to {@link System#exit(int)} by
 * {@link Main}.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** The command completed, or the control session ended normally. */
  SUCCESS(0),
  /** Arguments could not be parsed. */
  INVALID_ARGS(2),
  /** A file could not be read or written. */
  IO_ERROR(3),
  /** Configuration was rejected after parsing. */
  CONFIG_ERROR(4),
  /** An unexpected failure occurred. */
  RUNTIME_FAILURE(5),
  /** The process was interrupted. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric status.
   *
   * @return exit status
   */
  public int code() {
    return code;
  }
}

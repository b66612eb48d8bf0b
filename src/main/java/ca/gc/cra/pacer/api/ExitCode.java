package ca.gc.cra.pacer.api;

/**
 * Process exit codes returned by PACER commands.
 *
 * @since PACER 0.1
 */
public enum ExitCode {
  /** Command completed. */
  SUCCESS(0),
  /** Arguments could not be parsed or named an unknown command. */
  INVALID_ARGS(2),
  /** A configuration file could not be read. */
  IO_ERROR(3),
  /** Configuration values were rejected. */
  CONFIG_ERROR(4),
  /** The command failed while running. */
  RUNTIME_FAILURE(5),
  /** The command was interrupted. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric exit status.
   *
   * @return process exit status
   */
  public int code() {
    return code;
  }
}

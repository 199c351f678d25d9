package ca.gc.cra.prplan.api;

/**
 * Process exit codes returned by the CLI.
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Run completed; every group succeeded. */
  SUCCESS(0),
  /** Arguments could not be parsed or failed validation. */
  INVALID_ARGS(2),
  /** An artifact, report, or configuration file could not be read or written. */
  IO_ERROR(3),
  /** Configuration was rejected after the run started. */
  CONFIG_ERROR(4),
  /** Unexpected failure. */
  RUNTIME_FAILURE(5),
  /** The module directory does not exist. */
  VALIDATION_FAILURE(6),
  /** At least one execution group failed. */
  PLAN_FAILURE(7),
  /** The run was interrupted. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric process exit status.
   *
   * @return exit status
   */
  public int code() {
    return code;
  }
}

package ca.gc.cra.prplan.domain.plan;

/**
 * Checked exception raised when a plan executor invocation exits non-zero or cannot be started.
 *
 * @since 0.1.0
 */
public final class PlanExecutionException extends Exception {
  /** Exit code reported when the process never started or was interrupted. */
  public static final int NO_EXIT_CODE = -1;

  private final String target;
  private final int exitCode;

  /**
   * Creates an exception for a process that ran and failed.
   *
   * @param target target (or batch label) being planned
   * @param exitCode non-zero process exit status
   * @param msg human-readable error
   */
  public PlanExecutionException(String target, int exitCode, String msg) {
    super(msg);
    this.target = target;
    this.exitCode = exitCode;
  }

  /**
   * Creates an exception wrapping a failure to launch or await the process.
   *
   * @param target target (or batch label) being planned
   * @param msg human-readable error
   * @param cause underlying I/O or interruption failure
   */
  public PlanExecutionException(String target, String msg, Throwable cause) {
    super(msg, cause);
    this.target = target;
    this.exitCode = NO_EXIT_CODE;
  }

  /**
   * Returns the target whose invocation failed.
   *
   * @return target identifier or batch label
   */
  public String target() {
    return target;
  }

  /**
   * Returns the process exit status.
   *
   * @return exit code, or {@link #NO_EXIT_CODE} when the process did not complete
   */
  public int exitCode() {
    return exitCode;
  }
}

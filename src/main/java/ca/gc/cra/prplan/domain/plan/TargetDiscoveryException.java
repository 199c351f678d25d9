package ca.gc.cra.prplan.domain.plan;

/**
 * Checked exception thrown when affected targets cannot be discovered.
 * <p>Callers recover by planning every target in batch mode.</p>
 *
 * @since 0.1.0
 */
public final class TargetDiscoveryException extends Exception {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param msg human-readable error
   */
  public TargetDiscoveryException(String msg) { super(msg); }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param msg human-readable error
   * @param cause process or I/O failure raised by the discovery script
   */
  public TargetDiscoveryException(String msg, Throwable cause) { super(msg, cause); }
}

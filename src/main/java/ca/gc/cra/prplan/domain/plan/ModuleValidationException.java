package ca.gc.cra.prplan.domain.plan;

/**
 * Checked exception thrown when the requested module is not present in the working directory.
 *
 * @since 0.1.0
 */
public final class ModuleValidationException extends Exception {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param msg human-readable error, shown to the operator as-is
   */
  public ModuleValidationException(String msg) { super(msg); }
}

package ca.gc.cra.prplan.application.port;

import ca.gc.cra.prplan.domain.plan.ModuleValidationException;

/**
 * Port confirming that a module exists before any plan runs.
 *
 * @since 0.1.0
 */
public interface ModuleValidatorPort {
  /**
   * Validates the module.
   *
   * @param moduleName module requested by the operator
   * @throws ModuleValidationException if the module cannot be found
   */
  void validate(String moduleName) throws ModuleValidationException;
}

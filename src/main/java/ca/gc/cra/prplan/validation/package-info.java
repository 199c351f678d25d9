/**
 * Input validation helpers shared by the CLI and configuration layers.
 * <p>Failures surface as {@link java.lang.IllegalArgumentException} so the CLI maps them to a configuration
 * exit code.</p>
 */
package ca.gc.cra.prplan.validation;

/**
 * Logging utilities that tune verbosity and bound process output before it reaches logs.
 * <p><strong>Concurrency:</strong> Stateless helpers; level changes happen once at CLI startup.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.prplan.logging;

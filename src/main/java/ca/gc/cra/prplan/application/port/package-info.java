/**
 * Ports connecting the plan use cases to processes, storage, metrics, and time.
 * <p><strong>Role:</strong> Hexagonal boundary; adapters live under {@code ca.gc.cra.prplan.infrastructure}.</p>
 * <p><strong>Concurrency:</strong> Executor, artifact, and metrics ports are called from both group threads.</p>
 */
package ca.gc.cra.prplan.application.port;

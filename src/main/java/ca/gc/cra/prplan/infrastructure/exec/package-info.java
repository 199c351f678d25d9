/**
 * Process adapters for the plan executor and target discovery, plus executor factories for group workers.
 * <p><strong>Role:</strong> Infrastructure on the driven side; every external command is launched here.</p>
 * <p><strong>Concurrency:</strong> Each group thread launches its own processes; adapters hold no mutable state.</p>
 * <p><strong>Security:</strong> Commands are built as argument lists, never through a shell.</p>
 */
package ca.gc.cra.prplan.infrastructure.exec;

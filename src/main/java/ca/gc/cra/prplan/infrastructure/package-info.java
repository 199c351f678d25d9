/**
 * Infrastructure adapters that bind the plan ports to processes, the file system, and metrics backends.
 * <p><strong>Concurrency:</strong> Executor, artifact, and metrics adapters are shared by both group threads.</p>
 * <p><strong>Metrics:</strong> Adapters emit nothing themselves; the pipelines report {@code plan.*} counters.</p>
 */
package ca.gc.cra.prplan.infrastructure;

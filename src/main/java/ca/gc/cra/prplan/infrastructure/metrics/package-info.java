/**
 * Metrics adapters that bridge the plan pipelines to OpenTelemetry or discard observations.
 * <p><strong>Concurrency:</strong> Implementations are thread-safe; both group threads record concurrently.</p>
 * <p><strong>Metrics:</strong> Publishes the {@code plan.executor.*}, {@code plan.group.*}, {@code plan.scan.*}
 * and {@code plan.report.*} names.</p>
 */
package ca.gc.cra.prplan.infrastructure.metrics;

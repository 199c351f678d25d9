package ca.gc.cra.prplan.infrastructure.metrics;

import ca.gc.cra.prplan.application.port.MetricsPort;

/**
 * Metrics adapter selected when {@code metricsExporter=none}; every observation is dropped.
 * <p>Thread-safe and stateless.</p>
 *
 * @since 0.1.0
 */
public final class NoOpMetricsAdapter implements MetricsPort {
  /** Creates a no-op metrics adapter. */
  public NoOpMetricsAdapter() {}

  /**
   * Drops the increment.
   *
   * @param key metric identifier; ignored
   */
  @Override
  public void increment(String key) {}

  /**
   * Drops the observation.
   *
   * @param key metric identifier; ignored
   * @param value observed value; ignored
   */
  @Override
  public void observe(String key, long value) {}
}

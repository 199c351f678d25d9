package ca.gc.cra.prplan.application.port;

/**
 * <strong>What:</strong> Port supplying wall-clock timestamps.
 * <p><strong>Why:</strong> Output directory names and run summaries embed the start time; tests inject fixed clocks.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.prplan.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();
}

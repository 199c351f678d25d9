package ca.gc.cra.prplan.infrastructure.metrics;

import java.util.Locale;
import java.util.Objects;

/**
 * Resolved metrics exporter settings handed to {@link OpenTelemetryMetricsAdapter}.
 *
 * @param exporter exporter mode
 * @param endpoint OTLP endpoint; used only when {@code exporter} is {@link Exporter#OTLP}
 * @param resourceAttributes comma-separated {@code key=value} resource attributes; may be blank
 * @since 0.1.0
 */
public record MetricsSettings(Exporter exporter, String endpoint, String resourceAttributes) {
  /** Endpoint used when none is configured. */
  public static final String DEFAULT_ENDPOINT = "http://localhost:4317";

  /**
   * Normalizes blank values.
   */
  public MetricsSettings {
    Objects.requireNonNull(exporter, "exporter");
    endpoint = (endpoint == null || endpoint.isBlank()) ? DEFAULT_ENDPOINT : endpoint.trim();
    resourceAttributes = resourceAttributes == null ? "" : resourceAttributes.trim();
  }

  /**
   * Returns settings that disable export.
   *
   * @return disabled settings
   */
  public static MetricsSettings disabled() {
    return new MetricsSettings(Exporter.NONE, null, null);
  }

  /** Supported exporters. */
  public enum Exporter {
    /** Export over OTLP gRPC. */
    OTLP,
    /** Drop everything. */
    NONE;

    /**
     * Parses an exporter name.
     *
     * @param raw {@code none} or {@code otlp}; blank selects {@link #NONE}
     * @return parsed exporter
     * @throws IllegalArgumentException if the name is unknown
     */
    public static Exporter from(String raw) {
      if (raw == null || raw.isBlank()) {
        return NONE;
      }
      return switch (raw.trim().toLowerCase(Locale.ROOT)) {
        case "none" -> NONE;
        case "otlp" -> OTLP;
        default -> throw new IllegalArgumentException(
            "metricsExporter must be 'none' or 'otlp' (was '" + raw + "')");
      };
    }
  }
}

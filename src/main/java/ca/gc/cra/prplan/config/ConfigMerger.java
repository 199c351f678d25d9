package ca.gc.cra.prplan.config;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Merges defaults, YAML and CLI values (CLI wins) and validates cross-cutting keys.
 *
 * @since 0.1.0
 */
public final class ConfigMerger {
  private static final Set<String> METRICS_EXPORTERS = Set.of("none", "otlp");

  private ConfigMerger() {}

  /**
   * Builds the effective configuration.
   *
   * @param mode subcommand name, used in messages
   * @param yaml flattened YAML values, if a file was supplied
   * @param cli CLI {@code key=value} arguments
   * @param defaults defaults from {@link DefaultsForMode}
   * @param warn sink for override warnings; may be {@code null}
   * @return immutable merged map
   * @throws IllegalArgumentException if a merged value is invalid
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlValues = yaml.orElse(Map.of());
    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlValues);
    if (cli != null) {
      for (Map.Entry<String, String> entry : cli.entrySet()) {
        String key = entry.getKey();
        if (key == null || entry.getValue() == null) {
          continue;
        }
        if (yamlValues.containsKey(key) && warn != null) {
          warn.accept("CLI overrides YAML for key: " + key);
        }
        merged.put(key, entry.getValue());
      }
    }
    validate(mode, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String mode, Map<String, String> effective) {
    String exporter = trim(effective.get("metricsExporter")).toLowerCase(Locale.ROOT);
    if (!exporter.isEmpty() && !METRICS_EXPORTERS.contains(exporter)) {
      throw new IllegalArgumentException(
          "metricsExporter must be one of " + METRICS_EXPORTERS + " for " + mode);
    }
    String endpoint = trim(effective.get("otelEndpoint"));
    if (!endpoint.isEmpty()) {
      requireHttpUrl(endpoint);
    }
  }

  private static void requireHttpUrl(String endpoint) {
    try {
      URI uri = new URI(endpoint);
      String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
      if (!(scheme.equals("http") || scheme.equals("https")) || uri.getHost() == null) {
        throw new IllegalArgumentException("otelEndpoint must be an http(s) URL: " + endpoint);
      }
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint is not a valid URL: " + endpoint, ex);
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}

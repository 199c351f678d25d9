package ca.gc.cra.prplan.config;

import ca.gc.cra.prplan.domain.plan.PlanMode;
import ca.gc.cra.prplan.infrastructure.metrics.MetricsSettings;
import ca.gc.cra.prplan.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable configuration of a {@code generate} run.
 *
 * @param moduleName module to plan
 * @param outputDirectory explicit output directory; empty derives {@code pr-plans-<timestamp>} under the working
 *     directory
 * @param workDir directory holding the terragrunt module directories and the discovery script
 * @param mode requested planning mode
 * @param executorCommand planning executable
 * @param discoveryScript affected-modules script
 * @param restrictedMarker substring that classifies a target as GovCloud
 * @param govcloudOrganizations organizations passed to GovCloud batch plans
 * @param govcloudRegions regions passed to GovCloud batch plans
 * @param commandLabel command label shown in report headers
 * @param allowOverwrite whether a non-empty output directory may be reused
 * @param dryRun print the resolved plan without running it
 * @param metrics metrics exporter settings
 * @since 0.1.0
 */
public record GenerateConfig(
    String moduleName,
    Optional<Path> outputDirectory,
    Path workDir,
    PlanMode mode,
    String executorCommand,
    String discoveryScript,
    String restrictedMarker,
    String govcloudOrganizations,
    String govcloudRegions,
    String commandLabel,
    boolean allowOverwrite,
    boolean dryRun,
    MetricsSettings metrics) {
  /** Prefix of derived output directory names. */
  public static final String OUTPUT_DIR_PREFIX = "pr-plans-";
  private static final DateTimeFormatter OUTPUT_DIR_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss");

  /**
   * Validates components.
   */
  public GenerateConfig {
    moduleName = Strings.requireModuleName(moduleName);
    outputDirectory = Objects.requireNonNullElse(outputDirectory, Optional.empty());
    workDir = Objects.requireNonNull(workDir, "workDir").toAbsolutePath().normalize();
    mode = Objects.requireNonNullElse(mode, PlanMode.BATCH);
    executorCommand = Strings.requireNonBlank("executorCommand", executorCommand);
    discoveryScript = Strings.requireNonBlank("discoveryScript", discoveryScript);
    restrictedMarker = Strings.requireNonBlank("restrictedMarker", restrictedMarker);
    govcloudOrganizations = Strings.requireNonBlank("govcloud.organizations", govcloudOrganizations);
    govcloudRegions = Strings.requireNonBlank("govcloud.regions", govcloudRegions);
    commandLabel = Strings.requirePrintableAscii("report.commandLabel", commandLabel, 200);
    metrics = Objects.requireNonNullElse(metrics, MetricsSettings.disabled());
  }

  /**
   * Builds a configuration from merged {@code key=value} entries.
   *
   * @param options effective configuration from {@link ConfigMerger}
   * @return validated configuration
   * @throws IllegalArgumentException if a value is missing or invalid
   */
  public static GenerateConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    Map<String, String> defaults = DefaultsForMode.asFlatMap(DefaultsForMode.GENERATE);
    Path workDir = parsePath("workDir", valueOr(options, defaults, "workDir"));
    Optional<Path> out = optional(options.get("out"))
        .map(value -> workDir.resolve(parsePath("out", value)).normalize());
    boolean targeted = parseBoolean(options.get("targeted"));
    return new GenerateConfig(
        options.get("module"),
        out,
        workDir,
        targeted ? PlanMode.TARGETED : PlanMode.BATCH,
        valueOr(options, defaults, "executorCommand"),
        valueOr(options, defaults, "discoveryScript"),
        valueOr(options, defaults, "restrictedMarker"),
        valueOr(options, defaults, "govcloud.organizations"),
        valueOr(options, defaults, "govcloud.regions"),
        valueOr(options, defaults, "report.commandLabel"),
        parseBoolean(options.get("allowOverwrite")),
        parseBoolean(options.get("dryRun")),
        metricsSettings(options));
  }

  /**
   * Resolves the output directory, deriving a timestamped name when none was configured.
   *
   * @param nowMillis current epoch milliseconds
   * @param zone time zone used for the derived name
   * @return absolute output directory
   */
  public Path resolveOutputDirectory(long nowMillis, ZoneId zone) {
    return outputDirectory.orElseGet(() -> workDir.resolve(
        OUTPUT_DIR_PREFIX + OUTPUT_DIR_STAMP.format(Instant.ofEpochMilli(nowMillis).atZone(zone))));
  }

  static MetricsSettings metricsSettings(Map<String, String> options) {
    return new MetricsSettings(
        MetricsSettings.Exporter.from(options.get("metricsExporter")),
        options.get("otelEndpoint"),
        options.get("otelResourceAttributes"));
  }

  static Path parsePath(String name, String value) {
    try {
      return Path.of(Strings.requireNonBlank(name, value));
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + value, ex);
    }
  }

  static boolean parseBoolean(String value) {
    return value != null && Boolean.parseBoolean(value.trim());
  }

  private static Optional<String> optional(String value) {
    return (value == null || value.isBlank()) ? Optional.empty() : Optional.of(value.trim());
  }

  private static String valueOr(Map<String, String> options, Map<String, String> defaults, String key) {
    return optional(options.get(key)).orElse(defaults.get(key));
  }
}

package ca.gc.cra.prplan.config;

import ca.gc.cra.prplan.domain.report.ReportAssembler;
import ca.gc.cra.prplan.infrastructure.metrics.MetricsSettings;
import ca.gc.cra.prplan.validation.Strings;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable configuration of a {@code report} run over an existing output directory.
 *
 * @param moduleName module named in report headers
 * @param inputDirectory directory holding the group artifacts; the report is written back into it
 * @param commandLabel command label shown in report headers
 * @param metrics metrics exporter settings
 * @since 0.1.0
 */
public record ReportConfig(
    String moduleName, Path inputDirectory, String commandLabel, MetricsSettings metrics) {

  /**
   * Validates components.
   */
  public ReportConfig {
    moduleName = Strings.requireModuleName(moduleName);
    inputDirectory = Objects.requireNonNull(inputDirectory, "inputDirectory").toAbsolutePath().normalize();
    commandLabel = Strings.requirePrintableAscii("report.commandLabel",
        commandLabel == null || commandLabel.isBlank() ? ReportAssembler.DEFAULT_COMMAND_LABEL : commandLabel,
        200);
    metrics = Objects.requireNonNullElse(metrics, MetricsSettings.disabled());
  }

  /**
   * Builds a configuration from merged {@code key=value} entries.
   *
   * @param options effective configuration from {@link ConfigMerger}
   * @return validated configuration
   * @throws IllegalArgumentException if {@code module} or {@code in} is missing or invalid
   */
  public static ReportConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    String in = options.get("in");
    if (in == null || in.isBlank()) {
      throw new IllegalArgumentException("in=DIR is required");
    }
    return new ReportConfig(
        options.get("module"),
        GenerateConfig.parsePath("in", in),
        options.get("report.commandLabel"),
        GenerateConfig.metricsSettings(options));
  }
}

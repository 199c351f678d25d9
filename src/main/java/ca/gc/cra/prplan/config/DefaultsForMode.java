package ca.gc.cra.prplan.config;

import ca.gc.cra.prplan.domain.plan.GroupPartitioner;
import ca.gc.cra.prplan.domain.report.ReportAssembler;
import ca.gc.cra.prplan.infrastructure.exec.ProcessPlanExecutor;
import ca.gc.cra.prplan.infrastructure.exec.ScriptTargetDiscovery;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Flat string defaults per subcommand, the lowest-precedence layer under YAML and CLI values.
 * <p>Keys match the {@code key=value} CLI arguments and the flattened YAML keys.</p>
 *
 * @since 0.1.0
 */
public final class DefaultsForMode {
  /** Subcommand that plans and reports. */
  public static final String GENERATE = "generate";
  /** Subcommand that only reports. */
  public static final String REPORT = "report";

  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns the defaults for a subcommand.
   *
   * @param mode {@code generate} or {@code report}, case-insensitive
   * @return immutable defaults, common keys included
   * @throws IllegalArgumentException if the mode is unknown
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (mode.trim().toLowerCase(Locale.ROOT)) {
      case GENERATE -> buildGenerateDefaults();
      case REPORT -> buildReportDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("report.commandLabel", ReportAssembler.DEFAULT_COMMAND_LABEL);
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildGenerateDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("out", "");
    map.put("workDir", ".");
    map.put("targeted", "false");
    map.put("executorCommand", ProcessPlanExecutor.DEFAULT_COMMAND);
    map.put("discoveryScript", ScriptTargetDiscovery.DEFAULT_SCRIPT);
    map.put("restrictedMarker", GroupPartitioner.DEFAULT_RESTRICTED_MARKER);
    map.put("govcloud.organizations", ProcessPlanExecutor.DEFAULT_GOVCLOUD_ORGANIZATIONS);
    map.put("govcloud.regions", ProcessPlanExecutor.DEFAULT_GOVCLOUD_REGIONS);
    map.put("allowOverwrite", "false");
    map.put("dryRun", "false");
    return map;
  }

  private static Map<String, String> buildReportDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("in", "");
    return map;
  }
}

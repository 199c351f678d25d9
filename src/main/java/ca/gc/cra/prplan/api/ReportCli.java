package ca.gc.cra.prplan.api;

import ca.gc.cra.prplan.application.pipeline.ReportGenerationUseCase;
import ca.gc.cra.prplan.application.pipeline.ReportGenerationUseCase.GeneratedReport;
import ca.gc.cra.prplan.application.port.MetricsPort;
import ca.gc.cra.prplan.config.CompositionRoot;
import ca.gc.cra.prplan.config.DefaultsForMode;
import ca.gc.cra.prplan.config.ReportConfig;
import ca.gc.cra.prplan.logging.LoggingConfigurator;
import ca.gc.cra.prplan.validation.Paths;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for {@code prplan report}: rebuilds {@code pr-ready.md} from existing plan artifacts.
 *
 * @since 0.1.0
 */
public final class ReportCli {
  private static final Logger log = LoggerFactory.getLogger(ReportCli.class);
  private static final String SUMMARY_USAGE =
      "usage: prplan report <module> in=DIR [config=FILE] [report.commandLabel=TEXT] [--verbose]";
  private static final String HELP_TEXT = """
      prplan report

      Usage:
        prplan report <module> in=DIR [options]

      Re-reads commercial-plans.txt and govcloud-plans.txt from DIR and writes
      DIR/pr-ready.md without running any plan.

      Options:
        in=DIR                      Directory produced by prplan generate (required)
        config=FILE                 YAML configuration (common + report sections)
        report.commandLabel=TEXT    Command shown in report headers
        metricsExporter=none|otlp   Metrics export (default none)
        otelEndpoint=URL            OTLP endpoint when metricsExporter=otlp

      Flags:
        --verbose                   Enable DEBUG logging
        --help                      Show this message
      """;

  private ReportCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  /**
   * Executes the report CLI.
   *
   * @param args raw CLI arguments after the subcommand
   * @return exit code describing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for report CLI");
    }

    ReportConfig config;
    try {
      Map<String, String> kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      ConfigCliUtils.applyPositionalModule(kv, input.positionals());
      String configPath = ConfigCliUtils.extractConfigPath(kv);
      config = ReportConfig.fromMap(
          ConfigCliUtils.effectiveConfig(DefaultsForMode.REPORT, kv, configPath, log));
      Paths.validateReadableDir("in", config.inputDirectory());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid report arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }

    MetricsPort metrics = CompositionRoot.metricsFor(config.metrics());
    try {
      ReportGenerationUseCase useCase = new CompositionRoot(metrics).reportGenerationUseCase(config);
      GeneratedReport report = useCase.generate(config.moduleName());
      CliPrinter.printLines(
          "Report regenerated with " + report.report().environments().size() + " environments",
          "Report: " + report.path());
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Report generation I/O failure in {}", config.inputDirectory(), ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Report configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in report generation", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      GenerateCli.closeMetrics(metrics);
    }
  }
}

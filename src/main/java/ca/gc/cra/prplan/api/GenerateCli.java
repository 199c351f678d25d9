package ca.gc.cra.prplan.api;

import ca.gc.cra.prplan.application.pipeline.PlanGenerationUseCase;
import ca.gc.cra.prplan.application.pipeline.PlanGenerationUseCase.GenerationOutcome;
import ca.gc.cra.prplan.application.port.MetricsPort;
import ca.gc.cra.prplan.config.CompositionRoot;
import ca.gc.cra.prplan.config.DefaultsForMode;
import ca.gc.cra.prplan.config.GenerateConfig;
import ca.gc.cra.prplan.domain.plan.AccountClass;
import ca.gc.cra.prplan.domain.plan.GroupExecutionException;
import ca.gc.cra.prplan.domain.plan.ModuleValidationException;
import ca.gc.cra.prplan.domain.plan.PlanMode;
import ca.gc.cra.prplan.infrastructure.exec.ProcessPlanExecutor;
import ca.gc.cra.prplan.infrastructure.persistence.FilePlanArtifactStore;
import ca.gc.cra.prplan.logging.LoggingConfigurator;
import ca.gc.cra.prplan.validation.Paths;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for {@code prplan generate}: plans both account classes and writes the PR report.
 *
 * @since 0.1.0
 */
public final class GenerateCli {
  private static final Logger log = LoggerFactory.getLogger(GenerateCli.class);
  private static final String SUMMARY_USAGE =
      "usage: prplan generate <module> [out=DIR] [config=FILE] [workDir=DIR] "
          + "[--targeted] [--allow-overwrite] [--dry-run] [--verbose]";
  private static final String HELP_TEXT = """
      prplan generate

      Usage:
        prplan generate <module> [options]

      Runs terraform plans for the commercial and GovCloud accounts in parallel and
      writes a PR-ready report grouped by environment and region.

      Options:
        out=DIR                     Output directory (default pr-plans-<yyyyMMdd-HHmmss>)
        workDir=DIR                 Directory holding terragrunt_<module> (default .)
        config=FILE                 YAML configuration (common + generate sections)
        executorCommand=CMD         Planning executable (default kitman)
        discoveryScript=PATH        Affected-modules script (default ./affected-modules.sh)
        restrictedMarker=TEXT       Target substring marking GovCloud (default govcloud); GovCloud
                                    output is always scanned for govcloud-/us-gov- markers
        govcloud.organizations=X    GovCloud batch organizations
        govcloud.regions=X          GovCloud batch regions
        report.commandLabel=TEXT    Command shown in report headers
        metricsExporter=none|otlp   Metrics export (default none)
        otelEndpoint=URL            OTLP endpoint when metricsExporter=otlp
        otelResourceAttributes=K=V,...

      Flags:
        --targeted                  Plan only affected modules (falls back to plan_all)
        --allow-overwrite           Reuse a non-empty output directory
        --dry-run                   Print the resolved plan without running anything
        --verbose                   Enable DEBUG logging
        --help                      Show this message

      Output files:
        commercial-plans.txt, govcloud-plans.txt, pr-ready.md, run-summary.json
      """;

  private GenerateCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  /**
   * Executes the generate CLI.
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
      log.debug("Verbose logging enabled for generate CLI");
    }

    GenerateConfig config;
    try {
      Map<String, String> kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      ConfigCliUtils.applyPositionalModule(kv, input.positionals());
      if (input.hasFlag("--targeted")) {
        kv.put("targeted", "true");
      }
      if (input.hasFlag("--allow-overwrite")) {
        kv.put("allowOverwrite", "true");
      }
      if (input.hasFlag("--dry-run")) {
        kv.put("dryRun", "true");
      }
      String configPath = ConfigCliUtils.extractConfigPath(kv);
      config = GenerateConfig.fromMap(
          ConfigCliUtils.effectiveConfig(DefaultsForMode.GENERATE, kv, configPath, log));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid generate arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }

    MetricsPort metrics = CompositionRoot.metricsFor(config.metrics());
    try {
      return execute(config, new CompositionRoot(metrics));
    } finally {
      closeMetrics(metrics);
    }
  }

  static ExitCode execute(GenerateConfig config, CompositionRoot root) {
    Path outputDirectory;
    try {
      outputDirectory = Paths.validateWritableDir(
          config.resolveOutputDirectory(root.clock().nowMillis(), ZoneId.systemDefault()),
          config.allowOverwrite());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid output directory: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (config.dryRun()) {
      printDryRunPlan(config, outputDirectory, root.planExecutor(config));
      return ExitCode.SUCCESS;
    }

    PlanGenerationUseCase useCase = root.planGenerationUseCase(config, outputDirectory);
    try {
      log.info("Generating {} plans for module {} into {}",
          config.mode().name().toLowerCase(Locale.ROOT), config.moduleName(), outputDirectory);
      GenerationOutcome outcome = useCase.generate(config.moduleName(), config.mode());
      printCompletion(outcome.outputDirectory(), outcome.report().path(), outcome.effectiveMode());
      return ExitCode.SUCCESS;
    } catch (ModuleValidationException ex) {
      log.error("Module validation failed: {}", ex.getMessage());
      return ExitCode.VALIDATION_FAILURE;
    } catch (GroupExecutionException ex) {
      log.error("Plan generation failed: {}", ex.getMessage());
      Path report = outputDirectory.resolve(FilePlanArtifactStore.REPORT_FILE_NAME);
      if (!ex.allGroupsFailed() && Files.exists(report)) {
        CliPrinter.println("Partial report (successful groups only): " + report);
      }
      return ExitCode.PLAN_FAILURE;
    } catch (IOException ex) {
      log.error("Plan generation I/O failure in {}", outputDirectory, ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Plan generation configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Plan generation interrupted; shutting down", ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in plan generation", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static void printDryRunPlan(
      GenerateConfig config, Path outputDirectory, ProcessPlanExecutor executor) {
    String planLine = config.mode() == PlanMode.TARGETED
        ? " Targeted plans   : " + String.join(" ", executor.planTargetCommand("<target>"))
        : " Commercial plans : " + String.join(" ", executor.planAllCommand(AccountClass.COMMERCIAL,
            config.moduleName()));
    String secondLine = config.mode() == PlanMode.TARGETED
        ? " Discovery        : " + config.discoveryScript() + " " + config.moduleName() + " ."
        : " GovCloud plans   : " + String.join(" ", executor.planAllCommand(AccountClass.GOVCLOUD,
            config.moduleName()));
    CliPrinter.printLines(
        "Generate dry-run: no plans will be run.",
        " Module           : " + config.moduleName(),
        " Mode             : " + config.mode(),
        " Working dir      : " + config.workDir(),
        " Output directory : " + outputDirectory,
        secondLine,
        planLine,
        " GovCloud marker  : " + config.restrictedMarker(),
        " Metrics exporter : " + config.metrics().exporter(),
        " Allow overwrite  : " + config.allowOverwrite(),
        " Re-run without --dry-run to generate plans.");
  }

  private static void printCompletion(Path outputDirectory, Path report, PlanMode effectiveMode) {
    CliPrinter.printLines(
        "PR plans generated (" + effectiveMode.name().toLowerCase(Locale.ROOT) + ") in "
            + outputDirectory,
        "Report: " + report,
        "",
        "Quick commands:",
        "  cat " + report + " | pbcopy",
        "  less " + outputDirectory.resolve(AccountClass.COMMERCIAL.artifactFileName()),
        "  less " + outputDirectory.resolve(AccountClass.GOVCLOUD.artifactFileName()));
  }

  static void closeMetrics(MetricsPort metrics) {
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics exporter", ex);
      }
    }
  }
}

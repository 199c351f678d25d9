package ca.gc.cra.prplan.config;

import ca.gc.cra.prplan.application.pipeline.PlanGenerationUseCase;
import ca.gc.cra.prplan.application.pipeline.PlanGroupRunner;
import ca.gc.cra.prplan.application.pipeline.PlanOrchestrator;
import ca.gc.cra.prplan.application.pipeline.ReportGenerationUseCase;
import ca.gc.cra.prplan.application.port.ClockPort;
import ca.gc.cra.prplan.application.port.MetricsPort;
import ca.gc.cra.prplan.application.port.PlanArtifactPort;
import ca.gc.cra.prplan.application.port.PlanExecutorPort;
import ca.gc.cra.prplan.domain.plan.GroupPartitioner;
import ca.gc.cra.prplan.domain.report.ReportAssembler;
import ca.gc.cra.prplan.infrastructure.exec.ProcessPlanExecutor;
import ca.gc.cra.prplan.infrastructure.exec.ScriptTargetDiscovery;
import ca.gc.cra.prplan.infrastructure.metrics.MetricsSettings;
import ca.gc.cra.prplan.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.prplan.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.prplan.infrastructure.module.DirectoryModuleValidator;
import ca.gc.cra.prplan.infrastructure.persistence.FilePlanArtifactStore;
import ca.gc.cra.prplan.infrastructure.persistence.JsonRunSummaryWriter;
import ca.gc.cra.prplan.infrastructure.time.SystemClockAdapter;
import java.nio.file.Path;
import java.util.Objects;

/**
 * <strong>What:</strong> Wires ports to adapters for one CLI invocation.
 * <p><strong>Role:</strong> The only place that names concrete infrastructure classes.</p>
 * <p><strong>Thread-safety:</strong> Construct and use on the CLI thread.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private final MetricsPort metrics;
  private final ClockPort clock;

  /**
   * Creates a root with the given metrics sink and the system clock.
   *
   * @param metrics metrics sink shared by every use case
   */
  public CompositionRoot(MetricsPort metrics) {
    this(metrics, new SystemClockAdapter());
  }

  /**
   * Creates a root.
   *
   * @param metrics metrics sink shared by every use case
   * @param clock time source
   */
  public CompositionRoot(MetricsPort metrics, ClockPort clock) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Builds the metrics adapter for the configured exporter.
   *
   * @param settings exporter settings
   * @return no-op adapter when export is disabled; otherwise an OpenTelemetry adapter the caller must close
   */
  public static MetricsPort metricsFor(MetricsSettings settings) {
    Objects.requireNonNull(settings, "settings");
    if (settings.exporter() == MetricsSettings.Exporter.NONE) {
      return new NoOpMetricsAdapter();
    }
    return new OpenTelemetryMetricsAdapter(settings);
  }

  /**
   * Returns the clock shared by the use cases.
   *
   * @return clock
   */
  public ClockPort clock() {
    return clock;
  }

  /**
   * Builds the process-backed plan executor.
   *
   * @param config generate configuration
   * @return executor running in {@link GenerateConfig#workDir()}
   */
  public ProcessPlanExecutor planExecutor(GenerateConfig config) {
    return new ProcessPlanExecutor(
        config.workDir(),
        config.executorCommand(),
        config.govcloudOrganizations(),
        config.govcloudRegions());
  }

  /**
   * Builds the generation use case writing into {@code outputDirectory}.
   *
   * @param config generate configuration
   * @param outputDirectory validated output directory
   * @return wired use case
   */
  public PlanGenerationUseCase planGenerationUseCase(GenerateConfig config, Path outputDirectory) {
    return planGenerationUseCase(config, outputDirectory, planExecutor(config));
  }

  PlanGenerationUseCase planGenerationUseCase(
      GenerateConfig config, Path outputDirectory, PlanExecutorPort executor) {
    PlanArtifactPort artifacts = new FilePlanArtifactStore(outputDirectory);
    PlanGroupRunner runner = new PlanGroupRunner(executor, artifacts, metrics);
    return new PlanGenerationUseCase(
        new DirectoryModuleValidator(config.workDir()),
        new ScriptTargetDiscovery(config.workDir(), config.discoveryScript()),
        new GroupPartitioner(config.restrictedMarker()),
        new PlanOrchestrator(runner),
        new ReportGenerationUseCase(artifacts, new ReportAssembler(config.commandLabel()), metrics),
        artifacts,
        new JsonRunSummaryWriter(),
        clock);
  }

  /**
   * Builds the standalone report use case over an existing output directory.
   *
   * @param config report configuration
   * @return wired use case
   */
  public ReportGenerationUseCase reportGenerationUseCase(ReportConfig config) {
    return new ReportGenerationUseCase(
        new FilePlanArtifactStore(config.inputDirectory()),
        new ReportAssembler(config.commandLabel()),
        metrics);
  }
}

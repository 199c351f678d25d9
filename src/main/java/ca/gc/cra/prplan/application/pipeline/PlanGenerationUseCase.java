package ca.gc.cra.prplan.application.pipeline;

import ca.gc.cra.prplan.application.pipeline.ReportGenerationUseCase.GeneratedReport;
import ca.gc.cra.prplan.application.port.ClockPort;
import ca.gc.cra.prplan.application.port.ModuleValidatorPort;
import ca.gc.cra.prplan.application.port.PlanArtifactPort;
import ca.gc.cra.prplan.application.port.RunSummaryPort;
import ca.gc.cra.prplan.application.port.TargetDiscoveryPort;
import ca.gc.cra.prplan.domain.plan.GroupExecutionException;
import ca.gc.cra.prplan.domain.plan.GroupPartition;
import ca.gc.cra.prplan.domain.plan.GroupPartitioner;
import ca.gc.cra.prplan.domain.plan.ModuleValidationException;
import ca.gc.cra.prplan.domain.plan.PlanMode;
import ca.gc.cra.prplan.domain.plan.RunSummary;
import ca.gc.cra.prplan.domain.plan.RunSummary.GroupSummary;
import ca.gc.cra.prplan.domain.plan.TargetDiscoveryException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> End-to-end plan generation for one module: validate, discover, plan both account classes,
 * then build the PR report.
 * <p><strong>Why:</strong> Keeps the CLI free of sequencing and fallback rules.</p>
 * <p><strong>Role:</strong> Application-layer use case behind {@code prplan generate}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject modules without a terragrunt directory before any plan runs.</li>
 *   <li>Fall back to batch mode when targeted discovery fails or finds nothing.</li>
 *   <li>Report over the groups that succeeded, then surface any group failure.</li>
 *   <li>Record a run summary for every run that reached the planning stage.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe for concurrent {@link #generate(String, PlanMode)} calls.</p>
 *
 * @since 0.1.0
 */
public final class PlanGenerationUseCase {
  private static final Logger log = LoggerFactory.getLogger(PlanGenerationUseCase.class);
  static final int LISTED_TARGETS = 5;

  private final ModuleValidatorPort validator;
  private final TargetDiscoveryPort discovery;
  private final GroupPartitioner partitioner;
  private final PlanOrchestrator orchestrator;
  private final ReportGenerationUseCase reports;
  private final PlanArtifactPort artifacts;
  private final RunSummaryPort summaries;
  private final ClockPort clock;

  /**
   * Creates the use case.
   *
   * @param validator module validator
   * @param discovery target discovery used in targeted mode
   * @param partitioner splits discovered targets by account class
   * @param orchestrator runs both execution groups
   * @param reports report generation over stored artifacts
   * @param artifacts artifact storage shared with the groups
   * @param summaries run summary sink
   * @param clock time source for summary timestamps
   */
  public PlanGenerationUseCase(
      ModuleValidatorPort validator,
      TargetDiscoveryPort discovery,
      GroupPartitioner partitioner,
      PlanOrchestrator orchestrator,
      ReportGenerationUseCase reports,
      PlanArtifactPort artifacts,
      RunSummaryPort summaries,
      ClockPort clock) {
    this.validator = Objects.requireNonNull(validator, "validator");
    this.discovery = Objects.requireNonNull(discovery, "discovery");
    this.partitioner = Objects.requireNonNull(partitioner, "partitioner");
    this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
    this.reports = Objects.requireNonNull(reports, "reports");
    this.artifacts = Objects.requireNonNull(artifacts, "artifacts");
    this.summaries = Objects.requireNonNull(summaries, "summaries");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Generates plans and the PR report for a module.
   *
   * @param moduleName module to plan; must not be blank
   * @param requestedMode mode requested by the caller
   * @return outcome of a run in which every group succeeded
   * @throws ModuleValidationException if the module directory is missing
   * @throws GroupExecutionException if any group failed; the report exists unless both failed
   * @throws IOException if the report or run summary cannot be written
   * @throws InterruptedException if interrupted while planning
   */
  public GenerationOutcome generate(String moduleName, PlanMode requestedMode)
      throws ModuleValidationException, GroupExecutionException, IOException, InterruptedException {
    Objects.requireNonNull(moduleName, "moduleName");
    Objects.requireNonNull(requestedMode, "requestedMode");
    long startedAt = clock.nowMillis();

    validator.validate(moduleName);
    log.info("Module {} validated; writing plans to {}", moduleName, artifacts.directory());

    Optional<GroupPartition> partition = requestedMode == PlanMode.TARGETED
        ? discoverTargets(moduleName)
        : Optional.empty();
    PlanMode effectiveMode = partition.isPresent() ? PlanMode.TARGETED : PlanMode.BATCH;

    OrchestrationResult result = partition.isPresent()
        ? orchestrator.runTargeted(partition.get())
        : orchestrator.runBatch(moduleName);

    Optional<GeneratedReport> report = Optional.empty();
    if (result.allFailed()) {
      log.error("All plan groups failed; no report generated");
    } else {
      report = Optional.of(reports.generate(moduleName, result.succeededClasses()));
    }

    RunSummary summary = new RunSummary(
        moduleName,
        requestedMode,
        effectiveMode,
        artifacts.directory(),
        startedAt,
        clock.nowMillis(),
        result.results().stream().map(GroupSummary::from).toList(),
        report.map(r -> r.report().recordCount()).orElse(0),
        report.map(r -> r.report().environments().size()).orElse(0),
        report.map(GeneratedReport::path));
    Path summaryPath = summaries.write(summary);
    log.debug("Run summary written to {}", summaryPath);

    result.requireAllSucceeded();
    return new GenerationOutcome(
        effectiveMode, artifacts.directory(), report.orElseThrow(), summaryPath, result);
  }

  private Optional<GroupPartition> discoverTargets(String moduleName) throws InterruptedException {
    List<String> targets;
    try {
      targets = discovery.discover(moduleName);
    } catch (TargetDiscoveryException ex) {
      log.warn("Could not detect affected modules, falling back to plan_all: {}", ex.getMessage());
      return Optional.empty();
    }
    if (targets.isEmpty()) {
      log.warn("No affected modules detected, falling back to plan_all");
      return Optional.empty();
    }
    log.info("Found {} affected modules", targets.size());
    if (log.isDebugEnabled()) {
      targets.stream().limit(LISTED_TARGETS).forEach(target -> log.debug("  {}", target));
      if (targets.size() > LISTED_TARGETS) {
        log.debug("  ... and {} more", targets.size() - LISTED_TARGETS);
      }
    }
    GroupPartition partition = partitioner.partition(targets);
    log.info("Partitioned targets on '{}': {} commercial, {} GovCloud",
        partitioner.restrictedMarker(), partition.commercial().size(), partition.govcloud().size());
    if (!partitioner.usesDefaultMarker() && !partition.govcloud().isEmpty()) {
      log.warn("Restricted marker '{}' is not '{}'; GovCloud output is still scanned for govcloud-/us-gov- "
          + "markers, so unmatched blocks are left out of the report",
          partitioner.restrictedMarker(), GroupPartitioner.DEFAULT_RESTRICTED_MARKER);
    }
    return Optional.of(partition);
  }

  /**
   * Result of a fully successful generation run.
   *
   * @param effectiveMode mode actually used after any discovery fallback
   * @param outputDirectory directory holding every artifact
   * @param report generated report
   * @param runSummary location of {@code run-summary.json}
   * @param groups both group outcomes
   */
  public record GenerationOutcome(
      PlanMode effectiveMode,
      Path outputDirectory,
      GeneratedReport report,
      Path runSummary,
      OrchestrationResult groups) {}
}

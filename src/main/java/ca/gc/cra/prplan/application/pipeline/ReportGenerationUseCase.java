package ca.gc.cra.prplan.application.pipeline;

import ca.gc.cra.prplan.application.port.MetricsPort;
import ca.gc.cra.prplan.application.port.PlanArtifactPort;
import ca.gc.cra.prplan.domain.plan.AccountClass;
import ca.gc.cra.prplan.domain.plan.ActionRecord;
import ca.gc.cra.prplan.domain.report.PlanReport;
import ca.gc.cra.prplan.domain.report.ReportAssembler;
import ca.gc.cra.prplan.domain.scan.PlanTextScanner;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Builds the PR report from stored group artifacts.
 * <p><strong>Why:</strong> Report generation only needs the raw artifacts, so it can be re-run without planning again.</p>
 * <p><strong>Role:</strong> Application-layer use case shared by {@code generate} and {@code report}.</p>
 * <p><strong>Thread-safety:</strong> Safe for sequential reuse; scanners are created per artifact.</p>
 * <p><strong>Observability:</strong> Emits {@code plan.scan.records}, {@code plan.scan.dropped}, and
 * {@code plan.report.environments}.</p>
 *
 * @since 0.1.0
 */
public final class ReportGenerationUseCase {
  private static final Logger log = LoggerFactory.getLogger(ReportGenerationUseCase.class);

  private final PlanArtifactPort artifacts;
  private final ReportAssembler assembler;
  private final MetricsPort metrics;

  /**
   * Creates the use case.
   *
   * @param artifacts artifact storage to read group output from and write the report to
   * @param assembler report assembler
   * @param metrics metrics sink; {@code null} disables metrics
   */
  public ReportGenerationUseCase(
      PlanArtifactPort artifacts, ReportAssembler assembler, MetricsPort metrics) {
    this.artifacts = Objects.requireNonNull(artifacts, "artifacts");
    this.assembler = Objects.requireNonNull(assembler, "assembler");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
  }

  /**
   * Generates the report from every account class artifact.
   *
   * @param moduleName module named in environment headers
   * @return assembled report and its location
   * @throws IOException if an artifact cannot be read or the report cannot be written
   */
  public GeneratedReport generate(String moduleName) throws IOException {
    return generate(moduleName, EnumSet.allOf(AccountClass.class));
  }

  /**
   * Generates the report from the artifacts of the supplied classes.
   * <p>Commercial records are folded before GovCloud records regardless of collection order.</p>
   *
   * @param moduleName module named in environment headers
   * @param accountClasses classes whose artifacts should be included
   * @return assembled report and its location
   * @throws IOException if an artifact cannot be read or the report cannot be written
   */
  public GeneratedReport generate(String moduleName, Collection<AccountClass> accountClasses)
      throws IOException {
    Objects.requireNonNull(moduleName, "moduleName");
    Set<AccountClass> included = accountClasses.isEmpty()
        ? EnumSet.noneOf(AccountClass.class)
        : EnumSet.copyOf(accountClasses);
    List<ActionRecord> records = new ArrayList<>();
    for (AccountClass accountClass : included) {
      records.addAll(scanArtifact(accountClass));
    }
    PlanReport report = assembler.assemble(records);
    metrics.observe("plan.report.environments", report.environments().size());
    Path path = artifacts.writeReport(assembler.render(report, moduleName));
    log.info("Wrote report with {} environments to {}", report.environments().size(), path);
    return new GeneratedReport(report, path);
  }

  private List<ActionRecord> scanArtifact(AccountClass accountClass) throws IOException {
    Optional<String> content = artifacts.readGroupOutput(accountClass);
    if (content.isEmpty() || content.get().isEmpty()) {
      log.debug("No {} artifact to scan", accountClass.displayName());
      return List.of();
    }
    if (AccountClass.isNoWorkText(content.get())) {
      log.debug("Skipping {} placeholder artifact", accountClass.displayName());
      return List.of();
    }
    PlanTextScanner scanner = PlanTextScanner.forAccountClass(accountClass);
    List<ActionRecord> records = scanner.scan(content.get());
    metrics.observe("plan.scan.records", records.size());
    if (scanner.droppedBlocks() > 0) {
      metrics.observe("plan.scan.dropped", scanner.droppedBlocks());
      log.debug("Dropped {} {} plan blocks without environment/region context",
          scanner.droppedBlocks(), accountClass.displayName());
    }
    if (scanner.unterminatedBlock()) {
      log.debug("{} output ended inside an unterminated plan block", accountClass.displayName());
    }
    log.info("Scanned {} plan blocks from {} output", records.size(), accountClass.displayName());
    return records;
  }

  /**
   * Report produced by a generation pass.
   *
   * @param report assembled report
   * @param path location of the rendered Markdown
   */
  public record GeneratedReport(PlanReport report, Path path) {}
}

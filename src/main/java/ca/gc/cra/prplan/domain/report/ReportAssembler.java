package ca.gc.cra.prplan.domain.report;

import ca.gc.cra.prplan.domain.plan.ActionRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Folds action records into environments and regions and renders the PR Markdown.
 * <p><strong>Role:</strong> Final domain stage of report generation.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Group records by environment, keeping the last block seen per region.</li>
 *   <li>Render environments and regions in ascending order as collapsible sections.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from immutable settings; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class ReportAssembler {
  /** First line of every report. */
  public static final String REPORT_TITLE = "**Terraform plan**";
  /** Command label shown in environment headers when none is configured. */
  public static final String DEFAULT_COMMAND_LABEL = "kitman tg plan_all";

  private static final Logger log = LoggerFactory.getLogger(ReportAssembler.class);

  private final String commandLabel;

  /**
   * Creates an assembler using {@link #DEFAULT_COMMAND_LABEL}.
   */
  public ReportAssembler() {
    this(DEFAULT_COMMAND_LABEL);
  }

  /**
   * Creates an assembler with a custom command label.
   *
   * @param commandLabel text shown after {@code command:} in environment headers
   */
  public ReportAssembler(String commandLabel) {
    this.commandLabel = Objects.requireNonNull(commandLabel, "commandLabel");
  }

  /**
   * Groups records by environment and region.
   *
   * @param records records in fold order (commercial first, then GovCloud); must not be {@code null}
   * @return report with environments sorted by name
   */
  public PlanReport assemble(List<ActionRecord> records) {
    Objects.requireNonNull(records, "records");
    SortedMap<String, EnvironmentGroup> environments = new TreeMap<>();
    for (ActionRecord record : records) {
      EnvironmentGroup group =
          environments.computeIfAbsent(record.environment(), EnvironmentGroup::new);
      group.put(record.region(), record.blockText())
          .ifPresent(previous -> log.debug(
              "Replacing earlier plan block for {}/{}", record.environment(), record.region()));
    }
    return new PlanReport(new ArrayList<>(environments.values()), records.size());
  }

  /**
   * Renders the report body.
   *
   * @param report assembled report
   * @param moduleName module shown in every environment header
   * @return Markdown document
   */
  public String render(PlanReport report, String moduleName) {
    Objects.requireNonNull(report, "report");
    Objects.requireNonNull(moduleName, "moduleName");
    StringBuilder out = new StringBuilder();
    out.append(REPORT_TITLE).append("\n\n");
    for (EnvironmentGroup environment : report.environments()) {
      out.append("## [environment: ").append(environment.name())
          .append("] - [command: ").append(commandLabel)
          .append("] - [module: ").append(moduleName).append("]\n\n");
      for (Map.Entry<String, String> entry : environment.blocksByRegion().entrySet()) {
        String blockText = entry.getValue();
        if (blockText == null || blockText.isEmpty()) {
          continue;
        }
        out.append("<details>\n<summary>").append(entry.getKey()).append("</summary>\n\n```bash\n");
        out.append(blockText);
        out.append("\n```\n\n</details>\n\n");
      }
    }
    return out.toString();
  }

  /**
   * Returns the configured command label.
   *
   * @return command label
   */
  public String commandLabel() {
    return commandLabel;
  }
}

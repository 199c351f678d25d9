package ca.gc.cra.prplan.domain.plan;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Machine-readable record of one generation run.
 *
 * @param moduleName module that was planned
 * @param requestedMode mode asked for on the command line
 * @param effectiveMode mode actually used after discovery fallback
 * @param outputDirectory directory holding every artifact
 * @param startedAtMillis run start, epoch milliseconds
 * @param finishedAtMillis run end, epoch milliseconds
 * @param groups per-group outcomes in account-class order
 * @param recordCount action records folded into the report
 * @param environmentCount environments rendered in the report
 * @param report rendered report location, absent when no report was produced
 * @since 0.1.0
 */
public record RunSummary(
    String moduleName,
    PlanMode requestedMode,
    PlanMode effectiveMode,
    Path outputDirectory,
    long startedAtMillis,
    long finishedAtMillis,
    List<GroupSummary> groups,
    int recordCount,
    int environmentCount,
    Optional<Path> report) {

  /**
   * Validates required fields and copies the group list.
   */
  public RunSummary {
    Objects.requireNonNull(moduleName, "moduleName");
    Objects.requireNonNull(requestedMode, "requestedMode");
    Objects.requireNonNull(effectiveMode, "effectiveMode");
    Objects.requireNonNull(outputDirectory, "outputDirectory");
    groups = List.copyOf(Objects.requireNonNull(groups, "groups"));
    report = Objects.requireNonNullElse(report, Optional.empty());
  }

  /**
   * Indicates whether every group succeeded.
   *
   * @return {@code true} when no group recorded a failure
   */
  public boolean succeeded() {
    return groups.stream().allMatch(GroupSummary::succeeded);
  }

  /**
   * Outcome of one group as recorded in the summary.
   *
   * @param accountClass group
   * @param targets targets assigned to the group
   * @param invocations successful invocations
   * @param succeeded whether the group completed
   * @param noWork whether the group had nothing to plan
   * @param failedTarget target whose invocation failed, if any
   * @param error failure message, if any
   */
  public record GroupSummary(
      AccountClass accountClass,
      int targets,
      int invocations,
      boolean succeeded,
      boolean noWork,
      Optional<String> failedTarget,
      Optional<String> error) {

    /**
     * Summarizes a group result.
     *
     * @param result group outcome
     * @return summary entry
     */
    public static GroupSummary from(GroupResult result) {
      Objects.requireNonNull(result, "result");
      return new GroupSummary(
          result.accountClass(),
          result.targets(),
          result.invocations(),
          result.succeeded(),
          result.noWorkRecorded(),
          result.failure().map(PlanExecutionException::target),
          result.failure().map(Throwable::getMessage));
    }
  }
}

package ca.gc.cra.prplan.domain.plan;

import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Outcome of one execution group (all invocations for one account class).
 * <p><strong>Role:</strong> Value handed from the orchestrator to report generation and the run summary.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param accountClass group that produced the result
 * @param rawOutput captured plan text; the sentinel when the group had no work, empty on failure
 * @param targets number of targets assigned to the group ({@code 0} in batch mode)
 * @param invocations executor invocations that completed successfully
 * @param failure failure that stopped the group, if any
 * @since 0.1.0
 */
public record GroupResult(
    AccountClass accountClass,
    String rawOutput,
    int targets,
    int invocations,
    Optional<PlanExecutionException> failure) {

  /**
   * Validates required fields.
   */
  public GroupResult {
    Objects.requireNonNull(accountClass, "accountClass");
    rawOutput = Objects.requireNonNullElse(rawOutput, "");
    failure = Objects.requireNonNullElse(failure, Optional.empty());
  }

  /**
   * Builds a successful result.
   *
   * @param accountClass group that ran
   * @param rawOutput captured output
   * @param targets targets assigned to the group
   * @param invocations completed invocations
   * @return successful result
   */
  public static GroupResult succeeded(
      AccountClass accountClass, String rawOutput, int targets, int invocations) {
    return new GroupResult(accountClass, rawOutput, targets, invocations, Optional.empty());
  }

  /**
   * Builds the result of a group that had nothing to plan.
   *
   * @param accountClass empty group
   * @return successful result carrying the class sentinel
   */
  public static GroupResult noWork(AccountClass accountClass) {
    return new GroupResult(accountClass, accountClass.noWorkArtifact(), 0, 0, Optional.empty());
  }

  /**
   * Builds a failed result.
   *
   * @param accountClass group that failed
   * @param targets targets assigned to the group
   * @param invocations invocations that succeeded before the failure
   * @param cause failure that stopped the group; must not be {@code null}
   * @return failed result with empty output
   */
  public static GroupResult failed(
      AccountClass accountClass, int targets, int invocations, PlanExecutionException cause) {
    return new GroupResult(
        accountClass, "", targets, invocations, Optional.of(Objects.requireNonNull(cause, "cause")));
  }

  /**
   * Indicates whether every invocation of the group succeeded.
   *
   * @return {@code true} when no failure was recorded
   */
  public boolean succeeded() {
    return failure.isEmpty();
  }

  /**
   * Indicates whether the group skipped execution because it had no targets.
   *
   * @return {@code true} when the output is the sentinel text
   */
  public boolean noWorkRecorded() {
    return succeeded() && rawOutput.equals(accountClass.noWorkArtifact());
  }
}

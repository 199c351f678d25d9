package ca.gc.cra.prplan.domain.plan;

import java.util.List;
import java.util.Objects;

/**
 * Checked exception summarizing every execution group that failed during one run.
 * <p>The first failure is the cause; when both groups failed the second is attached as suppressed.</p>
 *
 * @since 0.1.0
 */
public final class GroupExecutionException extends Exception {
  private final List<AccountClass> failedGroups;

  /**
   * Creates an aggregated failure.
   *
   * @param failures failed group results in account-class order; must not be empty
   * @throws IllegalArgumentException if {@code failures} is empty or contains a successful result
   */
  public GroupExecutionException(List<GroupResult> failures) {
    super(describe(failures), firstCause(failures));
    this.failedGroups = failures.stream().map(GroupResult::accountClass).toList();
    for (int i = 1; i < failures.size(); i++) {
      failures.get(i).failure().ifPresent(this::addSuppressed);
    }
  }

  /**
   * Returns the account classes that failed.
   *
   * @return immutable list of failed classes
   */
  public List<AccountClass> failedGroups() {
    return failedGroups;
  }

  /**
   * Indicates whether every group of the run failed.
   *
   * @return {@code true} when no group succeeded
   */
  public boolean allGroupsFailed() {
    return failedGroups.size() == AccountClass.values().length;
  }

  private static String describe(List<GroupResult> failures) {
    Objects.requireNonNull(failures, "failures");
    if (failures.isEmpty()) {
      throw new IllegalArgumentException("failures must not be empty");
    }
    StringBuilder sb = new StringBuilder();
    for (GroupResult result : failures) {
      PlanExecutionException cause = result.failure()
          .orElseThrow(() -> new IllegalArgumentException(
              result.accountClass() + " group did not fail"));
      if (sb.length() > 0) {
        sb.append("; ");
      }
      sb.append(result.accountClass().displayName())
          .append(" plans failed: ")
          .append(cause.getMessage());
    }
    return sb.toString();
  }

  private static Throwable firstCause(List<GroupResult> failures) {
    return failures.get(0).failure().orElse(null);
  }
}

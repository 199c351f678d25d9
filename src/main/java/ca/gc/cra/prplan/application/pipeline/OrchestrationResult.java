package ca.gc.cra.prplan.application.pipeline;

import ca.gc.cra.prplan.domain.plan.AccountClass;
import ca.gc.cra.prplan.domain.plan.GroupExecutionException;
import ca.gc.cra.prplan.domain.plan.GroupResult;
import java.util.List;
import java.util.Objects;

/**
 * Outcomes of both execution groups of a run.
 *
 * @param commercial commercial group outcome
 * @param govcloud GovCloud group outcome
 * @since 0.1.0
 */
public record OrchestrationResult(GroupResult commercial, GroupResult govcloud) {

  /**
   * Validates that each result belongs to its slot.
   *
   * @throws IllegalArgumentException if a result carries the wrong account class
   */
  public OrchestrationResult {
    Objects.requireNonNull(commercial, "commercial");
    Objects.requireNonNull(govcloud, "govcloud");
    if (commercial.accountClass() != AccountClass.COMMERCIAL) {
      throw new IllegalArgumentException("commercial slot holds " + commercial.accountClass());
    }
    if (govcloud.accountClass() != AccountClass.GOVCLOUD) {
      throw new IllegalArgumentException("govcloud slot holds " + govcloud.accountClass());
    }
  }

  /**
   * Returns both results, commercial first.
   *
   * @return results in account-class order
   */
  public List<GroupResult> results() {
    return List.of(commercial, govcloud);
  }

  /**
   * Returns the result of one class.
   *
   * @param accountClass class to look up
   * @return matching result
   */
  public GroupResult result(AccountClass accountClass) {
    return switch (Objects.requireNonNull(accountClass, "accountClass")) {
      case COMMERCIAL -> commercial;
      case GOVCLOUD -> govcloud;
    };
  }

  /**
   * Returns the failed results, commercial first.
   *
   * @return possibly empty list of failures
   */
  public List<GroupResult> failures() {
    return results().stream().filter(result -> !result.succeeded()).toList();
  }

  /**
   * Returns the account classes whose groups succeeded.
   *
   * @return succeeded classes in account-class order
   */
  public List<AccountClass> succeededClasses() {
    return results().stream()
        .filter(GroupResult::succeeded)
        .map(GroupResult::accountClass)
        .toList();
  }

  /**
   * Indicates whether every group failed.
   *
   * @return {@code true} when no group succeeded
   */
  public boolean allFailed() {
    return failures().size() == results().size();
  }

  /**
   * Throws when any group failed.
   *
   * @throws GroupExecutionException naming every failed group
   */
  public void requireAllSucceeded() throws GroupExecutionException {
    List<GroupResult> failures = failures();
    if (!failures.isEmpty()) {
      throw new GroupExecutionException(failures);
    }
  }
}

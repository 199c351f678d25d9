package ca.gc.cra.prplan.domain.plan;

import java.util.List;
import java.util.Objects;

/**
 * Targets split by account class, each list in discovery order.
 *
 * @param commercial targets planned with commercial credentials
 * @param govcloud targets planned in the restricted GovCloud partition
 * @since 0.1.0
 */
public record GroupPartition(List<String> commercial, List<String> govcloud) {

  /**
   * Copies both lists so the partition stays immutable.
   *
   * @param commercial commercial targets; must not be {@code null}
   * @param govcloud GovCloud targets; must not be {@code null}
   */
  public GroupPartition {
    commercial = List.copyOf(Objects.requireNonNull(commercial, "commercial"));
    govcloud = List.copyOf(Objects.requireNonNull(govcloud, "govcloud"));
  }

  /**
   * Returns the targets belonging to the supplied class.
   *
   * @param accountClass class to look up
   * @return immutable target list
   */
  public List<String> targets(AccountClass accountClass) {
    return switch (Objects.requireNonNull(accountClass, "accountClass")) {
      case COMMERCIAL -> commercial;
      case GOVCLOUD -> govcloud;
    };
  }

  /**
   * Returns the number of targets across both classes.
   *
   * @return combined target count
   */
  public int size() {
    return commercial.size() + govcloud.size();
  }
}

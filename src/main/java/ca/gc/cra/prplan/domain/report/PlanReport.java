package ca.gc.cra.prplan.domain.report;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Environments of an assembled report in ascending name order.
 *
 * @param environments environment groups sorted by name
 * @param recordCount number of records folded into the report, including overwritten ones
 * @since 0.1.0
 */
public record PlanReport(List<EnvironmentGroup> environments, int recordCount) {

  /**
   * Copies the environment list.
   */
  public PlanReport {
    environments = List.copyOf(Objects.requireNonNull(environments, "environments"));
  }

  /**
   * Looks up an environment by name.
   *
   * @param name environment name
   * @return matching group when present
   */
  public Optional<EnvironmentGroup> environment(String name) {
    return environments.stream().filter(group -> group.name().equals(name)).findFirst();
  }

  /**
   * Indicates whether no block made it into the report.
   *
   * @return {@code true} when there are no environments
   */
  public boolean isEmpty() {
    return environments.isEmpty();
  }
}

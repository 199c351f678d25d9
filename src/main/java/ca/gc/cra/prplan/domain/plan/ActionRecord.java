package ca.gc.cra.prplan.domain.plan;

import java.util.Objects;

/**
 * <strong>What:</strong> One proposed-change excerpt attributed to an environment and region.
 * <p><strong>Role:</strong> Domain value emitted by the plan text scanner and folded by the report assembler.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param environment environment (organization) in effect when the block closed; never blank
 * @param region region in effect when the block closed; never blank
 * @param blockText verbatim plan lines from the actions header through the {@code Plan:} summary
 * @since 0.1.0
 */
public record ActionRecord(String environment, String region, String blockText) {

  /**
   * Validates that context fields are present.
   *
   * @throws IllegalArgumentException if {@code environment} or {@code region} is blank
   */
  public ActionRecord {
    Objects.requireNonNull(environment, "environment");
    Objects.requireNonNull(region, "region");
    Objects.requireNonNull(blockText, "blockText");
    if (environment.isBlank()) {
      throw new IllegalArgumentException("environment must not be blank");
    }
    if (region.isBlank()) {
      throw new IllegalArgumentException("region must not be blank");
    }
  }
}

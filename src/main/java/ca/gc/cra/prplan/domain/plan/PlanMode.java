package ca.gc.cra.prplan.domain.plan;

/**
 * <strong>What:</strong> Strategies for invoking the plan executor within a group.
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum PlanMode {
  /** One {@code plan_all} invocation per account class. */
  BATCH,
  /** One {@code plan} invocation per discovered affected target. */
  TARGETED
}

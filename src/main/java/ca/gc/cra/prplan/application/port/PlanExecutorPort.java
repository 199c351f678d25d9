package ca.gc.cra.prplan.application.port;

import ca.gc.cra.prplan.domain.plan.AccountClass;
import ca.gc.cra.prplan.domain.plan.PlanExecutionException;

/**
 * <strong>What:</strong> Port invoking the external plan executor.
 * <p><strong>Role:</strong> Output port used by execution groups; the default adapter launches {@code kitman tg}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate one concurrent caller per account class.</p>
 *
 * @since 0.1.0
 */
public interface PlanExecutorPort {
  /**
   * Plans every target of a module for one account class in a single invocation.
   *
   * @param accountClass class selecting the batch arguments
   * @param moduleName module being planned
   * @return captured standard output
   * @throws PlanExecutionException if the executor exits non-zero or cannot be started
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  String planAll(AccountClass accountClass, String moduleName)
      throws PlanExecutionException, InterruptedException;

  /**
   * Plans a single target.
   *
   * @param target target identifier (terragrunt working directory)
   * @return captured standard output
   * @throws PlanExecutionException if the executor exits non-zero or cannot be started
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  String planTarget(String target) throws PlanExecutionException, InterruptedException;
}

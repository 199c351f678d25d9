package ca.gc.cra.prplan.application.pipeline;

import ca.gc.cra.prplan.domain.plan.AccountClass;
import ca.gc.cra.prplan.domain.plan.GroupPartition;
import ca.gc.cra.prplan.domain.plan.GroupResult;
import ca.gc.cra.prplan.domain.plan.PlanExecutionException;
import ca.gc.cra.prplan.infrastructure.exec.ExecutorFactories;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Runs the commercial and GovCloud execution groups concurrently and joins both.
 * <p><strong>Why:</strong> The two account classes plan independently; a failure in one must not hide or cancel the
 * other's output.</p>
 * <p><strong>Role:</strong> Application-layer orchestrator; the only synchronization point of a run.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe for concurrent {@code run*} invocations.</p>
 * <p><strong>Observability:</strong> Tags group threads with the {@code group} MDC key.</p>
 *
 * @since 0.1.0
 */
public final class PlanOrchestrator {
  private static final Logger log = LoggerFactory.getLogger(PlanOrchestrator.class);
  private static final String MDC_GROUP = "group";
  private static final long SHUTDOWN_WAIT_MILLIS = 5_000L;

  private final PlanGroupRunner runner;

  /**
   * Creates an orchestrator.
   *
   * @param runner runner executing each group
   */
  public PlanOrchestrator(PlanGroupRunner runner) {
    this.runner = Objects.requireNonNull(runner, "runner");
  }

  /**
   * Runs both groups in batch mode.
   *
   * @param moduleName module being planned
   * @return both outcomes
   * @throws InterruptedException if the orchestrating thread is interrupted
   */
  public OrchestrationResult runBatch(String moduleName) throws InterruptedException {
    Objects.requireNonNull(moduleName, "moduleName");
    return run(
        () -> runner.runBatch(AccountClass.COMMERCIAL, moduleName),
        () -> runner.runBatch(AccountClass.GOVCLOUD, moduleName));
  }

  /**
   * Runs both groups in targeted mode.
   *
   * @param partition targets split by account class
   * @return both outcomes
   * @throws InterruptedException if the orchestrating thread is interrupted
   */
  public OrchestrationResult runTargeted(GroupPartition partition) throws InterruptedException {
    Objects.requireNonNull(partition, "partition");
    return run(
        () -> runner.runTargeted(AccountClass.COMMERCIAL, partition.commercial()),
        () -> runner.runTargeted(AccountClass.GOVCLOUD, partition.govcloud()));
  }

  OrchestrationResult run(GroupTask commercial, GroupTask govcloud) throws InterruptedException {
    List<Callable<GroupResult>> tasks = List.of(
        wrap(AccountClass.COMMERCIAL, commercial),
        wrap(AccountClass.GOVCLOUD, govcloud));
    ExecutorService executor = ExecutorFactories.newGroupPool(
        tasks.size(),
        ExecutorFactories.DEFAULT_GROUP_PREFIX,
        (thread, ex) -> log.error("Uncaught failure on {}", thread.getName(), ex));
    try {
      List<Future<GroupResult>> futures = executor.invokeAll(tasks);
      return new OrchestrationResult(
          collect(AccountClass.COMMERCIAL, futures.get(0)),
          collect(AccountClass.GOVCLOUD, futures.get(1)));
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Plan groups interrupted; requesting shutdown");
      executor.shutdownNow();
      throw ex;
    } finally {
      if (!executor.isShutdown()) {
        boolean terminated = ExecutorFactories.shutdownAndAwait(executor, SHUTDOWN_WAIT_MILLIS);
        if (!terminated) {
          log.warn("Plan group workers did not terminate within {} ms", SHUTDOWN_WAIT_MILLIS);
        }
      }
    }
  }

  private Callable<GroupResult> wrap(AccountClass accountClass, GroupTask task) {
    return () -> {
      String previousGroup = MDC.get(MDC_GROUP);
      try {
        MDC.put(MDC_GROUP, accountClass.displayName());
        log.debug("{} group started", accountClass.displayName());
        return task.execute();
      } catch (RuntimeException ex) {
        log.error("{} group failed unexpectedly", accountClass.displayName(), ex);
        return GroupResult.failed(accountClass, 0, 0, new PlanExecutionException(
            accountClass.displayName(), "unexpected failure: " + ex.getMessage(), ex));
      } finally {
        if (previousGroup == null) {
          MDC.remove(MDC_GROUP);
        } else {
          MDC.put(MDC_GROUP, previousGroup);
        }
      }
    };
  }

  private static GroupResult collect(AccountClass accountClass, Future<GroupResult> future)
      throws InterruptedException {
    try {
      return future.get();
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause();
      return GroupResult.failed(accountClass, 0, 0, new PlanExecutionException(
          accountClass.displayName(), "group did not complete: " + cause, cause));
    }
  }

  /**
   * Work executed for one group.
   */
  @FunctionalInterface
  interface GroupTask {
    GroupResult execute() throws InterruptedException;
  }
}

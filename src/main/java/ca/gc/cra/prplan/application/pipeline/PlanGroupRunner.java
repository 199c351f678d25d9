package ca.gc.cra.prplan.application.pipeline;

import ca.gc.cra.prplan.application.port.MetricsPort;
import ca.gc.cra.prplan.application.port.PlanArtifactPort;
import ca.gc.cra.prplan.application.port.PlanExecutorPort;
import ca.gc.cra.prplan.domain.plan.AccountClass;
import ca.gc.cra.prplan.domain.plan.GroupResult;
import ca.gc.cra.prplan.domain.plan.PlanExecutionException;
import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Runs every executor invocation of one account class and stores the captured output.
 * <p><strong>Role:</strong> Application-layer execution group driven by {@link PlanOrchestrator}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Invoke the executor once (batch) or once per target, strictly in input order.</li>
 *   <li>Stop at the first failed invocation without starting the remaining ones.</li>
 *   <li>Write the group artifact before returning; remove stale artifacts when the group fails.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless between calls; one runner may serve both groups concurrently provided
 * the ports are thread-safe.</p>
 * <p><strong>Observability:</strong> Emits {@code plan.executor.*} and {@code plan.group.*} metrics.</p>
 *
 * @since 0.1.0
 */
public final class PlanGroupRunner {
  private static final Logger log = LoggerFactory.getLogger(PlanGroupRunner.class);

  private final PlanExecutorPort executor;
  private final PlanArtifactPort artifacts;
  private final MetricsPort metrics;

  /**
   * Creates a runner.
   *
   * @param executor plan executor port
   * @param artifacts artifact storage for raw group output
   * @param metrics metrics sink; {@code null} disables metrics
   */
  public PlanGroupRunner(PlanExecutorPort executor, PlanArtifactPort artifacts, MetricsPort metrics) {
    this.executor = Objects.requireNonNull(executor, "executor");
    this.artifacts = Objects.requireNonNull(artifacts, "artifacts");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
  }

  /**
   * Plans the whole module for one account class with a single invocation.
   *
   * @param accountClass group to plan
   * @param moduleName module being planned
   * @return group outcome; executor and artifact failures are reported in the result
   * @throws InterruptedException if interrupted while the executor runs
   */
  public GroupResult runBatch(AccountClass accountClass, String moduleName) throws InterruptedException {
    Objects.requireNonNull(accountClass, "accountClass");
    Objects.requireNonNull(moduleName, "moduleName");
    log.info("Running {} account plans for module {}", accountClass.displayName(), moduleName);
    String output;
    try {
      output = invoke("plan_all " + moduleName, () -> executor.planAll(accountClass, moduleName));
    } catch (PlanExecutionException ex) {
      return fail(accountClass, 0, 0, ex);
    }
    return store(GroupResult.succeeded(accountClass, output, 0, 1));
  }

  /**
   * Plans each target in order, concatenating outputs separated by a newline.
   *
   * @param accountClass group to plan
   * @param targets targets of the group in discovery order
   * @return group outcome; an empty target list yields the class's "no work" result
   * @throws InterruptedException if interrupted while an executor runs
   */
  public GroupResult runTargeted(AccountClass accountClass, List<String> targets)
      throws InterruptedException {
    Objects.requireNonNull(accountClass, "accountClass");
    List<String> ordered = List.copyOf(Objects.requireNonNull(targets, "targets"));
    if (ordered.isEmpty()) {
      log.info("No {} plans needed", accountClass.displayName());
      return store(GroupResult.noWork(accountClass));
    }
    log.info("Running {} {} plans", ordered.size(), accountClass.displayName());
    StringBuilder buffer = new StringBuilder();
    int completed = 0;
    for (String target : ordered) {
      log.debug("Planning: {}", target);
      try {
        buffer.append(invoke(target, () -> executor.planTarget(target))).append('\n');
      } catch (PlanExecutionException ex) {
        return fail(accountClass, ordered.size(), completed, ex);
      }
      completed++;
    }
    return store(GroupResult.succeeded(accountClass, buffer.toString(), ordered.size(), completed));
  }

  private String invoke(String label, Invocation invocation)
      throws PlanExecutionException, InterruptedException {
    long start = System.nanoTime();
    metrics.increment("plan.executor.invocations");
    try {
      return invocation.call();
    } catch (PlanExecutionException ex) {
      metrics.increment("plan.executor.failures");
      throw ex;
    } finally {
      long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
      metrics.observe("plan.executor.durationMillis", elapsedMillis);
      log.debug("Executor finished for {} in {} ms", label, elapsedMillis);
    }
  }

  private GroupResult store(GroupResult result) {
    try {
      artifacts.writeGroupOutput(result.accountClass(), result.rawOutput());
    } catch (IOException ex) {
      PlanExecutionException failure = new PlanExecutionException(
          result.accountClass().artifactFileName(),
          "failed to write " + result.accountClass().artifactFileName() + ": " + ex.getMessage(),
          ex);
      return fail(result.accountClass(), result.targets(), result.invocations(), failure);
    }
    metrics.increment(groupMetric(result.accountClass(), "success"));
    log.info("{} plans completed ({} invocations)",
        result.accountClass().displayName(), result.invocations());
    return result;
  }

  private GroupResult fail(
      AccountClass accountClass, int targets, int completed, PlanExecutionException cause) {
    log.error("{} plans failed at {}: {}",
        accountClass.displayName(), cause.target(), cause.getMessage());
    try {
      artifacts.deleteGroupOutput(accountClass);
    } catch (IOException deleteEx) {
      cause.addSuppressed(deleteEx);
      log.warn("Unable to remove stale {} artifact", accountClass.displayName(), deleteEx);
    }
    metrics.increment(groupMetric(accountClass, "failure"));
    return GroupResult.failed(accountClass, targets, completed, cause);
  }

  private static String groupMetric(AccountClass accountClass, String outcome) {
    return "plan.group." + accountClass.name().toLowerCase(Locale.ROOT) + "." + outcome;
  }

  @FunctionalInterface
  private interface Invocation {
    String call() throws PlanExecutionException, InterruptedException;
  }
}

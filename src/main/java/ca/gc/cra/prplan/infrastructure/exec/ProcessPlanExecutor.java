package ca.gc.cra.prplan.infrastructure.exec;

import ca.gc.cra.prplan.application.port.PlanExecutorPort;
import ca.gc.cra.prplan.domain.plan.AccountClass;
import ca.gc.cra.prplan.domain.plan.PlanExecutionException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> {@link PlanExecutorPort} that shells out to the {@code kitman tg} planning command.
 * <p><strong>Role:</strong> Driven adapter; one OS process per invocation, started in the configured working
 * directory.</p>
 * <p><strong>Thread-safety:</strong> Stateless; both group threads may invoke it concurrently.</p>
 *
 * @since 0.1.0
 */
public final class ProcessPlanExecutor implements PlanExecutorPort {
  /** Executable used when none is configured. */
  public static final String DEFAULT_COMMAND = "kitman";
  /** GovCloud organizations passed to batch plans by default. */
  public static final String DEFAULT_GOVCLOUD_ORGANIZATIONS = "govcloud-staging|govcloud-production";
  /** GovCloud regions passed to batch plans by default. */
  public static final String DEFAULT_GOVCLOUD_REGIONS = "us-gov-west-1";

  private final ProcessRunner runner;
  private final String command;
  private final String govcloudOrganizations;
  private final String govcloudRegions;

  /**
   * Creates an executor.
   *
   * @param workDir directory the command runs in
   * @param command executable name or path
   * @param govcloudOrganizations value of {@code --organizations} for GovCloud batch plans
   * @param govcloudRegions value of {@code --regions} for GovCloud batch plans
   */
  public ProcessPlanExecutor(
      Path workDir, String command, String govcloudOrganizations, String govcloudRegions) {
    this.runner = new ProcessRunner(workDir);
    this.command = Objects.requireNonNull(command, "command");
    this.govcloudOrganizations = Objects.requireNonNull(govcloudOrganizations, "govcloudOrganizations");
    this.govcloudRegions = Objects.requireNonNull(govcloudRegions, "govcloudRegions");
  }

  @Override
  public String planAll(AccountClass accountClass, String moduleName)
      throws PlanExecutionException, InterruptedException {
    return execute(accountClass.displayName() + " plan_all", planAllCommand(accountClass, moduleName));
  }

  @Override
  public String planTarget(String target) throws PlanExecutionException, InterruptedException {
    return execute(target, planTargetCommand(target));
  }

  /**
   * Builds the batch argument list for an account class.
   *
   * @param accountClass group being planned
   * @param moduleName module passed to {@code -m}
   * @return program and arguments
   */
  public List<String> planAllCommand(AccountClass accountClass, String moduleName) {
    Objects.requireNonNull(moduleName, "moduleName");
    List<String> args = new ArrayList<>(List.of(command, "tg", "plan_all", "-m", moduleName));
    if (accountClass == AccountClass.GOVCLOUD) {
      args.addAll(List.of("--organizations", govcloudOrganizations, "--regions", govcloudRegions));
    }
    args.addAll(List.of("--local", "--pr"));
    return List.copyOf(args);
  }

  /**
   * Builds the argument list planning a single target.
   *
   * @param target target working directory
   * @return program and arguments
   */
  public List<String> planTargetCommand(String target) {
    return List.of(command, "tg", "plan", "--wd", Objects.requireNonNull(target, "target"), "--local", "--pr");
  }

  private String execute(String label, List<String> args)
      throws PlanExecutionException, InterruptedException {
    ProcessRunner.Completed completed;
    try {
      completed = runner.run(args);
    } catch (IOException ex) {
      throw new PlanExecutionException(label, "could not run " + command + ": " + ex.getMessage(), ex);
    }
    if (!completed.succeeded()) {
      throw new PlanExecutionException(label, completed.exitCode(), completed.describeFailure());
    }
    return completed.stdout();
  }
}

package ca.gc.cra.prplan.infrastructure.exec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.prplan.domain.plan.AccountClass;
import ca.gc.cra.prplan.domain.plan.PlanExecutionException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

class ProcessPlanExecutorTest {

  @TempDir
  Path tempDir;

  @Test
  void commercialPlanAllCommandHasNoGovcloudScope() {
    ProcessPlanExecutor executor = defaults(tempDir);

    assertEquals(
        List.of("kitman", "tg", "plan_all", "-m", "iam", "--local", "--pr"),
        executor.planAllCommand(AccountClass.COMMERCIAL, "iam"));
  }

  @Test
  void govcloudPlanAllCommandScopesOrganizationsAndRegions() {
    ProcessPlanExecutor executor = defaults(tempDir);

    assertEquals(
        List.of("kitman", "tg", "plan_all", "-m", "iam",
            "--organizations", "govcloud-staging|govcloud-production",
            "--regions", "us-gov-west-1", "--local", "--pr"),
        executor.planAllCommand(AccountClass.GOVCLOUD, "iam"));
  }

  @Test
  void targetCommandUsesWorkingDirectoryFlag() {
    assertEquals(
        List.of("kitman", "tg", "plan", "--wd", "terragrunt_iam/x", "--local", "--pr"),
        defaults(tempDir).planTargetCommand("terragrunt_iam/x"));
  }

  @Test
  @DisabledOnOs(OS.WINDOWS)
  void returnsStdoutOfSuccessfulRun() throws Exception {
    Path tool = ScriptFixtures.executable(tempDir, "fake-kitman", "echo \"planned $*\"");
    ProcessPlanExecutor executor = new ProcessPlanExecutor(
        tempDir, tool.toString(), "govcloud-staging", "us-gov-west-1");

    String output = executor.planTarget("terragrunt_iam/roles");

    assertEquals("planned tg plan --wd terragrunt_iam/roles --local --pr\n", output);
  }

  @Test
  @DisabledOnOs(OS.WINDOWS)
  void runsInsideWorkDirectory() throws Exception {
    Files.createDirectory(tempDir.resolve("marker-dir"));
    Path tool = ScriptFixtures.executable(tempDir, "fake-kitman", "ls");
    ProcessPlanExecutor executor = new ProcessPlanExecutor(
        tempDir, tool.toString(), "o", "r");

    assertTrue(executor.planAll(AccountClass.COMMERCIAL, "iam").contains("marker-dir"));
  }

  @Test
  @DisabledOnOs(OS.WINDOWS)
  void nonZeroExitCarriesStderrTail() throws Exception {
    Path tool = ScriptFixtures.executable(tempDir, "fake-kitman",
        "echo partial; echo 'Error: credentials expired' >&2; exit 3");
    ProcessPlanExecutor executor = new ProcessPlanExecutor(tempDir, tool.toString(), "o", "r");

    PlanExecutionException ex = assertThrows(PlanExecutionException.class,
        () -> executor.planAll(AccountClass.GOVCLOUD, "iam"));

    assertEquals(3, ex.exitCode());
    assertEquals("GovCloud plan_all", ex.target());
    assertEquals("exit status 3: Error: credentials expired", ex.getMessage());
  }

  @Test
  void missingCommandIsAnExecutionFailure() {
    ProcessPlanExecutor executor = new ProcessPlanExecutor(
        tempDir, tempDir.resolve("no-such-tool").toString(), "o", "r");

    PlanExecutionException ex = assertThrows(PlanExecutionException.class,
        () -> executor.planTarget("x"));

    assertEquals(PlanExecutionException.NO_EXIT_CODE, ex.exitCode());
    assertTrue(ex.getMessage().startsWith("could not run"));
  }

  private static ProcessPlanExecutor defaults(Path workDir) {
    return new ProcessPlanExecutor(
        workDir,
        ProcessPlanExecutor.DEFAULT_COMMAND,
        ProcessPlanExecutor.DEFAULT_GOVCLOUD_ORGANIZATIONS,
        ProcessPlanExecutor.DEFAULT_GOVCLOUD_REGIONS);
  }
}

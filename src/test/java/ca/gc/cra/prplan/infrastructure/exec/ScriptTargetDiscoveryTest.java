package ca.gc.cra.prplan.infrastructure.exec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.prplan.domain.plan.TargetDiscoveryException;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

class ScriptTargetDiscoveryTest {

  @TempDir
  Path tempDir;

  @Test
  void parsesWorkdirTokenFromPlanCommands() {
    String output = String.join("\n",
        "Affected modules:",
        "  kitman tg plan -w terragrunt_iam/organizations/staging/eu-west-1/roles/terragrunt.hcl",
        "kitman tg plan --local -w terragrunt_iam/organizations/govcloud-staging/us-gov-west-1/roles",
        "kitman tg apply -w ignored/terragrunt.hcl",
        "kitman tg plan without-flag",
        "");

    assertEquals(List.of(
        "terragrunt_iam/organizations/staging/eu-west-1/roles",
        "terragrunt_iam/organizations/govcloud-staging/us-gov-west-1/roles"),
        ScriptTargetDiscovery.parseTargets(output));
  }

  @Test
  void trailingFlagWithoutValueIsIgnored() {
    assertTrue(ScriptTargetDiscovery.parseTargets("kitman tg plan -w").isEmpty());
    assertTrue(ScriptTargetDiscovery.parseTargets("").isEmpty());
  }

  @Test
  void onlyFirstTerragruntSuffixIsRemoved() {
    assertEquals(List.of("a/terragrunt.hcl"), ScriptTargetDiscovery.parseTargets(
        "kitman tg plan -w a/terragrunt.hcl/terragrunt.hcl"));
  }

  @Test
  void missingScriptFails() {
    ScriptTargetDiscovery discovery = new ScriptTargetDiscovery(tempDir, ScriptTargetDiscovery.DEFAULT_SCRIPT);

    TargetDiscoveryException ex =
        assertThrows(TargetDiscoveryException.class, () -> discovery.discover("iam"));
    assertTrue(ex.getMessage().contains("not found"));
  }

  @Test
  @DisabledOnOs(OS.WINDOWS)
  void runsScriptWithModuleAndRepositoryRoot() throws Exception {
    Path script = ScriptFixtures.executable(tempDir, "affected-modules.sh",
        "echo \"kitman tg plan -w terragrunt_$1/organizations/staging/eu-west-1/$2/terragrunt.hcl\"");
    ScriptTargetDiscovery discovery = new ScriptTargetDiscovery(tempDir, script.toString());

    assertEquals(List.of("terragrunt_iam/organizations/staging/eu-west-1/."), discovery.discover("iam"));
  }

  @Test
  @DisabledOnOs(OS.WINDOWS)
  void failingScriptIsReported() throws Exception {
    Path script = ScriptFixtures.executable(tempDir, "affected-modules.sh", "echo nope >&2; exit 1");
    ScriptTargetDiscovery discovery = new ScriptTargetDiscovery(tempDir, script.toString());

    TargetDiscoveryException ex =
        assertThrows(TargetDiscoveryException.class, () -> discovery.discover("iam"));
    assertTrue(ex.getMessage().contains("exit status 1: nope"));
  }
}

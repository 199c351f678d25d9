package ca.gc.cra.prplan.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.prplan.domain.plan.AccountClass;
import ca.gc.cra.prplan.domain.plan.GroupResult;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PlanGroupRunnerTest {
  private ScriptedPlanExecutor executor;
  private InMemoryPlanArtifactStore artifacts;
  private RecordingMetricsPort metrics;
  private PlanGroupRunner runner;

  @BeforeEach
  void setUp() {
    executor = new ScriptedPlanExecutor();
    artifacts = new InMemoryPlanArtifactStore();
    metrics = new RecordingMetricsPort();
    runner = new PlanGroupRunner(executor, artifacts, metrics);
  }

  @Test
  void batchRunStoresExecutorOutput() throws Exception {
    executor.respond(ScriptedPlanExecutor.batchLabel(AccountClass.COMMERCIAL, "iam"), "plan text");

    GroupResult result = runner.runBatch(AccountClass.COMMERCIAL, "iam");

    assertTrue(result.succeeded());
    assertEquals(1, result.invocations());
    assertEquals("plan text", artifacts.output(AccountClass.COMMERCIAL).orElseThrow());
    assertEquals(1, metrics.count("plan.executor.invocations"));
    assertEquals(1, metrics.count("plan.group.commercial.success"));
    assertEquals(1, metrics.observed("plan.executor.durationMillis").size());
  }

  @Test
  void targetedRunConcatenatesOutputsInOrder() throws Exception {
    executor.respond("a/govcloud/one", "first").respond("a/govcloud/two", "second");

    GroupResult result = runner.runTargeted(
        AccountClass.GOVCLOUD, List.of("a/govcloud/one", "a/govcloud/two"));

    assertTrue(result.succeeded());
    assertEquals(2, result.targets());
    assertEquals(2, result.invocations());
    assertEquals("first\nsecond\n", artifacts.output(AccountClass.GOVCLOUD).orElseThrow());
    assertEquals(List.of("a/govcloud/one", "a/govcloud/two"), executor.invocations());
  }

  @Test
  void emptyTargetListWritesPlaceholder() throws Exception {
    GroupResult result = runner.runTargeted(AccountClass.GOVCLOUD, List.of());

    assertTrue(result.noWorkRecorded());
    assertEquals("No GovCloud plans needed\n", artifacts.output(AccountClass.GOVCLOUD).orElseThrow());
    assertTrue(executor.invocations().isEmpty());
  }

  @Test
  void firstFailureStopsGroupAndRemovesStaleArtifact() throws Exception {
    artifacts.seed(AccountClass.COMMERCIAL, "stale output from a previous run");
    executor.respond("one", "ok").fail("two", 1).respond("three", "never");

    GroupResult result = runner.runTargeted(AccountClass.COMMERCIAL, List.of("one", "two", "three"));

    assertFalse(result.succeeded());
    assertEquals(1, result.invocations());
    assertEquals(3, result.targets());
    assertEquals("two", result.failure().orElseThrow().target());
    assertEquals(1, result.failure().orElseThrow().exitCode());
    assertEquals(List.of("one", "two"), executor.invocations());
    assertTrue(artifacts.output(AccountClass.COMMERCIAL).isEmpty());
    assertEquals(1, metrics.count("plan.executor.failures"));
    assertEquals(1, metrics.count("plan.group.commercial.failure"));
  }

  @Test
  void artifactWriteFailureFailsGroup() throws Exception {
    artifacts.failWritesFor(AccountClass.GOVCLOUD);

    GroupResult result = runner.runBatch(AccountClass.GOVCLOUD, "iam");

    assertFalse(result.succeeded());
    assertTrue(result.failure().orElseThrow().getMessage().contains("govcloud-plans.txt"));
    assertFalse(metrics.hasCounter("plan.group.govcloud.success"));
  }
}

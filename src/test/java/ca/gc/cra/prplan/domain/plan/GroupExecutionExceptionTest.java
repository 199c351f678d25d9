package ca.gc.cra.prplan.domain.plan;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class GroupExecutionExceptionTest {

  @Test
  void messageNamesEachFailedGroup() {
    PlanExecutionException commercial =
        new PlanExecutionException("plan_all iam", 1, "exit status 1: boom");
    PlanExecutionException govcloud =
        new PlanExecutionException("govcloud/roles", 2, "exit status 2: denied");

    GroupExecutionException ex = new GroupExecutionException(List.of(
        GroupResult.failed(AccountClass.COMMERCIAL, 0, 0, commercial),
        GroupResult.failed(AccountClass.GOVCLOUD, 3, 1, govcloud)));

    assertEquals(
        "commercial plans failed: exit status 1: boom; GovCloud plans failed: exit status 2: denied",
        ex.getMessage());
    assertSame(commercial, ex.getCause());
    assertEquals(1, ex.getSuppressed().length);
    assertSame(govcloud, ex.getSuppressed()[0]);
    assertTrue(ex.allGroupsFailed());
  }

  @Test
  void singleFailureIsNotAllGroups() {
    GroupExecutionException ex = new GroupExecutionException(List.of(
        GroupResult.failed(AccountClass.GOVCLOUD, 1, 0,
            new PlanExecutionException("t", 1, "bad"))));

    assertEquals(List.of(AccountClass.GOVCLOUD), ex.failedGroups());
    assertFalse(ex.allGroupsFailed());
  }

  @Test
  void rejectsSucceededResults() {
    assertThrows(IllegalArgumentException.class, () -> new GroupExecutionException(List.of(
        GroupResult.succeeded(AccountClass.COMMERCIAL, "ok", 0, 1))));
    assertThrows(IllegalArgumentException.class, () -> new GroupExecutionException(List.of()));
  }

  @Test
  void noWorkResultCarriesPlaceholderArtifact() {
    GroupResult result = GroupResult.noWork(AccountClass.GOVCLOUD);

    assertTrue(result.succeeded());
    assertTrue(result.noWorkRecorded());
    assertEquals("No GovCloud plans needed\n", result.rawOutput());
    assertTrue(AccountClass.isNoWorkText(result.rawOutput()));
  }
}

package ca.gc.cra.prplan.infrastructure.persistence;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import ca.gc.cra.prplan.domain.plan.AccountClass;
import ca.gc.cra.prplan.domain.plan.GroupResult;
import ca.gc.cra.prplan.domain.plan.PlanExecutionException;
import ca.gc.cra.prplan.domain.plan.PlanMode;
import ca.gc.cra.prplan.domain.plan.RunSummary;
import ca.gc.cra.prplan.domain.plan.RunSummary.GroupSummary;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonRunSummaryWriterTest {

  @TempDir
  Path tempDir;

  @Test
  void writesTopLevelFieldsAndGroups() throws Exception {
    RunSummary summary = new RunSummary(
        "iam",
        PlanMode.TARGETED,
        PlanMode.BATCH,
        tempDir,
        0L,
        1_500L,
        List.of(
            GroupSummary.from(GroupResult.succeeded(AccountClass.COMMERCIAL, "text", 0, 1)),
            GroupSummary.from(GroupResult.failed(AccountClass.GOVCLOUD, 0, 0,
                new PlanExecutionException("GovCloud plan_all", 1, "exit status 1")))),
        4,
        2,
        Optional.of(tempDir.resolve("pr-ready.md")));

    Path file = new JsonRunSummaryWriter().write(summary);

    assertEquals(tempDir.resolve(JsonRunSummaryWriter.FILE_NAME), file);
    Map<String, Object> top = new LinkedHashMap<>();
    List<Map<String, Object>> groups = new ArrayList<>();
    readSummary(file, top, groups);

    assertEquals("1", top.get("schemaVersion"));
    assertEquals("iam", top.get("module"));
    assertEquals("TARGETED", top.get("requestedMode"));
    assertEquals("BATCH", top.get("effectiveMode"));
    assertEquals("1970-01-01T00:00:01.500Z", top.get("finishedAt"));
    assertEquals("1500", top.get("durationMillis"));
    assertEquals("false", top.get("succeeded"));
    assertEquals("4", top.get("recordCount"));
    assertEquals(tempDir.resolve("pr-ready.md").toString(), top.get("report"));

    assertEquals(2, groups.size());
    assertEquals("COMMERCIAL", groups.get(0).get("accountClass"));
    assertNull(groups.get(0).get("error"));
    assertEquals("govcloud-plans.txt", groups.get(1).get("artifact"));
    assertEquals("GovCloud plan_all", groups.get(1).get("failedTarget"));
    assertEquals("exit status 1", groups.get(1).get("error"));
  }

  private static void readSummary(Path file, Map<String, Object> top, List<Map<String, Object>> groups)
      throws IOException {
    try (JsonParser parser = new JsonFactory().createParser(file.toFile())) {
      parser.nextToken();
      while (parser.nextToken() == JsonToken.FIELD_NAME) {
        String field = parser.currentName();
        JsonToken value = parser.nextToken();
        if ("groups".equals(field)) {
          while (parser.nextToken() == JsonToken.START_OBJECT) {
            groups.add(readFlatObject(parser));
          }
        } else {
          top.put(field, value == JsonToken.VALUE_NULL ? null : parser.getText());
        }
      }
    }
  }

  private static Map<String, Object> readFlatObject(JsonParser parser) throws IOException {
    Map<String, Object> values = new LinkedHashMap<>();
    while (parser.nextToken() == JsonToken.FIELD_NAME) {
      String field = parser.currentName();
      JsonToken value = parser.nextToken();
      values.put(field, value == JsonToken.VALUE_NULL ? null : parser.getText());
    }
    return values;
  }
}

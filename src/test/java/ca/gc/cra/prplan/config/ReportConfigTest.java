package ca.gc.cra.prplan.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ReportConfigTest {

  @Test
  void requiresInputDirectory() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> ReportConfig.fromMap(Map.of("module", "iam")));

    assertEquals("in=DIR is required", ex.getMessage());
  }

  @Test
  void blankCommandLabelFallsBackToDefault() {
    ReportConfig config = ReportConfig.fromMap(Map.of("module", "iam", "in", "pr-plans-x"));

    assertEquals("kitman tg plan_all", config.commandLabel());
    assertEquals(Path.of("pr-plans-x").toAbsolutePath().normalize(), config.inputDirectory());
  }

  @Test
  void customCommandLabelKept() {
    ReportConfig config = ReportConfig.fromMap(Map.of(
        "module", "iam", "in", "out", "report.commandLabel", "kitman tg plan"));

    assertEquals("kitman tg plan", config.commandLabel());
  }
}

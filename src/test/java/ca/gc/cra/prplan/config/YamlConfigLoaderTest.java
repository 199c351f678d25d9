package ca.gc.cra.prplan.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir
  Path tempDir;

  @Test
  void mergesCommonAndModeSectionsWithNestedKeys() throws Exception {
    Path config = tempDir.resolve("prplan.yaml");
    Files.writeString(config, String.join("\n",
        "common:",
        "  metricsExporter: otlp",
        "  report:",
        "    commandLabel: kitman tg plan",
        "generate:",
        "  targeted: true",
        "  metricsExporter: none",
        "  govcloud:",
        "    regions: us-gov-east-1",
        "report:",
        "  in: ignored",
        ""));

    Map<String, String> values = YamlConfigLoader.load(config, "generate").orElseThrow();

    assertEquals("none", values.get("metricsExporter"));
    assertEquals("kitman tg plan", values.get("report.commandLabel"));
    assertEquals("true", values.get("targeted"));
    assertEquals("us-gov-east-1", values.get("govcloud.regions"));
    assertFalse(values.containsKey("in"));
  }

  @Test
  void missingFileIsEmpty() throws Exception {
    assertEquals(Optional.empty(), YamlConfigLoader.load(tempDir.resolve("absent.yaml"), "generate"));
  }

  @Test
  void emptyDocumentIsEmptyMap() throws Exception {
    Path config = tempDir.resolve("empty.yaml");
    Files.writeString(config, "");

    assertTrue(YamlConfigLoader.load(config, "report").orElseThrow().isEmpty());
  }

  @Test
  void arraysAreRejected() throws Exception {
    Path config = tempDir.resolve("bad.yaml");
    Files.writeString(config, "generate:\n  targets:\n    - a\n    - b\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(config, "generate"));
  }

  @Test
  void malformedYamlIsAConfigError() throws Exception {
    Path config = tempDir.resolve("broken.yaml");
    Files.writeString(config, "generate: [unclosed\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(config, "generate"));
  }
}

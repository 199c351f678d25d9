package ca.gc.cra.prplan.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlAndEmitsWarning() {
    Map<String, String> defaults = Map.of("executorCommand", "kitman", "targeted", "false");
    Map<String, String> yaml = Map.of("executorCommand", "/opt/kitman", "targeted", "true");
    Map<String, String> cli = Map.of("executorCommand", "./kitman");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "generate", Optional.of(yaml), cli, defaults, warnings::add);

    assertEquals("./kitman", merged.get("executorCommand"));
    assertEquals("true", merged.get("targeted"));
    assertEquals(List.of("CLI overrides YAML for key: executorCommand"), warnings);
  }

  @Test
  void defaultsFillMissingKeys() {
    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "generate",
        Optional.empty(),
        Map.of("module", "iam"),
        DefaultsForMode.asFlatMap("generate"),
        msg -> {});

    assertEquals("iam", merged.get("module"));
    assertEquals("kitman", merged.get("executorCommand"));
  }

  @Test
  void unknownMetricsExporterRejected() {
    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        "report", Optional.empty(), Map.of("metricsExporter", "statsd"), Map.of(), msg -> {}));
  }

  @Test
  void otelEndpointMustBeHttpUrl() {
    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        "generate", Optional.of(Map.of("otelEndpoint", "grpc://collector:4317")), Map.of(), Map.of(),
        msg -> {}));
    assertEquals("https://collector:4317", ConfigMerger.buildEffectiveConfig(
        "generate", Optional.empty(), Map.of("otelEndpoint", "https://collector:4317"), Map.of(),
        msg -> {}).get("otelEndpoint"));
  }
}

package ca.gc.cra.prplan.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import org.junit.jupiter.api.Test;

class OpenTelemetryBootstrapTest {

  @Test
  void disabledExporterYieldsNoopMeter() {
    try (OpenTelemetryBootstrap.BootstrapResult result =
        OpenTelemetryBootstrap.initialize(MetricsSettings.disabled())) {
      assertTrue(result.isNoop());
      assertNotNull(result.meter());
      result.forceFlush();
    }
  }

  @Test
  void adapterOverDisabledSettingsAcceptsCalls() {
    try (OpenTelemetryMetricsAdapter adapter = new OpenTelemetryMetricsAdapter(MetricsSettings.disabled())) {
      adapter.increment("plan.executor.invocations");
      adapter.observe("plan.scan.records", 1L);
    }
  }

  @Test
  void resourceAttributesSkipMalformedEntries() {
    Attributes attributes =
        OpenTelemetryBootstrap.parseResourceAttributes("team=platform, broken, =x, env = ci");

    assertEquals(2, attributes.size());
    assertEquals("platform", attributes.get(AttributeKey.stringKey("team")));
    assertEquals("ci", attributes.get(AttributeKey.stringKey("env")));
  }

  @Test
  void exporterParsing() {
    assertEquals(MetricsSettings.Exporter.NONE, MetricsSettings.Exporter.from(""));
    assertEquals(MetricsSettings.Exporter.OTLP, MetricsSettings.Exporter.from(" OTLP "));
    assertThrows(IllegalArgumentException.class, () -> MetricsSettings.Exporter.from("prometheus"));
    assertEquals(MetricsSettings.DEFAULT_ENDPOINT,
        new MetricsSettings(MetricsSettings.Exporter.OTLP, " ", null).endpoint());
  }
}

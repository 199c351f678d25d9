package ca.gc.cra.prplan.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private static final AttributeKey<String> KEY_ATTR = AttributeKey.stringKey("prplan.metric.key");

  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void incrementExportsCounterWithOriginalKey() {
    adapter.increment("plan.group.govcloud.failure");
    adapter.increment("plan.group.govcloud.failure");
    adapter.forceFlush();

    MetricData counter = metric(reader.collectAllMetrics(), "plan.group.govcloud.failure");
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("plan.group.govcloud.failure", point.getAttributes().get(KEY_ATTR));
  }

  @Test
  void durationObservationsUseMillisecondHistogram() {
    adapter.observe("plan.executor.durationMillis", 120L);
    adapter.observe("plan.executor.durationMillis", 80L);
    adapter.forceFlush();

    MetricData histogram = metric(reader.collectAllMetrics(), "plan.executor.durationmillis");
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    assertEquals("ms", histogram.getUnit());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(200.0, point.getSum());
    assertEquals("plan.executor.durationMillis", point.getAttributes().get(KEY_ATTR));
  }

  @Test
  void countObservationsAreUnitless() {
    adapter.observe("plan.scan.records", 3L);
    adapter.forceFlush();

    assertEquals("1", metric(reader.collectAllMetrics(), "plan.scan.records").getUnit());
  }

  @Test
  void sanitizeNameReplacesUnsupportedCharacters() {
    assertEquals("plan.scan_records", OpenTelemetryMetricsAdapter.sanitizeName("plan.scan records"));
    assertEquals("m1.count", OpenTelemetryMetricsAdapter.sanitizeName("1.count"));
    assertEquals("prplan.metric", OpenTelemetryMetricsAdapter.sanitizeName(" "));
  }

  private static MetricData metric(Collection<MetricData> metrics, String name) {
    MetricData found = metrics.stream()
        .filter(metric -> metric.getName().equals(name))
        .findFirst()
        .orElse(null);
    assertTrue(found != null, "Expected metric " + name + " to be exported");
    return found;
  }
}

package ca.gc.cra.pacer.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
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
  private static final AttributeKey<String> METRIC_KEY = AttributeKey.stringKey("pacer.metric.key");

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
  void incrementExportsCounterWithKeyAttribute() {
    adapter.increment("governor.frame.rejected.too_soon");
    adapter.increment("governor.frame.rejected.too_soon");
    adapter.forceFlush();

    MetricData counter = find(reader.collectAllMetrics(), "governor.frame.rejected.too_soon");
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("governor.frame.rejected.too_soon", point.getAttributes().get(METRIC_KEY));

    assertEquals("pacer", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("ca.gc.cra", counter.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
    String instance = counter.getResource().getAttribute(AttributeKey.stringKey("service.instance.id"));
    assertTrue(instance != null && !instance.isBlank(), "service instance id expected");
  }

  @Test
  void observeExportsHistogramWithUnit() {
    adapter.observe("governor.analysis.durationNanos", 12_000_000L);
    adapter.observe("governor.analysis.durationNanos", 18_000_000L);

    MetricData histogram = find(reader.collectAllMetrics(), "governor.analysis.durationnanos");
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    assertEquals("ns", histogram.getUnit());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(30_000_000d, point.getSum(), 1e-6);
    assertEquals("governor.analysis.durationNanos", point.getAttributes().get(METRIC_KEY));
  }

  @Test
  void unitsFollowKeySuffix() {
    assertEquals("ns", OpenTelemetryMetricsAdapter.unitFor("governor.analysis.durationNanos"));
    assertEquals("By", OpenTelemetryMetricsAdapter.unitFor("monitor.memory.bytes"));
    assertEquals("%", OpenTelemetryMetricsAdapter.unitFor("monitor.dropped.percent"));
    assertEquals("1", OpenTelemetryMetricsAdapter.unitFor("pipeline.analyzer.failed"));
  }

  @Test
  void sanitizeNameProducesValidInstrumentNames() {
    assertEquals("governor.frame.seen", OpenTelemetryMetricsAdapter.sanitizeName("governor.frame.seen"));
    assertEquals("m9lives", OpenTelemetryMetricsAdapter.sanitizeName("9lives"));
    assertEquals("a_b", OpenTelemetryMetricsAdapter.sanitizeName("A b"));
    assertEquals("pacer.metric", OpenTelemetryMetricsAdapter.sanitizeName(" "));
  }

  @Test
  void parsesResourceAttributesSkippingMalformedPairs() {
    Attributes attributes =
        OpenTelemetryBootstrap.parseResourceAttributes("deployment.environment=lab, broken, =x, team = vision");
    assertEquals(2, attributes.size());
    assertEquals("lab", attributes.get(AttributeKey.stringKey("deployment.environment")));
    assertEquals("vision", attributes.get(AttributeKey.stringKey("team")));
  }

  @Test
  void disabledSettingsRunInNoopMode() {
    try (OpenTelemetryMetricsAdapter noop = new OpenTelemetryMetricsAdapter(TelemetrySettings.disabled())) {
      noop.increment("governor.frame.seen");
      noop.observe("monitor.memory.bytes", 1L);
      noop.forceFlush();
    }
  }

  private static MetricData find(Collection<MetricData> metrics, String name) {
    return metrics.stream()
        .filter(metric -> metric.getName().equals(name))
        .findFirst()
        .orElseThrow(() -> new AssertionError("metric " + name + " not exported"));
  }
}

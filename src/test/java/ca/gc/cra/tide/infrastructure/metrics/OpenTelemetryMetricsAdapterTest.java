package ca.gc.cra.tide.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Collection;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private static final AttributeKey<String> KEY_ATTR = AttributeKey.stringKey("tide.metric.key");

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
  void incrementRecordsCounterWithAttributes() {
    adapter.increment("stream.append.success");
    adapter.increment("stream.append.success");
    adapter.flush();

    MetricData counter = find(reader.collectAllMetrics(), "stream.append.success");
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(2L, point.getValue());
    assertEquals("stream.append.success", point.getAttributes().get(KEY_ATTR));
    assertEquals("tide", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("ca.gc.cra", counter.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
  }

  @Test
  void observeRecordsHistogramWithUnit() {
    adapter.observe("stream.append.latencyMillis", 40L);
    adapter.observe("stream.append.latencyMillis", 60L);
    adapter.observe("stream.append.bytes", 4096L);
    adapter.flush();

    Collection<MetricData> metrics = reader.collectAllMetrics();
    MetricData latency = find(metrics, "stream.append.latencymillis");
    assertEquals(MetricDataType.HISTOGRAM, latency.getType());
    assertEquals("ms", latency.getUnit());
    HistogramPointData point = latency.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(100.0, point.getSum());
    assertEquals("stream.append.latencyMillis", point.getAttributes().get(KEY_ATTR));
    assertEquals("By", find(metrics, "stream.append.bytes").getUnit());
  }

  @Test
  void noopHandleDiscardsMeasurements() {
    OpenTelemetryMetricsAdapter noop = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.Handle.noop());

    noop.increment("stream.append.success");
    noop.observe("stream.append.rows", 10L);
    noop.flush();
    noop.close();

    assertTrue(reader.collectAllMetrics().isEmpty());
  }

  @Test
  void metricNamesAreSanitized() {
    assertEquals("stream.append.latencymillis", OpenTelemetryMetricsAdapter.metricName("stream.append.latencyMillis"));
    assertEquals("m9_lives", OpenTelemetryMetricsAdapter.metricName("9 lives"));
    assertEquals("tide.metric", OpenTelemetryMetricsAdapter.metricName("  "));
    assertEquals("1", OpenTelemetryMetricsAdapter.unitFor("stream.append.rows"));
  }

  private static MetricData find(Collection<MetricData> metrics, String name) {
    Optional<MetricData> match = metrics.stream().filter(metric -> metric.getName().equals(name)).findFirst();
    assertTrue(match.isPresent(), "Expected metric " + name + " to be exported");
    return match.orElseThrow();
  }
}

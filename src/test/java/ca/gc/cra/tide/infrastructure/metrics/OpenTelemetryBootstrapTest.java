package ca.gc.cra.tide.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.sdk.resources.Resource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryBootstrapTest {
  private String previousExporter;

  @AfterEach
  void resetProperties() {
    if (previousExporter == null) {
      System.clearProperty("otel.metrics.exporter");
    } else {
      System.setProperty("otel.metrics.exporter", previousExporter);
    }
  }

  @Test
  void exporterNoneFallsBackToNoop() {
    previousExporter = System.getProperty("otel.metrics.exporter");
    System.setProperty("otel.metrics.exporter", "none");

    OpenTelemetryBootstrap.Handle handle = OpenTelemetryBootstrap.initialize();

    assertTrue(handle.isNoop(), "Expected noop metrics bootstrap when exporter=none");
    handle.close();
  }

  @Test
  void exporterModeParsing() {
    assertEquals(OpenTelemetryBootstrap.ExporterMode.NONE, OpenTelemetryBootstrap.ExporterMode.parse(" NONE "));
    assertEquals(OpenTelemetryBootstrap.ExporterMode.OTLP, OpenTelemetryBootstrap.ExporterMode.parse(null));
    assertEquals(OpenTelemetryBootstrap.ExporterMode.OTLP, OpenTelemetryBootstrap.ExporterMode.parse("zipkin"));
  }

  @Test
  void parsesResourceAttributesSkippingMalformedEntries() {
    Attributes attributes = OpenTelemetryBootstrap.parseAttributes("site=ottawa, =bad,rack=,team = sensors");

    assertEquals("ottawa", attributes.get(AttributeKey.stringKey("site")));
    assertEquals("sensors", attributes.get(AttributeKey.stringKey("team")));
    assertNull(attributes.get(AttributeKey.stringKey("rack")));
    assertEquals(2, attributes.size());
  }

  @Test
  void resourceCarriesServiceIdentityAndExtras() {
    Resource resource = OpenTelemetryBootstrap.buildResource("1.2.3",
        Attributes.of(AttributeKey.stringKey("deployment.environment"), "lab"));

    assertEquals("tide", resource.getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("1.2.3", resource.getAttribute(AttributeKey.stringKey("service.version")));
    assertEquals("lab", resource.getAttribute(AttributeKey.stringKey("deployment.environment")));
  }
}

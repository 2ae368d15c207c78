package ca.gc.cra.tide.api;

import ca.gc.cra.tide.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves metrics exporter settings from the command line into the system properties read by the
 * OpenTelemetry bootstrap. Consumed keys are removed from the argument map.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {}

  static void configureMetrics(Map<String, String> args) {
    String exporter = args.remove("metricsExporter");
    if (exporter != null) {
      String mode = exporter.trim().toLowerCase(Locale.ROOT);
      if (!mode.equals("otlp") && !mode.equals("none")) {
        throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
      }
      System.setProperty("otel.metrics.exporter", mode);
      log.debug("Metrics exporter set to {}", mode);
    }

    String endpoint = args.remove("otelEndpoint");
    if (endpoint != null) {
      System.setProperty("otel.exporter.otlp.endpoint", validateEndpoint(endpoint.trim()));
      log.debug("OTLP endpoint set to {}", endpoint.trim());
    }

    String attributes = args.remove("otelResourceAttributes");
    if (attributes != null) {
      System.setProperty("otel.resource.attributes",
          Strings.requirePrintableAscii("otelResourceAttributes", attributes, MAX_ATTRIBUTES_LENGTH));
    }
  }

  private static String validateEndpoint(String raw) {
    URI uri;
    try {
      uri = new URI(raw);
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
    String scheme = uri.getScheme();
    if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
      throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
    }
    if (uri.getHost() == null || uri.getHost().isBlank()) {
      throw new IllegalArgumentException("otelEndpoint must include a host");
    }
    return raw;
  }
}

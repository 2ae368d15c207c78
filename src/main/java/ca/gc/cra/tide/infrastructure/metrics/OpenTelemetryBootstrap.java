package ca.gc.cra.tide.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.io.IOException;
import java.io.InputStream;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the OpenTelemetry meter provider for the streaming client.
 *
 * <p>Settings come from system properties first ({@code otel.metrics.exporter},
 * {@code otel.exporter.otlp.endpoint}, {@code otel.resource.attributes}) and then from the matching
 * {@code OTEL_*} environment variables. Any failure falls back to a noop meter so metrics never stop
 * ingestion.</p>
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);

  static final String INSTRUMENTATION_SCOPE = "ca.gc.cra.tide";
  private static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  private static final Duration EXPORT_INTERVAL = Duration.ofSeconds(30);
  private static final Duration SHUTDOWN_WAIT = Duration.ofSeconds(5);
  private static final String POM_PROPERTIES = "/META-INF/maven/ca.gc.cra/tide/pom.properties";

  private OpenTelemetryBootstrap() {}

  static Handle initialize() {
    try {
      ExporterSettings settings = ExporterSettings.resolve();
      if (settings.mode() == ExporterMode.NONE) {
        log.info("OpenTelemetry metrics exporter disabled (exporter=none)");
        return Handle.noop();
      }
      OtlpGrpcMetricExporter exporter = OtlpGrpcMetricExporter.builder()
          .setEndpoint(settings.endpoint())
          .build();
      MetricReader reader = PeriodicMetricReader.builder(exporter).setInterval(EXPORT_INTERVAL).build();
      Handle handle = Handle.active(reader, settings.resource(), settings.version());
      log.info("OpenTelemetry metrics exporting via OTLP to {}", settings.endpoint());
      return handle;
    } catch (RuntimeException ex) {
      log.error("OpenTelemetry metrics initialization failed; continuing without metrics", ex);
      return Handle.noop();
    }
  }

  static Handle forTesting(MetricReader reader) {
    String version = serviceVersion();
    return Handle.active(Objects.requireNonNull(reader, "reader"), buildResource(version, Attributes.empty()), version);
  }

  static Resource buildResource(String version, Attributes extra) {
    AttributesBuilder attributes = Attributes.builder()
        .put(AttributeKey.stringKey("service.name"), "tide")
        .put(AttributeKey.stringKey("service.namespace"), "ca.gc.cra")
        .put(AttributeKey.stringKey("service.version"), version);
    String instance = instanceId();
    if (!instance.isBlank()) {
      attributes.put(AttributeKey.stringKey("service.instance.id"), instance);
    }
    Resource resource = Resource.getDefault().merge(Resource.create(attributes.build()));
    return extra.isEmpty() ? resource : resource.merge(Resource.create(extra));
  }

  /**
   * Parses {@code key=value,key=value}; malformed entries are logged and skipped.
   */
  static Attributes parseAttributes(String raw) {
    AttributesBuilder builder = Attributes.builder();
    if (raw == null) {
      return builder.build();
    }
    for (String entry : raw.split(",")) {
      String trimmed = entry.trim();
      if (trimmed.isEmpty()) {
        continue;
      }
      int eq = trimmed.indexOf('=');
      String key = eq > 0 ? trimmed.substring(0, eq).trim() : "";
      String value = eq > 0 ? trimmed.substring(eq + 1).trim() : "";
      if (key.isEmpty() || value.isEmpty()) {
        log.warn("Ignoring malformed resource attribute '{}'", trimmed);
        continue;
      }
      builder.put(AttributeKey.stringKey(key), value);
    }
    return builder.build();
  }

  private static String instanceId() {
    String override = System.getenv("OTEL_RESOURCE_SERVICE_INSTANCE");
    if (override != null && !override.isBlank()) {
      return override.trim();
    }
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException ex) {
      log.debug("Local host name unavailable for service.instance.id", ex);
      return "";
    }
  }

  static String serviceVersion() {
    Package pkg = OpenTelemetryBootstrap.class.getPackage();
    if (pkg != null && pkg.getImplementationVersion() != null) {
      return pkg.getImplementationVersion();
    }
    try (InputStream in = OpenTelemetryBootstrap.class.getResourceAsStream(POM_PROPERTIES)) {
      if (in != null) {
        Properties props = new Properties();
        props.load(in);
        String version = props.getProperty("version");
        if (version != null && !version.isBlank()) {
          return version;
        }
      }
    } catch (IOException ex) {
      log.debug("Unable to read {}", POM_PROPERTIES, ex);
    }
    return "0.0.0-dev";
  }

  private static String setting(String property, String env, String fallback) {
    String value = System.getProperty(property);
    if (value == null || value.isBlank()) {
      value = System.getenv(env);
    }
    return value == null || value.isBlank() ? fallback : value.trim();
  }

  enum ExporterMode {
    OTLP,
    NONE;

    static ExporterMode parse(String raw) {
      String normalized = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
      return switch (normalized) {
        case "none" -> NONE;
        case "", "otlp" -> OTLP;
        default -> {
          log.warn("Unknown metrics exporter '{}'; using otlp", raw);
          yield OTLP;
        }
      };
    }
  }

  record ExporterSettings(ExporterMode mode, String endpoint, Resource resource, String version) {
    static ExporterSettings resolve() {
      ExporterMode mode = ExporterMode.parse(
          setting("otel.metrics.exporter", "OTEL_METRICS_EXPORTER", "otlp"));
      String endpoint = setting("otel.exporter.otlp.endpoint", "OTEL_EXPORTER_OTLP_ENDPOINT", DEFAULT_ENDPOINT);
      String version = serviceVersion();
      Attributes extra = parseAttributes(setting("otel.resource.attributes", "OTEL_RESOURCE_ATTRIBUTES", ""));
      return new ExporterSettings(mode, endpoint, buildResource(version, extra), version);
    }
  }

  /** Meter plus the provider that must be flushed and shut down on exit. */
  static final class Handle implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;

    private Handle(Meter meter, SdkMeterProvider provider) {
      this.meter = meter;
      this.provider = provider;
    }

    static Handle noop() {
      return new Handle(MeterProvider.noop().get(INSTRUMENTATION_SCOPE), null);
    }

    static Handle active(MetricReader reader, Resource resource, String version) {
      SdkMeterProvider provider = SdkMeterProvider.builder()
          .setResource(resource)
          .registerMetricReader(reader)
          .build();
      Meter meter = provider.meterBuilder(INSTRUMENTATION_SCOPE)
          .setInstrumentationVersion(version)
          .build();
      return new Handle(meter, provider);
    }

    Meter meter() {
      return meter;
    }

    boolean isNoop() {
      return provider == null;
    }

    void forceFlush() {
      if (provider != null) {
        await(provider.forceFlush(), "flush");
      }
    }

    @Override
    public void close() {
      if (provider != null) {
        await(provider.shutdown(), "shutdown");
      }
    }

    private static void await(CompletableResultCode result, String action) {
      result.join(SHUTDOWN_WAIT.toMillis(), TimeUnit.MILLISECONDS);
      if (!result.isSuccess()) {
        log.warn("OpenTelemetry meter provider {} did not complete within {}", action, SHUTDOWN_WAIT);
      }
    }
  }
}

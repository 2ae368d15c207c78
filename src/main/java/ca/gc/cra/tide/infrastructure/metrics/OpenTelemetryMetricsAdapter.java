package ca.gc.cra.tide.infrastructure.metrics;

import ca.gc.cra.tide.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards streaming counters and latency observations to OpenTelemetry instruments.
 *
 * <p>Instruments are created lazily per metric key. Keys ending in {@code Millis} are recorded in
 * milliseconds and keys ending in {@code bytes} in bytes.</p>
 *
 * @since 0.1.0
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY = AttributeKey.stringKey("tide.metric.key");
  private static final String FALLBACK_NAME = "tide.metric";

  private final OpenTelemetryBootstrap.Handle handle;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Histogram> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter using exporter settings from system properties and {@code OTEL_*} variables.
   */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.Handle handle) {
    this.handle = Objects.requireNonNull(handle, "handle");
    if (handle.isNoop()) {
      log.info("OpenTelemetry metrics disabled; counters are discarded");
    }
  }

  @Override
  public void increment(String key) {
    if (handle.isNoop()) {
      return;
    }
    Counter counter = counters.computeIfAbsent(Objects.requireNonNull(key, "key"), this::newCounter);
    counter.instrument().add(1, counter.attributes());
  }

  @Override
  public void observe(String key, long value) {
    if (handle.isNoop()) {
      return;
    }
    Histogram histogram = histograms.computeIfAbsent(Objects.requireNonNull(key, "key"), this::newHistogram);
    histogram.instrument().record(value, histogram.attributes());
  }

  /** Pushes pending data points to the exporter. */
  public void flush() {
    handle.forceFlush();
  }

  /** Flushes and shuts the meter provider down. */
  @Override
  public void close() {
    handle.close();
  }

  private Counter newCounter(String key) {
    Meter meter = handle.meter();
    LongCounter counter = meter.counterBuilder(metricName(key))
        .setUnit("1")
        .setDescription("Streaming counter " + key)
        .build();
    return new Counter(counter, Attributes.of(METRIC_KEY, key));
  }

  private Histogram newHistogram(String key) {
    Meter meter = handle.meter();
    LongHistogram histogram = meter.histogramBuilder(metricName(key))
        .ofLongs()
        .setUnit(unitFor(key))
        .setDescription("Streaming observation " + key)
        .build();
    return new Histogram(histogram, Attributes.of(METRIC_KEY, key));
  }

  static String unitFor(String key) {
    String lower = key.toLowerCase(Locale.ROOT);
    if (lower.endsWith("millis")) {
      return "ms";
    }
    if (lower.endsWith("bytes")) {
      return "By";
    }
    return "1";
  }

  /**
   * Converts a metric key into a valid instrument name: lower case, starting with a letter, limited to
   * letters, digits, {@code _}, {@code -} and {@code .}.
   */
  static String metricName(String key) {
    String trimmed = key == null ? "" : key.trim().toLowerCase(Locale.ROOT);
    if (trimmed.isEmpty()) {
      return FALLBACK_NAME;
    }
    StringBuilder name = new StringBuilder(trimmed.length() + 1);
    if (!Character.isLetter(trimmed.charAt(0))) {
      name.append('m');
    }
    for (int i = 0; i < trimmed.length(); i++) {
      char c = trimmed.charAt(i);
      boolean allowed = Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.';
      name.append(allowed ? c : '_');
    }
    String result = name.toString();
    if (!result.equals(key)) {
      log.debug("Metric key '{}' exported as '{}'", key, result);
    }
    return result;
  }

  private record Counter(LongCounter instrument, Attributes attributes) {}

  private record Histogram(LongHistogram instrument, Attributes attributes) {}
}

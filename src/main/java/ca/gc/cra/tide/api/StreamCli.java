package ca.gc.cra.tide.api;

import ca.gc.cra.tide.application.ingest.CancellationToken;
import ca.gc.cra.tide.application.ingest.IngestionLoop;
import ca.gc.cra.tide.application.ingest.IngestionStatistics;
import ca.gc.cra.tide.application.ingest.StatisticsSnapshot;
import ca.gc.cra.tide.application.port.ClockPort;
import ca.gc.cra.tide.application.port.HttpTransport;
import ca.gc.cra.tide.application.port.SensorSource;
import ca.gc.cra.tide.application.stream.ChannelSession;
import ca.gc.cra.tide.config.ConfigurationException;
import ca.gc.cra.tide.config.LoopConfig;
import ca.gc.cra.tide.config.StreamingConfig;
import ca.gc.cra.tide.config.StreamingConfigLoader;
import ca.gc.cra.tide.domain.error.IngestException;
import ca.gc.cra.tide.infrastructure.http.JdkHttpTransport;
import ca.gc.cra.tide.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.tide.infrastructure.sensor.DeviceIdentities;
import ca.gc.cra.tide.infrastructure.sensor.HostSystemMetricsSampler;
import ca.gc.cra.tide.infrastructure.sensor.SimulatedSensorSource;
import ca.gc.cra.tide.logging.LoggingConfigurator;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Streams sensor readings into the configured pipe until stopped.
 *
 * @since 0.1.0
 */
public final class StreamCli {
  private static final Logger log = LoggerFactory.getLogger(StreamCli.class);
  private static final Set<String> KNOWN_KEYS = Set.of(
      "config", "batchSize", "batchInterval", "readingInterval", "maxBatches", "statsEvery",
      "waitForCommit", "commitTimeout");
  private static final long SHUTDOWN_GRACE_SECONDS = 35;
  private static final Duration COMMIT_POLL_INTERVAL = Duration.ofSeconds(1);
  private static final String SUMMARY_USAGE =
      "usage: stream [config=PATH] [batchSize=N] [batchInterval=SECONDS] [readingInterval=SECONDS] "
          + "[maxBatches=N] [--simulate] [--dry-run]";
  private static final String HELP_TEXT = """
      TIDE streaming ingestion

      Usage:
        stream [options]

      Options:
        config=PATH                JSON connection file (default snowflake_config.json)
        batchSize=N                Readings per batch, 1..10000 (default 10)
        batchInterval=SECONDS      Pause between batches (default 5.0)
        readingInterval=SECONDS    Pause between readings within a batch (default 0.5)
        maxBatches=N               Stop after N acknowledged batches; 0 runs until stopped (default 0)
        statsEvery=N               Log statistics every N batches; 0 disables (default 10)
        waitForCommit=true|false   Wait for the last offset to be committed before exiting (default false)
        commitTimeout=SECONDS      Bound on the commit wait (default 60)
        metricsExporter=otlp|none  OpenTelemetry metrics exporter (default otlp)
        otelEndpoint=URL           OTLP endpoint (default http://localhost:4317)
        otelResourceAttributes=K=V,...  Extra resource attributes
        --simulate                 Use simulated Sense HAT readings
        --dry-run                  Validate configuration and print the plan without connecting
        --verbose                  Enable DEBUG logging
        --help                     Show this message
      """;

  private StreamCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    CancellationToken cancellation = new CancellationToken();
    CountDownLatch finished = new CountDownLatch(1);
    Thread hook = new Thread(() -> {
      cancellation.cancel();
      try {
        finished.await(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
    }, "tide-shutdown");
    Runtime.getRuntime().addShutdownHook(hook);
    try {
      return run(args, new JdkHttpTransport(), ClockPort.SYSTEM, cancellation);
    } finally {
      finished.countDown();
    }
  }

  static ExitCode run(String[] args, HttpTransport transport, ClockPort clock, CancellationToken cancellation) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for stream command");
    }
    Set<String> unknownFlags = input.unknownFlags("--simulate", "--dry-run");
    if (!unknownFlags.isEmpty()) {
      log.error("Unknown option(s): {}", unknownFlags);
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    LoopConfig loopConfig;
    try {
      Map<String, String> kv = CliArgsParser.toMap(input.keyValueArgs());
      TelemetryConfigurator.configureMetrics(kv);
      for (String key : kv.keySet()) {
        if (!KNOWN_KEYS.contains(key)) {
          throw new IllegalArgumentException("unknown argument: " + key);
        }
      }
      loopConfig = LoopConfig.fromMap(kv, input.hasFlag("--simulate"));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    StreamingConfig config;
    try {
      config = StreamingConfigLoader.load(loopConfig.configPath());
    } catch (ConfigurationException ex) {
      log.error("Configuration error: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Unable to read configuration {}", loopConfig.configPath(), ex);
      return ExitCode.IO_ERROR;
    }

    if (input.hasFlag("--dry-run")) {
      printPlan(config, loopConfig);
      return ExitCode.SUCCESS;
    }
    if (!loopConfig.simulate()) {
      log.info("No Sense HAT driver is available to the JVM; streaming simulated readings");
    }

    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter()) {
      return stream(config, loopConfig, transport, clock, metrics, cancellation);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Streaming interrupted; shutting down");
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected failure while streaming", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static ExitCode stream(
      StreamingConfig config,
      LoopConfig loopConfig,
      HttpTransport transport,
      ClockPort clock,
      OpenTelemetryMetricsAdapter metrics,
      CancellationToken cancellation) throws InterruptedException {
    log.info("Starting TIDE stream: {}", config);
    ChannelSession session;
    try {
      StreamingComponents components = StreamingComponents.wire(config, transport, clock, metrics);
      session = components.newSession();
      session.open();
    } catch (IngestException ex) {
      log.error("Failed to initialize streaming client: {}", ex.getMessage(), ex);
      return ExitCode.STARTUP_FAILURE;
    }

    SensorSource sensor = new SimulatedSensorSource(
        DeviceIdentities.detect(), new HostSystemMetricsSampler(), clock);
    IngestionStatistics statistics = new IngestionStatistics(clock);
    try (sensor; session) {
      log.info("Sensor: {}", sensor.describe());
      StatisticsSnapshot snapshot =
          new IngestionLoop(session, sensor, loopConfig, statistics, metrics).run(cancellation);
      if (loopConfig.waitForCommit() && snapshot.batches() > 0) {
        boolean committed = session.waitForCommit(
            session.offset(), loopConfig.commitTimeout(), COMMIT_POLL_INTERVAL);
        if (!committed) {
          log.warn("Offset {} not confirmed committed within {}", session.offset(), loopConfig.commitTimeout());
        }
      }
      log.info("Final statistics: {}", snapshot.summary());
    }
    metrics.flush();
    return ExitCode.SUCCESS;
  }

  private static void printPlan(StreamingConfig config, LoopConfig loop) {
    CliPrinter.printLines(
        "Stream dry-run: no connection will be made.",
        " Account          : " + config.account(),
        " User             : " + config.user(),
        " Authentication   : " + config.authMode(),
        " Control plane    : " + config.controlPlaneUri(),
        " Target pipe      : " + config.target().qualifiedName(),
        " Channel base     : " + config.channelBaseName(),
        " Batch size       : " + loop.batchSize(),
        " Reading interval : " + loop.readingInterval(),
        " Batch interval   : " + loop.batchInterval(),
        " Max batches      : " + (loop.maxBatches() == 0 ? "unlimited" : loop.maxBatches()),
        " Wait for commit  : " + loop.waitForCommit());
  }
}

package ca.gc.cra.tide.application.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.tide.application.port.SensorSource;
import ca.gc.cra.tide.application.stream.ChannelSession;
import ca.gc.cra.tide.config.LoopConfig;
import ca.gc.cra.tide.domain.stream.PipeTarget;
import ca.gc.cra.tide.domain.telemetry.SensorRecord;
import ca.gc.cra.tide.infrastructure.auth.CredentialProvider;
import ca.gc.cra.tide.infrastructure.auth.StaticTokenSource;
import ca.gc.cra.tide.infrastructure.discovery.EndpointResolver;
import ca.gc.cra.tide.testing.MutableClock;
import ca.gc.cra.tide.testing.RecordingMetricsPort;
import ca.gc.cra.tide.testing.ScriptedHttpTransport;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class IngestionLoopTest {
  private static final URI CONTROL = URI.create("https://xy12345.snowflakecomputing.com");

  private final ScriptedHttpTransport transport = ScriptedHttpTransport.acceptingService();
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final MutableClock clock = MutableClock.atEpoch();
  private final CancellationToken cancellation = new CancellationToken();

  @Test
  void stopsAfterMaxBatches() throws Exception {
    StatisticsSnapshot snapshot = loop(new CountingSensor(), config(2, 3, Duration.ZERO)).run(cancellation);

    assertEquals(3L, snapshot.batches());
    assertEquals(6L, snapshot.rows());
    assertEquals(0L, snapshot.errors());
    assertTrue(snapshot.bytes() > 0L);
    assertEquals(3, transport.requests("POST", ScriptedHttpTransport.ROWS_PATH).size());
  }

  @Test
  void rejectedBatchIsCountedAndLoopContinues() throws Exception {
    transport.reset("POST", ScriptedHttpTransport.ROWS_PATH)
        .respond("POST", ScriptedHttpTransport.ROWS_PATH, 400, "{\"code\":\"ERR_INVALID_ROWS\"}")
        .respond("POST", ScriptedHttpTransport.ROWS_PATH, 200, "{\"next_continuation_token\":\"ct-next\"}");
    ChannelSession session = openSession();

    StatisticsSnapshot snapshot = new IngestionLoop(session, new CountingSensor(), config(1, 2, Duration.ZERO),
        new IngestionStatistics(clock), metrics).run(cancellation);

    assertEquals(1L, snapshot.errors());
    assertEquals(2L, snapshot.batches());
    assertEquals(3, transport.requests("POST", ScriptedHttpTransport.ROWS_PATH).size());
    assertEquals(2L, session.offset());
  }

  @Test
  void cancellationDiscardsPartialBatch() throws Exception {
    CountingSensor sensor = new CountingSensor();
    sensor.cancelAfter = 3;

    StatisticsSnapshot snapshot = loop(sensor, config(5, 0, Duration.ZERO)).run(cancellation);

    assertEquals(3, sensor.reads.get());
    assertEquals(0L, snapshot.batches());
    assertTrue(transport.requests("POST", ScriptedHttpTransport.ROWS_PATH).isEmpty());
  }

  @Test
  void cancellationInterruptsBatchInterval() throws Exception {
    transport.reset("POST", ScriptedHttpTransport.ROWS_PATH).respondWith("POST", ScriptedHttpTransport.ROWS_PATH,
        request -> {
          cancellation.cancel();
          return ScriptedHttpTransport.response(200, "{\"next_continuation_token\":\"ct-1\"}");
        });
    long started = System.nanoTime();

    StatisticsSnapshot snapshot = loop(new CountingSensor(), config(1, 0, Duration.ofMinutes(10))).run(cancellation);

    assertEquals(1L, snapshot.batches());
    assertTrue(Duration.ofNanos(System.nanoTime() - started).compareTo(Duration.ofSeconds(30)) < 0);
  }

  @Test
  void alreadyCancelledLoopSendsNothing() throws Exception {
    cancellation.cancel();
    CountingSensor sensor = new CountingSensor();

    StatisticsSnapshot snapshot = loop(sensor, config(5, 0, Duration.ZERO)).run(cancellation);

    assertEquals(0, sensor.reads.get());
    assertEquals(0L, snapshot.batches());
  }

  @Test
  void sensorFailuresAreSkipped() throws Exception {
    CountingSensor sensor = new CountingSensor();
    sensor.failEvery = 2;

    StatisticsSnapshot snapshot = loop(sensor, config(4, 1, Duration.ZERO)).run(cancellation);

    assertEquals(1L, snapshot.batches());
    assertEquals(2L, snapshot.rows());
    assertEquals(2, metrics.count("ingest.sensor.failure"));
  }

  @Test
  void logsSampleOncePerBatch() throws Exception {
    Logger logger = (Logger) LoggerFactory.getLogger(IngestionLoop.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    try {
      loop(new CountingSensor(), config(3, 2, Duration.ZERO)).run(cancellation);
    } finally {
      logger.detachAppender(appender);
      appender.stop();
    }

    List<String> samples = appender.list.stream()
        .map(ILoggingEvent::getFormattedMessage)
        .filter(message -> message.startsWith("Sample: "))
        .toList();
    assertEquals(2, samples.size());
    assertEquals("Sample: Temp=21.0C, Humidity=40.0%, Pressure=1013.3mb, CPU=5.0%", samples.get(0));
    assertEquals("Sample: Temp=24.0C, Humidity=40.0%, Pressure=1013.3mb, CPU=5.0%", samples.get(1));
  }

  private IngestionLoop loop(SensorSource sensor, LoopConfig config) throws Exception {
    return new IngestionLoop(openSession(), sensor, config, new IngestionStatistics(clock), metrics);
  }

  private ChannelSession openSession() throws Exception {
    StaticTokenSource identity = new StaticTokenSource("tok");
    EndpointResolver resolver = new EndpointResolver(CONTROL, identity, transport, metrics);
    CredentialProvider credentials = new CredentialProvider(CONTROL, identity, resolver, transport, clock, metrics);
    ChannelSession session = new ChannelSession(
        new PipeTarget("D", "S", "P"), "SENSEHAT_CHNL_TEST", credentials, transport, clock, metrics);
    session.open();
    return session;
  }

  private static LoopConfig config(int batchSize, long maxBatches, Duration batchInterval) {
    return new LoopConfig(Path.of("unused.json"), batchSize, Duration.ZERO, batchInterval, maxBatches,
        0, false, Duration.ofSeconds(1), true);
  }

  private final class CountingSensor implements SensorSource {
    private final AtomicInteger reads = new AtomicInteger();
    private int cancelAfter;
    private int failEvery;

    @Override
    public SensorRecord read() throws IOException {
      int n = reads.incrementAndGet();
      if (cancelAfter > 0 && n >= cancelAfter) {
        cancellation.cancel();
      }
      if (failEvery > 0 && n % failEvery == 0) {
        throw new IOException("I2C read failed");
      }
      return SensorRecord.builder()
          .put("uuid", "reading-" + n)
          .put("temperature", 20d + n)
          .put("humidity", 40d)
          .put("pressure", 1013.25d)
          .put("cpu_percent", 5d)
          .build();
    }

    @Override
    public String describe() {
      return "counting sensor";
    }
  }
}

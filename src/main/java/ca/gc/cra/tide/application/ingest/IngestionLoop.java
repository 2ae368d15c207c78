package ca.gc.cra.tide.application.ingest;

import ca.gc.cra.tide.application.port.MetricsPort;
import ca.gc.cra.tide.application.port.SensorSource;
import ca.gc.cra.tide.application.stream.ChannelSession;
import ca.gc.cra.tide.config.LoopConfig;
import ca.gc.cra.tide.domain.error.ChannelException;
import ca.gc.cra.tide.domain.error.IngestException;
import ca.gc.cra.tide.domain.stream.AppendResult;
import ca.gc.cra.tide.domain.telemetry.SensorRecord;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Collects sensor readings into batches and appends them to a channel on a fixed
 * cadence.
 * <p><strong>Why:</strong> Keeps one failed batch from stopping the stream; the session keeps its last
 * acknowledged offset and token so the next batch proceeds normally.</p>
 * <p><strong>Role:</strong> Sole writer of its {@link ChannelSession}. Cancellation is observed between
 * readings, between batches and during the inter-batch sleep.</p>
 * <p><strong>Thread-safety:</strong> Run from a single thread; {@link CancellationToken} may be triggered
 * from any thread.</p>
 *
 * @since 0.1.0
 */
public final class IngestionLoop {
  private static final Logger log = LoggerFactory.getLogger(IngestionLoop.class);

  private final ChannelSession session;
  private final SensorSource sensor;
  private final LoopConfig config;
  private final IngestionStatistics statistics;
  private final MetricsPort metrics;

  /**
   * Creates a loop.
   *
   * @param session open channel session
   * @param sensor reading source
   * @param config batching cadence
   * @param statistics counters updated after every batch
   * @param metrics metrics sink; records {@code ingest.sensor.failure}
   */
  public IngestionLoop(
      ChannelSession session,
      SensorSource sensor,
      LoopConfig config,
      IngestionStatistics statistics,
      MetricsPort metrics) {
    this.session = Objects.requireNonNull(session, "session");
    this.sensor = Objects.requireNonNull(sensor, "sensor");
    this.config = Objects.requireNonNull(config, "config");
    this.statistics = Objects.requireNonNull(statistics, "statistics");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Runs until cancelled or until {@link LoopConfig#maxBatches()} batches have been acknowledged.
   *
   * @param cancellation shutdown signal
   * @return final statistics
   * @throws InterruptedException when the running thread is interrupted
   */
  public StatisticsSnapshot run(CancellationToken cancellation) throws InterruptedException {
    Objects.requireNonNull(cancellation, "cancellation");
    log.info("Streaming {} readings per batch to {} (channel {})",
        config.batchSize(), session.target().qualifiedName(), session.channelName());

    while (!cancellation.isCancelled()) {
      if (limitReached()) {
        log.info("Reached max batches ({})", config.maxBatches());
        break;
      }
      List<SensorRecord> batch = collect(cancellation);
      if (cancellation.isCancelled()) {
        if (!batch.isEmpty()) {
          log.info("Shutdown requested; discarding {} unsent readings", batch.size());
        }
        break;
      }
      if (!batch.isEmpty()) {
        send(batch);
      }
      if (limitReached()) {
        continue;
      }
      if (cancellation.sleep(config.batchInterval())) {
        break;
      }
    }

    StatisticsSnapshot snapshot = statistics.snapshot();
    log.info("Ingestion stopped: {}", snapshot.summary());
    return snapshot;
  }

  private boolean limitReached() {
    return config.maxBatches() > 0 && statistics.batches() >= config.maxBatches();
  }

  private List<SensorRecord> collect(CancellationToken cancellation) throws InterruptedException {
    List<SensorRecord> batch = new ArrayList<>(config.batchSize());
    for (int i = 0; i < config.batchSize(); i++) {
      if (cancellation.isCancelled()) {
        break;
      }
      try {
        SensorRecord record = sensor.read();
        if (batch.isEmpty()) {
          logSample(record);
        }
        batch.add(record);
      } catch (IOException | IllegalArgumentException ex) {
        metrics.increment("ingest.sensor.failure");
        log.error("Error reading sensor {}: {}", sensor.describe(), ex.getMessage());
      }
      if (i < config.batchSize() - 1 && cancellation.sleep(config.readingInterval())) {
        break;
      }
    }
    return batch;
  }

  private void send(List<SensorRecord> batch) throws InterruptedException {
    try {
      AppendResult result = session.append(batch);
      statistics.recordBatch(result.rows(), result.bytes());
      long sent = statistics.batches();
      log.info("Sent batch {}: {} readings (offset {})", sent, result.rows(), result.offset());
      if (config.statsEvery() > 0 && sent % config.statsEvery() == 0) {
        log.info("Statistics: {}", statistics.snapshot().summary());
      }
    } catch (ChannelException ex) {
      statistics.recordError();
      log.error("Batch of {} rows rejected by channel {}; rows dropped: {}",
          batch.size(), session.channelName(), ex.getMessage());
    } catch (IngestException ex) {
      statistics.recordError();
      log.error("Batch of {} rows not sent to channel {}; rows dropped: {}",
          batch.size(), session.channelName(), ex.getMessage(), ex);
    }
  }

  private static void logSample(SensorRecord record) {
    if (!log.isInfoEnabled()) {
      return;
    }
    log.info("Sample: Temp={}C, Humidity={}%, Pressure={}mb, CPU={}%",
        oneDecimal(record.get("temperature")),
        oneDecimal(record.get("humidity")),
        oneDecimal(record.get("pressure")),
        oneDecimal(record.get("cpu_percent")));
  }

  private static String oneDecimal(Object value) {
    if (value instanceof Number number) {
      return String.format(Locale.ROOT, "%.1f", number.doubleValue());
    }
    return "n/a";
  }
}

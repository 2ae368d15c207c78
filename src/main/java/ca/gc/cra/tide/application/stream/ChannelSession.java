package ca.gc.cra.tide.application.stream;

import ca.gc.cra.tide.application.port.ClockPort;
import ca.gc.cra.tide.application.port.HttpTransport;
import ca.gc.cra.tide.application.port.IngestCredentials;
import ca.gc.cra.tide.application.port.MetricsPort;
import ca.gc.cra.tide.domain.error.ChannelException;
import ca.gc.cra.tide.domain.error.IngestException;
import ca.gc.cra.tide.domain.stream.AppendResult;
import ca.gc.cra.tide.domain.stream.ChannelPhase;
import ca.gc.cra.tide.domain.stream.ChannelStatus;
import ca.gc.cra.tide.domain.stream.PipeTarget;
import ca.gc.cra.tide.domain.telemetry.SensorRecord;
import ca.gc.cra.tide.infrastructure.json.JsonSupport;
import ca.gc.cra.tide.infrastructure.json.NdjsonEncoder;
import ca.gc.cra.tide.logging.Logs;
import ca.gc.cra.tide.validation.Strings;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Owns one streaming channel and its ordering state (continuation token and offset).
 * <p><strong>Why:</strong> The service accepts an append only when it carries the continuation token returned
 * by the previous append, so the token and offset must advance together and only on acknowledged calls.</p>
 * <p><strong>Role:</strong> Driven by the ingestion loop; pulls scoped tokens and the ingest host from
 * {@link IngestCredentials} before every data-plane call.</p>
 * <p><strong>Thread-safety:</strong> Single writer. State changes happen under an internal lock and a second
 * caller arriving while an append is in flight fails fast with {@link IllegalStateException}.</p>
 *
 * @since 0.1.0
 */
public final class ChannelSession implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ChannelSession.class);

  private static final DateTimeFormatter CHANNEL_SUFFIX = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
  private static final String STREAMING_PREFIX = "/v2/streaming";
  private static final String NDJSON = "application/x-ndjson";

  private final PipeTarget target;
  private final String channelName;
  private final IngestCredentials credentials;
  private final HttpTransport transport;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final JsonSupport json = new JsonSupport();
  private final NdjsonEncoder encoder = new NdjsonEncoder();
  private final ReentrantLock writeLock = new ReentrantLock();

  private volatile ChannelPhase phase = ChannelPhase.UNOPENED;
  private volatile String continuationToken;
  private volatile long offset;

  /**
   * Creates an unopened session.
   *
   * @param target database, schema and pipe receiving rows
   * @param channelName unique channel name, see {@link #channelName(String, LocalDateTime)}
   * @param credentials ingest host and scoped-token supplier
   * @param transport HTTP transport
   * @param clock time source for latency measurements
   * @param metrics metrics sink
   */
  public ChannelSession(
      PipeTarget target,
      String channelName,
      IngestCredentials credentials,
      HttpTransport transport,
      ClockPort clock,
      MetricsPort metrics) {
    this.target = Objects.requireNonNull(target, "target");
    this.channelName = Strings.requireIdentifier("channelName", channelName);
    this.credentials = Objects.requireNonNull(credentials, "credentials");
    this.transport = Objects.requireNonNull(transport, "transport");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Derives a per-run channel name so concurrent or restarted processes never share a channel.
   *
   * @param baseName configured base name
   * @param createdAt local creation time
   * @return {@code {base}_{yyyyMMdd_HHmmss}}
   */
  public static String channelName(String baseName, LocalDateTime createdAt) {
    return Strings.requireNonBlank("channel_name", baseName) + "_" + CHANNEL_SUFFIX.format(createdAt);
  }

  /**
   * Opens or attaches to the channel and adopts the server's continuation token and committed offset.
   *
   * @throws IllegalStateException when the session is not {@link ChannelPhase#UNOPENED}
   * @throws ChannelException when the service rejects the request or the response lacks a continuation token;
   *     the session stays unopened
   * @throws IngestException when the ingest host or scoped token cannot be obtained
   * @throws InterruptedException when interrupted while waiting on the network
   */
  public void open() throws IngestException, InterruptedException {
    acquire("open");
    try {
      if (phase != ChannelPhase.UNOPENED) {
        throw new IllegalStateException("Channel " + channelName + " cannot be opened from " + phase);
      }
      URI uri = dataPlaneUri(STREAMING_PREFIX + target.channelPath(channelName), null);
      HttpTransport.Response response = exchange("Open channel " + channelName,
          HttpTransport.Request.builder("PUT", uri)
              .header("Content-Type", "application/json")
              .body("{}"));

      Map<String, Object> body = parseBody("Open channel " + channelName, response);
      String token = requireContinuationToken("Open channel " + channelName, body, response);
      long committed;
      try {
        committed = JsonSupport.longValue(JsonSupport.asObject(body.get("channel_status")),
            "last_committed_offset_token").orElse(0L);
      } catch (IllegalArgumentException ex) {
        throw new ChannelException("Open channel " + channelName + " returned an invalid offset", ex);
      }

      continuationToken = token;
      offset = committed;
      phase = ChannelPhase.OPEN;
      metrics.increment("stream.channel.opened");
      log.info("Channel {} opened on {} (last committed offset {})",
          channelName, target.qualifiedName(), committed);
    } finally {
      writeLock.unlock();
    }
  }

  /**
   * Appends one batch as NDJSON using the next offset.
   *
   * <p>The offset and continuation token change only when the service acknowledges the batch; a failed call
   * leaves both untouched and the session open.</p>
   *
   * @param records batch to send; an empty batch is a no-op
   * @return offset, row count and payload size of the acknowledged batch
   * @throws IllegalStateException when the session is not open or another append is in flight
   * @throws ChannelException when the service rejects the batch or the call fails
   * @throws IngestException when the scoped token cannot be refreshed
   * @throws InterruptedException when interrupted while waiting on the network
   */
  public AppendResult append(List<SensorRecord> records) throws IngestException, InterruptedException {
    Objects.requireNonNull(records, "records");
    acquire("append");
    try {
      requireOpen("append");
      if (records.isEmpty()) {
        return AppendResult.empty();
      }
      long candidate = offset + 1;
      byte[] payload = encoder.encode(records);
      String query = "continuationToken=" + URLEncoder.encode(continuationToken, StandardCharsets.UTF_8)
          + "&offsetToken=" + candidate;
      URI uri = dataPlaneUri(
          STREAMING_PREFIX + "/data" + target.channelPath(channelName) + "/rows", query);

      String operation = "Append offset " + candidate + " to " + channelName;
      long started = clock.nowMillis();
      HttpTransport.Response response;
      try {
        response = exchange(operation,
            HttpTransport.Request.builder("POST", uri)
                .header("Content-Type", NDJSON)
                .body(payload));
      } catch (ChannelException ex) {
        metrics.increment("stream.append.failure");
        throw ex;
      }
      metrics.observe("stream.append.latencyMillis", Math.max(0L, clock.nowMillis() - started));

      String next;
      try {
        next = requireContinuationToken(operation, parseBody(operation, response), response);
      } catch (ChannelException ex) {
        metrics.increment("stream.append.failure");
        throw ex;
      }

      continuationToken = next;
      offset = candidate;
      metrics.increment("stream.append.success");
      metrics.observe("stream.append.rows", records.size());
      metrics.observe("stream.append.bytes", payload.length);
      log.debug("Appended {} rows ({} bytes) to {} at offset {}",
          records.size(), payload.length, channelName, candidate);
      return new AppendResult(candidate, records.size(), payload.length);
    } finally {
      writeLock.unlock();
    }
  }

  /**
   * Queries the service for this channel's committed offset.
   *
   * @return channel status; committed offset {@code 0} when the service reports none
   * @throws IllegalStateException when the session is not open
   * @throws ChannelException when the status call fails
   * @throws IngestException when the scoped token cannot be refreshed
   * @throws InterruptedException when interrupted while waiting on the network
   */
  public ChannelStatus status() throws IngestException, InterruptedException {
    requireOpen("query status of");
    URI uri = dataPlaneUri(STREAMING_PREFIX + target.pipePath() + ":bulk-channel-status", null);
    String operation = "Status of " + channelName;
    HttpTransport.Response response = exchange(operation,
        HttpTransport.Request.builder("POST", uri)
            .header("Content-Type", "application/json")
            .body(json.write(Map.of("channel_names", List.of(channelName)))));

    Map<String, Object> body = parseBody(operation, response);
    Map<String, Object> statuses = JsonSupport.asObject(body.get("channel_statuses"));
    Map<String, Object> entry = statuses == null ? null : JsonSupport.asObject(statuses.get(channelName));
    try {
      long committed = JsonSupport.longValue(entry, "committed_offset_token").orElse(0L);
      return new ChannelStatus(channelName, committed, entry);
    } catch (IllegalArgumentException ex) {
      throw new ChannelException(operation + " returned an invalid offset", ex);
    }
  }

  /**
   * Polls {@link #status()} until the service has committed {@code expectedOffset}.
   *
   * <p>Poll failures are logged and retried until the timeout elapses.</p>
   *
   * @param expectedOffset offset that must be committed
   * @param timeout overall bound on the wait
   * @param pollInterval delay between polls
   * @return {@code true} once the committed offset reaches {@code expectedOffset}; {@code false} on timeout
   * @throws InterruptedException when interrupted while sleeping or polling
   */
  public boolean waitForCommit(long expectedOffset, Duration timeout, Duration pollInterval)
      throws InterruptedException {
    long deadline = System.nanoTime() + timeout.toNanos();
    long pollNanos = Math.max(1L, pollInterval.toNanos());
    while (true) {
      try {
        long committed = status().committedOffset();
        if (committed >= expectedOffset) {
          log.info("Offset {} committed on {}", expectedOffset, channelName);
          return true;
        }
        log.debug("Waiting for offset {} on {} (committed {})", expectedOffset, channelName, committed);
      } catch (IngestException | IllegalStateException ex) {
        log.warn("Status poll for {} failed: {}", channelName, ex.getMessage());
      }
      long remaining = deadline - System.nanoTime();
      if (remaining <= 0) {
        log.warn("Timed out waiting for offset {} on {}", expectedOffset, channelName);
        return false;
      }
      TimeUnit.NANOSECONDS.sleep(Math.min(pollNanos, remaining));
    }
  }

  /** Marks the session closed. The service expires idle channels on its own, so no request is made. */
  @Override
  public void close() {
    if (phase != ChannelPhase.CLOSED) {
      phase = ChannelPhase.CLOSED;
      log.info("Channel {} closed at offset {}", channelName, offset);
    }
  }

  public String channelName() {
    return channelName;
  }

  public PipeTarget target() {
    return target;
  }

  public ChannelPhase phase() {
    return phase;
  }

  /**
   * Offset of the last acknowledged batch.
   *
   * @return committed local offset; the server-reported value right after open
   */
  public long offset() {
    return offset;
  }

  public Optional<String> continuationToken() {
    return Optional.ofNullable(continuationToken);
  }

  private void acquire(String operation) {
    if (!writeLock.tryLock()) {
      throw new IllegalStateException("Cannot " + operation + " channel " + channelName
          + " while another request is in flight");
    }
  }

  private void requireOpen(String operation) {
    if (phase != ChannelPhase.OPEN) {
      throw new IllegalStateException("Cannot " + operation + " channel " + channelName + " in phase " + phase);
    }
  }

  private URI dataPlaneUri(String path, String query) throws IngestException, InterruptedException {
    String host = credentials.ingestHost();
    return URI.create("https://" + host + path + (query == null ? "" : "?" + query));
  }

  private HttpTransport.Response exchange(String operation, HttpTransport.Request.Builder builder)
      throws IngestException, InterruptedException {
    HttpTransport.Request request = builder
        .header("Authorization", "Bearer " + credentials.scopedToken())
        .header("Accept", "application/json")
        .build();
    HttpTransport.Response response;
    try {
      response = transport.send(request);
    } catch (IOException ex) {
      throw new ChannelException(operation + " failed", ex);
    }
    if (!response.isSuccess()) {
      throw new ChannelException(operation + " rejected", response.status(), Logs.body(response.body()));
    }
    return response;
  }

  private Map<String, Object> parseBody(String operation, HttpTransport.Response response)
      throws ChannelException {
    if (response.body().isBlank()) {
      return Map.of();
    }
    try {
      return json.parseObject(response.body());
    } catch (IllegalArgumentException ex) {
      throw new ChannelException(operation + " returned malformed JSON", response.status(),
          Logs.body(response.body()));
    }
  }

  private static String requireContinuationToken(
      String operation, Map<String, Object> body, HttpTransport.Response response) throws ChannelException {
    return JsonSupport.string(body, "next_continuation_token").orElseThrow(() -> new ChannelException(
        operation + " returned no continuation token", response.status(), Logs.body(response.body())));
  }
}

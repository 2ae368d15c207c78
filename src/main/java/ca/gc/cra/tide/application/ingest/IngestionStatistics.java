package ca.gc.cra.tide.application.ingest;

import ca.gc.cra.tide.application.port.ClockPort;
import java.util.Objects;
import java.util.concurrent.atomic.LongAdder;

/**
 * <strong>What:</strong> Monotonic counters for acknowledged rows, batches, bytes and failed appends.
 * <p><strong>Thread-safety:</strong> Thread-safe; written by the ingestion loop and readable from any thread.
 * A snapshot is not atomic across counters.</p>
 *
 * @since 0.1.0
 */
public final class IngestionStatistics {
  private final ClockPort clock;
  private final long startedAtMillis;
  private final LongAdder rows = new LongAdder();
  private final LongAdder batches = new LongAdder();
  private final LongAdder bytes = new LongAdder();
  private final LongAdder errors = new LongAdder();

  public IngestionStatistics(ClockPort clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.startedAtMillis = clock.nowMillis();
  }

  /**
   * Records an acknowledged batch.
   *
   * @param rowCount rows in the batch
   * @param byteCount payload size
   */
  public void recordBatch(int rowCount, long byteCount) {
    rows.add(rowCount);
    bytes.add(byteCount);
    batches.increment();
  }

  public void recordError() {
    errors.increment();
  }

  public long batches() {
    return batches.sum();
  }

  public long errors() {
    return errors.sum();
  }

  public StatisticsSnapshot snapshot() {
    return new StatisticsSnapshot(
        rows.sum(), batches.sum(), bytes.sum(), errors.sum(), clock.nowMillis() - startedAtMillis);
  }
}

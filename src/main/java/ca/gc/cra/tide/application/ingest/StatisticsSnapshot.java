package ca.gc.cra.tide.application.ingest;

import java.util.Locale;

/**
 * Point-in-time copy of the ingestion counters.
 *
 * @param rows rows acknowledged by the service
 * @param batches batches acknowledged by the service
 * @param bytes NDJSON bytes acknowledged by the service
 * @param errors failed appends
 * @param elapsedMillis time since statistics started
 * @since 0.1.0
 */
public record StatisticsSnapshot(long rows, long batches, long bytes, long errors, long elapsedMillis) {

  /**
   * Average throughput since start.
   *
   * @return rows per second; {@code 0} before any time has elapsed
   */
  public double rowsPerSecond() {
    return elapsedMillis <= 0 ? 0d : rows * 1000d / elapsedMillis;
  }

  /**
   * One-line summary for the operational log.
   *
   * @return formatted counters
   */
  public String summary() {
    return String.format(Locale.ROOT,
        "rows=%d batches=%d bytes=%,d errors=%d elapsed=%.1fs throughput=%.2f rows/sec",
        rows, batches, bytes, errors, elapsedMillis / 1000d, rowsPerSecond());
  }
}

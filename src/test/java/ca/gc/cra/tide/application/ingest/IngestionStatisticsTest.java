package ca.gc.cra.tide.application.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.cra.tide.testing.MutableClock;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class IngestionStatisticsTest {

  @Test
  void accumulatesBatchesAndErrors() {
    MutableClock clock = MutableClock.atEpoch();
    IngestionStatistics statistics = new IngestionStatistics(clock);

    statistics.recordBatch(10, 2_500L);
    statistics.recordBatch(10, 2_600L);
    statistics.recordError();
    clock.advance(Duration.ofSeconds(4));

    StatisticsSnapshot snapshot = statistics.snapshot();
    assertEquals(20L, snapshot.rows());
    assertEquals(2L, snapshot.batches());
    assertEquals(5_100L, snapshot.bytes());
    assertEquals(1L, snapshot.errors());
    assertEquals(4_000L, snapshot.elapsedMillis());
    assertEquals(5.0d, snapshot.rowsPerSecond());
    assertEquals("rows=20 batches=2 bytes=5,100 errors=1 elapsed=4.0s throughput=5.00 rows/sec",
        snapshot.summary());
  }

  @Test
  void zeroElapsedHasZeroThroughput() {
    assertEquals(0d, new StatisticsSnapshot(5, 1, 100, 0, 0).rowsPerSecond());
  }
}

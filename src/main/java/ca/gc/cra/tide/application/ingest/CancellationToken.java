package ca.gc.cra.tide.application.ingest;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot shutdown signal shared between the CLI shutdown hook and the ingestion loop.
 *
 * <p>Sleeping through {@link #sleep(Duration)} wakes immediately once the token is cancelled, so shutdown
 * latency is bounded by the request in flight rather than by the configured intervals.</p>
 *
 * @since 0.1.0
 */
public final class CancellationToken {
  private final CountDownLatch latch = new CountDownLatch(1);

  /** Requests shutdown. Safe to call from any thread and more than once. */
  public void cancel() {
    latch.countDown();
  }

  public boolean isCancelled() {
    return latch.getCount() == 0;
  }

  /**
   * Waits for {@code duration} or until cancelled, whichever comes first.
   *
   * @param duration time to wait; zero or negative returns immediately
   * @return {@code true} when the token was cancelled
   * @throws InterruptedException when the waiting thread is interrupted
   */
  public boolean sleep(Duration duration) throws InterruptedException {
    if (duration.isZero() || duration.isNegative()) {
      return isCancelled();
    }
    return latch.await(duration.toNanos(), TimeUnit.NANOSECONDS);
  }
}

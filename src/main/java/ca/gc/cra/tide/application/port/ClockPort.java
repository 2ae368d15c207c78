package ca.gc.cra.tide.application.port;

/**
 * <strong>What:</strong> Port supplying wall-clock timestamps to token caches and statistics.
 * <p><strong>Why:</strong> Token expiry decisions must be testable without waiting an hour.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @since 0.1.0
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z; subject to system clock adjustments
   */
  long nowMillis();

  /** Default {@link ClockPort} using {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}

package ca.gc.cra.tide.application.port;

import ca.gc.cra.tide.domain.telemetry.SensorRecord;
import java.io.IOException;

/**
 * Produces one telemetry record per call; the ingestion loop polls it at the configured cadence.
 *
 * @since 0.1.0
 */
public interface SensorSource extends AutoCloseable {
  /**
   * Takes one reading.
   *
   * @return flat record for the reading
   * @throws IOException when the sensor cannot be read; the loop skips the reading
   */
  SensorRecord read() throws IOException;

  /**
   * Human readable description used in startup logs.
   *
   * @return description such as {@code simulated}
   */
  String describe();

  @Override
  default void close() {}
}

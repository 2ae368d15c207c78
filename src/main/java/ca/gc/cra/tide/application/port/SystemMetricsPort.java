package ca.gc.cra.tide.application.port;

import ca.gc.cra.tide.domain.telemetry.SystemMetrics;

/**
 * Samples host CPU, memory, disk and temperature for inclusion in readings.
 *
 * @since 0.1.0
 */
public interface SystemMetricsPort {
  /**
   * Takes a sample. Implementations return {@link SystemMetrics#UNAVAILABLE} values for anything the
   * host cannot report rather than failing.
   *
   * @return current metrics
   */
  SystemMetrics sample();
}

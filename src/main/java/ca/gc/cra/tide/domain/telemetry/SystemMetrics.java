package ca.gc.cra.tide.domain.telemetry;

/**
 * Host health sampled alongside each reading.
 *
 * @param cpuPercent system CPU load, 0-100
 * @param memoryPercent physical memory in use, 0-100
 * @param diskUsageMb used space on the root filesystem in MiB
 * @param cpuTempCelsius SoC temperature, {@code 0} when unavailable
 * @since 0.1.0
 */
public record SystemMetrics(
    double cpuPercent, double memoryPercent, double diskUsageMb, double cpuTempCelsius) {

  /** Metrics reported when the host cannot be sampled. */
  public static final SystemMetrics UNAVAILABLE = new SystemMetrics(0d, 0d, 0d, 0d);

  /**
   * SoC temperature in Fahrenheit.
   *
   * @return {@code C * 9/5 + 32}
   */
  public double cpuTempFahrenheit() {
    return cpuTempCelsius * 9d / 5d + 32d;
  }
}

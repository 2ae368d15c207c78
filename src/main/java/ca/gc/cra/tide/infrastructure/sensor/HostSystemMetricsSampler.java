package ca.gc.cra.tide.infrastructure.sensor;

import ca.gc.cra.tide.application.port.SystemMetricsPort;
import ca.gc.cra.tide.domain.telemetry.SystemMetrics;
import java.io.File;
import java.io.IOException;
import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Samples CPU load, memory use, root filesystem use and SoC temperature.
 * <p><strong>Why:</strong> Readings carry host health so a failing device can be spotted from the warehouse.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the injected paths; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class HostSystemMetricsSampler implements SystemMetricsPort {
  private static final Logger log = LoggerFactory.getLogger(HostSystemMetricsSampler.class);

  /** Linux thermal zone reporting millidegrees Celsius, present on Raspberry Pi OS. */
  public static final Path DEFAULT_THERMAL_ZONE = Path.of("/sys/class/thermal/thermal_zone0/temp");
  private static final double BYTES_PER_MB = 1024d * 1024d;

  private final Path thermalZone;
  private final File diskRoot;

  public HostSystemMetricsSampler() {
    this(DEFAULT_THERMAL_ZONE, new File("/"));
  }

  HostSystemMetricsSampler(Path thermalZone, File diskRoot) {
    this.thermalZone = Objects.requireNonNull(thermalZone, "thermalZone");
    this.diskRoot = Objects.requireNonNull(diskRoot, "diskRoot");
  }

  @Override
  public SystemMetrics sample() {
    double cpu = 0d;
    double memory = 0d;
    OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
    if (os instanceof com.sun.management.OperatingSystemMXBean ext) {
      double load = ext.getCpuLoad();
      cpu = load < 0 ? 0d : load * 100d;
      long total = ext.getTotalMemorySize();
      if (total > 0) {
        memory = (total - ext.getFreeMemorySize()) * 100d / total;
      }
    }
    double diskUsed = (diskRoot.getTotalSpace() - diskRoot.getFreeSpace()) / BYTES_PER_MB;
    return new SystemMetrics(cpu, memory, Math.max(0d, diskUsed), cpuTemperature());
  }

  double cpuTemperature() {
    if (!Files.isReadable(thermalZone)) {
      return SystemMetrics.UNAVAILABLE.cpuTempCelsius();
    }
    try {
      String raw = Files.readString(thermalZone, StandardCharsets.US_ASCII).trim();
      return Long.parseLong(raw) / 1000d;
    } catch (IOException | NumberFormatException ex) {
      log.debug("Unable to read CPU temperature from {}", thermalZone, ex);
      return SystemMetrics.UNAVAILABLE.cpuTempCelsius();
    }
  }
}

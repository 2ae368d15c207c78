package ca.gc.cra.tide.infrastructure.sensor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.tide.domain.telemetry.SystemMetrics;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class HostSystemMetricsSamplerTest {
  @TempDir Path tempDir;

  @Test
  void readsMillidegreeThermalZone() throws Exception {
    Path zone = Files.writeString(tempDir.resolve("temp"), "48312\n");

    HostSystemMetricsSampler sampler = new HostSystemMetricsSampler(zone, tempDir.toFile());

    assertEquals(48.312d, sampler.cpuTemperature(), 1e-9);
  }

  @Test
  void missingOrGarbledThermalZoneReportsZero() throws Exception {
    Path garbled = Files.writeString(tempDir.resolve("garbled"), "n/a");

    assertEquals(0d, new HostSystemMetricsSampler(tempDir.resolve("absent"), tempDir.toFile()).cpuTemperature());
    assertEquals(0d, new HostSystemMetricsSampler(garbled, tempDir.toFile()).cpuTemperature());
  }

  @Test
  void sampleReportsBoundedPercentages() {
    SystemMetrics metrics = new HostSystemMetricsSampler(tempDir.resolve("absent"), tempDir.toFile()).sample();

    assertTrue(metrics.cpuPercent() >= 0d && metrics.cpuPercent() <= 100d);
    assertTrue(metrics.memoryPercent() >= 0d && metrics.memoryPercent() <= 100d);
    assertTrue(metrics.diskUsageMb() >= 0d);
  }
}

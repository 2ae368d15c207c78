package ca.gc.cra.tide.domain.telemetry;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.Instant;
import org.junit.jupiter.api.Test;

class SensorReadingTest {

  @Test
  void flattensIntoWarehouseColumns() {
    MotionSample.Axes axes = new MotionSample.Axes(0.1d, 0.2d, 0.3d);
    SensorReading reading = new SensorReading(
        "sensehat_pi_20250115120000_1",
        "20250115120000_sensehat_pi_20250115120000_1",
        new DeviceIdentity("pi", "10.0.0.7", "aa:bb:cc:dd:ee:ff"),
        Instant.parse("2025-01-15T12:00:00Z"),
        new EnvironmentSample(22.4d, 41.2d, 1013.2d),
        new MotionSample(1d, 2d, 3d, axes, axes, axes, 180d),
        new SystemMetrics(12.34d, 55.56d, 1024.04d, 50d),
        true);

    SensorRecord record = reading.toRecord();

    assertEquals(30, record.size());
    assertEquals("pi", record.get("hostname"));
    assertEquals(1_736_942_400L, record.get("ts"));
    assertEquals("2025-01-15T12:00:00Z", record.get("datetimestamp"));
    assertEquals("01/15/2025 12:00:00", record.get("systemtime"));
    assertEquals(12.3d, record.get("cpu_percent"));
    assertEquals(55.6d, record.get("memory_percent"));
    assertEquals(122.0d, record.get("cputempf"));
    assertEquals(0.3d, record.get("mag_z"));
    assertEquals(Boolean.TRUE, record.get("simulated"));
  }
}

package ca.gc.cra.tide.infrastructure.sensor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.tide.domain.telemetry.DeviceIdentity;
import ca.gc.cra.tide.domain.telemetry.SensorReading;
import ca.gc.cra.tide.domain.telemetry.SensorRecord;
import ca.gc.cra.tide.domain.telemetry.SystemMetrics;
import ca.gc.cra.tide.testing.MutableClock;
import java.time.Duration;
import java.util.Random;
import org.junit.jupiter.api.Test;

class SimulatedSensorSourceTest {
  private final DeviceIdentity device = new DeviceIdentity("pi4", "10.0.0.7", "dc:a6:32:00:00:01");
  private final MutableClock clock = MutableClock.atEpoch();
  private final SimulatedSensorSource source = new SimulatedSensorSource(
      device, () -> new SystemMetrics(7.5d, 40d, 2048d, 48.2d), clock, new Random(42L));

  @Test
  void identifiersCarryHostTimestampAndSequence() {
    SensorReading first = source.next();
    clock.advance(Duration.ofSeconds(1));
    SensorReading second = source.next();

    assertEquals("sensehat_pi4_20250115120000_1", first.uuid());
    assertEquals("sensehat_pi4_20250115120001_2", second.uuid());
    assertTrue(first.rowId().startsWith("20250115120000_"));
    assertNotEquals(first.rowId(), second.rowId());
    assertTrue(first.simulated());
  }

  @Test
  void valuesStayInPlausibleRanges() {
    for (int i = 0; i < 200; i++) {
      SensorReading reading = source.next();
      double humidity = reading.environment().humidity();
      assertTrue(humidity >= 0d && humidity <= 100d, "humidity " + humidity);
      assertTrue(reading.motion().yaw() >= 0d && reading.motion().yaw() <= 360d);
      assertTrue(reading.motion().pitch() >= -5d && reading.motion().pitch() <= 5d);
      double pressure = reading.environment().pressure();
      assertTrue(pressure > 950d && pressure < 1080d, "pressure " + pressure);
    }
  }

  @Test
  void recordIncludesSystemMetricsAndDevice() {
    SensorRecord record = source.read();

    assertEquals("pi4", record.get("hostname"));
    assertEquals("dc:a6:32:00:00:01", record.get("macaddress"));
    assertEquals(7.5d, record.get("cpu_percent"));
    assertEquals(48.2d, record.get("cputempc"));
    assertEquals(Boolean.TRUE, record.get("simulated"));
  }

  @Test
  void describesDevice() {
    assertEquals("simulated Sense HAT on pi4", source.describe());
  }

  @Test
  void roundsToRequestedPlaces() {
    assertEquals(22.35d, SimulatedSensorSource.round(22.3456d, 2));
    assertEquals(0.1235d, SimulatedSensorSource.round(0.12346d, 4));
  }
}

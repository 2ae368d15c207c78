package ca.gc.cra.tide.domain.telemetry;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Typed Sense HAT reading, the schema of the {@code SENSEHAT_SENSOR_DATA} table.
 *
 * <p>{@link #toRecord()} flattens the reading into the column names the pipe expects.</p>
 *
 * @param uuid reading identifier ({@code sensehat_{host}_{yyyyMMddHHmmss}_{n}})
 * @param rowId row identifier ({@code {yyyyMMddHHmmss}_{random uuid}})
 * @param device device identity
 * @param timestamp capture instant
 * @param environment environmental values
 * @param motion IMU values
 * @param system host health
 * @param simulated whether the values came from the simulator
 * @since 0.1.0
 */
public record SensorReading(
    String uuid,
    String rowId,
    DeviceIdentity device,
    Instant timestamp,
    EnvironmentSample environment,
    MotionSample motion,
    SystemMetrics system,
    boolean simulated) {

  private static final DateTimeFormatter ISO_UTC =
      DateTimeFormatter.ISO_OFFSET_DATE_TIME.withZone(ZoneOffset.UTC);
  private static final DateTimeFormatter SYSTEM_TIME =
      DateTimeFormatter.ofPattern("MM/dd/yyyy HH:mm:ss").withZone(ZoneOffset.UTC);

  public SensorReading {
    Objects.requireNonNull(uuid, "uuid");
    Objects.requireNonNull(rowId, "rowId");
    Objects.requireNonNull(device, "device");
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(environment, "environment");
    Objects.requireNonNull(motion, "motion");
    Objects.requireNonNull(system, "system");
  }

  /**
   * Flattens the reading into table columns.
   *
   * @return record with one field per column
   */
  public SensorRecord toRecord() {
    return SensorRecord.builder()
        .put("uuid", uuid)
        .put("rowid", rowId)
        .put("hostname", device.hostname())
        .put("ipaddress", device.ipAddress())
        .put("macaddress", device.macAddress())
        .put("ts", timestamp.getEpochSecond())
        .put("datetimestamp", ISO_UTC.format(timestamp))
        .put("systemtime", SYSTEM_TIME.format(timestamp))
        .put("temperature", environment.temperature())
        .put("humidity", environment.humidity())
        .put("pressure", environment.pressure())
        .put("pitch", motion.pitch())
        .put("roll", motion.roll())
        .put("yaw", motion.yaw())
        .put("accel_x", motion.accel().x())
        .put("accel_y", motion.accel().y())
        .put("accel_z", motion.accel().z())
        .put("gyro_x", motion.gyro().x())
        .put("gyro_y", motion.gyro().y())
        .put("gyro_z", motion.gyro().z())
        .put("mag_x", motion.mag().x())
        .put("mag_y", motion.mag().y())
        .put("mag_z", motion.mag().z())
        .put("compass", motion.compass())
        .put("cpu_percent", round1(system.cpuPercent()))
        .put("memory_percent", round1(system.memoryPercent()))
        .put("disk_usage_mb", round1(system.diskUsageMb()))
        .put("cputempc", round1(system.cpuTempCelsius()))
        .put("cputempf", round1(system.cpuTempFahrenheit()))
        .put("simulated", simulated)
        .build();
  }

  private static double round1(double value) {
    return Math.round(value * 10d) / 10d;
  }
}

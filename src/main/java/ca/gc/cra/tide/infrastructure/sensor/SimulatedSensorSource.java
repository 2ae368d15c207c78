package ca.gc.cra.tide.infrastructure.sensor;

import ca.gc.cra.tide.application.port.ClockPort;
import ca.gc.cra.tide.application.port.SensorSource;
import ca.gc.cra.tide.application.port.SystemMetricsPort;
import ca.gc.cra.tide.domain.telemetry.DeviceIdentity;
import ca.gc.cra.tide.domain.telemetry.EnvironmentSample;
import ca.gc.cra.tide.domain.telemetry.MotionSample;
import ca.gc.cra.tide.domain.telemetry.SensorReading;
import ca.gc.cra.tide.domain.telemetry.SensorRecord;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.Random;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Generates plausible Sense HAT readings around indoor conditions (22 C, 45 % humidity, 1013 mb) for
 * running without the hardware.
 *
 * @since 0.1.0
 */
public final class SimulatedSensorSource implements SensorSource {
  private static final DateTimeFormatter COMPACT =
      DateTimeFormatter.ofPattern("yyyyMMddHHmmss").withZone(ZoneOffset.UTC);

  private final DeviceIdentity device;
  private final SystemMetricsPort systemMetrics;
  private final ClockPort clock;
  private final Random random;
  private final AtomicLong readings = new AtomicLong();

  public SimulatedSensorSource(DeviceIdentity device, SystemMetricsPort systemMetrics, ClockPort clock) {
    this(device, systemMetrics, clock, new Random());
  }

  SimulatedSensorSource(DeviceIdentity device, SystemMetricsPort systemMetrics, ClockPort clock, Random random) {
    this.device = Objects.requireNonNull(device, "device");
    this.systemMetrics = Objects.requireNonNull(systemMetrics, "systemMetrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.random = Objects.requireNonNull(random, "random");
  }

  @Override
  public SensorRecord read() {
    return next().toRecord();
  }

  /**
   * Produces the next typed reading.
   *
   * @return simulated reading stamped with the current time
   */
  public SensorReading next() {
    long count = readings.incrementAndGet();
    Instant now = Instant.ofEpochMilli(clock.nowMillis());
    String stamp = COMPACT.format(now);

    EnvironmentSample environment = new EnvironmentSample(
        round(gaussian(22.0, 2), 2),
        round(Math.max(0, Math.min(100, gaussian(45.0, 5))), 2),
        round(gaussian(1013.25, 5), 2));
    MotionSample motion = new MotionSample(
        round(uniform(-5, 5), 2),
        round(uniform(-5, 5), 2),
        round(uniform(0, 360), 2),
        axes(0, 0.1, 0, 0.1, 1.0, 0.05),
        axes(0, 1, 0, 1, 0, 1),
        axes(20, 5, -10, 5, -50, 10),
        round(uniform(0, 360), 2));

    return new SensorReading(
        "sensehat_" + device.hostname() + "_" + stamp + "_" + count,
        stamp + "_" + UUID.randomUUID(),
        device,
        now,
        environment,
        motion,
        systemMetrics.sample(),
        true);
  }

  @Override
  public String describe() {
    return "simulated Sense HAT on " + device.hostname();
  }

  private MotionSample.Axes axes(
      double meanX, double sdX, double meanY, double sdY, double meanZ, double sdZ) {
    return new MotionSample.Axes(
        round(gaussian(meanX, sdX), 4), round(gaussian(meanY, sdY), 4), round(gaussian(meanZ, sdZ), 4));
  }

  private double gaussian(double mean, double stdDev) {
    return mean + random.nextGaussian() * stdDev;
  }

  private double uniform(double min, double max) {
    return min + random.nextDouble() * (max - min);
  }

  static double round(double value, int places) {
    double scale = Math.pow(10, places);
    return Math.round(value * scale) / scale;
  }
}

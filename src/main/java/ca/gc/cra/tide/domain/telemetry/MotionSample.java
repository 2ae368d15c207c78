package ca.gc.cra.tide.domain.telemetry;

/**
 * Inertial measurement unit values.
 *
 * @param pitch orientation pitch in degrees
 * @param roll orientation roll in degrees
 * @param yaw orientation yaw in degrees
 * @param accel raw accelerometer axes in g
 * @param gyro raw gyroscope axes in rad/s
 * @param mag raw magnetometer axes in microtesla
 * @param compass heading in degrees
 * @since 0.1.0
 */
public record MotionSample(
    double pitch, double roll, double yaw, Axes accel, Axes gyro, Axes mag, double compass) {

  /**
   * Three-axis vector.
   *
   * @param x x axis
   * @param y y axis
   * @param z z axis
   */
  public record Axes(double x, double y, double z) {}
}

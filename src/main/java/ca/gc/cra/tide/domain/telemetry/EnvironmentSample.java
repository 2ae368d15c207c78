package ca.gc.cra.tide.domain.telemetry;

/**
 * Environmental sensor values.
 *
 * @param temperature degrees Celsius
 * @param humidity relative humidity percent
 * @param pressure millibars
 * @since 0.1.0
 */
public record EnvironmentSample(double temperature, double humidity, double pressure) {}
